/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.analysis;

import ai.evacortex.chronocheck.core.TemporalOperator;
import ai.evacortex.chronocheck.core.document.SourceSpan;
import ai.evacortex.chronocheck.core.formula.PathQuantifierType;

public record PathQuantifier(PathQuantifierType type, TemporalOperator operator, String formula,
                             OperatorContext context, SourceSpan location) {
}
