/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

import ai.evacortex.chronocheck.core.analysis.OperatorContext;
import ai.evacortex.chronocheck.core.document.SourceSpan;

import java.util.List;

/**
 * @param formula   space-joined operator symbols of the window, e.g. {@code "□ ◊"}
 * @param variables sorted, de-duplicated operand texts of the window
 */
public record PatternInstance(
        String formula,
        List<String> variables,
        SourceSpan location,
        PatternStrength strength,
        OperatorContext context,
        PatternQuality quality
) {
    public PatternInstance {
        variables = List.copyOf(variables);
    }
}
