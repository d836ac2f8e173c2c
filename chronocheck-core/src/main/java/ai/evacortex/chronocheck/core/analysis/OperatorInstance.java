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

import java.util.List;

/**
 * One occurrence of a temporal operator.
 *
 * @param operands     operand texts; canonical subformula renderings when the expression parsed
 * @param nestingLevel number of temporal-operator scopes enclosing the occurrence
 */
public record OperatorInstance(
        TemporalOperator operator,
        SourceSpan span,
        OperatorContext context,
        List<String> operands,
        int nestingLevel
) {
    public OperatorInstance {
        operands = List.copyOf(operands);
        if (nestingLevel < 0) throw new IllegalArgumentException("nestingLevel must be non-negative");
    }
}
