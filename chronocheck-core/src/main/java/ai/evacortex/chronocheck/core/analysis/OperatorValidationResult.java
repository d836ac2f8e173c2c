/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.analysis;

import java.util.List;

/**
 * Outcome of operator analysis. {@code valid} holds when there are no errors and the
 * complexity score does not exceed {@link TemporalOperatorAnalyzer#MAX_VALID_COMPLEXITY}.
 */
public record OperatorValidationResult(
        List<OperatorInstance> operators,
        List<PathQuantifier> pathQuantifiers,
        OperatorComplexity complexity,
        List<AnalysisIssue> errors,
        List<AnalysisIssue> warnings,
        boolean valid
) {
    public OperatorValidationResult {
        operators = List.copyOf(operators);
        pathQuantifiers = List.copyOf(pathQuantifiers);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
