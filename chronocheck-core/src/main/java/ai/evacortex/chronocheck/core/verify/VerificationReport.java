/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import ai.evacortex.chronocheck.core.analysis.OperatorValidationResult;
import ai.evacortex.chronocheck.core.model.StateSpaceAnalysis;
import ai.evacortex.chronocheck.core.pattern.PatternAnalysisResult;

/**
 * Everything produced for one document by {@link VerificationOrchestrator#verify}.
 */
public record VerificationReport(
        String document,
        OperatorValidationResult operators,
        PatternAnalysisResult patterns,
        int states,
        int transitions,
        boolean trivialStateSpace,
        boolean truncatedStateSpace,
        StateSpaceAnalysis stateSpace,
        ModelCheckingResult modelChecking
) {
}
