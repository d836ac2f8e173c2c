/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.analysis;

import ai.evacortex.chronocheck.core.document.SourceSpan;

/** Diagnostic attached to an analysis result. Never thrown. */
public record AnalysisIssue(Severity severity, String message, SourceSpan span) {

    public static AnalysisIssue error(String message, SourceSpan span) {
        return new AnalysisIssue(Severity.ERROR, message, span);
    }

    public static AnalysisIssue warning(String message, SourceSpan span) {
        return new AnalysisIssue(Severity.WARNING, message, span);
    }

    @Override
    public String toString() {
        return severity + " [" + span + "] " + message;
    }
}
