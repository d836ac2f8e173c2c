/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

import ai.evacortex.chronocheck.core.analysis.AnalysisIssue;

import java.util.List;

public record PatternAnalysisResult(
        List<TemporalPattern> patterns,
        PatternStatistics statistics,
        QualitySummary qualitySummary,
        List<PatternRecommendation> recommendations,
        List<AnalysisIssue> warnings
) {
    public PatternAnalysisResult {
        patterns = List.copyOf(patterns);
        recommendations = List.copyOf(recommendations);
        warnings = List.copyOf(warnings);
    }
}
