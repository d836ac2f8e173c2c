/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

/** Fractions in [0, 1] of pattern instances in the safety class, the liveness class and either. */
public record CoverageMetrics(double safety, double liveness, double overall) {
    public static final CoverageMetrics NONE = new CoverageMetrics(0.0, 0.0, 0.0);
}
