/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

/**
 * @param low   instances graded LOW or VERY_LOW
 * @param score {@code (high + 0.6 * medium) / total}, zero when there are no instances
 */
public record QualitySummary(int high, int medium, int low, double score) {
}
