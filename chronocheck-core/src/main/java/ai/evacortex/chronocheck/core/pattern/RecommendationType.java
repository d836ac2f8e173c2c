/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

public enum RecommendationType {
    ADD_SAFETY,
    ADD_LIVENESS,
    SIMPLIFY,
    ENHANCE_COVERAGE
}
