/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

public enum PatternKind {
    SAFETY,
    LIVENESS,
    RESPONSE,
    PERSISTENCE,
    RECURRENCE,
    FAIRNESS,
    PRECEDENCE,
    ABSENCE,
    EXISTENCE,
    CHAIN;

    /** Counted towards safety coverage. */
    public boolean isSafetyClass() {
        return this == SAFETY || this == ABSENCE;
    }

    /** Counted towards liveness coverage. */
    public boolean isLivenessClass() {
        return switch (this) {
            case LIVENESS, RESPONSE, PERSISTENCE, RECURRENCE, EXISTENCE -> true;
            default -> false;
        };
    }
}
