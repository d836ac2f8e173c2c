/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.engine;

public enum TraceType {
    /** Ends in a state; for safety violations, a bad state or a deadlock. */
    FINITE,
    /** Lasso: the last state loops back to {@code loopPoint}. */
    INFINITE,
    /** Only the violating or witnessing initial state is known. */
    PARTIAL
}
