/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.exceptions;

/**
 * Thrown when a state space violates a structural invariant (dangling transition target,
 * unknown initial state, labelling outside the state range). Signals a builder bug, not bad input.
 */
public class StateSpaceInvariantException extends IllegalStateException {
    public StateSpaceInvariantException(String message) {
        super("State space invariant violated: " + message);
    }
}
