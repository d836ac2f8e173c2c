/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.exceptions;

public class SolverException extends RuntimeException {
    public SolverException(String message) {
        super("Solver failure: " + message);
    }

    public SolverException(String message, Throwable cause) {
        super("Solver failure: " + message, cause);
    }
}
