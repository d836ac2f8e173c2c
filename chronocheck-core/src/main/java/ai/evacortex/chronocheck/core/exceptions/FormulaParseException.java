/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.exceptions;

public class FormulaParseException extends RuntimeException {

    private final int offset;

    public FormulaParseException(String message, int offset) {
        super("Malformed formula at offset " + offset + ": " + message);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
