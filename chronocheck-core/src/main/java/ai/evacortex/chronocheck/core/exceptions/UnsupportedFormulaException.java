/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.exceptions;

import ai.evacortex.chronocheck.core.formula.FormulaKind;

public class UnsupportedFormulaException extends RuntimeException {

    public UnsupportedFormulaException(String message) {
        super("Unsupported formula: " + message);
    }

    public UnsupportedFormulaException(FormulaKind kind, String where) {
        super("Unsupported formula: " + kind + " is not handled by " + where);
    }
}
