/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.document;

import ai.evacortex.chronocheck.core.formula.TemporalFormula;

import java.util.Objects;

/**
 * Expression attached to a document element: either an already-parsed formula tree
 * or raw text left for the analyzer to interpret.
 */
public record Expression(TemporalFormula formula, String text, SourceSpan span) {

    public Expression {
        if (formula == null && text == null) {
            throw new IllegalArgumentException("Expression needs a formula or text");
        }
        span = span == null ? SourceSpan.UNKNOWN : span;
    }

    public static Expression parsed(TemporalFormula formula, SourceSpan span) {
        return new Expression(Objects.requireNonNull(formula), null, span);
    }

    public static Expression raw(String text, SourceSpan span) {
        return new Expression(null, Objects.requireNonNull(text), span);
    }

    public boolean isParsed() {
        return formula != null;
    }

    /** Source text when present, the canonical rendering otherwise. */
    public String render() {
        return text != null ? text : formula.toString();
    }
}
