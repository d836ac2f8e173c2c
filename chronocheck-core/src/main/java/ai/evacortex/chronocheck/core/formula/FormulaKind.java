/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.formula;

import ai.evacortex.chronocheck.core.TemporalOperator;

/**
 * Tag of a {@link TemporalFormula} node. Each kind fixes its arity, the temporal operator
 * it carries (if any) and its path quantifier for the CTL forms.
 */
public enum FormulaKind {
    ATOMIC(0, null, PathQuantifierType.NONE, ""),
    NOT(1, null, PathQuantifierType.NONE, "¬"),
    AND(2, null, PathQuantifierType.NONE, "∧"),
    OR(2, null, PathQuantifierType.NONE, "∨"),
    IMPLIES(2, null, PathQuantifierType.NONE, "→"),

    ALWAYS(1, TemporalOperator.ALWAYS, PathQuantifierType.NONE, "□"),
    EVENTUALLY(1, TemporalOperator.EVENTUALLY, PathQuantifierType.NONE, "◊"),
    NEXT(1, TemporalOperator.NEXT, PathQuantifierType.NONE, "X"),
    UNTIL(2, TemporalOperator.UNTIL, PathQuantifierType.NONE, "U"),
    RELEASE(2, TemporalOperator.RELEASE, PathQuantifierType.NONE, "R"),
    WEAK_UNTIL(2, TemporalOperator.WEAK_UNTIL, PathQuantifierType.NONE, "W"),
    STRONG_RELEASE(2, TemporalOperator.STRONG_RELEASE, PathQuantifierType.NONE, "M"),

    EXISTS_NEXT(1, TemporalOperator.NEXT, PathQuantifierType.EXISTS_PATH, "EX"),
    FORALL_NEXT(1, TemporalOperator.NEXT, PathQuantifierType.ALL_PATHS, "AX"),
    EXISTS_ALWAYS(1, TemporalOperator.ALWAYS, PathQuantifierType.EXISTS_PATH, "EG"),
    FORALL_ALWAYS(1, TemporalOperator.ALWAYS, PathQuantifierType.ALL_PATHS, "AG"),
    EXISTS_EVENTUALLY(1, TemporalOperator.EVENTUALLY, PathQuantifierType.EXISTS_PATH, "EF"),
    FORALL_EVENTUALLY(1, TemporalOperator.EVENTUALLY, PathQuantifierType.ALL_PATHS, "AF"),
    EXISTS_UNTIL(2, TemporalOperator.UNTIL, PathQuantifierType.EXISTS_PATH, "E"),
    FORALL_UNTIL(2, TemporalOperator.UNTIL, PathQuantifierType.ALL_PATHS, "A");

    private final int arity;
    private final TemporalOperator operator;
    private final PathQuantifierType quantifier;
    private final String symbol;

    FormulaKind(int arity, TemporalOperator operator, PathQuantifierType quantifier, String symbol) {
        this.arity = arity;
        this.operator = operator;
        this.quantifier = quantifier;
        this.symbol = symbol;
    }

    public int arity() {
        return arity;
    }

    /** Temporal operator carried by this node, or {@code null} for atoms and boolean connectives. */
    public TemporalOperator operator() {
        return operator;
    }

    public PathQuantifierType quantifier() {
        return quantifier;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isTemporal() {
        return operator != null;
    }

    public boolean isPathQuantified() {
        return quantifier != PathQuantifierType.NONE;
    }

    public boolean isBoolean() {
        return this == NOT || this == AND || this == OR || this == IMPLIES;
    }
}
