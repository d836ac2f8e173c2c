/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.formula;

import java.util.*;

/**
 * Immutable CTL/LTL formula tree.
 *
 * <p>A node is tagged by its {@link FormulaKind}; atoms carry a proposition name and every
 * other node owns exactly {@link FormulaKind#arity()} operands. Operands are held in an
 * unmodifiable list, so a formula is a tree with no shared mutable nodes and no cycles.</p>
 *
 * <p>{@link #toString()} renders canonical text that {@link FormulaParser} parses back to
 * an equal tree. The canonical text is used as the normalized cache key.</p>
 */
public record TemporalFormula(FormulaKind kind, String name, List<TemporalFormula> operands) {

    public TemporalFormula {
        Objects.requireNonNull(kind, "kind must not be null");
        operands = operands == null ? List.of() : List.copyOf(operands);
        if (operands.size() != kind.arity()) {
            throw new IllegalArgumentException(kind + " expects " + kind.arity()
                    + " operand(s), got " + operands.size());
        }
        if (kind == FormulaKind.ATOMIC) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Atomic proposition requires a name");
            }
        } else if (name != null) {
            throw new IllegalArgumentException(kind + " does not carry a name");
        }
    }

    public static TemporalFormula atomic(String name) {
        return new TemporalFormula(FormulaKind.ATOMIC, name, List.of());
    }

    public static TemporalFormula unary(FormulaKind kind, TemporalFormula operand) {
        return new TemporalFormula(kind, null, List.of(operand));
    }

    public static TemporalFormula binary(FormulaKind kind, TemporalFormula left, TemporalFormula right) {
        return new TemporalFormula(kind, null, List.of(left, right));
    }

    public static TemporalFormula not(TemporalFormula f) { return unary(FormulaKind.NOT, f); }
    public static TemporalFormula and(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.AND, l, r); }
    public static TemporalFormula or(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.OR, l, r); }
    public static TemporalFormula implies(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.IMPLIES, l, r); }

    public static TemporalFormula always(TemporalFormula f) { return unary(FormulaKind.ALWAYS, f); }
    public static TemporalFormula eventually(TemporalFormula f) { return unary(FormulaKind.EVENTUALLY, f); }
    public static TemporalFormula next(TemporalFormula f) { return unary(FormulaKind.NEXT, f); }
    public static TemporalFormula until(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.UNTIL, l, r); }
    public static TemporalFormula release(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.RELEASE, l, r); }
    public static TemporalFormula weakUntil(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.WEAK_UNTIL, l, r); }
    public static TemporalFormula strongRelease(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.STRONG_RELEASE, l, r); }

    public static TemporalFormula existsNext(TemporalFormula f) { return unary(FormulaKind.EXISTS_NEXT, f); }
    public static TemporalFormula forallNext(TemporalFormula f) { return unary(FormulaKind.FORALL_NEXT, f); }
    public static TemporalFormula existsAlways(TemporalFormula f) { return unary(FormulaKind.EXISTS_ALWAYS, f); }
    public static TemporalFormula forallAlways(TemporalFormula f) { return unary(FormulaKind.FORALL_ALWAYS, f); }
    public static TemporalFormula existsEventually(TemporalFormula f) { return unary(FormulaKind.EXISTS_EVENTUALLY, f); }
    public static TemporalFormula forallEventually(TemporalFormula f) { return unary(FormulaKind.FORALL_EVENTUALLY, f); }
    public static TemporalFormula existsUntil(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.EXISTS_UNTIL, l, r); }
    public static TemporalFormula forallUntil(TemporalFormula l, TemporalFormula r) { return binary(FormulaKind.FORALL_UNTIL, l, r); }

    /** Sole operand of a unary node. */
    public TemporalFormula operand() {
        requireArity(1);
        return operands.get(0);
    }

    public TemporalFormula left() {
        requireArity(2);
        return operands.get(0);
    }

    public TemporalFormula right() {
        requireArity(2);
        return operands.get(1);
    }

    public boolean isAtomic() {
        return kind == FormulaKind.ATOMIC;
    }

    /** True when no node below (and including) this one is a temporal operator. */
    public boolean isPropositional() {
        if (kind.isTemporal()) return false;
        for (TemporalFormula op : operands) {
            if (!op.isPropositional()) return false;
        }
        return true;
    }

    /** True when the tree contains no path quantifier (a pure LTL or propositional formula). */
    public boolean isLinear() {
        if (kind.isPathQuantified()) return false;
        for (TemporalFormula op : operands) {
            if (!op.isLinear()) return false;
        }
        return true;
    }

    /** Atomic proposition names in first-occurrence order. */
    public Set<String> atoms() {
        Set<String> out = new LinkedHashSet<>();
        collectAtoms(this, out);
        return Collections.unmodifiableSet(out);
    }

    /** Distinct subformulas in post-order (operands before the node that owns them). */
    public List<TemporalFormula> subformulas() {
        LinkedHashSet<TemporalFormula> out = new LinkedHashSet<>();
        collectSubformulas(this, out);
        return List.copyOf(out);
    }

    /** Number of nodes in the tree. */
    public int size() {
        int n = 1;
        for (TemporalFormula op : operands) n += op.size();
        return n;
    }

    /** Depth of nested temporal operators; propositional formulas have depth 0. */
    public int temporalDepth() {
        int inner = 0;
        for (TemporalFormula op : operands) inner = Math.max(inner, op.temporalDepth());
        return kind.isTemporal() ? inner + 1 : inner;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ATOMIC -> name;
            case NOT, ALWAYS, EVENTUALLY -> kind.symbol() + wrapUnary(operand());
            case NEXT, EXISTS_NEXT, FORALL_NEXT, EXISTS_ALWAYS, FORALL_ALWAYS,
                 EXISTS_EVENTUALLY, FORALL_EVENTUALLY -> kind.symbol() + "(" + operand() + ")";
            case AND, OR, IMPLIES, UNTIL, RELEASE, WEAK_UNTIL, STRONG_RELEASE ->
                    wrapBinary(left()) + " " + kind.symbol() + " " + wrapBinary(right());
            case EXISTS_UNTIL, FORALL_UNTIL ->
                    kind.symbol() + "[" + wrapBinary(left()) + " U " + wrapBinary(right()) + "]";
        };
    }

    private static String wrapUnary(TemporalFormula f) {
        return f.kind.arity() == 2 ? "(" + f + ")" : f.toString();
    }

    private static String wrapBinary(TemporalFormula f) {
        boolean bracketed = f.kind == FormulaKind.EXISTS_UNTIL || f.kind == FormulaKind.FORALL_UNTIL;
        return f.kind.arity() == 2 && !bracketed ? "(" + f + ")" : f.toString();
    }

    private void requireArity(int expected) {
        if (kind.arity() != expected) {
            throw new IllegalStateException(kind + " has arity " + kind.arity());
        }
    }

    private static void collectAtoms(TemporalFormula f, Set<String> out) {
        if (f.isAtomic()) {
            out.add(f.name);
            return;
        }
        for (TemporalFormula op : f.operands) collectAtoms(op, out);
    }

    private static void collectSubformulas(TemporalFormula f, LinkedHashSet<TemporalFormula> out) {
        for (TemporalFormula op : f.operands) collectSubformulas(op, out);
        out.add(f);
    }
}
