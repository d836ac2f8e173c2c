/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.formula;

import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural rewrites used before bounded encoding.
 */
public final class FormulaRewriter {

    private FormulaRewriter() {
    }

    /**
     * Replaces weak until and strong release with until/release:
     * {@code a W b = b R (a ∨ b)} and {@code a M b = b U (a ∧ b)}.
     */
    public static TemporalFormula desugar(TemporalFormula f) {
        if (f.isAtomic()) return f;
        List<TemporalFormula> ops = new ArrayList<>(f.operands().size());
        for (TemporalFormula op : f.operands()) ops.add(desugar(op));
        return switch (f.kind()) {
            case WEAK_UNTIL -> TemporalFormula.release(ops.get(1), TemporalFormula.or(ops.get(0), ops.get(1)));
            case STRONG_RELEASE -> TemporalFormula.until(ops.get(1), TemporalFormula.and(ops.get(0), ops.get(1)));
            default -> new TemporalFormula(f.kind(), null, ops);
        };
    }

    /**
     * Reduces a formula to an equivalent LTL formula.
     *
     * <p>Pure LTL passes through unchanged. A conjunction of universally quantified formulas
     * whose arguments contain no further path quantifier is reduced by dropping the {@code A}:
     * {@code AG φ} becomes {@code □φ}, {@code A[φ U ψ]} becomes {@code φ U ψ}. Anything else
     * (existential quantifiers, nested quantifiers) has no LTL equivalent in general.</p>
     *
     * @throws UnsupportedFormulaException if the formula is outside the reducible fragment
     */
    public static TemporalFormula toLinear(TemporalFormula f) {
        if (f.isLinear()) return f;
        if (f.kind() == FormulaKind.AND) {
            return TemporalFormula.and(toLinear(f.left()), toLinear(f.right()));
        }
        if (f.kind().quantifier() != PathQuantifierType.ALL_PATHS) {
            throw new UnsupportedFormulaException("'" + f + "' has no linear-time equivalent");
        }
        for (TemporalFormula op : f.operands()) {
            if (!op.isLinear()) {
                throw new UnsupportedFormulaException("nested path quantifier in '" + f + "'");
            }
        }
        return switch (f.kind()) {
            case FORALL_ALWAYS -> TemporalFormula.always(f.operand());
            case FORALL_EVENTUALLY -> TemporalFormula.eventually(f.operand());
            case FORALL_NEXT -> TemporalFormula.next(f.operand());
            case FORALL_UNTIL -> TemporalFormula.until(f.left(), f.right());
            default -> throw new UnsupportedFormulaException(f.kind(), "linear reduction");
        };
    }
}
