/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import ai.evacortex.chronocheck.core.engine.CounterexampleTrace;
import ai.evacortex.chronocheck.core.engine.TraceType;
import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;
import ai.evacortex.chronocheck.core.formula.FormulaKind;
import ai.evacortex.chronocheck.core.formula.FormulaRewriter;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;
import ai.evacortex.chronocheck.core.model.StateSpace;

import java.util.*;

/**
 * Bounded encoding of LTL over lasso-shaped words.
 *
 * <p>A word of {@code k+1} positions {@code 0..k} loops back from {@code k} to the position held
 * in the Int constant {@code loop}. Every non-atomic subformula {@code ψ} gets one Bool constant
 * {@code f<n>@i} per position, defined by its one-step expansion. The successor of position
 * {@code k} is position {@code loop}. Until and release additionally get an auxiliary chain
 * {@code aux<n>@i} evaluated over a single pass of the loop ({@code aux@(k+1)} is false for until,
 * true for release); the value after {@code k} is {@code aux@loop}. This pins every eventuality
 * to the least fixed point, so a model is always a genuine infinite word.</p>
 *
 * <p>Paths of a {@link StateSpace} are read over its total extension: a state without successors
 * repeats forever, so a run that reaches a deadlock still yields an infinite word.</p>
 *
 * <p>Any lasso of fewer positions unrolls into one of {@code k+1} positions, so one query at the
 * largest affordable bound covers all shorter ones. A satisfiable query is conclusive at any
 * bound. An unsatisfiable one is conclusive only when {@code k+1} reaches
 * {@link #completenessThreshold}.</p>
 */
public final class LtlBoundedEncoder {

    public static final String LOOP = "loop";

    /**
     * @param positions number of word positions encoded ({@code k+1})
     * @param threshold positions needed before an unsat answer proves absence of models
     */
    public record Encoding(SmtScript script, TemporalFormula formula, int positions, long threshold) {
        public boolean complete() {
            return positions >= threshold;
        }
    }

    /** Encodes satisfiability of {@code formula} over arbitrary infinite words. */
    public Encoding encodeSatisfiability(TemporalFormula formula, int maxBound) {
        requireLinear(formula);
        TemporalFormula f = FormulaRewriter.desugar(formula);
        long threshold = completenessThreshold(f, 0);
        int positions = positions(threshold, maxBound);
        Unrolling u = new Unrolling(f, positions);
        SmtScript.Builder b = u.header();
        u.semantics(b);
        b.assertNamed("formula", u.at(f, 0));
        return new Encoding(b.build(), f, positions, threshold);
    }

    /**
     * Encodes the existence of an infinite path of {@code space}, starting in an initial state,
     * on which {@code property} fails. The property is reduced to LTL first.
     *
     * @throws UnsupportedFormulaException if the property has no linear-time equivalent
     */
    public Encoding encodeViolation(TemporalFormula property, StateSpace space, int maxBound) {
        TemporalFormula negated = negation(property);
        long threshold = completenessThreshold(negated, space.stateCount());
        int positions = positions(threshold, maxBound);
        Unrolling u = new Unrolling(negated, positions);
        SmtScript.Builder b = u.header();
        u.path(b, space);
        u.semantics(b);
        b.assertNamed("negated-property", u.at(negated, 0));
        return new Encoding(b.build(), negated, positions, threshold);
    }

    /** Completeness threshold of the violation query for {@code property} on a space of {@code states} states. */
    public static long violationThreshold(TemporalFormula property, int states) {
        return completenessThreshold(negation(property), states);
    }

    /** Positions actually encoded for a threshold under a bound. */
    public static int positions(long threshold, int maxBound) {
        return (int) Math.max(1, Math.min(threshold, maxBound));
    }

    private static TemporalFormula negation(TemporalFormula property) {
        return FormulaRewriter.desugar(TemporalFormula.not(FormulaRewriter.toLinear(property)));
    }

    /**
     * Positions that guarantee a lasso model exists whenever any model exists, saturating at
     * {@code Long.MAX_VALUE}. Over free words ({@code states == 0}) this is
     * {@code 2^(atoms + temporal) · (eventualities + 1)}. On the paths of a state space the
     * labelling fixes the atoms, giving {@code states · 2^temporal · (eventualities + 1)}.
     */
    public static long completenessThreshold(TemporalFormula f, int states) {
        int atoms = 0;
        int temporal = 0;
        int eventualities = 0;
        for (TemporalFormula sub : f.subformulas()) {
            if (sub.isAtomic()) {
                if (!isConstant(sub.name())) atoms++;
            } else if (sub.kind().isTemporal()) {
                temporal++;
                if (sub.kind() != FormulaKind.NEXT) eventualities++;
            }
        }
        int exponent = states > 0 ? temporal : atoms + temporal;
        long base = exponent >= 62 ? Long.MAX_VALUE : 1L << exponent;
        return saturatingMultiply(saturatingMultiply(Math.max(states, 1), base), eventualities + 1L);
    }

    /**
     * Reads the lasso of a violation model: {@code st@0..st@k} with the closing edge back to {@code loop}.
     */
    public static CounterexampleTrace decodeLasso(ConstraintModel model, int positions, StateSpace space) {
        List<Integer> states = new ArrayList<>(positions);
        for (int i = 0; i < positions; i++) {
            ModelValue v = model.variableAssignments().get(stateVar(i));
            if (v == null) throw new IllegalStateException("model has no value for " + stateVar(i));
            states.add((int) v.asLong());
        }
        ModelValue loopValue = model.variableAssignments().get(LOOP);
        int loop = loopValue == null ? 0 : (int) loopValue.asLong();
        List<String> labels = new ArrayList<>(states.size());
        for (int i = 0; i + 1 < states.size(); i++) {
            labels.add(edgeLabel(space, states.get(i), states.get(i + 1)));
        }
        labels.add(edgeLabel(space, states.get(states.size() - 1), states.get(loop)));
        return new CounterexampleTrace(states, labels, loop, TraceType.INFINITE);
    }

    static String stateVar(int i) {
        return "st@" + i;
    }

    static String atomVar(String atom, int i) {
        return "p!" + atom + "@" + i;
    }

    private static String edgeLabel(StateSpace space, int from, int to) {
        String label = space.transitionLabel(from, to);
        return label != null ? label : from + "->" + to;
    }

    private static void requireLinear(TemporalFormula f) {
        if (!f.isLinear()) throw new UnsupportedFormulaException("'" + f + "' contains a path quantifier");
    }

    private static boolean isConstant(String atom) {
        return atom.equals("true") || atom.equals("false");
    }

    private static long saturatingMultiply(long a, long b) {
        long hi = Math.multiplyHigh(a, b);
        long lo = a * b;
        return (hi == 0 && lo >= 0) ? lo : Long.MAX_VALUE;
    }

    /** Variable naming and clause generation for one formula at one bound. */
    private static final class Unrolling {
        private final int k;
        private final Map<TemporalFormula, Integer> index = new LinkedHashMap<>();

        Unrolling(TemporalFormula root, int positions) {
            this.k = positions - 1;
            List<TemporalFormula> subs = root.subformulas();
            for (int n = 0; n < subs.size(); n++) index.put(subs.get(n), n);
        }

        SmtScript.Builder header() {
            SmtScript.Builder b = SmtScript.builder().setOption("produce-unsat-cores", "true");
            b.declareConst(LOOP, SmtSort.INT);
            b.assertNamed("loop-range", SmtTerms.and(List.of(
                    "(<= 0 " + LOOP + ")", "(<= " + LOOP + " " + k + ")")));
            for (TemporalFormula sub : index.keySet()) {
                for (int i = 0; i <= k; i++) {
                    if (sub.isAtomic()) {
                        if (!isConstant(sub.name())) b.declareConst(atomVar(sub.name(), i), SmtSort.BOOL);
                    } else {
                        b.declareConst(fVar(sub, i), SmtSort.BOOL);
                        if (hasAux(sub)) b.declareConst(auxVar(sub, i), SmtSort.BOOL);
                    }
                }
            }
            return b;
        }

        /** Initial state, transition relation including the closing edge, and labelling. */
        void path(SmtScript.Builder b, StateSpace space) {
            int n = space.stateCount();
            for (int i = 0; i <= k; i++) b.declareConst(stateVar(i), SmtSort.INT);

            List<String> ranges = new ArrayList<>();
            for (int i = 0; i <= k; i++) {
                ranges.add("(<= 0 " + stateVar(i) + ")");
                ranges.add("(< " + stateVar(i) + " " + n + ")");
            }
            b.assertNamed("state-range", SmtTerms.and(ranges));

            List<String> init = new ArrayList<>();
            space.initialStates().stream().forEach(s -> init.add(SmtTerms.eq(stateVar(0), Integer.toString(s))));
            b.assertNamed("initial-state", SmtTerms.or(init));

            List<String> steps = new ArrayList<>();
            for (int i = 0; i < k; i++) steps.add(step(space, stateVar(i), stateVar(i + 1)));
            for (int j = 0; j <= k; j++) {
                steps.add(SmtTerms.implies(SmtTerms.eq(LOOP, Integer.toString(j)), step(space, stateVar(k), stateVar(j))));
            }
            b.assertNamed("transition-relation", SmtTerms.and(steps));

            List<String> labelling = new ArrayList<>();
            for (TemporalFormula sub : index.keySet()) {
                if (!sub.isAtomic() || isConstant(sub.name())) continue;
                BitSet holds = space.label(sub.name());
                for (int i = 0; i <= k; i++) {
                    List<String> where = new ArrayList<>();
                    final int pos = i;
                    holds.stream().forEach(s -> where.add(SmtTerms.eq(stateVar(pos), Integer.toString(s))));
                    labelling.add(SmtTerms.iff(atomVar(sub.name(), i), SmtTerms.or(where)));
                }
            }
            b.assertNamed("labelling", SmtTerms.and(labelling));
        }

        /** One step of the relation; a dead state stutters on itself. */
        private static String step(StateSpace space, String from, String to) {
            List<String> cases = new ArrayList<>();
            for (int u = 0; u < space.stateCount(); u++) {
                List<String> targets = new ArrayList<>();
                for (int v : space.successors(u)) targets.add(SmtTerms.eq(to, Integer.toString(v)));
                if (targets.isEmpty()) targets.add(SmtTerms.eq(to, Integer.toString(u)));
                cases.add(SmtTerms.implies(SmtTerms.eq(from, Integer.toString(u)), SmtTerms.or(targets)));
            }
            return SmtTerms.and(cases);
        }

        /** One defining equation per non-atomic subformula and position. */
        void semantics(SmtScript.Builder b) {
            List<String> defs = new ArrayList<>();
            for (TemporalFormula sub : index.keySet()) {
                if (sub.isAtomic()) continue;
                for (int i = 0; i <= k; i++) {
                    defs.add(SmtTerms.iff(fVar(sub, i), expansion(sub, i, false)));
                    if (hasAux(sub)) defs.add(SmtTerms.iff(auxVar(sub, i), expansion(sub, i, true)));
                }
            }
            b.assertNamed("semantics", SmtTerms.and(defs));
        }

        private String expansion(TemporalFormula f, int i, boolean aux) {
            return switch (f.kind()) {
                case NOT -> SmtTerms.not(at(f.operand(), i));
                case AND -> SmtTerms.and(List.of(at(f.left(), i), at(f.right(), i)));
                case OR -> SmtTerms.or(List.of(at(f.left(), i), at(f.right(), i)));
                case IMPLIES -> SmtTerms.implies(at(f.left(), i), at(f.right(), i));
                case NEXT -> i < k ? at(f.operand(), i + 1) : loopSelect(f.operand());
                case UNTIL -> SmtTerms.or(List.of(at(f.right(), i),
                        SmtTerms.and(List.of(at(f.left(), i), after(f, i, aux)))));
                case RELEASE -> SmtTerms.and(List.of(at(f.right(), i),
                        SmtTerms.or(List.of(at(f.left(), i), after(f, i, aux)))));
                case EVENTUALLY -> SmtTerms.or(List.of(at(f.operand(), i), after(f, i, aux)));
                case ALWAYS -> SmtTerms.and(List.of(at(f.operand(), i), after(f, i, aux)));
                default -> throw new UnsupportedFormulaException(f.kind(), "bounded encoding");
            };
        }

        /** Value of a fixed-point subformula at position {@code i+1}. */
        private String after(TemporalFormula f, int i, boolean aux) {
            if (i < k) return aux ? auxVar(f, i + 1) : fVar(f, i + 1);
            if (aux) {
                boolean leastFixpoint = f.kind() == FormulaKind.UNTIL || f.kind() == FormulaKind.EVENTUALLY;
                return leastFixpoint ? "false" : "true";
            }
            List<String> options = new ArrayList<>();
            for (int j = 0; j <= k; j++) {
                options.add(SmtTerms.and(List.of(SmtTerms.eq(LOOP, Integer.toString(j)), auxVar(f, j))));
            }
            return SmtTerms.or(options);
        }

        private String loopSelect(TemporalFormula f) {
            List<String> options = new ArrayList<>();
            for (int j = 0; j <= k; j++) {
                options.add(SmtTerms.and(List.of(SmtTerms.eq(LOOP, Integer.toString(j)), at(f, j))));
            }
            return SmtTerms.or(options);
        }

        String at(TemporalFormula f, int i) {
            if (f.isAtomic()) {
                if (isConstant(f.name())) return f.name();
                return SmtTerms.symbol(atomVar(f.name(), i));
            }
            return fVar(f, i);
        }

        private String fVar(TemporalFormula f, int i) {
            return "f" + index.get(f) + "@" + i;
        }

        private String auxVar(TemporalFormula f, int i) {
            return "aux" + index.get(f) + "@" + i;
        }

        private static boolean hasAux(TemporalFormula f) {
            return switch (f.kind()) {
                case UNTIL, RELEASE, EVENTUALLY, ALWAYS -> true;
                default -> false;
            };
        }
    }
}
