/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.engine;

import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;
import ai.evacortex.chronocheck.core.formula.FormulaKind;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;
import ai.evacortex.chronocheck.core.model.ModelLimits;
import ai.evacortex.chronocheck.core.model.StateSpace;

import java.util.*;
import java.util.function.IntPredicate;

/**
 * Explicit-state CTL model checker.
 *
 * <p>Satisfying sets are computed bottom-up over the formula tree. {@code EF} and {@code AF}
 * are least fixed points grown from the operand's set, {@code EG} and {@code AG} greatest fixed
 * points shrunk from it. Each pass that changes the set adds or removes at least one state, so
 * every loop stops after at most {@code |S|} changing passes.</p>
 *
 * <p>States without successors satisfy neither {@code AX φ} nor {@code AG φ} nor {@code EG φ}.
 * Unquantified temporal operators and {@code E[φ U ψ]} / {@code A[φ U ψ]} are rejected and
 * reported as UNKNOWN.</p>
 *
 * <p>The checker holds no mutable state; concurrent calls on a shared {@link StateSpace} are safe.</p>
 */
public class CtlModelChecker {

    private final ModelLimits limits;

    public CtlModelChecker() {
        this(ModelLimits.defaults());
    }

    public CtlModelChecker(ModelLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public CheckOutcome check(TemporalFormula formula, StateSpace space) {
        if (space.stateCount() > limits.maxStates()) {
            return CheckOutcome.inconclusive(PropertyVerificationResult.unknown(
                    "state bound exceeded: " + space.stateCount() + " > " + limits.maxStates()));
        }
        List<FixpointStats> stats = new ArrayList<>();
        BitSet sat;
        try {
            sat = evaluate(formula, space, stats);
        } catch (UnsupportedFormulaException e) {
            return CheckOutcome.inconclusive(PropertyVerificationResult.unknown(e.getMessage()));
        }

        BitSet violating = space.initialStates();
        violating.andNot(sat);
        if (violating.isEmpty()) {
            return new CheckOutcome(PropertyVerificationResult.satisfied(), null,
                    witness(formula, space, sat), stats, sat);
        }
        int start = violating.nextSetBit(0);
        return new CheckOutcome(PropertyVerificationResult.violated(),
                counterexample(formula, space, start), null, stats, sat);
    }

    /**
     * States satisfying {@code formula}.
     *
     * @throws UnsupportedFormulaException for operators outside the fixed-point fragment
     */
    public BitSet satisfying(TemporalFormula formula, StateSpace space) {
        return evaluate(formula, space, new ArrayList<>());
    }

    private BitSet evaluate(TemporalFormula f, StateSpace space, List<FixpointStats> stats) {
        return switch (f.kind()) {
            case ATOMIC -> atomic(f.name(), space);
            case NOT -> {
                BitSet s = space.allStates();
                s.andNot(evaluate(f.operand(), space, stats));
                yield s;
            }
            case AND -> {
                BitSet s = evaluate(f.left(), space, stats);
                s.and(evaluate(f.right(), space, stats));
                yield s;
            }
            case OR -> {
                BitSet s = evaluate(f.left(), space, stats);
                s.or(evaluate(f.right(), space, stats));
                yield s;
            }
            case IMPLIES -> {
                BitSet s = space.allStates();
                s.andNot(evaluate(f.left(), space, stats));
                s.or(evaluate(f.right(), space, stats));
                yield s;
            }
            case EXISTS_NEXT -> existsNext(space, evaluate(f.operand(), space, stats));
            case FORALL_NEXT -> forallNext(space, evaluate(f.operand(), space, stats));
            case EXISTS_EVENTUALLY -> existsEventually(f, space, evaluate(f.operand(), space, stats), stats);
            case FORALL_EVENTUALLY -> forallEventually(f, space, evaluate(f.operand(), space, stats), stats);
            case EXISTS_ALWAYS -> existsAlways(f, space, evaluate(f.operand(), space, stats), stats);
            case FORALL_ALWAYS -> forallAlways(f, space, evaluate(f.operand(), space, stats), stats);
            case ALWAYS, EVENTUALLY, NEXT, UNTIL, RELEASE, WEAK_UNTIL, STRONG_RELEASE ->
                    throw new UnsupportedFormulaException("path operator " + f.kind().symbol()
                            + " without a path quantifier is not a CTL state formula: " + f);
            case EXISTS_UNTIL, FORALL_UNTIL -> throw new UnsupportedFormulaException(f.kind(), "the fixed-point checker");
        };
    }

    private static BitSet atomic(String name, StateSpace space) {
        if (name.equals("true") && !space.hasProposition("true")) return space.allStates();
        if (name.equals("false") && !space.hasProposition("false")) return new BitSet(space.stateCount());
        return space.label(name);
    }

    static BitSet existsNext(StateSpace space, BitSet target) {
        BitSet out = new BitSet(space.stateCount());
        for (int s = 0; s < space.stateCount(); s++) {
            if (anySuccessorIn(space, s, target)) out.set(s);
        }
        return out;
    }

    static BitSet forallNext(StateSpace space, BitSet target) {
        BitSet out = new BitSet(space.stateCount());
        for (int s = 0; s < space.stateCount(); s++) {
            if (space.hasSuccessors(s) && allSuccessorsIn(space, s, target)) out.set(s);
        }
        return out;
    }

    /** Least fixed point: add every state with an edge into the current set. */
    private static BitSet existsEventually(TemporalFormula f, StateSpace space, BitSet target, List<FixpointStats> stats) {
        BitSet current = (BitSet) target.clone();
        int passes = 0;
        while (true) {
            BitSet next = (BitSet) current.clone();
            for (int s = current.nextClearBit(0); s < space.stateCount(); s = current.nextClearBit(s + 1)) {
                if (anySuccessorIn(space, s, current)) next.set(s);
            }
            if (next.equals(current)) break;
            current = next;
            passes++;
        }
        stats.add(new FixpointStats(f.kind(), f.toString(), passes, current.cardinality()));
        return current;
    }

    /** Least fixed point: add every state whose successors are non-empty and all in the current set. */
    private static BitSet forallEventually(TemporalFormula f, StateSpace space, BitSet target, List<FixpointStats> stats) {
        BitSet current = (BitSet) target.clone();
        int passes = 0;
        while (true) {
            BitSet next = (BitSet) current.clone();
            for (int s = current.nextClearBit(0); s < space.stateCount(); s = current.nextClearBit(s + 1)) {
                if (space.hasSuccessors(s) && allSuccessorsIn(space, s, current)) next.set(s);
            }
            if (next.equals(current)) break;
            current = next;
            passes++;
        }
        stats.add(new FixpointStats(f.kind(), f.toString(), passes, current.cardinality()));
        return current;
    }

    /** Greatest fixed point: remove every state with no successor left in the current set. */
    private static BitSet existsAlways(TemporalFormula f, StateSpace space, BitSet target, List<FixpointStats> stats) {
        BitSet current = (BitSet) target.clone();
        int passes = 0;
        while (true) {
            BitSet next = (BitSet) current.clone();
            for (int s = current.nextSetBit(0); s >= 0; s = current.nextSetBit(s + 1)) {
                if (!anySuccessorIn(space, s, current)) next.clear(s);
            }
            if (next.equals(current)) break;
            current = next;
            passes++;
        }
        stats.add(new FixpointStats(f.kind(), f.toString(), passes, current.cardinality()));
        return current;
    }

    /** Greatest fixed point: remove every state that is dead or can leave the current set. */
    private static BitSet forallAlways(TemporalFormula f, StateSpace space, BitSet target, List<FixpointStats> stats) {
        BitSet current = (BitSet) target.clone();
        int passes = 0;
        while (true) {
            BitSet next = (BitSet) current.clone();
            for (int s = current.nextSetBit(0); s >= 0; s = current.nextSetBit(s + 1)) {
                if (!space.hasSuccessors(s) || !allSuccessorsIn(space, s, current)) next.clear(s);
            }
            if (next.equals(current)) break;
            current = next;
            passes++;
        }
        stats.add(new FixpointStats(f.kind(), f.toString(), passes, current.cardinality()));
        return current;
    }

    private static boolean anySuccessorIn(StateSpace space, int s, BitSet set) {
        for (int t : space.successors(s)) {
            if (set.get(t)) return true;
        }
        return false;
    }

    private static boolean allSuccessorsIn(StateSpace space, int s, BitSet set) {
        for (int t : space.successors(s)) {
            if (!set.get(t)) return false;
        }
        return true;
    }

    private CounterexampleTrace counterexample(TemporalFormula f, StateSpace space, int start) {
        return switch (f.kind()) {
            case FORALL_ALWAYS -> {
                BitSet good = evaluate(f.operand(), space, new ArrayList<>());
                List<Integer> path = shortestPath(space, start, s -> !good.get(s) || !space.hasSuccessors(s));
                yield path == null
                        ? new CounterexampleTrace(List.of(start), List.of(), null, TraceType.PARTIAL)
                        : new CounterexampleTrace(path, labels(space, path, null), null, TraceType.FINITE);
            }
            case FORALL_EVENTUALLY -> {
                BitSet af = satisfying(f, space);
                yield lassoCounterexample(space, start, af);
            }
            case FORALL_NEXT -> {
                BitSet target = evaluate(f.operand(), space, new ArrayList<>());
                for (int t : space.successors(start)) {
                    if (!target.get(t)) {
                        List<Integer> path = List.of(start, t);
                        yield new CounterexampleTrace(path, labels(space, path, null), null, TraceType.FINITE);
                    }
                }
                yield new CounterexampleTrace(List.of(start), List.of(), null, TraceType.FINITE);
            }
            default -> new CounterexampleTrace(List.of(start), List.of(), null, TraceType.PARTIAL);
        };
    }

    /** Walks inside the complement of {@code af} until a deadlock or a repeated state. */
    private static CounterexampleTrace lassoCounterexample(StateSpace space, int start, BitSet af) {
        List<Integer> path = new ArrayList<>();
        Map<Integer, Integer> seen = new HashMap<>();
        int s = start;
        while (true) {
            seen.put(s, path.size());
            path.add(s);
            int next = -1;
            for (int t : space.successors(s)) {
                if (!af.get(t)) {
                    next = t;
                    break;
                }
            }
            if (next < 0) {
                return new CounterexampleTrace(path, labels(space, path, null), null, TraceType.FINITE);
            }
            Integer loop = seen.get(next);
            if (loop != null) {
                return new CounterexampleTrace(path, labels(space, path, loop), loop, TraceType.INFINITE);
            }
            s = next;
        }
    }

    private WitnessTrace witness(TemporalFormula f, StateSpace space, BitSet sat) {
        BitSet init = space.initialStates();
        int start = init.nextSetBit(0);
        return switch (f.kind()) {
            case EXISTS_EVENTUALLY -> {
                BitSet target = evaluate(f.operand(), space, new ArrayList<>());
                List<Integer> path = shortestPath(space, start, target::get);
                yield path == null ? null : new WitnessTrace(path, labels(space, path, null), null, TraceType.FINITE);
            }
            case EXISTS_ALWAYS -> {
                List<Integer> path = new ArrayList<>();
                Map<Integer, Integer> seen = new HashMap<>();
                int s = start;
                while (true) {
                    seen.put(s, path.size());
                    path.add(s);
                    int next = -1;
                    for (int t : space.successors(s)) {
                        if (sat.get(t)) {
                            next = t;
                            break;
                        }
                    }
                    if (next < 0) yield null;
                    Integer loop = seen.get(next);
                    if (loop != null) {
                        yield new WitnessTrace(path, labels(space, path, loop), loop, TraceType.INFINITE);
                    }
                    s = next;
                }
            }
            case EXISTS_NEXT -> {
                BitSet target = evaluate(f.operand(), space, new ArrayList<>());
                for (int t : space.successors(start)) {
                    if (target.get(t)) {
                        List<Integer> path = List.of(start, t);
                        yield new WitnessTrace(path, labels(space, path, null), null, TraceType.FINITE);
                    }
                }
                yield null;
            }
            default -> null;
        };
    }

    /** BFS from {@code start} to the nearest state accepted by {@code goal}; {@code null} if none is reachable. */
    private static List<Integer> shortestPath(StateSpace space, int start, IntPredicate goal) {
        int n = space.stateCount();
        int[] parent = new int[n];
        Arrays.fill(parent, -2);
        parent[start] = -1;
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int s = queue.poll();
            if (goal.test(s)) {
                LinkedList<Integer> path = new LinkedList<>();
                for (int v = s; v >= 0; v = parent[v]) path.addFirst(v);
                return path;
            }
            for (int t : space.successors(s)) {
                if (parent[t] == -2) {
                    parent[t] = s;
                    queue.add(t);
                }
            }
        }
        return null;
    }

    private static List<String> labels(StateSpace space, List<Integer> path, Integer loop) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i + 1 < path.size(); i++) out.add(space.transitionLabel(path.get(i), path.get(i + 1)));
        if (loop != null) out.add(space.transitionLabel(path.get(path.size() - 1), path.get(loop)));
        return out;
    }
}
