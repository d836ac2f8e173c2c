/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

import ai.evacortex.chronocheck.core.exceptions.StateSpaceInvariantException;
import ai.evacortex.chronocheck.core.util.HashingUtil;

import java.util.*;

/**
 * Finite Kripke structure stored as an arena: states are indexed {@code 0..n-1}, transitions
 * are adjacency lists of ids and every state set is a {@link BitSet}.
 *
 * <p>Instances are immutable once built and safe to share between checking threads. All
 * structural invariants (transition endpoints, initial states and labels inside the arena)
 * are verified by {@link Builder#build()}.</p>
 */
public final class StateSpace {

    private final List<SystemState> states;
    private final List<List<Transition>> outgoing;
    private final int[][] successors;
    private final BitSet initial;
    private final Map<String, BitSet> labels;
    private final boolean trivial;
    private final boolean truncated;
    private final int transitionCount;

    private StateSpace(Builder b) {
        this.states = List.copyOf(b.states);
        int n = states.size();
        List<List<Transition>> out = new ArrayList<>(n);
        this.successors = new int[n][];
        int edges = 0;
        for (int i = 0; i < n; i++) {
            List<Transition> ts = List.copyOf(b.outgoing.get(i));
            out.add(ts);
            BitSet targets = new BitSet(n);
            for (Transition t : ts) targets.set(t.to());
            successors[i] = targets.stream().toArray();
            edges += ts.size();
        }
        this.outgoing = List.copyOf(out);
        this.initial = (BitSet) b.initial.clone();
        Map<String, BitSet> copy = new TreeMap<>();
        b.labels.forEach((k, v) -> copy.put(k, (BitSet) v.clone()));
        this.labels = Collections.unmodifiableMap(copy);
        this.trivial = b.trivial;
        this.truncated = b.truncated;
        this.transitionCount = edges;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int stateCount() {
        return states.size();
    }

    public int transitionCount() {
        return transitionCount;
    }

    public SystemState state(int id) {
        return states.get(id);
    }

    public List<SystemState> states() {
        return states;
    }

    public List<Transition> transitionsFrom(int id) {
        return outgoing.get(id);
    }

    /** Distinct successor ids in ascending order. The returned array is shared and must not be modified. */
    public int[] successors(int id) {
        return successors[id];
    }

    public boolean hasSuccessors(int id) {
        return successors[id].length > 0;
    }

    public BitSet initialStates() {
        return (BitSet) initial.clone();
    }

    public BitSet allStates() {
        BitSet all = new BitSet(states.size());
        all.set(0, states.size());
        return all;
    }

    /** States labelled with {@code proposition}; empty for unknown propositions. */
    public BitSet label(String proposition) {
        BitSet set = labels.get(proposition);
        return set == null ? new BitSet(states.size()) : (BitSet) set.clone();
    }

    public boolean hasProposition(String proposition) {
        return labels.containsKey(proposition);
    }

    public Set<String> propositions() {
        return labels.keySet();
    }

    /** Built from a document that declares no state variables, or whose functions never fire. */
    public boolean isTrivial() {
        return trivial;
    }

    /** Exploration stopped at the state bound; transitions out of the frontier are missing. */
    public boolean isTruncated() {
        return truncated;
    }

    /** Label of the first transition from {@code from} to {@code to}, or {@code null} if none. */
    public String transitionLabel(int from, int to) {
        for (Transition t : outgoing.get(from)) {
            if (t.to() == to) return t.label();
        }
        return null;
    }

    /**
     * Structural fingerprint (XXHash64) over states, edges, initial states and labels.
     * Two spaces with the same fingerprint are treated as identical by the solver cache.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder();
        sb.append(states.size()).append('|').append(initial).append('|');
        for (int i = 0; i < states.size(); i++) {
            sb.append(i).append(':').append(Arrays.toString(successors[i])).append(';');
        }
        labels.forEach((k, v) -> sb.append(k).append('=').append(v).append(';'));
        return HashingUtil.toHex(HashingUtil.xxHash64(sb.toString()));
    }

    @Override
    public String toString() {
        return "StateSpace{states=" + states.size() + ", transitions=" + transitionCount
                + ", initial=" + initial + (trivial ? ", trivial" : "") + (truncated ? ", truncated" : "") + "}";
    }

    public static final class Builder {
        private final List<SystemState> states = new ArrayList<>();
        private final List<List<Transition>> outgoing = new ArrayList<>();
        private final BitSet initial = new BitSet();
        private final Map<String, BitSet> labels = new HashMap<>();
        private boolean trivial;
        private boolean truncated;

        private Builder() {
        }

        /** Adds a state; its id must equal the current state count. */
        public Builder addState(SystemState state) {
            if (state.id() != states.size()) {
                throw new StateSpaceInvariantException("state id " + state.id() + " added at index " + states.size());
            }
            states.add(state);
            outgoing.add(new ArrayList<>());
            for (String p : state.properties()) labels.computeIfAbsent(p, k -> new BitSet()).set(state.id());
            return this;
        }

        /** Convenience for tests and synthetic graphs: a state with only propositions. */
        public Builder addState(int id, String... propositions) {
            return addState(new SystemState(id, Map.of(), Set.of(), new LinkedHashSet<>(Arrays.asList(propositions))));
        }

        public Builder addTransition(Transition t) {
            if (t.from() < 0 || t.from() >= states.size()) {
                throw new StateSpaceInvariantException("transition source " + t.from() + " is not a state");
            }
            outgoing.get(t.from()).add(t);
            return this;
        }

        public Builder addTransition(int from, int to) {
            return addTransition(Transition.of(from, to));
        }

        public Builder markInitial(int id) {
            initial.set(id);
            return this;
        }

        /** Registers a proposition; states already labelled with it keep their labels. */
        public Builder declareProposition(String proposition) {
            labels.computeIfAbsent(proposition, k -> new BitSet());
            return this;
        }

        public Builder trivial(boolean value) {
            this.trivial = value;
            return this;
        }

        public Builder truncated(boolean value) {
            this.truncated = value;
            return this;
        }

        public StateSpace build() {
            int n = states.size();
            if (n == 0) throw new StateSpaceInvariantException("state space has no states");
            if (initial.isEmpty()) throw new StateSpaceInvariantException("state space has no initial state");
            if (initial.length() > n) {
                throw new StateSpaceInvariantException("initial state " + (initial.length() - 1) + " is not a state");
            }
            for (int i = 0; i < n; i++) {
                for (Transition t : outgoing.get(i)) {
                    if (t.to() < 0 || t.to() >= n) {
                        throw new StateSpaceInvariantException("transition " + t.from() + "->" + t.to()
                                + " targets an unknown state");
                    }
                    if (t.probability() != null && (t.probability() < 0.0 || t.probability() > 1.0)) {
                        throw new StateSpaceInvariantException("transition " + t.from() + "->" + t.to()
                                + " has probability " + t.probability());
                    }
                }
            }
            for (Map.Entry<String, BitSet> e : labels.entrySet()) {
                if (e.getValue().length() > n) {
                    throw new StateSpaceInvariantException("proposition '" + e.getKey() + "' labels an unknown state");
                }
            }
            return new StateSpace(this);
        }
    }
}
