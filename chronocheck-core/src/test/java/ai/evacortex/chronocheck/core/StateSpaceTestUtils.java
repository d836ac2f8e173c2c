/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core;

import ai.evacortex.chronocheck.core.document.*;
import ai.evacortex.chronocheck.core.model.StateSpace;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Map;
import java.util.Random;

public final class StateSpaceTestUtils {

    private StateSpaceTestUtils() {
    }

    /** Two processes sharing a lock; loaded from {@code documents/mutex.json}. */
    public static SpecDocument mutexDocument() {
        try (InputStream in = StateSpaceTestUtils.class.getResourceAsStream("/documents/mutex.json")) {
            if (in == null) throw new IllegalStateException("documents/mutex.json not on the test classpath");
            return new SpecDocumentReader().read(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** One boolean {@code on} flipped by two guarded functions. */
    public static SpecDocument.Builder toggleDocument() {
        return SpecDocument.builder("toggle")
                .variable(StateVariable.bool("on", false))
                .function(new FunctionDecl("turnOn", null, Expression.raw("¬on", SourceSpan.UNKNOWN), Map.of("on", "true")))
                .function(new FunctionDecl("turnOff", null, Expression.raw("on", SourceSpan.UNKNOWN), Map.of("on", "false")));
    }

    /** One boolean {@code done} set once by {@code finish}; the second state has no successors. */
    public static SpecDocument.Builder finishDocument() {
        return SpecDocument.builder("finish")
                .variable(StateVariable.bool("done", false))
                .function(new FunctionDecl("finish", null, Expression.raw("¬done", SourceSpan.UNKNOWN), Map.of("done", "true")));
    }

    /** s0 → s1 → s2 → s0, with {@code p} holding only in s2. */
    public static StateSpace cycle3() {
        return StateSpace.builder()
                .addState(0)
                .addState(1)
                .addState(2, "p")
                .declareProposition("p")
                .addTransition(0, 1)
                .addTransition(1, 2)
                .addTransition(2, 0)
                .markInitial(0)
                .build();
    }

    /** s0 → s1 → ... → s(n-1) with a self-loop on the last state, which alone carries {@code p}. */
    public static StateSpace chain(int n) {
        StateSpace.Builder b = StateSpace.builder();
        for (int i = 0; i < n - 1; i++) b.addState(i);
        b.addState(n - 1, "p");
        for (int i = 0; i < n - 1; i++) b.addTransition(i, i + 1);
        b.addTransition(n - 1, n - 1);
        return b.markInitial(0).build();
    }

    /**
     * Random graph over {@code n} states labelled with {@code p} and {@code q}.
     * When {@code total} is set every state has at least one successor.
     */
    public static StateSpace randomGraph(Random rnd, int n, double density, boolean total) {
        StateSpace.Builder b = StateSpace.builder().declareProposition("p").declareProposition("q");
        for (int i = 0; i < n; i++) {
            boolean p = rnd.nextDouble() < 0.5;
            boolean q = rnd.nextDouble() < 0.3;
            if (p && q) b.addState(i, "p", "q");
            else if (p) b.addState(i, "p");
            else if (q) b.addState(i, "q");
            else b.addState(i);
        }
        for (int i = 0; i < n; i++) {
            boolean any = false;
            for (int j = 0; j < n; j++) {
                if (rnd.nextDouble() < density) {
                    b.addTransition(i, j);
                    any = true;
                }
            }
            if (total && !any) b.addTransition(i, rnd.nextInt(n));
        }
        b.markInitial(0);
        for (int i = 1; i < n; i++) {
            if (rnd.nextDouble() < 0.1) b.markInitial(i);
        }
        return b.build();
    }

    /** States from which some path of length ≥ 0 stays in {@code within} and reaches {@code goal}. */
    public static BitSet reachWithin(StateSpace space, BitSet within, BitSet goal) {
        BitSet out = new BitSet();
        for (int s = 0; s < space.stateCount(); s++) {
            BitSet seen = new BitSet();
            ArrayDeque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            seen.set(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                if (goal.get(v)) {
                    out.set(s);
                    break;
                }
                if (!within.get(v)) continue;
                for (int t : space.successors(v)) {
                    if (!seen.get(t)) {
                        seen.set(t);
                        queue.add(t);
                    }
                }
            }
        }
        return out;
    }
}
