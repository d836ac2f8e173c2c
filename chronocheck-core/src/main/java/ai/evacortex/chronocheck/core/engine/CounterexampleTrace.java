/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.engine;

import java.util.List;

/**
 * @param transitions labels of the traversed edges; a lasso also includes its closing edge
 * @param loopPoint   index into {@code states} the last state returns to, or {@code null}
 */
public record CounterexampleTrace(List<Integer> states, List<String> transitions, Integer loopPoint, TraceType type) {
    public CounterexampleTrace {
        states = List.copyOf(states);
        transitions = List.copyOf(transitions);
        if (states.isEmpty()) throw new IllegalArgumentException("trace must contain at least one state");
        if (loopPoint != null && (loopPoint < 0 || loopPoint >= states.size())) {
            throw new IllegalArgumentException("loopPoint " + loopPoint + " outside trace of length " + states.size());
        }
    }
}
