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

public record WitnessTrace(List<Integer> states, List<String> transitions, Integer loopPoint, TraceType type) {
    public WitnessTrace {
        states = List.copyOf(states);
        transitions = List.copyOf(transitions);
        if (states.isEmpty()) throw new IllegalArgumentException("trace must contain at least one state");
    }
}
