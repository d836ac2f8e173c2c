/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

import java.util.List;

/**
 * Structural summary of a state space.
 *
 * @param maxDepth                  longest shortest-path distance from an initial state
 * @param stronglyConnectedComponents components in reverse topological order, each sorted ascending
 * @param deadlockFree              no reachable state lacks a successor
 */
public record StateSpaceAnalysis(
        int reachableStates,
        List<Integer> unreachableStates,
        List<Integer> deadStates,
        double averageBranching,
        int maxDepth,
        List<List<Integer>> stronglyConnectedComponents,
        boolean deadlockFree
) {
    public StateSpaceAnalysis {
        unreachableStates = List.copyOf(unreachableStates);
        deadStates = List.copyOf(deadStates);
        stronglyConnectedComponents = stronglyConnectedComponents.stream().map(List::copyOf).toList();
    }
}
