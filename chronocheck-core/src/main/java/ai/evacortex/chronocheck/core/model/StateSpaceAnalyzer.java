/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

import java.util.*;

public class StateSpaceAnalyzer {

    public StateSpaceAnalysis analyze(StateSpace space) {
        int n = space.stateCount();
        int[] depth = new int[n];
        Arrays.fill(depth, -1);
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        BitSet init = space.initialStates();
        for (int s = init.nextSetBit(0); s >= 0; s = init.nextSetBit(s + 1)) {
            depth[s] = 0;
            queue.add(s);
        }
        int maxDepth = 0;
        while (!queue.isEmpty()) {
            int s = queue.poll();
            maxDepth = Math.max(maxDepth, depth[s]);
            for (int t : space.successors(s)) {
                if (depth[t] < 0) {
                    depth[t] = depth[s] + 1;
                    queue.add(t);
                }
            }
        }

        int reachable = 0;
        List<Integer> unreachable = new ArrayList<>();
        List<Integer> dead = new ArrayList<>();
        long edges = 0;
        boolean deadlockFree = true;
        for (int s = 0; s < n; s++) {
            edges += space.successors(s).length;
            if (depth[s] >= 0) reachable++;
            else unreachable.add(s);
            if (!space.hasSuccessors(s)) {
                dead.add(s);
                if (depth[s] >= 0) deadlockFree = false;
            }
        }
        double branching = (double) edges / n;
        return new StateSpaceAnalysis(reachable, unreachable, dead, branching, maxDepth,
                stronglyConnectedComponents(space), deadlockFree);
    }

    /** Tarjan's algorithm, iterative so deep chains do not exhaust the call stack. */
    public List<List<Integer>> stronglyConnectedComponents(StateSpace space) {
        int n = space.stateCount();
        int[] index = new int[n];
        int[] low = new int[n];
        Arrays.fill(index, -1);
        boolean[] onStack = new boolean[n];
        Deque<Integer> stack = new ArrayDeque<>();
        List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        int[] edgeCursor = new int[n];
        Deque<Integer> call = new ArrayDeque<>();
        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) continue;
            call.push(root);
            while (!call.isEmpty()) {
                int v = call.peek();
                if (index[v] < 0) {
                    index[v] = low[v] = counter++;
                    stack.push(v);
                    onStack[v] = true;
                }
                int[] succ = space.successors(v);
                if (edgeCursor[v] < succ.length) {
                    int w = succ[edgeCursor[v]++];
                    if (index[w] < 0) {
                        call.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }
                call.pop();
                if (!call.isEmpty()) {
                    int parent = call.peek();
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    Collections.sort(component);
                    components.add(component);
                }
            }
        }
        return components;
    }
}
