/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

/**
 * Edge of the transition relation. Guard, action and probability are optional ({@code null}).
 */
public record Transition(int from, int to, String guard, String action, Double probability) {

    public static Transition of(int from, int to) {
        return new Transition(from, to, null, null, null);
    }

    /** Action name when present, else {@code "from->to"}. */
    public String label() {
        return action != null ? action : from + "->" + to;
    }
}
