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
 * Explicit-state bounds. {@code maxStates} caps both exploration and checking.
 */
public record ModelLimits(int maxStates) {

    public static final String MAX_STATES_PROPERTY = "chronocheck.model.maxStates";
    public static final int DEFAULT_MAX_STATES = 10_000;

    public ModelLimits {
        if (maxStates < 1) throw new IllegalArgumentException("maxStates must be positive: " + maxStates);
    }

    public static ModelLimits defaults() {
        return new ModelLimits(Integer.getInteger(MAX_STATES_PROPERTY, DEFAULT_MAX_STATES));
    }
}
