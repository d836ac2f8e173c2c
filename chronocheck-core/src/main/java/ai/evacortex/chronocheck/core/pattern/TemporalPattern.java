/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

import java.util.List;

/**
 * All instances of one catalog rule. {@code confidence} is the mean instance strength and is
 * never below the rule's minimum confidence.
 */
public record TemporalPattern(PatternKind kind, String description, List<PatternInstance> instances, double confidence) {
    public TemporalPattern {
        instances = List.copyOf(instances);
    }
}
