/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

import ai.evacortex.chronocheck.core.TemporalOperator;

import java.util.List;

/**
 * Catalog entry. The description template may use {@code {formula}}, {@code {p}} and {@code {q}}.
 */
public record PatternRule(PatternKind kind, List<TemporalOperator> sequence, double minConfidence,
                          String descriptionTemplate) {

    public PatternRule {
        sequence = List.copyOf(sequence);
        if (sequence.isEmpty()) throw new IllegalArgumentException("Pattern sequence must not be empty");
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must lie in [0, 1]: " + minConfidence);
        }
    }

    public String describe(String formula, List<String> variables) {
        return descriptionTemplate
                .replace("{formula}", formula)
                .replace("{p}", variables.isEmpty() ? "P" : variables.get(0))
                .replace("{q}", variables.size() < 2 ? "Q" : variables.get(1));
    }
}
