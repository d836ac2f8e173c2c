/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.analysis;

import ai.evacortex.chronocheck.core.TemporalOperator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate operator statistics of a document.
 *
 * <p>{@code score = (min(maxNesting/10, 1) + min(count/20, 1) + distinctKinds/7) / 3}</p>
 */
public record OperatorComplexity(
        int operatorCount,
        int maxNesting,
        double averageNesting,
        Map<TemporalOperator, Integer> frequency,
        double score
) {

    public static final OperatorComplexity EMPTY = of(List.of());

    public OperatorComplexity {
        EnumMap<TemporalOperator, Integer> copy = new EnumMap<>(TemporalOperator.class);
        copy.putAll(frequency);
        frequency = Collections.unmodifiableMap(copy);
    }

    public static OperatorComplexity of(List<OperatorInstance> operators) {
        EnumMap<TemporalOperator, Integer> freq = new EnumMap<>(TemporalOperator.class);
        int max = 0;
        long sum = 0;
        for (OperatorInstance op : operators) {
            freq.merge(op.operator(), 1, Integer::sum);
            max = Math.max(max, op.nestingLevel());
            sum += op.nestingLevel();
        }
        int count = operators.size();
        double avg = count == 0 ? 0.0 : (double) sum / count;
        double score = count == 0 ? 0.0
                : (Math.min(max / 10.0, 1.0)
                + Math.min(count / 20.0, 1.0)
                + freq.size() / (double) TemporalOperator.values().length) / 3.0;
        return new OperatorComplexity(count, max, avg, freq, score);
    }

    public int count(TemporalOperator operator) {
        return frequency.getOrDefault(operator, 0);
    }

    public int distinctKinds() {
        return frequency.size();
    }
}
