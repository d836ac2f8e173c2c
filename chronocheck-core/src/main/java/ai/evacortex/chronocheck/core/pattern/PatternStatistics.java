/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * @param density instances per 100 document lines
 */
public record PatternStatistics(int totalPatterns, Map<PatternKind, Integer> byKind, double averageStrength,
                                double density, CoverageMetrics coverage) {

    public PatternStatistics {
        EnumMap<PatternKind, Integer> copy = new EnumMap<>(PatternKind.class);
        copy.putAll(byKind);
        byKind = Collections.unmodifiableMap(copy);
    }

    public int count(PatternKind kind) {
        return byKind.getOrDefault(kind, 0);
    }
}
