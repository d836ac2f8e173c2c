/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param timings per-property wall-clock time, in declaration order
 */
public record ModelCheckingStats(
        int statesExplored,
        int transitionsExplored,
        int verified,
        int failed,
        int unknown,
        int errors,
        Map<String, Duration> timings,
        Duration totalTime
) {
    public ModelCheckingStats {
        timings = Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }

    public int total() {
        return verified + failed + unknown + errors;
    }
}
