/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Solver limits and switches.
 */
public record SolverConfig(
        Duration timeout,                       // per call, enforced inside Z3 and as a wall-clock bound
        int maxModelSize,                       // models with more entries are truncated
        boolean enableQuantifierInstantiation,  // Z3 smt.mbqi
        boolean enableTheoryReasoning,          // integer constants in the Int theory instead of an uninterpreted sort
        Map<String, String> solverOptions,      // passed through as Z3 parameters
        int maxBound                            // cap on bounded LTL encodings
) {

    public static final String TIMEOUT_PROPERTY = "chronocheck.solver.timeoutMs";
    public static final String MAX_BOUND_PROPERTY = "chronocheck.solver.maxBound";

    public SolverConfig {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be positive: " + timeout);
        if (maxModelSize < 0) throw new IllegalArgumentException("maxModelSize must be >= 0: " + maxModelSize);
        if (maxBound < 1) throw new IllegalArgumentException("maxBound must be positive: " + maxBound);
        solverOptions = solverOptions == null ? Map.of() : Map.copyOf(solverOptions);
    }

    public static SolverConfig defaults() {
        return new SolverConfig(
                Duration.ofMillis(Long.getLong(TIMEOUT_PROPERTY, 10_000L)),
                1000,
                true,
                true,
                Map.of(),
                Integer.getInteger(MAX_BOUND_PROPERTY, 32));
    }

    public SolverConfig withTimeout(Duration timeout) {
        return new SolverConfig(timeout, maxModelSize, enableQuantifierInstantiation, enableTheoryReasoning, solverOptions, maxBound);
    }

    public SolverConfig withMaxBound(int maxBound) {
        return new SolverConfig(timeout, maxModelSize, enableQuantifierInstantiation, enableTheoryReasoning, solverOptions, maxBound);
    }

    public SolverConfig withTheoryReasoning(boolean enabled) {
        return new SolverConfig(timeout, maxModelSize, enableQuantifierInstantiation, enabled, solverOptions, maxBound);
    }
}
