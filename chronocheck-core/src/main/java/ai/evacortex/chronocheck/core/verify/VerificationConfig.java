/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import ai.evacortex.chronocheck.core.model.ModelLimits;
import ai.evacortex.chronocheck.core.solver.FormulaCache;
import ai.evacortex.chronocheck.core.solver.SolverConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of a {@link VerificationOrchestrator}.
 *
 * <p>{@link #load(Path)} reads an optional JSON file; absent keys keep their defaults:</p>
 * <pre>{@code
 * {"timeoutMs": 5000, "maxModelSize": 200, "enableQuantifierInstantiation": true,
 *  "enableTheoryReasoning": true, "solverOptions": {"random_seed": "7"}, "maxBound": 24,
 *  "maxStates": 20000, "parallelism": 4, "cacheMaxEntries": 5000}
 * }</pre>
 */
public record VerificationConfig(SolverConfig solver, ModelLimits limits, int parallelism, int cacheMaxEntries) {

    public static final String PARALLELISM_PROPERTY = "chronocheck.verify.parallelism";

    public VerificationConfig {
        Objects.requireNonNull(solver, "solver");
        Objects.requireNonNull(limits, "limits");
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        if (cacheMaxEntries < 0) throw new IllegalArgumentException("cacheMaxEntries must be >= 0: " + cacheMaxEntries);
    }

    public static VerificationConfig defaults() {
        return new VerificationConfig(
                SolverConfig.defaults(),
                ModelLimits.defaults(),
                Integer.getInteger(PARALLELISM_PROPERTY, Runtime.getRuntime().availableProcessors()),
                Integer.getInteger(FormulaCache.MAX_ENTRIES_PROPERTY, 10_000));
    }

    public VerificationConfig withSolver(SolverConfig solver) {
        return new VerificationConfig(solver, limits, parallelism, cacheMaxEntries);
    }

    public VerificationConfig withLimits(ModelLimits limits) {
        return new VerificationConfig(solver, limits, parallelism, cacheMaxEntries);
    }

    public VerificationConfig withParallelism(int parallelism) {
        return new VerificationConfig(solver, limits, parallelism, cacheMaxEntries);
    }

    record ConfigJson(Long timeoutMs, Integer maxModelSize, Boolean enableQuantifierInstantiation,
                      Boolean enableTheoryReasoning, Map<String, String> solverOptions, Integer maxBound,
                      Integer maxStates, Integer parallelism, Integer cacheMaxEntries) {}

    public static VerificationConfig load(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream in = Files.newInputStream(path)) {
            return merge(mapper.readValue(in, ConfigJson.class), defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load verification config " + path, e);
        }
    }

    private static VerificationConfig merge(ConfigJson json, VerificationConfig base) {
        SolverConfig s = base.solver();
        SolverConfig solver = new SolverConfig(
                json.timeoutMs() != null ? Duration.ofMillis(json.timeoutMs()) : s.timeout(),
                json.maxModelSize() != null ? json.maxModelSize() : s.maxModelSize(),
                json.enableQuantifierInstantiation() != null ? json.enableQuantifierInstantiation() : s.enableQuantifierInstantiation(),
                json.enableTheoryReasoning() != null ? json.enableTheoryReasoning() : s.enableTheoryReasoning(),
                json.solverOptions() != null ? json.solverOptions() : s.solverOptions(),
                json.maxBound() != null ? json.maxBound() : s.maxBound());
        return new VerificationConfig(
                solver,
                json.maxStates() != null ? new ModelLimits(json.maxStates()) : base.limits(),
                json.parallelism() != null ? json.parallelism() : base.parallelism(),
                json.cacheMaxEntries() != null ? json.cacheMaxEntries() : base.cacheMaxEntries());
    }
}
