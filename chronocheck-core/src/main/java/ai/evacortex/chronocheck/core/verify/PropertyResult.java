/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import ai.evacortex.chronocheck.core.engine.CounterexampleTrace;
import ai.evacortex.chronocheck.core.engine.FixpointStats;
import ai.evacortex.chronocheck.core.engine.PropertyVerificationResult;
import ai.evacortex.chronocheck.core.engine.VerificationOutcome;
import ai.evacortex.chronocheck.core.engine.WitnessTrace;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Verdict for one declared property.
 *
 * @param formula canonical formula text, or the raw text when it did not parse
 */
public record PropertyResult(
        String name,
        String formula,
        PropertyVerificationResult result,
        CounterexampleTrace counterexample,
        WitnessTrace witness,
        CheckEngine engine,
        List<FixpointStats> fixpoints,
        Duration elapsed
) {
    public PropertyResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(result, "result");
        fixpoints = fixpoints == null ? List.of() : List.copyOf(fixpoints);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    static PropertyResult without(String name, String formula, PropertyVerificationResult result) {
        return new PropertyResult(name, formula, result, null, null, CheckEngine.NONE, List.of(), Duration.ZERO);
    }

    public VerificationOutcome outcome() {
        return result.outcome();
    }
}
