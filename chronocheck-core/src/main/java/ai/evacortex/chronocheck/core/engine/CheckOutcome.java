/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.engine;

import java.util.BitSet;
import java.util.List;

/**
 * Result of one explicit-state check. Trace fields are {@code null} when no trace applies.
 */
public record CheckOutcome(
        PropertyVerificationResult result,
        CounterexampleTrace counterexample,
        WitnessTrace witness,
        List<FixpointStats> fixpoints,
        BitSet satisfying
) {
    public CheckOutcome {
        fixpoints = List.copyOf(fixpoints);
        satisfying = satisfying == null ? null : (BitSet) satisfying.clone();
    }

    static CheckOutcome inconclusive(PropertyVerificationResult result) {
        return new CheckOutcome(result, null, null, List.of(), null);
    }

    @Override
    public BitSet satisfying() {
        return satisfying == null ? null : (BitSet) satisfying.clone();
    }
}
