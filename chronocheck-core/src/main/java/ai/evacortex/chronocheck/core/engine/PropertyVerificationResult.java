/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.engine;

import java.util.Objects;

/**
 * Verdict for one property. UNKNOWN and ERROR always carry a reason.
 */
public record PropertyVerificationResult(VerificationOutcome outcome, String reason) {

    private static final PropertyVerificationResult SATISFIED = new PropertyVerificationResult(VerificationOutcome.SATISFIED, null);
    private static final PropertyVerificationResult VIOLATED = new PropertyVerificationResult(VerificationOutcome.VIOLATED, null);

    public PropertyVerificationResult {
        Objects.requireNonNull(outcome, "outcome");
        if ((outcome == VerificationOutcome.UNKNOWN || outcome == VerificationOutcome.ERROR) && reason == null) {
            throw new IllegalArgumentException(outcome + " requires a reason");
        }
    }

    public static PropertyVerificationResult satisfied() { return SATISFIED; }
    public static PropertyVerificationResult violated() { return VIOLATED; }
    public static PropertyVerificationResult unknown(String reason) { return new PropertyVerificationResult(VerificationOutcome.UNKNOWN, reason); }
    public static PropertyVerificationResult error(String reason) { return new PropertyVerificationResult(VerificationOutcome.ERROR, reason); }

    public boolean isConclusive() {
        return outcome == VerificationOutcome.SATISFIED || outcome == VerificationOutcome.VIOLATED;
    }

    @Override
    public String toString() {
        return reason == null ? outcome.name() : outcome + "(" + reason + ")";
    }
}
