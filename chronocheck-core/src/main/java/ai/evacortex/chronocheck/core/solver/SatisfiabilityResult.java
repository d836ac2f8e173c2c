/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import java.util.Objects;

/**
 * Solver outcome. SATISFIABLE carries a model, UNSATISFIABLE a proof, UNKNOWN and ERROR a reason.
 * Instances are immutable and are stored in the formula cache as they are.
 */
public record SatisfiabilityResult(SatStatus status, ConstraintModel model, UnsatisfiabilityProof proof, String reason) {

    public SatisfiabilityResult {
        Objects.requireNonNull(status, "status");
        switch (status) {
            case SATISFIABLE -> Objects.requireNonNull(model, "SATISFIABLE requires a model");
            case UNSATISFIABLE -> Objects.requireNonNull(proof, "UNSATISFIABLE requires a proof");
            case UNKNOWN, ERROR -> Objects.requireNonNull(reason, status + " requires a reason");
        }
    }

    public static SatisfiabilityResult satisfiable(ConstraintModel model) {
        return new SatisfiabilityResult(SatStatus.SATISFIABLE, model, null, null);
    }

    public static SatisfiabilityResult unsatisfiable(UnsatisfiabilityProof proof) {
        return new SatisfiabilityResult(SatStatus.UNSATISFIABLE, null, proof, null);
    }

    public static SatisfiabilityResult unknown(String reason) {
        return new SatisfiabilityResult(SatStatus.UNKNOWN, null, null, reason);
    }

    public static SatisfiabilityResult error(String reason) {
        return new SatisfiabilityResult(SatStatus.ERROR, null, null, reason);
    }

    public boolean isSatisfiable() {
        return status == SatStatus.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return status == SatStatus.UNSATISFIABLE;
    }

    @Override
    public String toString() {
        return switch (status) {
            case SATISFIABLE -> "SATISFIABLE(" + model.size() + " entries" + (model.truncated() ? ", truncated" : "") + ")";
            case UNSATISFIABLE -> "UNSATISFIABLE(" + proof.reason() + ")";
            case UNKNOWN, ERROR -> status + "(" + reason + ")";
        };
    }
}
