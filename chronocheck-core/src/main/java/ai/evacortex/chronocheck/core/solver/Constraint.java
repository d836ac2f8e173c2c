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

/** A constraint with the id reported back in unsat cores. */
public record Constraint(String id, ConstraintFormula formula) {
    public Constraint {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(formula, "formula");
        if (id.isBlank()) throw new IllegalArgumentException("constraint id must not be blank");
    }
}
