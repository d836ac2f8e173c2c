/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import java.util.*;

/**
 * Ordered conjunction of identified constraints.
 */
public record ConstraintSystem(List<Constraint> constraints) {

    public ConstraintSystem {
        constraints = List.copyOf(constraints);
        Set<String> ids = new HashSet<>();
        for (Constraint c : constraints) {
            if (!ids.add(c.id())) throw new IllegalArgumentException("Duplicate constraint id: " + c.id());
        }
    }

    public static ConstraintSystem of(Constraint... constraints) {
        return new ConstraintSystem(Arrays.asList(constraints));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return constraints.size();
    }

    public static final class Builder {
        private final List<Constraint> constraints = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String id, ConstraintFormula formula) {
            constraints.add(new Constraint(id, formula));
            return this;
        }

        /** Adds a constraint with the generated id {@code c<index>}. */
        public Builder add(ConstraintFormula formula) {
            return add("c" + constraints.size(), formula);
        }

        public ConstraintSystem build() {
            return new ConstraintSystem(constraints);
        }
    }
}
