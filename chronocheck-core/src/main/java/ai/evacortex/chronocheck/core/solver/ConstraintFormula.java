/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * First-order constraint formula. Atoms apply a predicate to terms; the predicates
 * {@code = < <= > >=} are interpreted, every other name is uninterpreted.
 */
public interface ConstraintFormula {

    Set<String> INTERPRETED = Set.of("=", "<", "<=", ">", ">=");

    static ConstraintFormula atom(String predicate, ConstraintTerm... terms) { return new Atomic(predicate, List.of(terms)); }
    static ConstraintFormula eq(ConstraintTerm a, ConstraintTerm b) { return new Atomic("=", List.of(a, b)); }
    static ConstraintFormula not(ConstraintFormula f) { return new Not(f); }
    static ConstraintFormula and(ConstraintFormula... fs) { return new And(List.of(fs)); }
    static ConstraintFormula or(ConstraintFormula... fs) { return new Or(List.of(fs)); }
    static ConstraintFormula forall(String variable, ConstraintFormula body) { return new Forall(variable, body); }
    static ConstraintFormula exists(String variable, ConstraintFormula body) { return new Exists(variable, body); }

    record Atomic(String predicate, List<ConstraintTerm> terms) implements ConstraintFormula {
        public Atomic {
            Objects.requireNonNull(predicate, "predicate");
            terms = List.copyOf(terms);
            if (INTERPRETED.contains(predicate) && terms.size() != 2) {
                throw new IllegalArgumentException("'" + predicate + "' takes two terms, got " + terms.size());
            }
        }

        public boolean isInterpreted() {
            return INTERPRETED.contains(predicate);
        }
    }

    record Not(ConstraintFormula operand) implements ConstraintFormula {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record And(List<ConstraintFormula> operands) implements ConstraintFormula {
        public And {
            operands = List.copyOf(operands);
        }
    }

    record Or(List<ConstraintFormula> operands) implements ConstraintFormula {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    record Forall(String variable, ConstraintFormula body) implements ConstraintFormula {
        public Forall {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(body, "body");
        }
    }

    record Exists(String variable, ConstraintFormula body) implements ConstraintFormula {
        public Exists {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(body, "body");
        }
    }
}
