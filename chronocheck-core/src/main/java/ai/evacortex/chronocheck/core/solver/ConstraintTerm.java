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

/** First-order term: a variable, a constant or a function application. */
public interface ConstraintTerm {

    static ConstraintTerm var(String name) { return new Variable(name); }
    static ConstraintTerm constant(String value) { return new Constant(value); }
    static ConstraintTerm constant(long value) { return new Constant(Long.toString(value)); }
    static ConstraintTerm apply(String function, ConstraintTerm... args) { return new Function(function, List.of(args)); }

    record Variable(String name) implements ConstraintTerm {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** Constant; a value that parses as a {@code long} is an integer literal, anything else a symbolic constant. */
    record Constant(String value) implements ConstraintTerm {
        public Constant {
            Objects.requireNonNull(value, "value");
        }

        public boolean isInteger() {
            try {
                Long.parseLong(value);
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Function(String name, List<ConstraintTerm> arguments) implements ConstraintTerm {
        public Function {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toString() {
            return arguments.isEmpty() ? name : name + arguments.toString().replace('[', '(').replace(']', ')');
        }
    }
}
