/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

/** Value of a state variable. */
public interface Value {

    /** Literal text of the value as written in documents and effects. */
    String literal();

    static Value of(boolean b) {
        return new Bool(b);
    }

    static Value symbol(String name) {
        return new Symbol(name);
    }

    record Bool(boolean value) implements Value {
        @Override
        public String literal() {
            return String.valueOf(value);
        }
    }

    record Symbol(String name) implements Value {
        @Override
        public String literal() {
            return name;
        }
    }
}
