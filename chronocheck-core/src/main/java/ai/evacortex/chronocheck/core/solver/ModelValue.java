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

/** Value assigned by a solver model. {@code text} is the literal in SMT-LIB notation. */
public record ModelValue(Kind kind, String text) {

    public enum Kind {
        BOOLEAN,
        INTEGER,
        REAL,
        STRING,
        ENUMERATION
    }

    public ModelValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static ModelValue of(boolean b) { return new ModelValue(Kind.BOOLEAN, String.valueOf(b)); }
    public static ModelValue of(long v) { return new ModelValue(Kind.INTEGER, String.valueOf(v)); }
    public static ModelValue real(String v) { return new ModelValue(Kind.REAL, v); }
    public static ModelValue string(String v) { return new ModelValue(Kind.STRING, v); }
    public static ModelValue enumeration(String v) { return new ModelValue(Kind.ENUMERATION, v); }

    public boolean asBoolean() {
        if (kind != Kind.BOOLEAN) throw new IllegalStateException(this + " is not a boolean");
        return Boolean.parseBoolean(text);
    }

    public long asLong() {
        if (kind != Kind.INTEGER) throw new IllegalStateException(this + " is not an integer");
        return Long.parseLong(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
