/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.document;

import java.util.List;

/**
 * Finite-domain state variable. Boolean variables have the domain {@code [false, true]}
 * and are labelled by their bare name; enumerations are labelled {@code name=value}.
 */
public record StateVariable(String name, List<String> domain, String initial) {

    private static final List<String> BOOLEAN_DOMAIN = List.of("false", "true");

    public StateVariable {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Variable name must not be blank");
        domain = List.copyOf(domain);
        if (domain.isEmpty()) throw new IllegalArgumentException("Variable " + name + " has an empty domain");
        if (!domain.contains(initial)) {
            throw new IllegalArgumentException("Initial value '" + initial + "' of " + name + " is outside its domain");
        }
    }

    public static StateVariable bool(String name, boolean initial) {
        return new StateVariable(name, BOOLEAN_DOMAIN, String.valueOf(initial));
    }

    public static StateVariable enumeration(String name, List<String> values, String initial) {
        return new StateVariable(name, values, initial);
    }

    public boolean isBoolean() {
        return domain.equals(BOOLEAN_DOMAIN);
    }

    /** Atomic proposition that holds when this variable has the given value, or null if none does. */
    public String atomFor(String value) {
        if (isBoolean()) return "true".equals(value) ? name : null;
        return name + "=" + value;
    }
}
