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
 * Finite interpretation of an uninterpreted function or predicate: explicit argument
 * tuples plus the value taken everywhere else.
 */
public record FunctionInterpretation(List<String> domain, String range,
                                     Map<List<ModelValue>, ModelValue> mappings, ModelValue elseValue) {

    public FunctionInterpretation {
        domain = List.copyOf(domain);
        mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    public ModelValue apply(List<ModelValue> arguments) {
        ModelValue v = mappings.get(arguments);
        return v != null ? v : elseValue;
    }
}
