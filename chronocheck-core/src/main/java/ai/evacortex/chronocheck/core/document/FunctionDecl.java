/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Function of the document.
 *
 * <p>The body is analyzed for temporal operators. A function that also declares a guard and
 * effects acts as a guarded update of the state variables: when the guard holds, each effect
 * assigns a literal value to a variable.</p>
 *
 * @param guard   enabling condition, or {@code null} when the function is not a transition
 * @param effects variable name to assigned value, in declaration order
 */
public record FunctionDecl(String name, Expression body, Expression guard, Map<String, String> effects) {

    public FunctionDecl {
        effects = effects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(effects));
    }

    public static FunctionDecl of(String name, Expression body) {
        return new FunctionDecl(name, body, null, Map.of());
    }

    public boolean isTransition() {
        return guard != null;
    }
}
