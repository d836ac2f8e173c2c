/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.analysis;

import java.util.Objects;

/** Document element an operator occurrence belongs to. */
public record OperatorContext(ContextKind kind, String owner) {

    public OperatorContext {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(owner, "owner");
    }

    public static OperatorContext rule(String name) { return new OperatorContext(ContextKind.RULE, name); }
    public static OperatorContext function(String name) { return new OperatorContext(ContextKind.FUNCTION, name); }
    public static OperatorContext metaConstraint(String key) { return new OperatorContext(ContextKind.META_CONSTRAINT, key); }
    public static OperatorContext evidence(String field) { return new OperatorContext(ContextKind.EVIDENCE, field); }

    /** Human-readable label, e.g. {@code rule 'r1'}. */
    public String describe() {
        String label = switch (kind) {
            case RULE -> "rule";
            case FUNCTION -> "function";
            case META_CONSTRAINT -> "meta constraint";
            case EVIDENCE -> "evidence field";
        };
        return label + " '" + owner + "'";
    }
}
