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
 * Satisfying assignment reported by the solver. Zero-arity boolean symbols are predicate
 * interpretations; every other constant is a variable assignment.
 *
 * @param truncated entries beyond the configured model size were dropped
 */
public record ConstraintModel(
        Map<String, ModelValue> variableAssignments,
        Map<String, FunctionInterpretation> functionInterpretations,
        Map<String, Boolean> predicateInterpretations,
        boolean truncated
) {

    public static final ConstraintModel EMPTY = new ConstraintModel(Map.of(), Map.of(), Map.of(), false);

    public ConstraintModel {
        variableAssignments = Collections.unmodifiableMap(new TreeMap<>(variableAssignments));
        functionInterpretations = Collections.unmodifiableMap(new TreeMap<>(functionInterpretations));
        predicateInterpretations = Collections.unmodifiableMap(new TreeMap<>(predicateInterpretations));
    }

    public int size() {
        return variableAssignments.size() + functionInterpretations.size() + predicateInterpretations.size();
    }

    public Optional<ModelValue> variable(String name) {
        return Optional.ofNullable(variableAssignments.get(name));
    }

    /** Truth value of a zero-arity predicate; absent symbols are unconstrained and read as false. */
    public boolean predicate(String name) {
        return predicateInterpretations.getOrDefault(name, false);
    }

    /**
     * Keeps at most {@code maxEntries} entries (predicates first, then variables, then functions,
     * each in name order) and flags the model as truncated when anything was dropped.
     */
    public ConstraintModel truncate(int maxEntries) {
        if (size() <= maxEntries) return this;
        int budget = maxEntries;
        Map<String, Boolean> preds = new TreeMap<>();
        for (Map.Entry<String, Boolean> e : predicateInterpretations.entrySet()) {
            if (budget-- <= 0) break;
            preds.put(e.getKey(), e.getValue());
        }
        Map<String, ModelValue> vars = new TreeMap<>();
        for (Map.Entry<String, ModelValue> e : variableAssignments.entrySet()) {
            if (budget-- <= 0) break;
            vars.put(e.getKey(), e.getValue());
        }
        Map<String, FunctionInterpretation> funs = new TreeMap<>();
        for (Map.Entry<String, FunctionInterpretation> e : functionInterpretations.entrySet()) {
            if (budget-- <= 0) break;
            funs.put(e.getKey(), e.getValue());
        }
        return new ConstraintModel(vars, funs, preds, true);
    }
}
