/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import java.util.ArrayList;
import java.util.List;

/**
 * Unsatisfiability certificate derived from the solver's unsat core: the conflicting
 * constraint ids, one premise step per core member and a closing contradiction step.
 */
public record UnsatisfiabilityProof(List<String> conflictingConstraints, List<ProofStep> steps, String reason) {

    public UnsatisfiabilityProof {
        conflictingConstraints = List.copyOf(conflictingConstraints);
        steps = List.copyOf(steps);
    }

    public static UnsatisfiabilityProof fromCore(List<String> core, SmtScript script) {
        List<ProofStep> steps = new ArrayList<>();
        for (String id : core) {
            String term = script.assertion(id);
            steps.add(new ProofStep("premise", List.of(), term == null ? id : term, "asserted as " + id));
        }
        String reason = core.isEmpty()
                ? "solver reported unsat without a core"
                : "constraints " + String.join(", ", core) + " are jointly unsatisfiable";
        steps.add(new ProofStep("contradiction", core, "false", "unsat core returned by the solver"));
        return new UnsatisfiabilityProof(core, steps, reason);
    }
}
