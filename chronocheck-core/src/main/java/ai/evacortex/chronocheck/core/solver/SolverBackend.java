/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

/**
 * Decision procedure behind the {@link SolverBridge}.
 *
 * <p>Implementations must be safe for concurrent use and must report every failure as an
 * ERROR result rather than throwing. Named assertions in the script are the constraint ids an
 * UNSATISFIABLE proof refers to.</p>
 */
public interface SolverBackend {

    SatisfiabilityResult check(SmtScript script, SolverConfig config);

    default String name() {
        return getClass().getSimpleName();
    }
}
