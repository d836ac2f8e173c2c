/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import ai.evacortex.chronocheck.core.engine.CounterexampleTrace;
import ai.evacortex.chronocheck.core.engine.PropertyVerificationResult;

/**
 * Outcome of a bounded check of one property against a state space.
 *
 * @param counterexample lasso violating the property; present only for a VIOLATED result
 * @param raw            solver answer for the violation query
 * @param bound          word positions encoded
 * @param threshold      positions at which an unsat answer becomes a proof
 */
public record BoundedVerification(PropertyVerificationResult result, CounterexampleTrace counterexample,
                                  SatisfiabilityResult raw, int bound, long threshold) {
}
