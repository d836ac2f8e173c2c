/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

/**
 * Overall status of a model-checking run.
 * <ul>
 *   <li>SUCCESS: every property satisfied</li>
 *   <li>PARTIAL_FAILURE: some properties satisfied, at least one violated or in error</li>
 *   <li>FAILED: no property satisfied and at least one violated or in error</li>
 *   <li>INCOMPLETE: nothing failed but some properties are unknown, or there were none to check</li>
 * </ul>
 */
public enum VerificationStatus {
    SUCCESS,
    PARTIAL_FAILURE,
    INCOMPLETE,
    FAILED;

    static VerificationStatus of(int total, int verified, int failed, int errors) {
        if (total == 0) return INCOMPLETE;
        if (verified == total) return SUCCESS;
        if (failed + errors > 0) return verified > 0 ? PARTIAL_FAILURE : FAILED;
        return INCOMPLETE;
    }
}
