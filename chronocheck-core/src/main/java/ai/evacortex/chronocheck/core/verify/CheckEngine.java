/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

/** Procedure that produced a property verdict. */
public enum CheckEngine {
    EXPLICIT_CTL,
    BOUNDED_SMT,
    NONE
}
