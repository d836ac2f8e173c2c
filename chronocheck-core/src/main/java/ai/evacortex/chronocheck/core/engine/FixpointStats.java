/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.engine;

import ai.evacortex.chronocheck.core.formula.FormulaKind;

/**
 * One fixed-point evaluation.
 *
 * @param changingPasses passes that added (least) or removed (greatest) at least one state;
 *                       never exceeds the state count
 */
public record FixpointStats(FormulaKind kind, String subformula, int changingPasses, int resultSize) {
}
