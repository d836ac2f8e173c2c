/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

/** Strength components of a matched operator window; {@code overall} is their mean. */
public record PatternStrength(double syntactic, double semantic, double coverage, double overall) {

    public static PatternStrength of(double syntactic, double semantic, double coverage) {
        return new PatternStrength(syntactic, semantic, coverage, (syntactic + semantic + coverage) / 3.0);
    }
}
