/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

public record SmtSort(String name) {

    public static final SmtSort BOOL = new SmtSort("Bool");
    public static final SmtSort INT = new SmtSort("Int");

    @Override
    public String toString() {
        return name;
    }
}
