/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.pattern;

import java.util.List;

import static ai.evacortex.chronocheck.core.TemporalOperator.*;

public final class PatternCatalog {

    private static final List<PatternRule> STANDARD = List.of(
            new PatternRule(PatternKind.SAFETY, List.of(ALWAYS), 0.8,
                    "Safety property: {formula} must always hold"),
            new PatternRule(PatternKind.LIVENESS, List.of(EVENTUALLY), 0.8,
                    "Liveness property: {formula} must eventually occur"),
            new PatternRule(PatternKind.RESPONSE, List.of(ALWAYS, EVENTUALLY), 0.7,
                    "Response property: if {p} then eventually {q}"),
            new PatternRule(PatternKind.PERSISTENCE, List.of(EVENTUALLY, ALWAYS), 0.7,
                    "Persistence property: {formula} eventually holds forever"),
            new PatternRule(PatternKind.RECURRENCE, List.of(ALWAYS, EVENTUALLY), 0.6,
                    "Recurrence property: {formula} occurs infinitely often"),
            new PatternRule(PatternKind.CHAIN, List.of(ALWAYS, NEXT), 0.7,
                    "Chain property: {p} is always followed by {q}"),
            new PatternRule(PatternKind.ABSENCE, List.of(ALWAYS, ALWAYS), 0.7,
                    "Absence property: {q} never occurs while {p} holds"),
            new PatternRule(PatternKind.EXISTENCE, List.of(EVENTUALLY, EVENTUALLY), 0.7,
                    "Existence property: {p} and {q} both eventually occur"),
            new PatternRule(PatternKind.PRECEDENCE, List.of(WEAK_UNTIL), 0.7,
                    "Precedence property: {p} holds until {q} occurs"),
            new PatternRule(PatternKind.FAIRNESS, List.of(ALWAYS, EVENTUALLY, ALWAYS, EVENTUALLY), 0.6,
                    "Fairness property: {formula} - recurring enablement implies recurring progress")
    );

    private PatternCatalog() {
    }

    public static List<PatternRule> standard() {
        return STANDARD;
    }
}
