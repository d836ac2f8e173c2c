/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.formula;

import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaRewriterTest {

    private final FormulaParser parser = new FormulaParser();

    @Test
    void testDesugar_weakUntilBecomesRelease() {
        assertEquals(parser.parse("q R (p ∨ q)"), FormulaRewriter.desugar(parser.parse("p W q")));
    }

    @Test
    void testDesugar_strongReleaseBecomesUntil() {
        assertEquals(parser.parse("q U (p ∧ q)"), FormulaRewriter.desugar(parser.parse("p M q")));
    }

    @Test
    void testDesugar_rewritesBelowOtherOperators() {
        assertEquals(parser.parse("□(b R (a ∨ b))"), FormulaRewriter.desugar(parser.parse("□(a W b)")));
        TemporalFormula untouched = parser.parse("□(p → ◊q)");
        assertEquals(untouched, FormulaRewriter.desugar(untouched));
    }

    @Test
    void testToLinear_dropsUniversalQuantifiers() {
        assertEquals(parser.parse("□p ∧ ◊q"), FormulaRewriter.toLinear(parser.parse("AG p ∧ AF q")));
        assertEquals(parser.parse("p U q"), FormulaRewriter.toLinear(parser.parse("A[p U q]")));
        assertEquals(parser.parse("X p"), FormulaRewriter.toLinear(parser.parse("AX p")));
        assertEquals(parser.parse("□(p → ◊q)"), FormulaRewriter.toLinear(parser.parse("AG (p → ◊q)")));
    }

    @Test
    void testToLinear_rejectsExistentialAndNestedQuantifiers() {
        assertThrows(UnsupportedFormulaException.class, () -> FormulaRewriter.toLinear(parser.parse("EF p")));
        assertThrows(UnsupportedFormulaException.class, () -> FormulaRewriter.toLinear(parser.parse("AG EF p")));
        assertThrows(UnsupportedFormulaException.class, () -> FormulaRewriter.toLinear(parser.parse("AG p ∨ AF q")));
    }
}
