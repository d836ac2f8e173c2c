/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static ai.evacortex.chronocheck.core.solver.ConstraintFormula.*;
import static ai.evacortex.chronocheck.core.solver.ConstraintTerm.*;
import static org.junit.jupiter.api.Assertions.*;

class ConstraintEncoderTest {

    private final ConstraintEncoder theory = new ConstraintEncoder(SolverConfig.defaults());
    private final ConstraintEncoder uninterpreted = new ConstraintEncoder(SolverConfig.defaults().withTheoryReasoning(false));

    @Test
    void testPredicates_declaredAndAssertedUnderIds() {
        ConstraintSystem system = ConstraintSystem.of(
                new Constraint("holds", atom("Ready", var("x"))),
                new Constraint("fails", not(atom("Ready", var("x")))));

        SmtScript script = theory.encode(system);
        String text = script.render();

        assertEquals("true", script.options().get("produce-unsat-cores"));
        assertTrue(text.contains("(declare-fun x () Int)"), text);
        assertTrue(text.contains("(declare-fun Ready (Int) Bool)"), text);
        assertTrue(text.contains("(assert (! (Ready x) :named holds))"), text);
        assertTrue(text.contains("(assert (! (not (Ready x)) :named fails))"), text);
        assertEquals(List.of("holds", "fails"), script.assertionNames());
    }

    @Test
    void testSymbolicConstants_pairwiseDistinct() {
        ConstraintSystem system = ConstraintSystem.builder()
                .add(eq(var("light"), constant("red")))
                .add(or(eq(var("light"), constant("green")), eq(var("light"), constant("blue"))))
                .build();

        SmtScript script = theory.encode(system);
        String text = script.render();

        assertTrue(text.contains("(declare-fun const!red () Int)"), text);
        assertTrue(text.contains("(assert (distinct const!blue const!green const!red))"), text);
        assertEquals(Arrays.asList(null, "c0", "c1"), script.assertionNames());
        assertEquals("(or (= light const!green) (= light const!blue))", script.assertion("c1"));
    }

    @Test
    void testIntegers_useTheoryWhenEnabled() {
        ConstraintSystem system = ConstraintSystem.builder()
                .add("bound", and(atom("<", var("n"), constant(3)), atom(">=", var("n"), constant(-2))))
                .build();

        assertEquals("(and (< n 3) (>= n (- 2)))", theory.encode(system).assertion("bound"));
        assertThrows(UnsupportedFormulaException.class, () -> uninterpreted.encode(system),
                "order predicates need the integer theory");
    }

    @Test
    void testUninterpretedSort_integersBecomeSymbols() {
        ConstraintSystem system = ConstraintSystem.builder()
                .add("a", eq(apply("succ", var("n")), constant(1)))
                .build();

        SmtScript script = uninterpreted.encode(system);
        String text = script.render();

        assertTrue(text.contains("(declare-sort Value 0)"), text);
        assertTrue(text.contains("(declare-fun n () Value)"), text);
        assertTrue(text.contains("(declare-fun succ (Value) Value)"), text);
        assertTrue(text.contains("(declare-fun const!1 () Value)"), text);
        assertFalse(text.contains("distinct"), "a single constant needs no distinctness axiom");
        assertEquals("(= (succ n) const!1)", script.assertion("a"));
    }

    @Test
    void testQuantifiers_bindTheirVariable() {
        ConstraintSystem system = ConstraintSystem.builder()
                .add("all", forall("x", exists("y", atom("Edge", var("x"), var("y")))))
                .build();

        SmtScript script = theory.encode(system);

        assertEquals("(forall ((x Int)) (exists ((y Int)) (Edge x y)))", script.assertion("all"));
        assertFalse(script.render().contains("(declare-fun x "), "bound variables are not constants");
    }

    @Test
    void testInconsistentSignatures_rejected() {
        assertThrows(UnsupportedFormulaException.class, () -> theory.encode(ConstraintSystem.builder()
                .add(atom("P", var("x")))
                .add(atom("P", var("x"), var("y")))
                .build()));
        assertThrows(UnsupportedFormulaException.class, () -> theory.encode(ConstraintSystem.builder()
                .add(atom("P", var("P")))
                .build()));
        assertThrows(UnsupportedFormulaException.class, () -> theory.encode(ConstraintSystem.builder()
                .add(eq(apply("f", var("x")), var("f")))
                .build()));
    }

    @Test
    void testSystem_rejectsDuplicateIdsAndMalformedAtoms() {
        assertThrows(IllegalArgumentException.class, () -> ConstraintSystem.of(
                new Constraint("c", atom("P")), new Constraint("c", atom("Q"))));
        assertThrows(IllegalArgumentException.class, () -> atom("<", var("x")));
    }
}
