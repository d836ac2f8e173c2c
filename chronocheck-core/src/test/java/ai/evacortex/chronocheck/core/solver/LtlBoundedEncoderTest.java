/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import ai.evacortex.chronocheck.core.StateSpaceTestUtils;
import ai.evacortex.chronocheck.core.engine.CounterexampleTrace;
import ai.evacortex.chronocheck.core.engine.TraceType;
import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;
import ai.evacortex.chronocheck.core.formula.FormulaParser;
import ai.evacortex.chronocheck.core.formula.FormulaRewriter;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;
import ai.evacortex.chronocheck.core.model.ModelLimits;
import ai.evacortex.chronocheck.core.model.StateSpace;
import ai.evacortex.chronocheck.core.model.StateSpaceBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LtlBoundedEncoderTest {

    private final FormulaParser parser = new FormulaParser();
    private final LtlBoundedEncoder encoder = new LtlBoundedEncoder();

    @Test
    void testCompletenessThreshold_freeWords() {
        // one atom, two eventualities: 2^(1+2) * 3
        assertEquals(24, LtlBoundedEncoder.completenessThreshold(parser.parse("□◊p"), 0));
        // next is not an eventuality: 2^(1+1) * 1
        assertEquals(4, LtlBoundedEncoder.completenessThreshold(parser.parse("X p"), 0));
        // constants are not atoms
        assertEquals(1, LtlBoundedEncoder.completenessThreshold(parser.parse("true ∧ ¬false"), 0));
    }

    @Test
    void testCompletenessThreshold_onStateSpace() {
        // ¬□p on three states: 3 * 2^1 * 2
        assertEquals(12, LtlBoundedEncoder.violationThreshold(parser.parse("AG p"), 3));
        assertEquals(12, LtlBoundedEncoder.violationThreshold(parser.parse("□p"), 3));
    }

    @Test
    void testCompletenessThreshold_saturates() {
        TemporalFormula f = TemporalFormula.atomic("p");
        for (int i = 0; i < 70; i++) f = TemporalFormula.next(f);
        assertEquals(Long.MAX_VALUE, LtlBoundedEncoder.completenessThreshold(f, 0));
        assertEquals(Long.MAX_VALUE, LtlBoundedEncoder.completenessThreshold(f, 1_000));
    }

    @Test
    void testPositions_clampedToBound() {
        assertEquals(8, LtlBoundedEncoder.positions(24, 8));
        assertEquals(3, LtlBoundedEncoder.positions(3, 8));
        assertEquals(1, LtlBoundedEncoder.positions(0, 8));
    }

    @Test
    void testSatisfiabilityEncoding_structure() {
        LtlBoundedEncoder.Encoding enc = encoder.encodeSatisfiability(parser.parse("□◊p"), 4);

        assertEquals(4, enc.positions());
        assertEquals(24, enc.threshold());
        assertFalse(enc.complete());
        assertEquals(List.of("loop-range", "semantics", "formula"), enc.script().assertionNames());
        assertEquals("(and (<= 0 loop) (<= loop 3))", enc.script().assertion("loop-range"));
        // subformulas in post-order: p, ◊p, □◊p
        assertEquals("f2@0", enc.script().assertion("formula"));

        String text = enc.script().render();
        assertTrue(text.contains("(declare-fun loop () Int)"), text);
        assertTrue(text.contains("(declare-fun p!p@3 () Bool)"), text);
        assertTrue(text.contains("(declare-fun aux1@3 () Bool)"), text);
        assertFalse(text.contains("p!p@4"), "positions run from 0 to k");
        // the eventuality chain ends in false after the last position
        assertTrue(enc.script().assertion("semantics").contains("(= aux1@3 (or p!p@3 false))"),
                enc.script().assertion("semantics"));
    }

    @Test
    void testSatisfiabilityEncoding_completeForSmallFormulas() {
        LtlBoundedEncoder.Encoding enc = encoder.encodeSatisfiability(parser.parse("p ∧ ¬p"), 32);
        assertEquals(2, enc.threshold());
        assertEquals(2, enc.positions());
        assertTrue(enc.complete());
    }

    @Test
    void testSatisfiabilityEncoding_desugarsWeakUntil() {
        LtlBoundedEncoder.Encoding enc = encoder.encodeSatisfiability(parser.parse("p W q"), 4);
        assertEquals(FormulaRewriter.desugar(parser.parse("p W q")), enc.formula());
    }

    @Test
    void testSatisfiabilityEncoding_rejectsPathQuantifiers() {
        assertThrows(UnsupportedFormulaException.class, () -> encoder.encodeSatisfiability(parser.parse("AG p"), 4));
    }

    @Test
    void testViolationEncoding_structure() {
        StateSpace space = StateSpaceTestUtils.cycle3();
        LtlBoundedEncoder.Encoding enc = encoder.encodeViolation(parser.parse("AG p"), space, 32);

        assertEquals(12, enc.positions());
        assertTrue(enc.complete());
        assertEquals(parser.parse("¬□p"), enc.formula());
        assertEquals(List.of("loop-range", "state-range", "initial-state", "transition-relation",
                "labelling", "semantics", "negated-property"), enc.script().assertionNames());
        assertEquals("(= st@0 0)", enc.script().assertion("initial-state"));
        assertTrue(enc.script().assertion("labelling").contains("(= p!p@0 (= st@0 2))"));
        String transitions = enc.script().assertion("transition-relation");
        assertTrue(transitions.contains("(=> (= st@0 0) (= st@1 1))"), transitions);
        assertTrue(transitions.contains("(=> (= loop 0) "), "closing edge back to the loop position");
    }

    @Test
    void testViolationEncoding_deadStateStutters() {
        StateSpace space = new StateSpaceBuilder(new ModelLimits(100)).build(StateSpaceTestUtils.finishDocument().build());
        LtlBoundedEncoder.Encoding enc = encoder.encodeViolation(parser.parse("□¬done"), space, 32);

        String transitions = enc.script().assertion("transition-relation");
        assertTrue(transitions.contains("(=> (= st@0 0) (= st@1 1))"), transitions);
        assertTrue(transitions.contains("(=> (= st@0 1) (= st@1 1))"), "the dead state repeats: " + transitions);
        assertFalse(transitions.contains("(=> (= st@0 1) false)"), transitions);
        assertTrue(enc.complete());
    }

    @Test
    void testDecodeLasso_stutterOnDeadState() {
        StateSpace space = new StateSpaceBuilder(new ModelLimits(100)).build(StateSpaceTestUtils.finishDocument().build());
        ConstraintModel model = new ConstraintModel(Map.of(
                "st@0", ModelValue.of(0L), "st@1", ModelValue.of(1L), "loop", ModelValue.of(1L)),
                Map.of(), Map.of(), false);

        CounterexampleTrace trace = LtlBoundedEncoder.decodeLasso(model, 2, space);

        assertEquals(List.of(0, 1), trace.states());
        assertEquals(List.of("finish", "1->1"), trace.transitions());
        assertEquals(1, trace.loopPoint());
    }

    @Test
    void testViolationEncoding_rejectsExistentialProperty() {
        assertThrows(UnsupportedFormulaException.class,
                () -> encoder.encodeViolation(parser.parse("EF p"), StateSpaceTestUtils.cycle3(), 8));
    }

    @Test
    void testDecodeLasso_readsStatesAndLoop() {
        ConstraintModel model = new ConstraintModel(Map.of(
                "st@0", ModelValue.of(0L), "st@1", ModelValue.of(1L), "st@2", ModelValue.of(2L),
                "loop", ModelValue.of(0L)), Map.of(), Map.of("f0@0", true), false);

        CounterexampleTrace trace = LtlBoundedEncoder.decodeLasso(model, 3, StateSpaceTestUtils.cycle3());

        assertEquals(List.of(0, 1, 2), trace.states());
        assertEquals(List.of("0->1", "1->2", "2->0"), trace.transitions());
        assertEquals(0, trace.loopPoint());
        assertEquals(TraceType.INFINITE, trace.type());
    }

    @Test
    void testDecodeLasso_missingStateFails() {
        ConstraintModel model = new ConstraintModel(Map.of("st@0", ModelValue.of(0L)), Map.of(), Map.of(), false);
        assertThrows(IllegalStateException.class,
                () -> LtlBoundedEncoder.decodeLasso(model, 2, StateSpaceTestUtils.cycle3()));
    }
}
