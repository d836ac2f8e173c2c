/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

import ai.evacortex.chronocheck.core.StateSpaceTestUtils;
import ai.evacortex.chronocheck.core.document.*;
import ai.evacortex.chronocheck.core.exceptions.InvalidDocumentException;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StateSpaceBuilderTest {

    private final StateSpaceBuilder builder = new StateSpaceBuilder(new ModelLimits(1_000));

    @Test
    void testToggle_twoStatesWithNamedTransitions() {
        StateSpace space = builder.build(StateSpaceTestUtils.toggleDocument().build());

        assertEquals(2, space.stateCount());
        assertEquals(2, space.transitionCount());
        assertFalse(space.isTrivial());
        assertFalse(space.isTruncated());
        assertTrue(space.initialStates().get(0));

        SystemState off = space.state(0);
        assertEquals(Value.of(false), off.valuation().get("on"));
        assertEquals(Set.of("turnOn"), off.locations());
        assertTrue(off.properties().isEmpty());
        assertEquals(Set.of("on"), space.state(1).properties());

        assertEquals("turnOn", space.transitionLabel(0, 1));
        assertEquals("turnOff", space.transitionLabel(1, 0));
        assertEquals("¬on", space.transitionsFrom(0).get(0).guard());
    }

    @Test
    void testMutex_reachableValuationsExcludeBothCritical() {
        StateSpace space = builder.build(StateSpaceTestUtils.mutexDocument());

        assertEquals(8, space.stateCount(), "3 x 3 positions minus (crit, crit)");
        BitSet both = space.label("p1=crit");
        both.and(space.label("p2=crit"));
        assertTrue(both.isEmpty());

        assertTrue(space.hasProposition("p1=wait"), "every enumeration value gets a proposition");
        assertTrue(space.hasProposition("lock"));
        for (SystemState s : space.states()) {
            boolean critical = s.properties().contains("p1=crit") || s.properties().contains("p2=crit");
            assertEquals(critical, s.properties().contains("lock"), "lock is held exactly in critical states: " + s);
        }
    }

    @Test
    void testMutex_initialStateIsInitialValuation() {
        StateSpace space = builder.build(StateSpaceTestUtils.mutexDocument());
        SystemState init = space.state(0);

        assertEquals(Value.symbol("idle"), init.valuation().get("p1"));
        assertEquals(Value.symbol("idle"), init.valuation().get("p2"));
        assertEquals(Value.of(false), init.valuation().get("lock"));
        assertEquals(Set.of("request1", "request2"), init.locations());
        assertEquals("s0{p1=idle, p2=idle, lock=false}", init.toString());
    }

    @Test
    void testStateBound_truncatesExploration() {
        StateSpace space = new StateSpaceBuilder(new ModelLimits(3)).build(StateSpaceTestUtils.mutexDocument());

        assertTrue(space.isTruncated());
        assertEquals(3, space.stateCount());
    }

    @Test
    void testNoVariables_singleTrivialState() {
        SpecDocument doc = SpecDocument.builder("plain")
                .rule("r", "□(req → ◊ack)")
                .property("p", "AG ready")
                .build();

        StateSpace space = builder.build(doc);

        assertTrue(space.isTrivial());
        assertEquals(1, space.stateCount());
        assertEquals(0, space.transitionCount());
        assertEquals(Set.of("ack", "ready", "req"), space.propositions());
        assertTrue(space.label("req").isEmpty());
    }

    @Test
    void testFunctionsWithoutGuard_contributeNoTransitions() {
        SpecDocument doc = SpecDocument.builder("idle")
                .variable(StateVariable.bool("x", true))
                .function(FunctionDecl.of("helper", Expression.raw("□x", SourceSpan.UNKNOWN)))
                .build();

        StateSpace space = builder.build(doc);
        assertEquals(1, space.stateCount());
        assertFalse(space.hasSuccessors(0));
        assertTrue(space.isTrivial(), "variables alone do not make a model");
    }

    @Test
    void testGuardsNeverEnabled_trivialSpace() {
        SpecDocument doc = SpecDocument.builder("stuck")
                .variable(StateVariable.bool("x", true))
                .function(new FunctionDecl("unset", null, raw("¬x"), Map.of("x", "false")))
                .build();

        StateSpace space = builder.build(doc);
        assertEquals(1, space.stateCount());
        assertEquals(0, space.transitionCount());
        assertTrue(space.isTrivial());
    }

    @Test
    void testFinish_deadStateKeepsSpaceNonTrivial() {
        StateSpace space = builder.build(StateSpaceTestUtils.finishDocument().build());

        assertEquals(2, space.stateCount());
        assertEquals(1, space.transitionCount());
        assertFalse(space.isTrivial());
        assertTrue(space.hasSuccessors(0));
        assertFalse(space.hasSuccessors(1));
        assertEquals(Set.of("done"), space.state(1).properties());
    }

    @Test
    void testInvalidDocuments_rejected() {
        assertThrows(InvalidDocumentException.class, () -> builder.build(withFunction(
                new FunctionDecl("f", null, raw("ghost"), Map.of("on", "true")))));
        assertThrows(InvalidDocumentException.class, () -> builder.build(withFunction(
                new FunctionDecl("f", null, raw("on"), Map.of("on", "maybe")))));
        assertThrows(InvalidDocumentException.class, () -> builder.build(withFunction(
                new FunctionDecl("f", null, raw("on"), Map.of("off", "true")))));
        assertThrows(InvalidDocumentException.class, () -> builder.build(withFunction(
                new FunctionDecl("f", null, raw("◊on"), Map.of()))));
        assertThrows(InvalidDocumentException.class, () -> builder.build(withFunction(
                new FunctionDecl("f", null, raw("on ∧"), Map.of()))));

        SpecDocument twice = SpecDocument.builder("dup")
                .variable(StateVariable.bool("on", false))
                .variable(StateVariable.bool("on", true))
                .build();
        assertThrows(InvalidDocumentException.class, () -> builder.build(twice));
    }

    @Test
    void testEnumerationUsedAsBoolean_rejected() {
        SpecDocument doc = SpecDocument.builder("enum")
                .variable(StateVariable.enumeration("mode", List.of("a", "b"), "a"))
                .function(new FunctionDecl("f", null, raw("mode"), Map.of("mode", "b")))
                .build();
        InvalidDocumentException e = assertThrows(InvalidDocumentException.class, () -> builder.build(doc));
        assertTrue(e.getMessage().contains("as a boolean"), e.getMessage());
    }

    private static SpecDocument withFunction(FunctionDecl fn) {
        return SpecDocument.builder("bad").variable(StateVariable.bool("on", false)).function(fn).build();
    }

    private static Expression raw(String text) {
        return Expression.raw(text, SourceSpan.UNKNOWN);
    }
}
