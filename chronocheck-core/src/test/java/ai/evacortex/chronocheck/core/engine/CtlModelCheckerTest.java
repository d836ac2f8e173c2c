/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.engine;

import ai.evacortex.chronocheck.core.StateSpaceTestUtils;
import ai.evacortex.chronocheck.core.formula.FormulaParser;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;
import ai.evacortex.chronocheck.core.model.ModelLimits;
import ai.evacortex.chronocheck.core.model.StateSpace;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CtlModelCheckerTest {

    private static final long SEED = 42L;
    private static final int GRAPHS = 60;

    private final FormulaParser parser = new FormulaParser();
    private final CtlModelChecker checker = new CtlModelChecker(new ModelLimits(10_000));

    @Test
    void testThreeCycle_existsEventuallyHoldsWithWitness() {
        CheckOutcome out = checker.check(parser.parse("EF p"), StateSpaceTestUtils.cycle3());

        assertEquals(VerificationOutcome.SATISFIED, out.result().outcome());
        assertNull(out.counterexample());
        assertNotNull(out.witness(), "EF should produce a witness path");
        assertEquals(List.of(0, 1, 2), out.witness().states());
        assertEquals(List.of("0->1", "1->2"), out.witness().transitions());
    }

    @Test
    void testThreeCycle_forallAlwaysViolatedAtInitialState() {
        CheckOutcome out = checker.check(parser.parse("AG p"), StateSpaceTestUtils.cycle3());

        assertEquals(VerificationOutcome.VIOLATED, out.result().outcome());
        CounterexampleTrace cex = out.counterexample();
        assertNotNull(cex);
        assertEquals(List.of(0), cex.states(), "s0 itself violates p");
        assertEquals(TraceType.FINITE, cex.type());
    }

    @Test
    void testForallEventually_counterexampleIsLasso() {
        StateSpace space = StateSpace.builder()
                .addState(0).addState(1).addState(2, "p").declareProposition("p")
                .addTransition(0, 1).addTransition(1, 0).addTransition(1, 2)
                .markInitial(0).build();

        CheckOutcome out = checker.check(parser.parse("AF p"), space);

        assertEquals(VerificationOutcome.VIOLATED, out.result().outcome());
        CounterexampleTrace cex = out.counterexample();
        assertEquals(TraceType.INFINITE, cex.type());
        assertEquals(List.of(0, 1), cex.states());
        assertEquals(0, cex.loopPoint());
        assertEquals(List.of("0->1", "1->0"), cex.transitions());
    }

    @Test
    void testDeadState_failsUniversalAlwaysAndNext() {
        StateSpace space = StateSpace.builder()
                .addState(0, "p").declareProposition("p").markInitial(0).build();

        assertEquals(VerificationOutcome.VIOLATED, checker.check(parser.parse("AG p"), space).result().outcome());
        assertEquals(VerificationOutcome.VIOLATED, checker.check(parser.parse("EG p"), space).result().outcome());
        assertEquals(VerificationOutcome.VIOLATED, checker.check(parser.parse("AX p"), space).result().outcome());
        assertEquals(VerificationOutcome.SATISFIED, checker.check(parser.parse("EF p"), space).result().outcome());
    }

    @Test
    void testUnquantifiedOperator_reportedUnknown() {
        CheckOutcome out = checker.check(parser.parse("□p"), StateSpaceTestUtils.cycle3());

        assertEquals(VerificationOutcome.UNKNOWN, out.result().outcome());
        assertTrue(out.result().reason().contains("path quantifier"), out.result().reason());
    }

    @Test
    void testExistsUntil_reportedUnknown() {
        CheckOutcome out = checker.check(parser.parse("E[p U q]"), StateSpaceTestUtils.cycle3());
        assertEquals(VerificationOutcome.UNKNOWN, out.result().outcome());
    }

    @Test
    void testStateBound_exceededIsUnknown() {
        CtlModelChecker small = new CtlModelChecker(new ModelLimits(2));
        CheckOutcome out = small.check(parser.parse("EF p"), StateSpaceTestUtils.cycle3());

        assertEquals(VerificationOutcome.UNKNOWN, out.result().outcome());
        assertTrue(out.result().reason().startsWith("state bound exceeded"), out.result().reason());
    }

    @Test
    void testChain_leastFixpointNeedsOnePassPerState() {
        int n = 12;
        StateSpace chain = StateSpaceTestUtils.chain(n);
        CheckOutcome out = checker.check(parser.parse("EF p"), chain);

        assertEquals(VerificationOutcome.SATISFIED, out.result().outcome());
        assertEquals(1, out.fixpoints().size());
        FixpointStats stats = out.fixpoints().get(0);
        assertEquals(n - 1, stats.changingPasses());
        assertEquals(n, stats.resultSize());
    }

    @Test
    void testRandomGraphs_existsAlwaysIsMaximalClosedSubset() {
        Random rnd = new Random(SEED);
        for (int g = 0; g < GRAPHS; g++) {
            StateSpace space = StateSpaceTestUtils.randomGraph(rnd, 3 + rnd.nextInt(14), 0.2, false);
            BitSet target = space.label("p");
            BitSet eg = checker.satisfying(parser.parse("EG p"), space);

            assertSubset(eg, target, "EG p ⊆ p");
            for (int s = eg.nextSetBit(0); s >= 0; s = eg.nextSetBit(s + 1)) {
                assertTrue(hasSuccessorIn(space, s, eg), "state " + s + " in EG p needs a successor in EG p");
            }
            assertEquals(referenceExistsAlways(space, target), eg, "EG p is the largest such subset, graph " + g);
        }
    }

    @Test
    void testRandomGraphs_forallAlwaysIsMaximalClosedSubset() {
        Random rnd = new Random(SEED + 1);
        for (int g = 0; g < GRAPHS; g++) {
            StateSpace space = StateSpaceTestUtils.randomGraph(rnd, 3 + rnd.nextInt(14), 0.2, false);
            BitSet target = space.label("p");
            BitSet ag = checker.satisfying(parser.parse("AG p"), space);

            assertSubset(ag, target, "AG p ⊆ p");
            for (int s = ag.nextSetBit(0); s >= 0; s = ag.nextSetBit(s + 1)) {
                assertTrue(space.hasSuccessors(s), "state " + s + " in AG p must not be dead");
                for (int t : space.successors(s)) {
                    assertTrue(ag.get(t), "successor " + t + " of " + s + " must stay in AG p");
                }
            }
            assertEquals(referenceForallAlways(space, target), ag, "AG p is the largest such subset, graph " + g);
        }
    }

    @Test
    void testRandomGraphs_existsEventuallyMatchesBackwardReachability() {
        Random rnd = new Random(SEED + 2);
        for (int g = 0; g < GRAPHS; g++) {
            StateSpace space = StateSpaceTestUtils.randomGraph(rnd, 3 + rnd.nextInt(14), 0.15, false);
            BitSet ef = checker.satisfying(parser.parse("EF q"), space);
            assertEquals(StateSpaceTestUtils.reachWithin(space, space.allStates(), space.label("q")), ef,
                    "EF q on graph " + g);
        }
    }

    @Test
    void testRandomTotalGraphs_dualitiesHold() {
        Random rnd = new Random(SEED + 3);
        for (int g = 0; g < GRAPHS; g++) {
            StateSpace space = StateSpaceTestUtils.randomGraph(rnd, 2 + rnd.nextInt(15), 0.2, true);

            assertEquals(checker.satisfying(parser.parse("EF p"), space),
                    checker.satisfying(parser.parse("¬AG ¬p"), space), "EF p = ¬AG¬p on graph " + g);
            assertEquals(checker.satisfying(parser.parse("EG p"), space),
                    checker.satisfying(parser.parse("¬AF ¬p"), space), "EG p = ¬AF¬p on graph " + g);
            assertEquals(checker.satisfying(parser.parse("EX p"), space),
                    checker.satisfying(parser.parse("¬AX ¬p"), space), "EX p = ¬AX¬p on graph " + g);
        }
    }

    @Test
    void testRandomGraphs_fixpointPassesBoundedByStateCount() {
        Random rnd = new Random(SEED + 4);
        List<TemporalFormula> formulas = List.of(
                parser.parse("EF p"), parser.parse("AF p"), parser.parse("EG p"),
                parser.parse("AG (p ∨ q)"), parser.parse("AG (p → AF q)"));
        for (int g = 0; g < GRAPHS; g++) {
            StateSpace space = StateSpaceTestUtils.randomGraph(rnd, 2 + rnd.nextInt(20), 0.15, false);
            for (TemporalFormula f : formulas) {
                CheckOutcome out = checker.check(f, space);
                assertFalse(out.fixpoints().isEmpty());
                for (FixpointStats stats : out.fixpoints()) {
                    assertTrue(stats.changingPasses() <= space.stateCount(),
                            f + " took " + stats.changingPasses() + " passes on " + space.stateCount() + " states");
                }
            }
        }
    }

    @Test
    void testRepeatedChecks_areIdentical() {
        Random rnd = new Random(SEED + 5);
        StateSpace space = StateSpaceTestUtils.randomGraph(rnd, 15, 0.2, false);
        for (String text : List.of("AG p", "AF q", "EG p", "EF (p ∧ q)", "AX p")) {
            TemporalFormula f = parser.parse(text);
            CheckOutcome first = checker.check(f, space);
            CheckOutcome second = checker.check(f, space);
            assertEquals(first, second, "checking " + text + " twice must agree");
        }
    }

    private static BitSet referenceExistsAlways(StateSpace space, BitSet target) {
        // states of `target` lying on a cycle inside `target`
        BitSet onCycle = new BitSet();
        for (int s = target.nextSetBit(0); s >= 0; s = target.nextSetBit(s + 1)) {
            BitSet self = new BitSet();
            self.set(s);
            for (int t : space.successors(s)) {
                if (target.get(t) && StateSpaceTestUtils.reachWithin(space, target, self).get(t)) {
                    onCycle.set(s);
                    break;
                }
            }
        }
        BitSet out = StateSpaceTestUtils.reachWithin(space, target, onCycle);
        out.and(target);
        return out;
    }

    private static BitSet referenceForallAlways(StateSpace space, BitSet target) {
        BitSet bad = space.allStates();
        bad.andNot(target);
        for (int s = 0; s < space.stateCount(); s++) {
            if (!space.hasSuccessors(s)) bad.set(s);
        }
        BitSet out = StateSpaceTestUtils.reachWithin(space, space.allStates(), bad);
        BitSet good = space.allStates();
        good.andNot(out);
        return good;
    }

    private static boolean hasSuccessorIn(StateSpace space, int s, BitSet set) {
        for (int t : space.successors(s)) {
            if (set.get(t)) return true;
        }
        return false;
    }

    private static void assertSubset(BitSet sub, BitSet sup, String message) {
        BitSet diff = (BitSet) sub.clone();
        diff.andNot(sup);
        assertTrue(diff.isEmpty(), message + ": extra states " + diff);
    }
}
