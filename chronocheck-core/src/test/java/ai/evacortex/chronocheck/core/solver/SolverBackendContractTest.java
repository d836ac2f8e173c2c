/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

abstract class SolverBackendContractTest {

    protected static final SolverConfig CONFIG = new SolverConfig(Duration.ofSeconds(10), 1000, true, true, Map.of(), 32);

    protected abstract SolverBackend backend();

    protected boolean available() {
        return true;
    }

    @BeforeEach
    void requireBackend() {
        assumeTrue(available(), backend().name() + " is not available on this platform");
    }

    @Test
    void integerConstraint_yieldsModel() {
        SmtScript script = SmtScript.builder()
                .declareConst("x", SmtSort.INT)
                .assertNamed("c1", "(> x 3)")
                .assertNamed("c2", "(< x 5)")
                .build();

        SatisfiabilityResult r = backend().check(script, CONFIG);

        assertEquals(SatStatus.SATISFIABLE, r.status(), r.toString());
        assertEquals(4L, r.model().variable("x").orElseThrow().asLong(), "only x = 4 satisfies both bounds");
        assertFalse(r.model().predicateInterpretations().keySet().stream().anyMatch(k -> k.startsWith("track!")),
                "tracking literals must not leak into the model");
    }

    @Test
    void conflictingConstraints_reportCore() {
        SmtScript script = SmtScript.builder()
                .declareConst("x", SmtSort.INT)
                .declareConst("y", SmtSort.INT)
                .assertNamed("above", "(> x 3)")
                .assertNamed("below", "(< x 2)")
                .assertNamed("free", "(= y 0)")
                .build();

        SatisfiabilityResult r = backend().check(script, CONFIG);

        assertEquals(SatStatus.UNSATISFIABLE, r.status(), r.toString());
        List<String> core = r.proof().conflictingConstraints();
        assertTrue(core.containsAll(List.of("above", "below")), "core " + core);
        assertEquals("contradiction", r.proof().steps().get(r.proof().steps().size() - 1).rule());
    }

    @Test
    void booleanConstants_arePredicates() {
        SmtScript script = SmtScript.builder()
                .declareConst("ready", SmtSort.BOOL)
                .declareConst("busy", SmtSort.BOOL)
                .assertTerm("(and ready (not busy))")
                .build();

        SatisfiabilityResult r = backend().check(script, CONFIG);

        assertTrue(r.isSatisfiable(), r.toString());
        assertTrue(r.model().predicate("ready"));
        assertFalse(r.model().predicate("busy"));
    }

    @Test
    void uninterpretedFunction_hasInterpretation() {
        SmtScript script = SmtScript.builder()
                .declareFun("f", List.of(SmtSort.INT), SmtSort.INT)
                .assertNamed("point", "(= (f 1) 5)")
                .build();

        SatisfiabilityResult r = backend().check(script, CONFIG);

        assertTrue(r.isSatisfiable(), r.toString());
        FunctionInterpretation f = r.model().functionInterpretations().get("f");
        assertNotNull(f, "model must interpret f");
        assertEquals(ModelValue.of(5L), f.apply(List.of(ModelValue.of(1L))));
    }

    @Test
    void malformedScript_isErrorNotException() {
        SmtScript script = SmtScript.builder()
                .declareConst("x", SmtSort.INT)
                .assertTerm("(> x undeclared_symbol)")
                .build();

        SatisfiabilityResult r = backend().check(script, CONFIG);

        assertEquals(SatStatus.ERROR, r.status(), r.toString());
    }

    @Test
    void encodedConstraintSystem_roundTrip() {
        ConstraintSystem system = ConstraintSystem.builder()
                .add("light-red", ConstraintFormula.eq(ConstraintTerm.var("light"), ConstraintTerm.constant("red")))
                .add("light-green", ConstraintFormula.eq(ConstraintTerm.var("light"), ConstraintTerm.constant("green")))
                .build();
        SmtScript script = new ConstraintEncoder(CONFIG).encode(system);

        SatisfiabilityResult r = backend().check(script, CONFIG);

        assertEquals(SatStatus.UNSATISFIABLE, r.status(), "distinct constants cannot both equal light");
        assertTrue(r.proof().conflictingConstraints().containsAll(List.of("light-red", "light-green")));
    }
}

@DisplayName("SolverBackend contract tests (Z3)")
class Z3SolverBackendContractTest extends SolverBackendContractTest {
    @Override
    protected SolverBackend backend() {
        return new Z3SolverBackend();
    }

    @Override
    protected boolean available() {
        return Z3SolverBackend.isAvailable();
    }
}
