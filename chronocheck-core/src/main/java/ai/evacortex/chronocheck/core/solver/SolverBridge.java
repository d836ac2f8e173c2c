/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import ai.evacortex.chronocheck.core.engine.CounterexampleTrace;
import ai.evacortex.chronocheck.core.engine.PropertyVerificationResult;
import ai.evacortex.chronocheck.core.exceptions.FormulaParseException;
import ai.evacortex.chronocheck.core.exceptions.SolverException;
import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;
import ai.evacortex.chronocheck.core.formula.FormulaParser;
import ai.evacortex.chronocheck.core.formula.FormulaRewriter;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;
import ai.evacortex.chronocheck.core.model.StateSpace;
import ai.evacortex.chronocheck.core.util.HashingUtil;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point to the external solver.
 *
 * <p>Formulas are translated to SMT-LIB, answered by the {@link SolverBackend} and interpreted
 * here. Every answer, including failures, is stored in the shared {@link FormulaCache} under a
 * content key:</p>
 * <ul>
 *   <li>{@code ltl:<md5 of canonical text>} for word satisfiability,</li>
 *   <li>{@code fo:<md5 of script>} for first-order systems,</li>
 *   <li>{@code bmc:<md5 of canonical text>@<state-space fingerprint>} for bounded verification.</li>
 * </ul>
 * <p>Models are cut to {@code maxModelSize} entries on the way out; the cache keeps them whole.</p>
 */
public class SolverBridge {

    private final SolverBackend backend;
    private final FormulaCache cache;
    private final SolverConfig config;
    private final FormulaParser parser = new FormulaParser();
    private final LtlBoundedEncoder ltlEncoder = new LtlBoundedEncoder();
    private final ConstraintEncoder constraintEncoder;

    public SolverBridge(SolverBackend backend, FormulaCache cache, SolverConfig config) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.config = Objects.requireNonNull(config, "config");
        this.constraintEncoder = new ConstraintEncoder(config);
    }

    public SolverConfig config() {
        return config;
    }

    /**
     * Satisfiability of an LTL or propositional formula over infinite words.
     * Unparseable text is an ERROR result.
     */
    public SatisfiabilityResult solve(String formulaText) {
        TemporalFormula formula;
        try {
            formula = parser.parse(formulaText);
        } catch (FormulaParseException e) {
            return cache.get("raw:" + HashingUtil.md5Hex(formulaText),
                    () -> SatisfiabilityResult.error(e.getMessage()));
        }
        return solve(formula);
    }

    public SatisfiabilityResult solve(TemporalFormula formula) {
        String key = "ltl:" + HashingUtil.md5Hex(formula.toString());
        return limit(cache.get(key, guarded(() -> {
            TemporalFormula linear = FormulaRewriter.toLinear(formula);
            LtlBoundedEncoder.Encoding enc = ltlEncoder.encodeSatisfiability(linear, config.maxBound());
            SatisfiabilityResult r = run(enc.script());
            if (r.isUnsatisfiable() && !enc.complete()) {
                return SatisfiabilityResult.unknown("no satisfying lasso within bound " + enc.positions()
                        + " (completeness threshold " + enc.threshold() + ")");
            }
            return r;
        })));
    }

    public SatisfiabilityResult solve(ConstraintSystem system) {
        SmtScript script;
        try {
            script = constraintEncoder.encode(system);
        } catch (UnsupportedFormulaException | IllegalArgumentException e) {
            return SatisfiabilityResult.error("translation failed: " + e.getMessage());
        }
        String key = "fo:" + HashingUtil.md5Hex(script.render());
        return limit(cache.get(key, guarded(() -> run(script))));
    }

    /**
     * Bounded check that no infinite path of {@code space} from an initial state violates
     * {@code property}. Paths ending in a deadlock are not considered.
     */
    public BoundedVerification verify(TemporalFormula property, StateSpace space) {
        long threshold;
        try {
            threshold = LtlBoundedEncoder.violationThreshold(property, space.stateCount());
        } catch (UnsupportedFormulaException e) {
            SatisfiabilityResult err = SatisfiabilityResult.error(e.getMessage());
            return new BoundedVerification(PropertyVerificationResult.error(e.getMessage()), null, err, 0, 0);
        }
        int bound = LtlBoundedEncoder.positions(threshold, config.maxBound());
        String key = "bmc:" + HashingUtil.md5Hex(property.toString()) + "@" + space.fingerprint();
        SatisfiabilityResult raw = cache.get(key, guarded(() ->
                run(ltlEncoder.encodeViolation(property, space, config.maxBound()).script())));

        return switch (raw.status()) {
            case SATISFIABLE -> {
                CounterexampleTrace trace;
                try {
                    trace = LtlBoundedEncoder.decodeLasso(raw.model(), bound, space);
                } catch (IllegalStateException | IllegalArgumentException | IndexOutOfBoundsException e) {
                    System.err.println("Counterexample for " + property + " could not be decoded: " + e.getMessage());
                    trace = null;
                }
                yield new BoundedVerification(PropertyVerificationResult.violated(), trace, limit(raw), bound, threshold);
            }
            case UNSATISFIABLE -> new BoundedVerification(bound >= threshold
                    ? PropertyVerificationResult.satisfied()
                    : PropertyVerificationResult.unknown("no counterexample within bound " + bound
                            + " (completeness threshold " + threshold + ")"),
                    null, raw, bound, threshold);
            case UNKNOWN -> new BoundedVerification(PropertyVerificationResult.unknown(raw.reason()), null, raw, bound, threshold);
            case ERROR -> new BoundedVerification(PropertyVerificationResult.error(raw.reason()), null, raw, bound, threshold);
        };
    }

    private SatisfiabilityResult run(SmtScript script) {
        SatisfiabilityResult r = backend.check(script, config);
        if (r == null) throw new SolverException(backend.name() + " returned no result");
        return r;
    }

    /** Turns translation and solver failures into ERROR results so they are cached as well. */
    private static Supplier<SatisfiabilityResult> guarded(Supplier<SatisfiabilityResult> loader) {
        return () -> {
            try {
                return loader.get();
            } catch (UnsupportedFormulaException | SolverException e) {
                return SatisfiabilityResult.error(e.getMessage());
            } catch (IllegalArgumentException e) {
                return SatisfiabilityResult.error("translation failed: " + e.getMessage());
            }
        };
    }

    private SatisfiabilityResult limit(SatisfiabilityResult r) {
        if (!r.isSatisfiable() || r.model().size() <= config.maxModelSize()) return r;
        return SatisfiabilityResult.satisfiable(r.model().truncate(config.maxModelSize()));
    }
}
