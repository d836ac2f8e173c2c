/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.verify;

import ai.evacortex.chronocheck.core.analysis.OperatorValidationResult;
import ai.evacortex.chronocheck.core.analysis.TemporalOperatorAnalyzer;
import ai.evacortex.chronocheck.core.document.SpecDocument;
import ai.evacortex.chronocheck.core.document.TemporalProperty;
import ai.evacortex.chronocheck.core.engine.CheckOutcome;
import ai.evacortex.chronocheck.core.engine.CtlModelChecker;
import ai.evacortex.chronocheck.core.engine.PropertyVerificationResult;
import ai.evacortex.chronocheck.core.engine.VerificationOutcome;
import ai.evacortex.chronocheck.core.exceptions.FormulaParseException;
import ai.evacortex.chronocheck.core.exceptions.StateSpaceInvariantException;
import ai.evacortex.chronocheck.core.exceptions.UnsupportedFormulaException;
import ai.evacortex.chronocheck.core.formula.FormulaParser;
import ai.evacortex.chronocheck.core.formula.FormulaRewriter;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;
import ai.evacortex.chronocheck.core.model.StateSpace;
import ai.evacortex.chronocheck.core.model.StateSpaceAnalyzer;
import ai.evacortex.chronocheck.core.model.StateSpaceBuilder;
import ai.evacortex.chronocheck.core.pattern.PatternAnalysisResult;
import ai.evacortex.chronocheck.core.pattern.TemporalPatternDetector;
import ai.evacortex.chronocheck.core.solver.BoundedVerification;
import ai.evacortex.chronocheck.core.solver.FormulaCache;
import ai.evacortex.chronocheck.core.solver.SolverBackend;
import ai.evacortex.chronocheck.core.solver.SolverBridge;
import ai.evacortex.chronocheck.core.solver.Z3SolverBackend;

import java.io.Closeable;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the full pipeline for a document: operator analysis and pattern detection for
 * diagnostics, then state-space construction and one check per declared property.
 *
 * <p>Properties are checked concurrently on a work-stealing pool. Each task owns its formula;
 * the {@link StateSpace} is shared read-only and the {@link FormulaCache} is the only shared
 * mutable component. Routing:</p>
 * <ul>
 *   <li>a trivial or truncated state space: UNKNOWN, never SATISFIED;</li>
 *   <li>pure LTL with temporal operators: bounded check through the {@link SolverBridge};</li>
 *   <li>propositional and CTL formulas: {@link CtlModelChecker}. When the checker cannot handle a
 *       CTL shape that reduces to LTL (such as {@code A[φ U ψ]}), the bounded check decides it.</li>
 * </ul>
 *
 * <p>{@link #cancel()} is cooperative: properties not yet started in the batches running at that
 * moment are reported as UNKNOWN("cancelled"). Later batches are unaffected.</p>
 */
public class VerificationOrchestrator implements Closeable {

    private final VerificationConfig config;
    private final VerificationTracer tracer;
    private final FormulaCache cache;
    private final SolverBridge bridge;
    private final TemporalOperatorAnalyzer operatorAnalyzer;
    private final TemporalPatternDetector patternDetector;
    private final StateSpaceBuilder stateSpaceBuilder;
    private final StateSpaceAnalyzer stateSpaceAnalyzer;
    private final CtlModelChecker checker;
    private final FormulaParser parser;
    private final ExecutorService executor;
    private final AtomicLong cancellations = new AtomicLong();

    public VerificationOrchestrator() {
        this(VerificationConfig.defaults());
    }

    public VerificationOrchestrator(VerificationConfig config) {
        this(config, new Z3SolverBackend(), new NoOpTracer());
    }

    public VerificationOrchestrator(VerificationConfig config, SolverBackend backend, VerificationTracer tracer) {
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.cache = new FormulaCache(config.cacheMaxEntries());
        this.bridge = new SolverBridge(backend, cache, config.solver());
        this.operatorAnalyzer = new TemporalOperatorAnalyzer();
        this.patternDetector = new TemporalPatternDetector();
        this.stateSpaceBuilder = new StateSpaceBuilder(config.limits());
        this.stateSpaceAnalyzer = new StateSpaceAnalyzer();
        this.checker = new CtlModelChecker(config.limits());
        this.parser = new FormulaParser();
        this.executor = Executors.newWorkStealingPool(config.parallelism());
    }

    public VerificationConfig config() {
        return config;
    }

    public FormulaCache cache() {
        return cache;
    }

    public SolverBridge solverBridge() {
        return bridge;
    }

    public OperatorValidationResult analyzeOperators(SpecDocument document) {
        return operatorAnalyzer.analyze(document);
    }

    public PatternAnalysisResult detectPatterns(SpecDocument document) {
        return detectPatterns(document, analyzeOperators(document));
    }

    public PatternAnalysisResult detectPatterns(SpecDocument document, OperatorValidationResult operators) {
        return patternDetector.detect(operators.operators(), document.size());
    }

    public StateSpace buildStateSpace(SpecDocument document) {
        long start = System.nanoTime();
        StateSpace space = stateSpaceBuilder.build(document);
        tracer.stateSpaceBuilt(document.name(), space, Duration.ofNanos(System.nanoTime() - start));
        return space;
    }

    /** Diagnostics plus model checking of every declared property. */
    public VerificationReport verify(SpecDocument document) {
        OperatorValidationResult operators = analyzeOperators(document);
        PatternAnalysisResult patterns = detectPatterns(document, operators);
        StateSpace space = buildStateSpace(document);
        ModelCheckingResult checking = check(document.name(), document.properties(), space);
        return new VerificationReport(document.name(), operators, patterns,
                space.stateCount(), space.transitionCount(), space.isTrivial(), space.isTruncated(),
                stateSpaceAnalyzer.analyze(space), checking);
    }

    public ModelCheckingResult check(SpecDocument document) {
        return check(document.name(), document.properties(), buildStateSpace(document));
    }

    /**
     * Checks each property against {@code space}. One failing property never blocks the others;
     * an invariant violation of the state space propagates.
     */
    public ModelCheckingResult check(String documentName, List<TemporalProperty> properties, StateSpace space) {
        long start = System.nanoTime();
        long generation = cancellations.get();
        List<Future<PropertyResult>> futures = new ArrayList<>(properties.size());
        for (TemporalProperty p : properties) {
            futures.add(executor.submit(() -> {
                if (cancellations.get() != generation) {
                    return PropertyResult.without(p.name(), p.formula().render(),
                            PropertyVerificationResult.unknown("cancelled"));
                }
                PropertyResult r = checkProperty(p, space);
                tracer.propertyChecked(documentName, r);
                return r;
            }));
        }

        List<PropertyResult> results = new ArrayList<>(properties.size());
        for (int i = 0; i < futures.size(); i++) {
            TemporalProperty p = properties.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(PropertyResult.without(p.name(), p.formula().render(),
                        PropertyVerificationResult.unknown("interrupted")));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof StateSpaceInvariantException sie) throw sie;
                if (cause instanceof Error err) throw err;
                results.add(PropertyResult.without(p.name(), p.formula().render(),
                        PropertyVerificationResult.error("check failed: " + cause)));
            }
        }
        return aggregate(results, space, Duration.ofNanos(System.nanoTime() - start));
    }

    /** Abandons the properties not yet started in every batch currently running. */
    public void cancel() {
        cancellations.incrementAndGet();
    }

    PropertyResult checkProperty(TemporalProperty property, StateSpace space) {
        long start = System.nanoTime();
        String text = property.formula().render();
        TemporalFormula formula;
        try {
            formula = property.formula().isParsed() ? property.formula().formula() : parser.parse(text);
        } catch (FormulaParseException e) {
            return PropertyResult.without(property.name(), text, PropertyVerificationResult.error(e.getMessage()));
        }
        String canonical = formula.toString();

        if (space.isTrivial()) {
            return PropertyResult.without(property.name(), canonical, PropertyVerificationResult.unknown(
                    "state space is trivial: the document declares no state variables or no enabled transitions"));
        }
        if (space.isTruncated()) {
            return PropertyResult.without(property.name(), canonical, PropertyVerificationResult.unknown(
                    "state space truncated at " + space.stateCount() + " states"));
        }

        if (formula.isLinear() && !formula.isPropositional()) {
            return bounded(property.name(), canonical, formula, space, start);
        }
        CheckOutcome outcome = checker.check(formula, space);
        if (outcome.result().outcome() == VerificationOutcome.UNKNOWN && reducesToLinear(formula)
                && space.stateCount() <= config.limits().maxStates()) {
            return bounded(property.name(), canonical, formula, space, start);
        }
        return new PropertyResult(property.name(), canonical, outcome.result(), outcome.counterexample(),
                outcome.witness(), CheckEngine.EXPLICIT_CTL, outcome.fixpoints(), since(start));
    }

    private PropertyResult bounded(String name, String canonical, TemporalFormula formula, StateSpace space, long start) {
        BoundedVerification v = bridge.verify(formula, space);
        return new PropertyResult(name, canonical, v.result(), v.counterexample(), null,
                CheckEngine.BOUNDED_SMT, List.of(), since(start));
    }

    private static boolean reducesToLinear(TemporalFormula formula) {
        try {
            FormulaRewriter.toLinear(formula);
            return true;
        } catch (UnsupportedFormulaException e) {
            return false;
        }
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ModelCheckingResult aggregate(List<PropertyResult> results, StateSpace space, Duration total) {
        int verified = 0, failed = 0, unknown = 0, errors = 0;
        Map<String, Duration> timings = new LinkedHashMap<>();
        for (PropertyResult r : results) {
            switch (r.outcome()) {
                case SATISFIED -> verified++;
                case VIOLATED -> failed++;
                case UNKNOWN -> unknown++;
                case ERROR -> errors++;
            }
            timings.put(r.name(), r.elapsed());
        }
        ModelCheckingStats stats = new ModelCheckingStats(space.stateCount(), space.transitionCount(),
                verified, failed, unknown, errors, timings, total);
        return new ModelCheckingResult(results, VerificationStatus.of(results.size(), verified, failed, errors), stats);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                System.err.println("Verification pool did not terminate in time; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
