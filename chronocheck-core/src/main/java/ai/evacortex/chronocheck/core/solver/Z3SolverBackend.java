/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import com.microsoft.z3.*;

import java.math.BigInteger;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link SolverBackend} on the Z3 Java API.
 *
 * <p>Every call runs in its own {@link Context}, so concurrent calls share no native state.
 * Named assertions are tracked with fresh Boolean literals; the unsat core is mapped back to
 * the assertion names. The configured timeout is passed to Z3 and also armed on a watchdog
 * that interrupts the context if Z3 overruns it.</p>
 */
public class Z3SolverBackend implements SolverBackend {

    private static final String TRACKER_PREFIX = "track!";
    private static final long WATCHDOG_GRACE_MS = 250;

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "chronocheck-z3-watchdog");
        t.setDaemon(true);
        return t;
    });

    @Override
    public SatisfiabilityResult check(SmtScript script, SolverConfig config) {
        Object guard = new Object();
        boolean[] finished = {false};
        boolean[] interrupted = {false};
        try (Context ctx = new Context(Map.of("model", "true"))) {
            ScheduledFuture<?> watchdog = WATCHDOG.schedule(() -> {
                synchronized (guard) {
                    if (!finished[0]) {
                        interrupted[0] = true;
                        ctx.interrupt();
                    }
                }
            }, config.timeout().toMillis() + WATCHDOG_GRACE_MS, TimeUnit.MILLISECONDS);
            try {
                return solve(ctx, script, config);
            } finally {
                watchdog.cancel(false);
                synchronized (guard) {
                    finished[0] = true;
                }
            }
        } catch (Z3Exception e) {
            if (interrupted[0]) return SatisfiabilityResult.unknown("timeout after " + config.timeout().toMillis() + " ms");
            return SatisfiabilityResult.error("z3: " + e.getMessage());
        } catch (LinkageError e) {
            return SatisfiabilityResult.error("z3 unavailable: " + e.getMessage());
        }
    }

    private SatisfiabilityResult solve(Context ctx, SmtScript script, SolverConfig config) {
        BoolExpr[] assertions = ctx.parseSMTLIB2String(script.renderDeclarationsAndAssertions(), null, null, null, null);
        List<String> names = script.assertionNames();
        if (assertions.length != names.size()) {
            return SatisfiabilityResult.error("z3 parsed " + assertions.length + " assertions, script has " + names.size());
        }

        Solver solver = ctx.mkSolver();
        solver.setParameters(parameters(ctx, config));

        Map<String, String> trackers = new HashMap<>();
        for (int i = 0; i < assertions.length; i++) {
            String name = names.get(i);
            if (name == null) {
                solver.add(assertions[i]);
            } else {
                String tracker = TRACKER_PREFIX + i;
                trackers.put(tracker, name);
                solver.assertAndTrack(assertions[i], ctx.mkBoolConst(tracker));
            }
        }

        Status status = solver.check();
        switch (status) {
            case SATISFIABLE:
                return SatisfiabilityResult.satisfiable(extractModel(solver.getModel()));
            case UNSATISFIABLE:
                List<String> core = new ArrayList<>();
                for (BoolExpr lit : solver.getUnsatCore()) {
                    String id = trackers.get(lit.toString());
                    if (id != null) core.add(id);
                }
                return SatisfiabilityResult.unsatisfiable(UnsatisfiabilityProof.fromCore(core, script));
            default:
                String reason = solver.getReasonUnknown();
                return SatisfiabilityResult.unknown(reason == null || reason.isBlank() ? "unknown" : reason);
        }
    }

    private static Params parameters(Context ctx, SolverConfig config) {
        Params p = ctx.mkParams();
        p.add("timeout", (int) Math.min(Integer.MAX_VALUE, config.timeout().toMillis()));
        if (!config.enableQuantifierInstantiation()) p.add("smt.mbqi", false);
        config.solverOptions().forEach((key, value) -> {
            if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
                p.add(key, Boolean.parseBoolean(value));
            } else if (value.matches("\\d+")) {
                p.add(key, Integer.parseInt(value));
            } else {
                p.add(key, value);
            }
        });
        return p;
    }

    private static ConstraintModel extractModel(Model model) {
        Map<String, ModelValue> variables = new TreeMap<>();
        Map<String, Boolean> predicates = new TreeMap<>();
        Map<String, FunctionInterpretation> functions = new TreeMap<>();

        for (FuncDecl<?> decl : model.getConstDecls()) {
            String name = decl.getName().toString();
            if (name.startsWith(TRACKER_PREFIX)) continue;
            Expr<?> value = model.getConstInterp(decl);
            if (value == null) continue;
            if (value.isBool()) {
                predicates.put(name, value.isTrue());
            } else {
                variables.put(name, toValue(value));
            }
        }
        for (FuncDecl<?> decl : model.getFuncDecls()) {
            FuncInterp<?> interp = model.getFuncInterp(decl);
            if (interp == null) continue;
            Map<List<ModelValue>, ModelValue> mappings = new LinkedHashMap<>();
            for (FuncInterp.Entry<?> entry : interp.getEntries()) {
                List<ModelValue> args = new ArrayList<>();
                for (Expr<?> a : entry.getArgs()) args.add(toValue(a));
                mappings.put(args, toValue(entry.getValue()));
            }
            List<String> domain = new ArrayList<>();
            for (Sort s : decl.getDomain()) domain.add(s.toString());
            functions.put(decl.getName().toString(),
                    new FunctionInterpretation(domain, decl.getRange().toString(), mappings, toValue(interp.getElse())));
        }
        return new ConstraintModel(variables, functions, predicates, false);
    }

    private static ModelValue toValue(Expr<?> e) {
        if (e.isBool()) return ModelValue.of(e.isTrue());
        if (e instanceof IntNum n) {
            BigInteger v = n.getBigInteger();
            return v.bitLength() < 64 ? ModelValue.of(v.longValue()) : new ModelValue(ModelValue.Kind.INTEGER, v.toString());
        }
        if (e instanceof RatNum r) return ModelValue.real(r.getNumerator().getBigInteger() + "/" + r.getDenominator().getBigInteger());
        return ModelValue.enumeration(e.toString());
    }

    /** True when the Z3 native library can be loaded on this platform. */
    public static boolean isAvailable() {
        return Availability.AVAILABLE;
    }

    private static final class Availability {
        static final boolean AVAILABLE = probe();

        private static boolean probe() {
            try (Context ctx = new Context()) {
                return ctx.mkSolver() != null;
            } catch (UnsatisfiedLinkError | NoClassDefFoundError | ExceptionInInitializerError | Z3Exception e) {
                System.err.println("Z3 is not available: " + e);
                return false;
            }
        }
    }
}
