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

import java.util.*;

/**
 * Translates a {@link ConstraintSystem} into an SMT-LIB script.
 *
 * <p>All terms live in one domain sort: {@code Int} when theory reasoning is enabled, otherwise
 * the uninterpreted sort {@code Value}. Free variables become constants of that sort. Symbolic
 * constants are declared as pairwise distinct constants; with the {@code Value} sort integer
 * literals are symbolic too and the order predicates are rejected. Each constraint is asserted
 * under its id.</p>
 */
public final class ConstraintEncoder {

    static final String VALUE_SORT = "Value";
    static final String CONSTANT_PREFIX = "const!";

    private final SolverConfig config;
    private final SmtSort domain;

    public ConstraintEncoder(SolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.domain = config.enableTheoryReasoning() ? SmtSort.INT : new SmtSort(VALUE_SORT);
    }

    public SmtScript encode(ConstraintSystem system) {
        Signature sig = new Signature();
        for (Constraint c : system.constraints()) sig.collect(c.formula(), new ArrayDeque<>());
        sig.checkDisjoint();

        SmtScript.Builder b = SmtScript.builder().setOption("produce-unsat-cores", "true");
        if (!config.enableTheoryReasoning()) b.declareSort(VALUE_SORT);
        for (String v : sig.freeVariables) b.declareConst(v, domain);
        for (String k : sig.constants) b.declareConst(CONSTANT_PREFIX + k, domain);
        sig.predicates.forEach((name, arity) -> b.declareFun(name, Collections.nCopies(arity, domain), SmtSort.BOOL));
        sig.functions.forEach((name, arity) -> b.declareFun(name, Collections.nCopies(arity, domain), domain));
        if (sig.constants.size() >= 2) {
            List<String> names = new ArrayList<>();
            for (String k : sig.constants) names.add(SmtTerms.symbol(CONSTANT_PREFIX + k));
            b.assertTerm(SmtTerms.app("distinct", names));
        }
        for (Constraint c : system.constraints()) {
            b.assertNamed(c.id(), formula(c.formula()));
        }
        return b.build();
    }

    private String formula(ConstraintFormula f) {
        if (f instanceof ConstraintFormula.Atomic a) {
            List<String> args = new ArrayList<>(a.terms().size());
            for (ConstraintTerm t : a.terms()) args.add(term(t));
            return SmtTerms.app(a.isInterpreted() ? a.predicate() : SmtTerms.symbol(a.predicate()), args);
        }
        if (f instanceof ConstraintFormula.Not n) return SmtTerms.not(formula(n.operand()));
        if (f instanceof ConstraintFormula.And a) return SmtTerms.and(formulas(a.operands()));
        if (f instanceof ConstraintFormula.Or o) return SmtTerms.or(formulas(o.operands()));
        if (f instanceof ConstraintFormula.Forall q) return quantifier("forall", q.variable(), q.body());
        if (f instanceof ConstraintFormula.Exists q) return quantifier("exists", q.variable(), q.body());
        throw new UnsupportedFormulaException("unknown constraint node " + f.getClass().getSimpleName());
    }

    private List<String> formulas(List<ConstraintFormula> fs) {
        List<String> out = new ArrayList<>(fs.size());
        for (ConstraintFormula f : fs) out.add(formula(f));
        return out;
    }

    private String quantifier(String kind, String variable, ConstraintFormula body) {
        return "(" + kind + " ((" + SmtTerms.symbol(variable) + " " + domain.name() + ")) " + formula(body) + ")";
    }

    private String term(ConstraintTerm t) {
        if (t instanceof ConstraintTerm.Variable v) return SmtTerms.symbol(v.name());
        if (t instanceof ConstraintTerm.Constant c) {
            if (config.enableTheoryReasoning() && c.isInteger()) return SmtTerms.intLiteral(Long.parseLong(c.value()));
            return SmtTerms.symbol(CONSTANT_PREFIX + c.value());
        }
        if (t instanceof ConstraintTerm.Function fn) {
            List<String> args = new ArrayList<>(fn.arguments().size());
            for (ConstraintTerm a : fn.arguments()) args.add(term(a));
            return SmtTerms.app(SmtTerms.symbol(fn.name()), args);
        }
        throw new UnsupportedFormulaException("unknown term " + t.getClass().getSimpleName());
    }

    /** Symbols used by a system, with arity checks. */
    private final class Signature {
        final Map<String, Integer> predicates = new TreeMap<>();
        final Map<String, Integer> functions = new TreeMap<>();
        final Set<String> freeVariables = new TreeSet<>();
        final Set<String> constants = new TreeSet<>();

        void collect(ConstraintFormula f, Deque<String> bound) {
            if (f instanceof ConstraintFormula.Atomic a) {
                if (a.isInterpreted()) {
                    if (!a.predicate().equals("=") && !config.enableTheoryReasoning()) {
                        throw new UnsupportedFormulaException("'" + a.predicate() + "' requires theory reasoning");
                    }
                } else {
                    arity(predicates, a.predicate(), a.terms().size(), "predicate");
                }
                for (ConstraintTerm t : a.terms()) collect(t, bound);
            } else if (f instanceof ConstraintFormula.Not n) {
                collect(n.operand(), bound);
            } else if (f instanceof ConstraintFormula.And a) {
                for (ConstraintFormula op : a.operands()) collect(op, bound);
            } else if (f instanceof ConstraintFormula.Or o) {
                for (ConstraintFormula op : o.operands()) collect(op, bound);
            } else if (f instanceof ConstraintFormula.Forall q) {
                bound.push(q.variable());
                collect(q.body(), bound);
                bound.pop();
            } else if (f instanceof ConstraintFormula.Exists q) {
                bound.push(q.variable());
                collect(q.body(), bound);
                bound.pop();
            }
        }

        void collect(ConstraintTerm t, Deque<String> bound) {
            if (t instanceof ConstraintTerm.Variable v) {
                if (!bound.contains(v.name())) freeVariables.add(v.name());
            } else if (t instanceof ConstraintTerm.Constant c) {
                if (!config.enableTheoryReasoning() || !c.isInteger()) constants.add(c.value());
            } else if (t instanceof ConstraintTerm.Function fn) {
                arity(functions, fn.name(), fn.arguments().size(), "function");
                for (ConstraintTerm a : fn.arguments()) collect(a, bound);
            }
        }

        void arity(Map<String, Integer> table, String name, int arity, String what) {
            Integer prev = table.putIfAbsent(name, arity);
            if (prev != null && prev != arity) {
                throw new UnsupportedFormulaException(what + " '" + name + "' used with arity " + prev + " and " + arity);
            }
        }

        void checkDisjoint() {
            for (String p : predicates.keySet()) {
                if (functions.containsKey(p) || freeVariables.contains(p)) {
                    throw new UnsupportedFormulaException("symbol '" + p + "' is used both as a predicate and a term");
                }
            }
            for (String fn : functions.keySet()) {
                if (freeVariables.contains(fn)) {
                    throw new UnsupportedFormulaException("symbol '" + fn + "' is used both as a function and a variable");
                }
            }
        }
    }
}
