/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.model;

import ai.evacortex.chronocheck.core.document.*;
import ai.evacortex.chronocheck.core.exceptions.FormulaParseException;
import ai.evacortex.chronocheck.core.exceptions.InvalidDocumentException;
import ai.evacortex.chronocheck.core.formula.FormulaParser;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;

import java.util.*;

/**
 * Derives a finite state space from a document by breadth-first exploration.
 *
 * <p>States are valuations of the declared {@link StateVariable}s, starting from their initial
 * values. Every function that declares a guard is a guarded update: in each state where the guard
 * holds it contributes a transition, labelled with the function name, to the valuation obtained
 * by applying its effects.</p>
 *
 * <p>Exploration stops once {@link ModelLimits#maxStates()} states exist; the space is then
 * marked truncated. A document without variables yields a single trivial state; a space in which
 * no function ever fires is marked trivial as well.</p>
 */
public class StateSpaceBuilder {

    private final ModelLimits limits;
    private final FormulaParser parser;

    public StateSpaceBuilder() {
        this(ModelLimits.defaults());
    }

    public StateSpaceBuilder(ModelLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.parser = new FormulaParser();
    }

    public StateSpace build(SpecDocument document) {
        Set<String> mentioned = mentionedAtoms(document);
        if (document.variables().isEmpty()) {
            StateSpace.Builder b = StateSpace.builder()
                    .addState(new SystemState(0, Map.of(), Set.of(), Set.of()))
                    .markInitial(0)
                    .trivial(true);
            mentioned.forEach(b::declareProposition);
            return b.build();
        }

        Map<String, StateVariable> variables = new LinkedHashMap<>();
        for (StateVariable v : document.variables()) {
            if (variables.put(v.name(), v) != null) {
                throw new InvalidDocumentException("variable '" + v.name() + "' is declared twice");
            }
        }
        List<GuardedUpdate> updates = compileUpdates(document, variables);

        StateSpace.Builder b = StateSpace.builder();
        for (StateVariable v : variables.values()) {
            for (String value : v.domain()) {
                String atom = v.atomFor(value);
                if (atom != null) b.declareProposition(atom);
            }
        }
        mentioned.forEach(b::declareProposition);

        Map<List<String>, Integer> index = new HashMap<>();
        List<List<String>> valuations = new ArrayList<>();
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        List<String> init = new ArrayList<>();
        for (StateVariable v : variables.values()) init.add(v.initial());
        index.put(init, 0);
        valuations.add(init);
        queue.add(0);

        List<List<Transition>> pending = new ArrayList<>();
        List<Set<String>> enabledAt = new ArrayList<>();
        boolean truncated = false;
        while (!queue.isEmpty()) {
            int id = queue.poll();
            List<String> current = valuations.get(id);
            List<Transition> out = new ArrayList<>();
            Set<String> enabled = new LinkedHashSet<>();
            for (GuardedUpdate u : updates) {
                if (!u.enabled(current, variables)) continue;
                enabled.add(u.name);
                List<String> next = u.apply(current);
                Integer target = index.get(next);
                if (target == null) {
                    if (valuations.size() >= limits.maxStates()) {
                        truncated = true;
                        continue;
                    }
                    target = valuations.size();
                    index.put(next, target);
                    valuations.add(next);
                    queue.add(target);
                }
                out.add(new Transition(id, target, u.guardText, u.name, null));
            }
            while (pending.size() <= id) {
                pending.add(null);
                enabledAt.add(null);
            }
            pending.set(id, out);
            enabledAt.set(id, enabled);
        }

        List<StateVariable> order = new ArrayList<>(variables.values());
        for (int id = 0; id < valuations.size(); id++) {
            List<String> values = valuations.get(id);
            Map<String, Value> valuation = new LinkedHashMap<>();
            Set<String> props = new LinkedHashSet<>();
            for (int k = 0; k < order.size(); k++) {
                StateVariable v = order.get(k);
                String value = values.get(k);
                valuation.put(v.name(), v.isBoolean() ? Value.of(Boolean.parseBoolean(value)) : Value.symbol(value));
                String atom = v.atomFor(value);
                if (atom != null) props.add(atom);
            }
            b.addState(new SystemState(id, valuation, enabledAt.get(id), props));
        }
        boolean fires = false;
        for (List<Transition> ts : pending) {
            for (Transition t : ts) b.addTransition(t);
            fires |= !ts.isEmpty();
        }
        return b.markInitial(0).truncated(truncated).trivial(!fires).build();
    }

    private List<GuardedUpdate> compileUpdates(SpecDocument document, Map<String, StateVariable> variables) {
        List<String> names = new ArrayList<>(variables.keySet());
        List<GuardedUpdate> updates = new ArrayList<>();
        for (FunctionDecl fn : document.functions()) {
            if (!fn.isTransition()) continue;
            TemporalFormula guard;
            try {
                guard = fn.guard().isParsed() ? fn.guard().formula() : parser.parse(fn.guard().text());
            } catch (FormulaParseException e) {
                throw new InvalidDocumentException("guard of function '" + fn.name() + "' is malformed", e);
            }
            if (!guard.isPropositional()) {
                throw new InvalidDocumentException("guard of function '" + fn.name() + "' must be propositional: " + guard);
            }
            String[] assignments = new String[names.size()];
            for (Map.Entry<String, String> effect : fn.effects().entrySet()) {
                StateVariable v = variables.get(effect.getKey());
                if (v == null) {
                    throw new InvalidDocumentException("function '" + fn.name() + "' assigns unknown variable '"
                            + effect.getKey() + "'");
                }
                if (!v.domain().contains(effect.getValue())) {
                    throw new InvalidDocumentException("function '" + fn.name() + "' assigns '" + effect.getValue()
                            + "' outside the domain of " + v.name());
                }
                assignments[names.indexOf(v.name())] = effect.getValue();
            }
            updates.add(new GuardedUpdate(fn.name(), guard, fn.guard().render(), assignments));
        }
        return updates;
    }

    private Set<String> mentionedAtoms(SpecDocument document) {
        Set<String> atoms = new TreeSet<>();
        List<Expression> expressions = new ArrayList<>();
        document.rules().forEach(r -> expressions.add(r.expression()));
        document.meta().forEach(m -> expressions.add(m.constraint()));
        document.properties().forEach(p -> expressions.add(p.formula()));
        for (Expression e : expressions) {
            if (e.isParsed()) {
                atoms.addAll(e.formula().atoms());
            } else if (parser.accepts(e.text())) {
                atoms.addAll(parser.parse(e.text()).atoms());
            }
        }
        atoms.remove("true");
        atoms.remove("false");
        return atoms;
    }

    private static final class GuardedUpdate {
        final String name;
        final TemporalFormula guard;
        final String guardText;
        final String[] assignments;

        GuardedUpdate(String name, TemporalFormula guard, String guardText, String[] assignments) {
            this.name = name;
            this.guard = guard;
            this.guardText = guardText;
            this.assignments = assignments;
        }

        boolean enabled(List<String> valuation, Map<String, StateVariable> variables) {
            return evaluate(guard, valuation, variables);
        }

        List<String> apply(List<String> valuation) {
            List<String> next = new ArrayList<>(valuation);
            for (int k = 0; k < assignments.length; k++) {
                if (assignments[k] != null) next.set(k, assignments[k]);
            }
            return next;
        }

        private boolean evaluate(TemporalFormula f, List<String> valuation, Map<String, StateVariable> variables) {
            return switch (f.kind()) {
                case ATOMIC -> holds(f.name(), valuation, variables);
                case NOT -> !evaluate(f.operand(), valuation, variables);
                case AND -> evaluate(f.left(), valuation, variables) && evaluate(f.right(), valuation, variables);
                case OR -> evaluate(f.left(), valuation, variables) || evaluate(f.right(), valuation, variables);
                case IMPLIES -> !evaluate(f.left(), valuation, variables) || evaluate(f.right(), valuation, variables);
                default -> throw new IllegalStateException("temporal operator in guard of " + name);
            };
        }

        private boolean holds(String atom, List<String> valuation, Map<String, StateVariable> variables) {
            if (atom.equals("true")) return true;
            if (atom.equals("false")) return false;
            int eq = atom.indexOf('=');
            String var = eq < 0 ? atom : atom.substring(0, eq);
            StateVariable v = variables.get(var);
            if (v == null) {
                throw new InvalidDocumentException("guard of function '" + name + "' references unknown variable '" + var + "'");
            }
            int k = new ArrayList<>(variables.keySet()).indexOf(var);
            String value = valuation.get(k);
            if (eq < 0) {
                if (!v.isBoolean()) {
                    throw new InvalidDocumentException("guard of function '" + name + "' uses enumeration '" + var
                            + "' as a boolean");
                }
                return "true".equals(value);
            }
            return value.equals(atom.substring(eq + 1));
        }
    }
}
