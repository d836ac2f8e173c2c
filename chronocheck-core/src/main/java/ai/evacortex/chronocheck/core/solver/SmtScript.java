/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import java.util.*;

/**
 * Ordered SMT-LIB 2 command sequence.
 *
 * <p>{@link #render()} produces the full script. Backends that assert through an API rather
 * than a text channel use {@link #renderDeclarationsAndAssertions()} together with
 * {@link #assertionNames()}, which lists the tracking name of every assertion in order.</p>
 */
public final class SmtScript {

    private final List<SmtCommand> commands;

    private SmtScript(List<SmtCommand> commands) {
        this.commands = List.copyOf(commands);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<SmtCommand> commands() {
        return commands;
    }

    public String render() {
        StringJoiner sj = new StringJoiner("\n", "", "\n");
        commands.forEach(c -> sj.add(c.render()));
        return sj.toString();
    }

    /** Declarations and anonymous assertions only; options and queries are left out. */
    public String renderDeclarationsAndAssertions() {
        StringJoiner sj = new StringJoiner("\n", "", "\n");
        for (SmtCommand c : commands) {
            if (c instanceof SmtCommand.DeclareSort || c instanceof SmtCommand.DeclareFun) {
                sj.add(c.render());
            } else if (c instanceof SmtCommand.Assert a) {
                sj.add(new SmtCommand.Assert(a.term(), null).render());
            }
        }
        return sj.toString();
    }

    /** Name of each assertion in order; {@code null} entries for anonymous assertions. */
    public List<String> assertionNames() {
        List<String> names = new ArrayList<>();
        for (SmtCommand c : commands) {
            if (c instanceof SmtCommand.Assert a) names.add(a.name());
        }
        return Collections.unmodifiableList(names);
    }

    /** Term of the named assertion, or {@code null}. */
    public String assertion(String name) {
        for (SmtCommand c : commands) {
            if (c instanceof SmtCommand.Assert a && name.equals(a.name())) return a.term();
        }
        return null;
    }

    public Map<String, String> options() {
        Map<String, String> out = new LinkedHashMap<>();
        for (SmtCommand c : commands) {
            if (c instanceof SmtCommand.SetOption o) out.put(o.name(), o.value());
        }
        return out;
    }

    public int assertionCount() {
        return assertionNames().size();
    }

    @Override
    public String toString() {
        return render();
    }

    public static final class Builder {
        private final List<SmtCommand> commands = new ArrayList<>();
        private final Set<String> declared = new HashSet<>();
        private final Set<String> assertionIds = new HashSet<>();

        private Builder() {
        }

        public Builder setOption(String name, String value) {
            commands.add(new SmtCommand.SetOption(name, value));
            return this;
        }

        public Builder declareSort(String name) {
            if (declared.add(name)) commands.add(new SmtCommand.DeclareSort(name, 0));
            return this;
        }

        public Builder declareConst(String name, SmtSort sort) {
            return declareFun(name, List.of(), sort);
        }

        /** Declares a function once; a repeated declaration with the same name is ignored. */
        public Builder declareFun(String name, List<SmtSort> arguments, SmtSort result) {
            if (declared.add(name)) commands.add(new SmtCommand.DeclareFun(name, arguments, result));
            return this;
        }

        public Builder assertTerm(String term) {
            commands.add(new SmtCommand.Assert(term, null));
            return this;
        }

        public Builder assertNamed(String name, String term) {
            if (!assertionIds.add(name)) throw new IllegalArgumentException("Duplicate assertion name: " + name);
            commands.add(new SmtCommand.Assert(term, name));
            return this;
        }

        public SmtScript build() {
            List<SmtCommand> all = new ArrayList<>(commands);
            all.add(new SmtCommand.CheckSat());
            all.add(new SmtCommand.GetModel());
            return new SmtScript(all);
        }
    }
}
