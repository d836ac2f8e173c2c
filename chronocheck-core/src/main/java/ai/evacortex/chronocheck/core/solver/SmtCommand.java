/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.solver;

import java.util.List;
import java.util.StringJoiner;

/** One SMT-LIB 2 command. Terms are carried as already-rendered s-expressions. */
public interface SmtCommand {

    String render();

    record SetOption(String name, String value) implements SmtCommand {
        @Override
        public String render() {
            return "(set-option :" + name + " " + value + ")";
        }
    }

    record DeclareSort(String name, int arity) implements SmtCommand {
        @Override
        public String render() {
            return "(declare-sort " + SmtTerms.symbol(name) + " " + arity + ")";
        }
    }

    record DeclareFun(String name, List<SmtSort> arguments, SmtSort result) implements SmtCommand {
        public DeclareFun {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String render() {
            StringJoiner args = new StringJoiner(" ", "(", ")");
            arguments.forEach(s -> args.add(s.name()));
            return "(declare-fun " + SmtTerms.symbol(name) + " " + args + " " + result.name() + ")";
        }
    }

    /** Assertion; {@code name} is the constraint id reported in unsat cores, or {@code null}. */
    record Assert(String term, String name) implements SmtCommand {
        @Override
        public String render() {
            return name == null
                    ? "(assert " + term + ")"
                    : "(assert (! " + term + " :named " + SmtTerms.symbol(name) + "))";
        }
    }

    record CheckSat() implements SmtCommand {
        @Override
        public String render() {
            return "(check-sat)";
        }
    }

    record GetModel() implements SmtCommand {
        @Override
        public String render() {
            return "(get-model)";
        }
    }
}
