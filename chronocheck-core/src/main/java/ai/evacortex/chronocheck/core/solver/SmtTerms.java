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
import java.util.regex.Pattern;

/** Helpers for rendering SMT-LIB terms. */
public final class SmtTerms {

    private static final Pattern SIMPLE_SYMBOL = Pattern.compile("[A-Za-z~!$%^&*_+=<>.?/\\-][A-Za-z0-9~!@$%^&*_+=<>.?/\\-]*");

    private SmtTerms() {
    }

    /** Renders a symbol, quoting it with {@code |...|} unless it is a simple symbol. */
    public static String symbol(String name) {
        if (SIMPLE_SYMBOL.matcher(name).matches()) return name;
        if (name.indexOf('|') >= 0 || name.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Symbol cannot be quoted: " + name);
        }
        return "|" + name + "|";
    }

    public static String app(String op, String... args) {
        return app(op, List.of(args));
    }

    public static String app(String op, List<String> args) {
        if (args.isEmpty()) return op;
        StringJoiner sj = new StringJoiner(" ", "(" + op + " ", ")");
        args.forEach(sj::add);
        return sj.toString();
    }

    /** n-ary connective that degrades gracefully: {@code (and)} becomes {@code true}, a single argument stays bare. */
    public static String nary(String op, List<String> args, String empty) {
        if (args.isEmpty()) return empty;
        if (args.size() == 1) return args.get(0);
        return app(op, args);
    }

    public static String and(List<String> args) {
        return nary("and", args, "true");
    }

    public static String or(List<String> args) {
        return nary("or", args, "false");
    }

    public static String not(String t) {
        return "(not " + t + ")";
    }

    public static String iff(String a, String b) {
        return "(= " + a + " " + b + ")";
    }

    public static String implies(String a, String b) {
        return "(=> " + a + " " + b + ")";
    }

    public static String eq(String a, String b) {
        return "(= " + a + " " + b + ")";
    }

    public static String intLiteral(long v) {
        return v < 0 ? "(- " + (-v) + ")" : Long.toString(v);
    }
}
