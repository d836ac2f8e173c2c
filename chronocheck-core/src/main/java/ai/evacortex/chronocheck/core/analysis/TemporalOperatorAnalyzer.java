/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.analysis;

import ai.evacortex.chronocheck.core.TemporalOperator;
import ai.evacortex.chronocheck.core.document.*;
import ai.evacortex.chronocheck.core.exceptions.FormulaParseException;
import ai.evacortex.chronocheck.core.formula.FormulaKind;
import ai.evacortex.chronocheck.core.formula.FormulaParser;
import ai.evacortex.chronocheck.core.formula.PathQuantifierType;
import ai.evacortex.chronocheck.core.formula.TemporalFormula;

import java.util.*;

/**
 * Locates temporal operators in every rule, function body, meta constraint and evidence field.
 *
 * <p>Parsed expressions (and raw text the {@link FormulaParser} accepts) are walked as trees:
 * operands are exact subformulas and the nesting level counts enclosing temporal operators.
 * Text that does not parse falls back to a lexical scan with grouping-delimiter nesting and a
 * fixed operand window; such expressions get a warning.</p>
 *
 * <p>The analyzer keeps no state between calls.</p>
 */
public class TemporalOperatorAnalyzer {

    public static final double MAX_VALID_COMPLEXITY = 0.8;
    public static final int MAX_NESTING = 5;
    public static final int MAX_OPERATORS_PER_FUNCTION = 3;
    static final int OPERAND_WINDOW = 10;

    private final FormulaParser parser;

    public TemporalOperatorAnalyzer() {
        this(new FormulaParser());
    }

    public TemporalOperatorAnalyzer(FormulaParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public OperatorValidationResult analyze(SpecDocument document) {
        Collector c = new Collector();
        for (RuleDecl rule : document.rules()) {
            scan(rule.expression(), OperatorContext.rule(rule.name()), c);
        }
        for (FunctionDecl fn : document.functions()) {
            int before = c.operators.size();
            if (fn.body() != null) scan(fn.body(), OperatorContext.function(fn.name()), c);
            int found = c.operators.size() - before;
            if (found > MAX_OPERATORS_PER_FUNCTION) {
                SourceSpan at = fn.body() != null ? fn.body().span() : SourceSpan.UNKNOWN;
                c.warnings.add(AnalysisIssue.warning("Function '" + fn.name() + "' contains " + found
                        + " temporal operators - consider splitting it", at));
            }
        }
        for (MetaEntry entry : document.meta()) {
            scan(entry.constraint(), OperatorContext.metaConstraint(entry.key()), c);
        }
        for (EvidenceBlock block : document.evidence()) {
            scan(block.expression(), OperatorContext.evidence(block.field()), c);
        }
        return c.finish();
    }

    /** Analyzes a single expression as if it were the only element of a document. */
    public OperatorValidationResult analyzeText(String text, OperatorContext context, SourceSpan span) {
        Collector c = new Collector();
        scan(Expression.raw(text, span), context, c);
        return c.finish();
    }

    private void scan(Expression expression, OperatorContext context, Collector c) {
        if (expression.isParsed()) {
            walk(expression.formula(), 0, context, expression.span(), Map.of(), c);
            return;
        }
        String text = expression.text();
        FormulaParser.Parsed parsed;
        try {
            parsed = parser.parseWithOffsets(text);
        } catch (FormulaParseException e) {
            c.warnings.add(AnalysisIssue.warning(context.describe() + " is not a well-formed formula ("
                    + e.getMessage() + "); operators located by lexical scan", expression.span()));
            lexicalScan(text, context, expression.span(), c);
            return;
        }
        walk(parsed.formula(), 0, context, expression.span(), parsed.offsets(), c);
    }

    private static void walk(TemporalFormula node, int depth, OperatorContext context, SourceSpan span,
                             Map<TemporalFormula, Integer> offsets, Collector c) {
        FormulaKind kind = node.kind();
        int inner = kind.isTemporal() ? depth + 1 : depth;
        if (kind.arity() == 2) {
            walk(node.left(), inner, context, span, offsets, c);
            record(node, depth, context, span, offsets, c);
            walk(node.right(), inner, context, span, offsets, c);
        } else if (kind.arity() == 1) {
            record(node, depth, context, span, offsets, c);
            walk(node.operand(), inner, context, span, offsets, c);
        }
    }

    private static void record(TemporalFormula node, int depth, OperatorContext context, SourceSpan span,
                               Map<TemporalFormula, Integer> offsets, Collector c) {
        FormulaKind kind = node.kind();
        if (!kind.isTemporal()) return;
        Integer offset = offsets.get(node);
        SourceSpan at = offset == null ? span : span.narrow(offset, kind.symbol().length());
        List<String> operands = new ArrayList<>(node.operands().size());
        for (TemporalFormula op : node.operands()) operands.add(op.toString());
        c.operators.add(new OperatorInstance(kind.operator(), at, context, operands, depth));
        if (kind.isPathQuantified()) {
            c.quantifiers.add(new PathQuantifier(kind.quantifier(), kind.operator(), node.toString(), context, at));
        }
    }

    void lexicalScan(String text, OperatorContext context, SourceSpan span, Collector c) {
        int nesting = 0;
        int n = text.length();
        for (int i = 0; i < n; i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '(', '[', '{' -> {
                    nesting++;
                    continue;
                }
                case ')', ']', '}' -> {
                    nesting = Math.max(0, nesting - 1);
                    continue;
                }
                default -> {
                }
            }
            TemporalOperator op = null;
            PathQuantifierType quantifier = PathQuantifierType.NONE;
            int symbolLength = 1;
            if (ch == '□' || ch == '◊' || ch == '◇' || ch == '○') {
                op = TemporalOperator.fromSymbol(ch);
            } else if (isWordStart(text, i)) {
                int end = i;
                while (end < n && isWordChar(text.charAt(end))) end++;
                String word = text.substring(i, end);
                if (word.length() == 1 && "XURWMGF".indexOf(word.charAt(0)) >= 0) {
                    op = TemporalOperator.fromSymbol(word.charAt(0));
                } else if (word.length() == 2 && "AE".indexOf(word.charAt(0)) >= 0 && "GFX".indexOf(word.charAt(1)) >= 0) {
                    op = TemporalOperator.fromSymbol(word.charAt(1));
                    quantifier = word.charAt(0) == 'A' ? PathQuantifierType.ALL_PATHS : PathQuantifierType.EXISTS_PATH;
                    symbolLength = 2;
                } else if (word.length() == 1 && "AE".indexOf(word.charAt(0)) >= 0) {
                    int j = end;
                    while (j < n && text.charAt(j) == ' ') j++;
                    if (j < n && (text.charAt(j) == '□' || text.charAt(j) == '◊' || text.charAt(j) == '[')) {
                        SourceSpan at = span.narrow(i, 1);
                        PathQuantifierType type = word.charAt(0) == 'A' ? PathQuantifierType.ALL_PATHS : PathQuantifierType.EXISTS_PATH;
                        TemporalOperator quantified = text.charAt(j) == '[' ? TemporalOperator.UNTIL
                                : TemporalOperator.fromSymbol(text.charAt(j));
                        c.quantifiers.add(new PathQuantifier(type, quantified, window(text, i, n), context, at));
                    }
                }
                if (op == null) {
                    i = end - 1;
                    continue;
                }
            }
            if (op == null) continue;
            SourceSpan at = span.narrow(i, symbolLength);
            List<String> operands = extractOperands(text, i, i + symbolLength - 1, op.isBinary());
            c.operators.add(new OperatorInstance(op, at, context, operands, nesting));
            if (quantifier != PathQuantifierType.NONE) {
                c.quantifiers.add(new PathQuantifier(quantifier, op, window(text, i, n), context, at));
            }
            i += symbolLength - 1;
        }
    }

    private static List<String> extractOperands(String text, int start, int last, boolean binary) {
        List<String> operands = new ArrayList<>(2);
        if (binary) {
            String left = text.substring(Math.max(0, start - OPERAND_WINDOW), start).trim();
            if (!left.isEmpty()) operands.add(left);
        }
        int from = last + 1;
        String right = text.substring(Math.min(from, text.length()), Math.min(text.length(), from + OPERAND_WINDOW)).trim();
        if (!right.isEmpty()) operands.add(right);
        return operands;
    }

    private static String window(String text, int start, int n) {
        return text.substring(start, Math.min(n, start + OPERAND_WINDOW + 2)).trim();
    }

    private static boolean isWordStart(String text, int i) {
        return isWordChar(text.charAt(i)) && (i == 0 || !isWordChar(text.charAt(i - 1)));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    static final class Collector {
        final List<OperatorInstance> operators = new ArrayList<>();
        final List<PathQuantifier> quantifiers = new ArrayList<>();
        final List<AnalysisIssue> errors = new ArrayList<>();
        final List<AnalysisIssue> warnings = new ArrayList<>();

        OperatorValidationResult finish() {
            OperatorComplexity complexity = OperatorComplexity.of(operators);

            long deep = operators.stream().filter(op -> op.nestingLevel() > MAX_NESTING).count();
            if (deep > 0) {
                warnings.add(AnalysisIssue.warning(deep + " operator(s) with nesting level above "
                        + MAX_NESTING + " - consider simplifying", SourceSpan.UNKNOWN));
            }
            for (OperatorInstance op : operators) {
                if (op.operator().isBinary() && op.operands().size() < 2) {
                    errors.add(AnalysisIssue.error("Binary operator " + op.operator() + " in "
                            + op.context().describe() + " requires two operands, found "
                            + op.operands().size(), op.span()));
                }
            }
            int always = complexity.count(TemporalOperator.ALWAYS);
            int eventually = complexity.count(TemporalOperator.EVENTUALLY);
            if (always > 0 && eventually > 2 * always) {
                warnings.add(AnalysisIssue.warning("Many 'eventually' operators (" + eventually + ") with few 'always' ("
                        + always + ") - check for a safety/liveness imbalance", SourceSpan.UNKNOWN));
            }
            boolean valid = errors.isEmpty() && complexity.score() <= MAX_VALID_COMPLEXITY;
            return new OperatorValidationResult(operators, quantifiers, complexity, errors, warnings, valid);
        }
    }
}
