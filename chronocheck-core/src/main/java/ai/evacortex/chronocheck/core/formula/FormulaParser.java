/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.formula;

import ai.evacortex.chronocheck.core.exceptions.FormulaParseException;

import java.util.*;

/**
 * Recursive-descent parser for the textual CTL/LTL syntax.
 *
 * <p>Precedence from lowest to highest: implication (right-assoc), disjunction, conjunction,
 * binary temporal operators {@code U R W M} (right-assoc), unary prefixes. Both the Unicode
 * glyphs and their ASCII spellings are accepted; {@link TemporalFormula#toString()} output
 * always parses back to an equal tree.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public final class FormulaParser {

    private static final Set<String> KEYWORDS = Set.of(
            "G", "F", "X", "U", "R", "W", "M", "A", "E",
            "AG", "AF", "AX", "EG", "EF", "EX");

    /**
     * Parse result carrying the character offset at which each temporal or boolean node's
     * operator symbol starts. Offsets are keyed by node identity.
     */
    public record Parsed(TemporalFormula formula, Map<TemporalFormula, Integer> offsets) {
        public int offsetOf(TemporalFormula node) {
            Integer off = offsets.get(node);
            return off == null ? -1 : off;
        }
    }

    public TemporalFormula parse(String text) {
        return parseWithOffsets(text).formula();
    }

    public Parsed parseWithOffsets(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Cursor cursor = new Cursor(tokenize(text));
        if (cursor.peek().type == TokenType.EOF) {
            throw new FormulaParseException("empty formula", 0);
        }
        TemporalFormula f = cursor.parseImplication();
        Token rest = cursor.peek();
        if (rest.type != TokenType.EOF) {
            throw new FormulaParseException("unexpected '" + rest.text + "'", rest.offset);
        }
        return new Parsed(f, Collections.unmodifiableMap(cursor.offsets));
    }

    /** Returns {@code true} if the text is a well-formed formula. */
    public boolean accepts(String text) {
        try {
            parse(text);
            return true;
        } catch (FormulaParseException e) {
            return false;
        }
    }

    private enum TokenType {
        LPAREN, RPAREN, LBRACKET, RBRACKET,
        NOT, AND, OR, IMPLIES,
        ALWAYS, EVENTUALLY, NEXT,
        UNTIL, RELEASE, WEAK_UNTIL, STRONG_RELEASE,
        CTL, QUANTIFIER, IDENT, EOF
    }

    private record Token(TokenType type, String text, int offset) {
    }

    private static List<Token> tokenize(String s) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            switch (c) {
                case '(' -> { out.add(new Token(TokenType.LPAREN, "(", start)); i++; }
                case ')' -> { out.add(new Token(TokenType.RPAREN, ")", start)); i++; }
                case '[' -> { out.add(new Token(TokenType.LBRACKET, "[", start)); i++; }
                case ']' -> { out.add(new Token(TokenType.RBRACKET, "]", start)); i++; }
                case '¬', '!', '~' -> { out.add(new Token(TokenType.NOT, "¬", start)); i++; }
                case '∧' -> { out.add(new Token(TokenType.AND, "∧", start)); i++; }
                case '∨' -> { out.add(new Token(TokenType.OR, "∨", start)); i++; }
                case '→', '⇒' -> { out.add(new Token(TokenType.IMPLIES, "→", start)); i++; }
                case '□' -> { out.add(new Token(TokenType.ALWAYS, "□", start)); i++; }
                case '◊', '◇' -> { out.add(new Token(TokenType.EVENTUALLY, "◊", start)); i++; }
                case '○' -> { out.add(new Token(TokenType.NEXT, "X", start)); i++; }
                case '&' -> {
                    i += (i + 1 < n && s.charAt(i + 1) == '&') ? 2 : 1;
                    out.add(new Token(TokenType.AND, "∧", start));
                }
                case '|' -> {
                    i += (i + 1 < n && s.charAt(i + 1) == '|') ? 2 : 1;
                    out.add(new Token(TokenType.OR, "∨", start));
                }
                case '-' -> {
                    if (i + 1 < n && s.charAt(i + 1) == '>') {
                        out.add(new Token(TokenType.IMPLIES, "→", start));
                        i += 2;
                    } else {
                        throw new FormulaParseException("unexpected '-'", start);
                    }
                }
                default -> {
                    if (!isIdentStart(c)) {
                        throw new FormulaParseException("unexpected character '" + c + "'", start);
                    }
                    while (i < n && isIdentPart(s.charAt(i))) i++;
                    String word = s.substring(start, i);
                    boolean valued = i < n && s.charAt(i) == '=' && i + 1 < n && isIdentPart(s.charAt(i + 1));
                    if (!valued && KEYWORDS.contains(word)) {
                        out.add(keyword(word, start));
                        continue;
                    }
                    if (valued) {
                        i++;
                        while (i < n && isIdentPart(s.charAt(i))) i++;
                        word = s.substring(start, i);
                    }
                    out.add(new Token(TokenType.IDENT, word, start));
                }
            }
        }
        out.add(new Token(TokenType.EOF, "<end>", n));
        return out;
    }

    private static Token keyword(String word, int offset) {
        TokenType type = switch (word) {
            case "G" -> TokenType.ALWAYS;
            case "F" -> TokenType.EVENTUALLY;
            case "X" -> TokenType.NEXT;
            case "U" -> TokenType.UNTIL;
            case "R" -> TokenType.RELEASE;
            case "W" -> TokenType.WEAK_UNTIL;
            case "M" -> TokenType.STRONG_RELEASE;
            case "A", "E" -> TokenType.QUANTIFIER;
            default -> TokenType.CTL;
        };
        return new Token(type, word, offset);
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || (c >= '0' && c <= '9');
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private final Map<TemporalFormula, Integer> offsets = new IdentityHashMap<>();
        private int pos;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(pos);
        }

        Token advance() {
            return tokens.get(pos++);
        }

        void expect(TokenType type, String what) {
            Token t = advance();
            if (t.type != type) {
                throw new FormulaParseException("expected " + what + " but found '" + t.text + "'", t.offset);
            }
        }

        TemporalFormula mark(TemporalFormula f, Token at) {
            offsets.put(f, at.offset);
            return f;
        }

        TemporalFormula parseImplication() {
            TemporalFormula left = parseDisjunction();
            if (peek().type == TokenType.IMPLIES) {
                Token op = advance();
                TemporalFormula right = parseImplication();
                return mark(TemporalFormula.implies(left, right), op);
            }
            return left;
        }

        TemporalFormula parseDisjunction() {
            TemporalFormula left = parseConjunction();
            while (peek().type == TokenType.OR) {
                Token op = advance();
                left = mark(TemporalFormula.or(left, parseConjunction()), op);
            }
            return left;
        }

        TemporalFormula parseConjunction() {
            TemporalFormula left = parseBinaryTemporal();
            while (peek().type == TokenType.AND) {
                Token op = advance();
                left = mark(TemporalFormula.and(left, parseBinaryTemporal()), op);
            }
            return left;
        }

        TemporalFormula parseBinaryTemporal() {
            TemporalFormula left = parseUnary();
            FormulaKind kind = switch (peek().type) {
                case UNTIL -> FormulaKind.UNTIL;
                case RELEASE -> FormulaKind.RELEASE;
                case WEAK_UNTIL -> FormulaKind.WEAK_UNTIL;
                case STRONG_RELEASE -> FormulaKind.STRONG_RELEASE;
                default -> null;
            };
            if (kind == null) return left;
            Token op = advance();
            TemporalFormula right = parseBinaryTemporal();
            return mark(TemporalFormula.binary(kind, left, right), op);
        }

        TemporalFormula parseUnary() {
            Token t = peek();
            switch (t.type) {
                case NOT -> {
                    advance();
                    return mark(TemporalFormula.not(parseUnary()), t);
                }
                case ALWAYS -> {
                    advance();
                    return mark(TemporalFormula.always(parseUnary()), t);
                }
                case EVENTUALLY -> {
                    advance();
                    return mark(TemporalFormula.eventually(parseUnary()), t);
                }
                case NEXT -> {
                    advance();
                    return mark(TemporalFormula.next(parseUnary()), t);
                }
                case CTL -> {
                    advance();
                    return mark(TemporalFormula.unary(ctlKind(t.text, t.offset), parseUnary()), t);
                }
                case QUANTIFIER -> {
                    return parseQuantified();
                }
                case LPAREN -> {
                    advance();
                    TemporalFormula inner = parseImplication();
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                }
                case IDENT -> {
                    advance();
                    return TemporalFormula.atomic(t.text);
                }
                default -> throw new FormulaParseException("unexpected '" + t.text + "'", t.offset);
            }
        }

        private TemporalFormula parseQuantified() {
            Token q = advance();
            boolean all = q.text.equals("A");
            Token next = peek();
            switch (next.type) {
                case ALWAYS, EVENTUALLY, NEXT -> {
                    advance();
                    String op = switch (next.type) {
                        case ALWAYS -> "G";
                        case EVENTUALLY -> "F";
                        default -> "X";
                    };
                    FormulaKind kind = ctlKind(q.text + op, q.offset);
                    return mark(TemporalFormula.unary(kind, parseUnary()), q);
                }
                case LBRACKET -> {
                    advance();
                    TemporalFormula inner = parseImplication();
                    expect(TokenType.RBRACKET, "']'");
                    if (inner.kind() != FormulaKind.UNTIL) {
                        throw new FormulaParseException("expected 'φ U ψ' inside " + q.text + "[...]", next.offset);
                    }
                    FormulaKind kind = all ? FormulaKind.FORALL_UNTIL : FormulaKind.EXISTS_UNTIL;
                    return mark(TemporalFormula.binary(kind, inner.left(), inner.right()), q);
                }
                default -> throw new FormulaParseException(
                        "path quantifier '" + q.text + "' must precede a temporal operator", q.offset);
            }
        }

        private static FormulaKind ctlKind(String word, int offset) {
            return switch (word) {
                case "AG" -> FormulaKind.FORALL_ALWAYS;
                case "AF" -> FormulaKind.FORALL_EVENTUALLY;
                case "AX" -> FormulaKind.FORALL_NEXT;
                case "EG" -> FormulaKind.EXISTS_ALWAYS;
                case "EF" -> FormulaKind.EXISTS_EVENTUALLY;
                case "EX" -> FormulaKind.EXISTS_NEXT;
                default -> throw new FormulaParseException("unknown path operator '" + word + "'", offset);
            };
        }
    }
}
