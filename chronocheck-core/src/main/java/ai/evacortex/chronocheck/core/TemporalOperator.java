/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core;

/**
 * Temporal operators recognised in rule, function, meta and evidence expressions.
 *
 * <p>The constant doubles as a classification tag and as the display symbol used in
 * canonical formula text.</p>
 */
public enum TemporalOperator {
    ALWAYS('□', false),
    EVENTUALLY('◊', false),
    NEXT('X', false),
    UNTIL('U', true),
    RELEASE('R', true),
    WEAK_UNTIL('W', true),
    STRONG_RELEASE('M', true);

    private final char symbol;
    private final boolean binary;

    TemporalOperator(char symbol, boolean binary) {
        this.symbol = symbol;
        this.binary = binary;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isBinary() {
        return binary;
    }

    /**
     * Resolves a symbol (including the ASCII aliases {@code G} and {@code F} and the
     * alternative glyphs {@code ◇}, {@code ○}) to its operator.
     *
     * @return the operator, or {@code null} if the character is not an operator symbol
     */
    public static TemporalOperator fromSymbol(char c) {
        return switch (c) {
            case '□', 'G' -> ALWAYS;
            case '◊', '◇', 'F' -> EVENTUALLY;
            case 'X', '○' -> NEXT;
            case 'U' -> UNTIL;
            case 'R' -> RELEASE;
            case 'W' -> WEAK_UNTIL;
            case 'M' -> STRONG_RELEASE;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
