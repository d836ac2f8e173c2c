/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.document;

/**
 * Location of a document element: 1-based line and column plus the character length
 * of the element's text. {@link #UNKNOWN} marks synthesized elements.
 */
public record SourceSpan(int line, int column, int length) {

    public static final SourceSpan UNKNOWN = new SourceSpan(0, 0, 0);

    public SourceSpan {
        if (line < 0 || column < 0 || length < 0) {
            throw new IllegalArgumentException("Span coordinates must be non-negative");
        }
    }

    public static SourceSpan at(int line, int column) {
        return new SourceSpan(line, column, 0);
    }

    /** Span of a sub-range that starts {@code offset} characters into this span, on the same line. */
    public SourceSpan narrow(int offset, int length) {
        if (this == UNKNOWN || line == 0) return new SourceSpan(0, 0, Math.max(0, length));
        return new SourceSpan(line, column + Math.max(0, offset), Math.max(0, length));
    }

    @Override
    public String toString() {
        return line == 0 ? "<unknown>" : line + ":" + column;
    }
}
