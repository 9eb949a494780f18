package org.pragmatica.spacing.core;

/**
 * Mapped position of a token in its source file.
 *
 * @param line   0-based line number
 * @param column 0-based column of the token's first character
 */
public record SourceLocation(int line, int column) {

    private static final SourceLocation UNKNOWN = new SourceLocation(-1, -1);

    public static SourceLocation sourceLocation(int line, int column) {
        return new SourceLocation(line, column);
    }

    /**
     * Location used when the token source could not provide one.
     */
    public static SourceLocation unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return line >= 0 && column >= 0;
    }

    public boolean isLineStart() {
        return isKnown() && column == 0;
    }

    @Override
    public String toString() {
        return isKnown()
               ? (line + 1) + ":" + (column + 1)
               : "<unknown>";
    }
}
