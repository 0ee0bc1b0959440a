package org.pragmatica.regex.grammar;

/**
 * Terminal classes of the regular expression grammar. Each class matches exactly
 * one input character.
 */
public enum TokenKind {
    /**
     * Stands for the empty production. The character is configurable; {@code #} by default.
     */
    EMPTY_MARKER('#'),
    /**
     * ASCII letter, digit or underscore.
     */
    SYMBOL('\0'),
    LEFT_PAREN('('),
    RIGHT_PAREN(')'),
    STAR('*'),
    PLUS('+');

    public static final char DEFAULT_EMPTY_MARKER = '#';

    private final char literal;

    TokenKind(char literal) {
        this.literal = literal;
    }

    /**
     * Test a single character against this class.
     */
    public boolean matches(char c, char emptyMarker) {
        return switch (this) {
            case EMPTY_MARKER -> c == emptyMarker;
            case SYMBOL -> isSymbol(c);
            default -> c == literal;
        };
    }

    /**
     * Human-readable description used in diagnostics.
     */
    public String expected(char emptyMarker) {
        return switch (this) {
            case EMPTY_MARKER -> "'" + emptyMarker + "'";
            case SYMBOL -> "symbol";
            default -> "'" + literal + "'";
        };
    }

    /**
     * The fixed character of an operator or parenthesis class.
     *
     * @throws IllegalStateException for {@link #SYMBOL}, which has no single character
     */
    public char literal() {
        if (this == SYMBOL) {
            throw new IllegalStateException("symbol class has no single literal");
        }
        return literal;
    }

    public static boolean isSymbol(char c) {
        return c == '_'
               || (c >= '0' && c <= '9')
               || (c >= 'A' && c <= 'Z')
               || (c >= 'a' && c <= 'z');
    }

    /**
     * Whether any terminal class accepts {@code c}.
     */
    public static boolean isTokenChar(char c, char emptyMarker) {
        for (var kind : values()) {
            if (kind.matches(c, emptyMarker)) {
                return true;
            }
        }
        return false;
    }
}
