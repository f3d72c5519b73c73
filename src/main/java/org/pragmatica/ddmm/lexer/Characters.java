package org.pragmatica.ddmm.lexer;

/**
 * Character classes shared by the scanner and the rewriters.
 */
public final class Characters {
    private Characters() {}

    /**
     * Letter, digit or underscore. Takes a code point so letters outside the BMP count.
     */
    public static boolean isIdentifierChar(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }

    /**
     * Identifier character ending right before {@code index}.
     */
    public static boolean isIdentifierBefore(CharSequence text, int index) {
        return index > 0 && isIdentifierChar(Character.codePointBefore(text, index));
    }

    /**
     * Identifier character starting at {@code index}.
     */
    public static boolean isIdentifierAt(CharSequence text, int index) {
        return index < text.length() && isIdentifierChar(Character.codePointAt(text, index));
    }

    public static boolean isQuote(int c) {
        return c == '"' || c == '\'';
    }

    /**
     * String prefix letters: raw, bytes, interpolated (f) and unicode, in any case.
     */
    public static boolean isStringPrefix(char c) {
        return switch (c) {
            case 'f', 'F', 'r', 'R', 'b', 'B', 'u', 'U' -> true;
            default -> false;
        };
    }

    public static boolean isBracketSymbol(int c) {
        return c < Character.MIN_SUPPLEMENTARY_CODE_POINT && Bracket.ofSymbol((char) c)
                                                                    .isPresent();
    }
}
