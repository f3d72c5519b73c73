package org.pragmatica.ddmm.lexer;

import java.util.Optional;

/**
 * Keyword/bracket table: each reserved keyword denotes exactly one bracket character.
 */
public enum Bracket {
    OPEN_PAREN("drake", '(', Family.PAREN, true),
    CLOSE_PAREN("maye", ')', Family.PAREN, false),
    OPEN_CURLY("Drake", '{', Family.CURLY_BRACE, true),
    CLOSE_CURLY("Maye", '}', Family.CURLY_BRACE, false),
    OPEN_SQUARE("DRAKE", '[', Family.SQUARE_BRACKET, true),
    CLOSE_SQUARE("MAYE", ']', Family.SQUARE_BRACKET, false);

    /**
     * Bracket family shared by an opener and its closer.
     */
    public enum Family {
        PAREN("paren"),
        CURLY_BRACE("curly brace"),
        SQUARE_BRACKET("square bracket");

        private final String display;

        Family(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    private static final Bracket[] VALUES = values();

    private final String keyword;
    private final char symbol;
    private final Family family;
    private final boolean opener;

    Bracket(String keyword, char symbol, Family family, boolean opener) {
        this.keyword = keyword;
        this.symbol = symbol;
        this.family = family;
        this.opener = opener;
    }

    public String keyword() {
        return keyword;
    }

    public char symbol() {
        return symbol;
    }

    public Family family() {
        return family;
    }

    public boolean isOpener() {
        return opener;
    }

    /**
     * The opener a closer must be matched against; an opener returns itself.
     */
    public Bracket expectedOpener() {
        return switch (this) {
            case CLOSE_PAREN -> OPEN_PAREN;
            case CLOSE_CURLY -> OPEN_CURLY;
            case CLOSE_SQUARE -> OPEN_SQUARE;
            default -> this;
        };
    }

    /**
     * "'drake' (paren)" - the form used in diagnostics.
     */
    public String describe() {
        return "'" + keyword + "' (" + family.display() + ")";
    }

    public static Optional<Bracket> ofSymbol(char c) {
        for (var bracket : VALUES) {
            if (bracket.symbol == c) {
                return Optional.of(bracket);
            }
        }
        return Optional.empty();
    }

    static Bracket[] all() {
        return VALUES;
    }
}
