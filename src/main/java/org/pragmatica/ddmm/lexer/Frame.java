package org.pragmatica.ddmm.lexer;

import java.util.Locale;

/**
 * Lexical context frames. The scanner keeps a stack of them; the bottom frame is always {@link Code}.
 */
public sealed interface Frame {
    /**
     * Whether keyword/bracket recognition applies in this frame.
     */
    default boolean isActive() {
        return false;
    }

    record Code() implements Frame {
        public static final Code INSTANCE = new Code();

        @Override
        public boolean isActive() {
            return true;
        }
    }

    // # up to end of line
    record Comment() implements Frame {
        public static final Comment INSTANCE = new Comment();
    }

    /**
     * Quoted literal.
     *
     * @param quote        opening quote character
     * @param triple       whether the delimiter is three quote characters
     * @param raw          backslashes are inert
     * @param interpolated braces introduce expressions
     * @param bytes        bytes literal; scanned like a plain literal
     */
    record StringLiteral(char quote, boolean triple, boolean raw, boolean interpolated, boolean bytes) implements Frame {
        public static StringLiteral open(String prefix, char quote, boolean triple) {
            var flags = prefix.toLowerCase(Locale.ROOT);
            return new StringLiteral(quote,
                                     triple,
                                     flags.indexOf('r') >= 0,
                                     flags.indexOf('f') >= 0,
                                     flags.indexOf('b') >= 0);
        }

        public String delimiter() {
            return triple
                   ? String.valueOf(quote)
                           .repeat(3)
                   : String.valueOf(quote);
        }
    }

    /**
     * Expression inside an interpolated literal, closed when the brace depth returns to zero.
     */
    record Interpolation(int braceDepth) implements Frame {
        public static final Interpolation ENTERED = new Interpolation(1);

        @Override
        public boolean isActive() {
            return true;
        }

        public Interpolation deeper() {
            return new Interpolation(braceDepth + 1);
        }

        public Interpolation shallower() {
            return new Interpolation(braceDepth - 1);
        }

        public boolean isClosed() {
            return braceDepth == 0;
        }
    }
}
