package org.pragmatica.ddmm.rewrite;

import org.pragmatica.ddmm.lexer.Bracket;
import org.pragmatica.ddmm.lexer.ContextScanner;
import org.pragmatica.ddmm.lexer.Segment;
import org.pragmatica.ddmm.lexer.TokenMatcher;

import java.util.Objects;

/**
 * Substitutes recognized tokens and copies every other segment verbatim.
 *
 * <p>Only spaces are ever inserted, never newlines, so output lines correspond 1:1 to input lines.
 */
public abstract sealed class Rewriter permits ForwardRewriter, ReverseRewriter {
    private final TokenMatcher matcher;

    Rewriter(TokenMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * Keywords to brackets.
     */
    public static Rewriter forward() {
        return ForwardRewriter.INSTANCE;
    }

    /**
     * Brackets to keywords.
     */
    public static Rewriter reverse() {
        return ReverseRewriter.INSTANCE;
    }

    public final String rewrite(String source) {
        Objects.requireNonNull(source, "source");
        var output = new StringBuilder(source.length() + 16);
        ContextScanner.scan(source, matcher)
                      .forEach(segment -> {
                          if (segment instanceof Segment.Token token) {
                              emit(output, source, token);
                          }else {
                              output.append(segment.text());
                          }
                      });
        return output.toString();
    }

    private void emit(StringBuilder output, String source, Segment.Token token) {
        if (output.length() > 0 && needsSpaceBefore(Character.codePointBefore(output, output.length()))) {
            output.append(' ');
        }
        output.append(replacement(token.bracket()));
        int following = token.span()
                             .end()
                             .offset();
        if (following < source.length() && needsSpaceAfter(source.codePointAt(following))) {
            output.append(' ');
        }
    }

    protected abstract String replacement(Bracket bracket);

    /**
     * @param previous last code point already written to the output
     */
    protected abstract boolean needsSpaceBefore(int previous);

    /**
     * @param following input code point right after the token
     */
    protected abstract boolean needsSpaceAfter(int following);
}
