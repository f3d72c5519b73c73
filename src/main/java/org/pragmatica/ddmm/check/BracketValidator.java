package org.pragmatica.ddmm.check;

import org.pragmatica.ddmm.lexer.Bracket;
import org.pragmatica.ddmm.lexer.ContextScanner;
import org.pragmatica.ddmm.lexer.Segment;
import org.pragmatica.ddmm.lexer.TokenMatcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Checks keyword bracket nesting using the same contextual scanning as the rewriters.
 * Keywords inside strings and comments are ignored; keywords inside interpolation expressions count.
 *
 * <p>Never throws for malformed input; every problem is returned as a {@link Diagnostic}.
 */
public final class BracketValidator {
    private final String displayName;
    private final Deque<OpenBracket> open = new ArrayDeque<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private BracketValidator(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Validate {@code source}.
     *
     * @return diagnostics in source order followed by unclosed openers, outermost first; empty when balanced
     */
    public static List<Diagnostic> check(String source, String displayName) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(displayName, "displayName");
        var validator = new BracketValidator(displayName);
        ContextScanner.scan(source, TokenMatcher.KEYWORDS)
                      .filter(Segment.Token.class::isInstance)
                      .map(Segment.Token.class::cast)
                      .forEach(validator::accept);
        return validator.finish();
    }

    private void accept(Segment.Token token) {
        var bracket = token.bracket();
        int line = token.span()
                        .start()
                        .line();
        if (bracket.isOpener()) {
            open.addLast(new OpenBracket(bracket, line));
            return;
        }
        var innermost = open.pollLast();
        if (innermost == null) {
            diagnostics.add(Diagnostic.unexpectedCloser(bracket, displayName, line));
        }else if (innermost.bracket() != bracket.expectedOpener()) {
            diagnostics.add(Diagnostic.mismatched(innermost.bracket(), innermost.line(), bracket, displayName, line));
        }
    }

    private List<Diagnostic> finish() {
        for (var unclosed : open) {
            diagnostics.add(Diagnostic.unclosed(unclosed.bracket(), displayName, unclosed.line()));
        }
        return List.copyOf(diagnostics);
    }

    private record OpenBracket(Bracket bracket, int line) {}
}
