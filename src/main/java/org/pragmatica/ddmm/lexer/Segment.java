package org.pragmatica.ddmm.lexer;

import org.pragmatica.ddmm.text.SourceSpan;

/**
 * Classified run of source text produced by {@link ContextScanner}.
 * Concatenating the {@code text()} of all segments reproduces the input exactly.
 */
public sealed interface Segment {
    SourceSpan span();

    String text();

    // Plain characters in Code or Interpolation context
    record Code(SourceSpan span, String text) implements Segment {}

    // From '#' up to and including the newline
    record Comment(SourceSpan span, String text) implements Segment {}

    // Delimiters, prefix and content of a quoted literal
    record StringLiteral(SourceSpan span, String text) implements Segment {}

    // '{' entering or '}' leaving an interpolation expression
    record InterpolationBoundary(SourceSpan span, String text) implements Segment {}

    /**
     * Recognized keyword or bracket in an active context.
     */
    record Token(SourceSpan span, String text, Bracket bracket) implements Segment {}
}
