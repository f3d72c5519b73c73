package org.pragmatica.ddmm.text;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * Span covering this span and a following span.
     */
    public SourceSpan extendTo(SourceSpan following) {
        return new SourceSpan(start, following.end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
