package org.pragmatica.ddmm.lexer;

import org.pragmatica.ddmm.text.SourceLocation;
import org.pragmatica.ddmm.text.SourceSpan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lexical context tracker.
 *
 * <p>Walks the input left to right keeping a stack of {@link Frame}s and yields the input as a sequence of
 * {@link Segment}s. Substitution tokens are recognized by the supplied {@link TokenMatcher}, and only while
 * the innermost frame is Code or an interpolation expression. Comment and string content is passed through
 * unexamined apart from delimiter, escape and interpolation-entry detection.
 *
 * <p>Scanning never fails: an unterminated literal or comment simply runs to end of input.
 * Adjacent plain, comment or string characters are coalesced into one segment.
 */
public final class ContextScanner implements Iterator<Segment> {
    private final String input;
    private final TokenMatcher matcher;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private SourceLocation location = SourceLocation.START;
    private Segment pending;

    private ContextScanner(String input, TokenMatcher matcher) {
        this.input = input;
        this.matcher = matcher;
        frames.push(Frame.Code.INSTANCE);
    }

    /**
     * Lazily scan {@code input}.
     */
    public static Stream<Segment> scan(String input, TokenMatcher matcher) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(matcher, "matcher");
        var scanner = new ContextScanner(input, matcher);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(scanner,
                                                                        Spliterator.ORDERED | Spliterator.NONNULL),
                                    false);
    }

    public static List<Segment> tokenize(String input, TokenMatcher matcher) {
        return scan(input, matcher).toList();
    }

    @Override
    public boolean hasNext() {
        return pending != null || !isAtEnd();
    }

    @Override
    public Segment next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        var first = takePending();
        if (!isCoalescing(first)) {
            return first;
        }
        var span = first.span();
        while (!isAtEnd()) {
            var following = step();
            if (following.getClass() != first.getClass()) {
                pending = following;
                break;
            }
            span = span.extendTo(following.span());
        }
        return coalesced(first, span, span.extract(input));
    }

    private Segment takePending() {
        if (pending == null) {
            return step();
        }
        var segment = pending;
        pending = null;
        return segment;
    }

    private Segment step() {
        var frame = frames.peek();
        if (frame instanceof Frame.Comment) {
            return scanComment();
        }
        if (frame instanceof Frame.StringLiteral literal) {
            return scanLiteral(literal);
        }
        return scanActive(frame);
    }

    private Segment scanActive(Frame frame) {
        var start = location;
        char c = peek();
        // Interpolation expressions cannot hold comments
        if (frame instanceof Frame.Code && c == '#') {
            advance(1);
            frames.push(Frame.Comment.INSTANCE);
            return new Segment.Comment(span(start), text(start));
        }
        if (enterLiteral()) {
            return new Segment.StringLiteral(span(start), text(start));
        }
        if (frame instanceof Frame.Interpolation expression) {
            if (c == '{') {
                replaceTop(expression.deeper());
            }else if (c == '}') {
                var outer = expression.shallower();
                if (outer.isClosed()) {
                    advance(1);
                    frames.pop();
                    return new Segment.InterpolationBoundary(span(start), text(start));
                }
                replaceTop(outer);
            }
        }
        var match = matcher.match(input, position());
        if (match.isPresent()) {
            advance(match.get()
                         .length());
            return new Segment.Token(span(start),
                                     text(start),
                                     match.get()
                                          .bracket());
        }
        advance(1);
        return new Segment.Code(span(start), text(start));
    }

    /**
     * Push a literal frame if an optional prefix run followed by a quote starts here.
     */
    private boolean enterLiteral() {
        int quotePos = position();
        while (quotePos < input.length() && Characters.isStringPrefix(input.charAt(quotePos))) {
            quotePos++ ;
        }
        if (quotePos >= input.length() || !Characters.isQuote(input.charAt(quotePos))) {
            return false;
        }
        char quote = input.charAt(quotePos);
        boolean triple = input.startsWith(String.valueOf(quote)
                                                .repeat(3),
                                          quotePos);
        var literal = Frame.StringLiteral.open(input.substring(position(), quotePos), quote, triple);
        advance(quotePos - position() + literal.delimiter()
                                               .length());
        frames.push(literal);
        return true;
    }

    private Segment scanLiteral(Frame.StringLiteral literal) {
        var start = location;
        if (literal.triple()) {
            if (input.startsWith(literal.delimiter(), position())) {
                advance(3);
                frames.pop();
                return literal(start);
            }
        }else if (peek() == literal.quote() && !isEscapedQuote(literal)) {
            advance(1);
            frames.pop();
            return literal(start);
        }
        if (literal.interpolated()) {
            if (peek() == '{') {
                // {{ is a literal brace
                if (peekAt(1) == '{') {
                    advance(2);
                    return literal(start);
                }
                advance(1);
                frames.push(Frame.Interpolation.ENTERED);
                return new Segment.InterpolationBoundary(span(start), text(start));
            }
            if (peek() == '}' && peekAt(1) == '}') {
                advance(2);
                return literal(start);
            }
        }
        if (!literal.raw() && peek() == '\\' && position() + 1 < input.length()) {
            advance(2);
            return literal(start);
        }
        advance(1);
        return literal(start);
    }

    private Segment scanComment() {
        var start = location;
        int newline = input.indexOf('\n', position());
        if (newline < 0) {
            advance(input.length() - position());
        }else {
            advance(newline + 1 - position());
            frames.pop();
        }
        return new Segment.Comment(span(start), text(start));
    }

    private boolean isEscapedQuote(Frame.StringLiteral literal) {
        if (literal.raw()) {
            return false;
        }
        int backslashes = 0;
        for (int i = position() - 1; i >= 0 && input.charAt(i) == '\\'; i-- ) {
            backslashes++ ;
        }
        return backslashes % 2 == 1;
    }

    private void replaceTop(Frame frame) {
        frames.pop();
        frames.push(frame);
    }

    private Segment literal(SourceLocation start) {
        return new Segment.StringLiteral(span(start), text(start));
    }

    private static boolean isCoalescing(Segment segment) {
        return segment instanceof Segment.Code
               || segment instanceof Segment.Comment
               || segment instanceof Segment.StringLiteral;
    }

    private static Segment coalesced(Segment first, SourceSpan span, String text) {
        if (first instanceof Segment.Comment) {
            return new Segment.Comment(span, text);
        }
        if (first instanceof Segment.StringLiteral) {
            return new Segment.StringLiteral(span, text);
        }
        return new Segment.Code(span, text);
    }

    private boolean isAtEnd() {
        return position() >= input.length();
    }

    private int position() {
        return location.offset();
    }

    private char peek() {
        return input.charAt(position());
    }

    private char peekAt(int distance) {
        int index = position() + distance;
        return index < input.length()
               ? input.charAt(index)
               : '\0';
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++ ) {
            location = location.next(input.charAt(position()));
        }
    }

    private String text(SourceLocation start) {
        return input.substring(start.offset(), position());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location);
    }
}
