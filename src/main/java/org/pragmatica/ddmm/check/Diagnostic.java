package org.pragmatica.ddmm.check;

import org.pragmatica.ddmm.lexer.Bracket;

/**
 * Bracket matching problem found by {@link BracketValidator}.
 *
 * <p>Example output of {@link #format(String)}:
 * <pre>
 * Mismatched brackets: opened with 'drake' (paren) on line 1 but closed with 'Maye' (curly brace)
 *   File "app.ddmm", line 3
 *     print drake x Maye
 * </pre>
 *
 * @param kind        Problem category
 * @param message     Human-readable message
 * @param displayName Source name shown in the location line
 * @param line        1-based line the problem is reported at
 */
public record Diagnostic(
    Kind kind,
    String message,
    String displayName,
    int line
) {
    public enum Kind {
        UNEXPECTED_CLOSER,
        MISMATCHED_BRACKETS,
        UNCLOSED_OPENER
    }

    /**
     * Closer with nothing open.
     */
    public static Diagnostic unexpectedCloser(Bracket closer, String displayName, int line) {
        return new Diagnostic(Kind.UNEXPECTED_CLOSER,
                              "Unexpected closing " + closer.describe() + " with no matching opener",
                              displayName,
                              line);
    }

    /**
     * Closer of a different family than the innermost open bracket. Reported at the closer's line.
     */
    public static Diagnostic mismatched(Bracket opener, int openerLine, Bracket closer, String displayName, int line) {
        return new Diagnostic(Kind.MISMATCHED_BRACKETS,
                              "Mismatched brackets: opened with " + opener.describe() + " on line " + openerLine
                              + " but closed with " + closer.describe(),
                              displayName,
                              line);
    }

    /**
     * Opener still open at end of input. Reported at the opener's line.
     */
    public static Diagnostic unclosed(Bracket opener, String displayName, int line) {
        return new Diagnostic(Kind.UNCLOSED_OPENER, "Unclosed " + opener.describe(), displayName, line);
    }

    /**
     * Message and location, without a source excerpt.
     */
    public String format() {
        return message + "\n  File \"" + displayName + "\", line " + line;
    }

    /**
     * Message and location followed by the offending source line, when there is one.
     */
    public String format(String source) {
        var lines = source.split("\n", -1);
        if (line < 1 || line > lines.length || lines[line - 1].isBlank()) {
            return format();
        }
        return format() + "\n    " + lines[line - 1].strip();
    }

    @Override
    public String toString() {
        return format();
    }
}
