package org.pragmatica.ddmm;

import org.pragmatica.ddmm.check.BracketValidator;
import org.pragmatica.ddmm.check.Diagnostic;
import org.pragmatica.ddmm.rewrite.Rewriter;

import java.util.List;

/**
 * Entry point for rewriting keyword-bracket source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var python = Ddmm.transform("print drake 'hi' maye");      // print ( 'hi' )
 * var ddmm = Ddmm.reverseTransform("d = {'a': 1}");           // d = Drake 'a': 1 Maye
 * var problems = Ddmm.checkBracketMatching("drake Maye", "app.ddmm");
 * }</pre>
 *
 * <p>All operations are pure and safe to call concurrently.
 */
public final class Ddmm {
    public static final String DEFAULT_DISPLAY_NAME = "<string>";

    private Ddmm() {}

    /**
     * Replace keywords with bracket characters outside strings and comments.
     * Never fails; malformed nesting yields best-effort output.
     */
    public static String transform(String source) {
        return Rewriter.forward()
                       .rewrite(source);
    }

    /**
     * Replace bracket characters with keywords outside strings and comments.
     */
    public static String reverseTransform(String source) {
        return Rewriter.reverse()
                       .rewrite(source);
    }

    /**
     * Validate keyword bracket matching, reporting against {@value #DEFAULT_DISPLAY_NAME}.
     */
    public static List<Diagnostic> checkBracketMatching(String source) {
        return checkBracketMatching(source, DEFAULT_DISPLAY_NAME);
    }

    /**
     * Validate keyword bracket matching.
     *
     * @return diagnostics; empty when all brackets match
     */
    public static List<Diagnostic> checkBracketMatching(String source, String displayName) {
        return BracketValidator.check(source, displayName);
    }
}
