package org.pragmatica.ddmm.lexer;

import java.util.Optional;

/**
 * Recognizes substitution tokens at a position in an active context.
 */
@FunctionalInterface
public interface TokenMatcher {

    /**
     * Try to match a token starting at {@code pos}.
     */
    Optional<Match> match(String source, int pos);

    /**
     * A recognized token and the number of source characters it covers.
     */
    record Match(Bracket bracket, int length) {}

    /**
     * Keyword dialect: {@code drake}, {@code Maye}, ... isolated by word boundaries on both sides.
     */
    TokenMatcher KEYWORDS = (source, pos) -> {
        if (Characters.isIdentifierBefore(source, pos)) {
            return Optional.empty();
        }
        for (var bracket : Bracket.all()) {
            var keyword = bracket.keyword();
            var end = pos + keyword.length();
            if (source.startsWith(keyword, pos) && !Characters.isIdentifierAt(source, end)) {
                return Optional.of(new Match(bracket, keyword.length()));
            }
        }
        return Optional.empty();
    };

    /**
     * Native bracket characters.
     */
    TokenMatcher SYMBOLS = (source, pos) -> Bracket.ofSymbol(source.charAt(pos))
                                                   .map(bracket -> new Match(bracket, 1));
}
