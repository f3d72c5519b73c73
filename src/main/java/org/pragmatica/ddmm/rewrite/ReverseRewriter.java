package org.pragmatica.ddmm.rewrite;

import org.pragmatica.ddmm.lexer.Bracket;
import org.pragmatica.ddmm.lexer.Characters;
import org.pragmatica.ddmm.lexer.TokenMatcher;

/**
 * {@code f(x)} becomes {@code f drake x maye}.
 *
 * <p>Besides identifier characters, a closing quote before the keyword and a quote or another bracket
 * after it also get a separating space, so adjacent brackets never fuse into one word.
 */
final class ReverseRewriter extends Rewriter {
    static final ReverseRewriter INSTANCE = new ReverseRewriter();

    private ReverseRewriter() {
        super(TokenMatcher.SYMBOLS);
    }

    @Override
    protected String replacement(Bracket bracket) {
        return bracket.keyword();
    }

    @Override
    protected boolean needsSpaceBefore(int previous) {
        return Characters.isIdentifierChar(previous) || Characters.isQuote(previous);
    }

    @Override
    protected boolean needsSpaceAfter(int following) {
        return Characters.isIdentifierChar(following)
               || Characters.isQuote(following)
               || Characters.isBracketSymbol(following);
    }
}
