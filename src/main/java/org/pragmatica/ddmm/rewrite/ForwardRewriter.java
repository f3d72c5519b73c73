package org.pragmatica.ddmm.rewrite;

import org.pragmatica.ddmm.lexer.Bracket;
import org.pragmatica.ddmm.lexer.Characters;
import org.pragmatica.ddmm.lexer.TokenMatcher;

/**
 * {@code drake x maye} becomes {@code ( x )}.
 */
final class ForwardRewriter extends Rewriter {
    static final ForwardRewriter INSTANCE = new ForwardRewriter();

    private ForwardRewriter() {
        super(TokenMatcher.KEYWORDS);
    }

    @Override
    protected String replacement(Bracket bracket) {
        return String.valueOf(bracket.symbol());
    }

    @Override
    protected boolean needsSpaceBefore(int previous) {
        return Characters.isIdentifierChar(previous);
    }

    @Override
    protected boolean needsSpaceAfter(int following) {
        return Characters.isIdentifierChar(following) || Characters.isQuote(following);
    }
}
