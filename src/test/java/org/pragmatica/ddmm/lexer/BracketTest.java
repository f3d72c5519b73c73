package org.pragmatica.ddmm.lexer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BracketTest {

    @Test
    void closers_expectOpenerOfSameFamily() {
        for (var bracket : Bracket.values()) {
            if (!bracket.isOpener()) {
                var opener = bracket.expectedOpener();
                assertTrue(opener.isOpener());
                assertEquals(bracket.family(), opener.family());
            }
        }
    }

    @Test
    void lookup_bySymbol() {
        assertThat(Bracket.ofSymbol('[')).contains(Bracket.OPEN_SQUARE);
        assertThat(Bracket.ofSymbol('<')).isEmpty();
    }

    @Test
    void describe_namesKeywordAndFamily() {
        assertEquals("'DRAKE' (square bracket)", Bracket.OPEN_SQUARE.describe());
        assertEquals("'maye' (paren)", Bracket.CLOSE_PAREN.describe());
    }
}
