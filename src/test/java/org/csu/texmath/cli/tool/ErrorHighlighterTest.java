package org.csu.texmath.cli.tool;

import org.csu.texmath.engine.TokenSpan;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ErrorHighlighterTest {

    @Test
    void testCaretUnderToken() {
        assertEquals("  2+*3\n    ^", ErrorHighlighter.highlight("2+*3", Optional.of(new TokenSpan(2, 1))));
        assertEquals("  1 + foo(x)\n      ^^^", ErrorHighlighter.highlight("1 + foo(x)", Optional.of(new TokenSpan(4, 3))));
    }

    @Test
    void testCaretAfterEndOfInput() {
        assertEquals("  2+\n    ^", ErrorHighlighter.highlight("2+", Optional.empty()));
        assertEquals("  \n  ^", ErrorHighlighter.highlight("", Optional.empty()));
    }

    @Test
    void testTabsAreKeptForAlignment() {
        assertEquals("  \tx y\n  \t  ^", ErrorHighlighter.highlight("\tx y", Optional.of(new TokenSpan(3, 1))));
    }
}
