package org.pragmatica.plc.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceExcerptTest {

    @Test
    void render_underlinesSpanOnItsLine() {
        var source = "a := 1;\nx := := 1;\n";

        var text = SourceExcerpt.render("error: unexpected token", SourceSpan.of(13, 15), source);

        assertEquals("""
                         error: unexpected token
                          --> 2:6
                           |
                         2 | x := := 1;
                           |      ^^""", text);
    }

    @Test
    void render_emptySpan_stillUnderlinesOneColumn() {
        var text = SourceExcerpt.render("error", SourceSpan.at(0), "x");

        assertTrue(text.endsWith("| ^"));
    }

    @Test
    void location_resolvesLineAndColumn() {
        var location = SourceLocation.of("ab\r\ncd", 5);

        assertEquals(2, location.line());
        assertEquals(2, location.column());
        assertEquals("cd", location.lineText("ab\r\ncd"));
        assertEquals("ab", SourceLocation.of("ab\r\ncd", 1).lineText("ab\r\ncd"));
    }

    @Test
    void span_coveringAndExtract() {
        var covering = SourceSpan.covering(List.of(SourceSpan.of(4, 6), SourceSpan.of(1, 3)), SourceSpan.EMPTY);

        assertEquals(SourceSpan.of(1, 6), covering);
        assertEquals(SourceSpan.EMPTY, SourceSpan.covering(List.of(), SourceSpan.EMPTY));
        assertEquals("bc", SourceSpan.of(1, 3).extract("abc"));
        assertEquals("c", SourceSpan.of(2, 10).extract("abc"));
        assertThrows(IllegalArgumentException.class, () -> SourceSpan.of(3, 1));
    }
}
