package com.ciro.jcss.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CssTextTest {

    @Test
    void splitsOnlyAtTopLevel() {
        assertEquals(List.of("a", "b(c, d)", "'e,f'", "[g,h]"),
                CssText.splitTopLevel("a, b(c, d), 'e,f', [g,h]", ','));
    }

    @Test
    void compactsOutsideStrings() {
        assertEquals("a>b,c", CssText.compactAround("a > b , c", ">,"));
        assertEquals("'a , b',c", CssText.compactAround("'a , b' , c", ","));
    }

    @Test
    void quotesAndWords() {
        assertEquals("Roboto", CssText.stripQuotes("'Roboto'"));
        assertEquals("Roboto", CssText.stripQuotes("Roboto"));
        assertEquals("fade", CssText.firstWord("  fade 1s ease"));
        assertEquals("", CssText.firstWord("   "));
    }
}
