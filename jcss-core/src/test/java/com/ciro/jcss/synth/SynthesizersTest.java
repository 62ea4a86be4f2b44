package com.ciro.jcss.synth;

import com.ciro.jcss.CssTools;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SynthesizersTest {

    private final CssTools tools = new CssTools();

    @Test
    void minifyCompactsAndDropsEmpty() {
        assertEquals(".a,.b>.c{color:#123;margin:0}",
                tools.minify("/* c */ .a , .b > .c { color : #112233 ; margin: 0 } .empty { } @media print { .x { } }"));
    }

    @Test
    void minifyIsIdempotent() {
        String once = tools.minify("@media screen { .a { color: #aabbcc; font: 12px 'A B' , serif } }");
        assertEquals("@media screen{.a{color:#abc;font:12px 'A B',serif}}", once);
        assertEquals(once, tools.minify(once));
    }

    @Test
    void shortensOnlyRepeatedPairs() {
        assertEquals("#123", Minifier.shortenHex("#112233"));
        assertEquals("#112234", Minifier.shortenHex("#112234"));
        assertEquals("#ABC", Minifier.shortenHex("#AABBCC"));
        assertEquals("#aabbccdd", Minifier.shortenHex("#aabbccdd"));
        assertEquals("'#aabbcc'", Minifier.shortenHex("'#aabbcc'"));
    }

    @Test
    void beautifyOneSelectorPerLine() {
        assertEquals("h1,\nh2 {\n    color: red;\n}\n\np {\n    margin: 0;\n}\n",
                tools.beautify("h1,h2{color:red}p{margin:0}"));
    }

    @Test
    void sortByPropertyName() {
        assertEquals(".a {\n    a: 2;\n    m: 3;\n    z: 1;\n}\n", tools.sortProperties(".a { z: 1; a: 2; m: 3 }"));
    }

    @Test
    void removeDuplicatesMergesRulesAndMedia() {
        assertEquals(".a {\n    color: blue;\n    padding: 0;\n}\n"
                        + ".b {\n    margin: 0;\n}\n"
                        + "@media print {\n    .x {\n        a: 1;\n        b: 2;\n    }\n}\n",
                tools.removeDuplicates(".a { color: red } .b { margin: 0 } .a { color: blue; padding: 0 }"
                        + "@media print { .x { a: 1 } } @media print { .x { b: 2 } }"));
    }

    @Test
    void removeDuplicatesKeepsDifferentConditions() {
        String out = tools.removeDuplicates("@media print { .x { a: 1 } } @media screen { .x { a: 1 } }");
        assertEquals("@media print {\n    .x {\n        a: 1;\n    }\n}\n@media screen {\n    .x {\n        a: 1;\n    }\n}\n", out);
    }

    @Test
    void minifyKeepsNestedAtRule() {
        assertEquals("@page{margin:1in;@top-center{content:\"x\"}}",
                tools.minify("@page { margin: 1in; @top-center { content: \"x\" } }"));
    }

    @Test
    void removeDuplicatesIsIdempotent() {
        String once = tools.removeDuplicates(".a { color: red } .b { margin: 0 } .a { color: blue; padding: 0 }"
                + "@media print { .x { a: 1 } } @media print { .x { b: 2; a: 3 } }");
        assertEquals(once, tools.removeDuplicates(once));
    }

    @Test
    void removeDuplicatesCollapsesSingleRule() {
        // el último valor gana también dentro de una misma regla
        assertEquals(".a {\n    color: blue;\n}\n", tools.removeDuplicates(".a{color:red;color:blue}"));
    }

    @Test
    void sortIsIdempotent() {
        String once = tools.sortProperties(".a { z: 1; /* c */ a: 2 } @media print { .b { y: 1; b: 2 } }");
        assertEquals(once, tools.sortProperties(once));
    }

    @Test
    void sortMovesCommentsToEnd() {
        assertEquals(".a {\n    a: 2;\n    z: 1;\n    /* c */\n}\n", tools.sortProperties(".a { /* c */ z: 1; a: 2 }"));
    }
}
