package com.ciro.jcss.syntax;

import com.ciro.jcss.ast.Stylesheet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CssWriterTest {

    private final CssParser parser = new CssParser();

    private String write(String css, CssWriterSettings settings) {
        return new CssWriter(settings).getCSSAsString(parser.parseStylesheet(css));
    }

    @Test
    void standardOutputOneDeclarationPerLine() {
        assertEquals(".a {\n    color: red;\n    margin: 0 !important;\n}\n",
                write(".a{color:red;margin:0!important}", CssWriterSettings.standard()));
    }

    @Test
    void nestedBlocksAreIndented() {
        assertEquals("@media print {\n    .a {\n        color: red;\n    }\n}\n",
                write("@media print{.a{color:red}}", CssWriterSettings.standard()));
    }

    @Test
    void statementsEndWithSemicolon() {
        assertEquals("@charset \"UTF-8\";\n", write("@charset \"UTF-8\";", CssWriterSettings.standard()));
    }

    @Test
    void optimizedDropsCommentsAndWhitespace() {
        assertEquals(".a{color:red;margin:0}@import 'b.css';",
                write(".a { color: red; margin: 0 } /* x */ @import 'b.css';", CssWriterSettings.optimized()));
    }

    @Test
    void beautifiedSplitsSelectorLists() {
        assertEquals("h1,\nh2 {\n    color: red;\n}\n\np {\n    margin: 0;\n}\n",
                write("h1, h2 { color: red } p { margin: 0 }", CssWriterSettings.beautified()));
    }

    @Test
    void standardOutputIsStable() {
        String css = "/* a */ .a , .b { color: red } @media (min-width: 1px) { .c { x: y } } @font-face { src: url(a.woff) }";
        String once = write(css, CssWriterSettings.standard());
        Stylesheet again = parser.parseStylesheet(once);

        assertEquals(once, new CssWriter(CssWriterSettings.standard()).getCSSAsString(again));
    }

    @Test
    void nestedBlockInsideDeclarationsIsWrittenBack() {
        String css = "@page { margin: 1in; @top-center { content: \"x\" } }";

        assertEquals("@page {\n    margin: 1in;\n    @top-center {\n        content: \"x\";\n    }\n}\n",
                write(css, CssWriterSettings.standard()));
        assertEquals("@page{margin:1in;@top-center{content:\"x\"}}", write(css, CssWriterSettings.optimized()));
    }
}
