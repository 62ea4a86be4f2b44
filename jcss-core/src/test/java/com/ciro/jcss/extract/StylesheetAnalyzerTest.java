package com.ciro.jcss.extract;

import com.ciro.jcss.CssTools;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StylesheetAnalyzerTest {

    private static final String CSS = "@import url('theme.css') screen;\n"
            + "/* c1 */\n"
            + ".a { color: red; margin: 0 }\n"
            + ".b { color: #fff; font-family: Arial }\n"
            + ".a { padding: 1px }\n"
            + "@media (max-width: 600px) { .a { color: blue } }\n"
            + "@media print { }\n"
            + "@keyframes k { from { opacity: 0 } }\n";

    private final StylesheetAnalysis analysis = new CssTools().analyzeStylesheet(CSS);

    @Test
    void selectorsAndProperties() {
        assertEquals(List.of(".a", ".b", ".a", ".a"), analysis.selectors());
        assertEquals(4, analysis.selectorsCount());
        assertEquals(2, analysis.uniqueSelectors());
        assertEquals(6, analysis.propertiesCount());
        assertEquals(4, analysis.uniqueProperties());
        assertEquals(List.of(
                new PropertyUsage("color", 3),
                new PropertyUsage("margin", 1),
                new PropertyUsage("font-family", 1),
                new PropertyUsage("padding", 1)), analysis.mostUsedProperties());
    }

    @Test
    void colorsAndFonts() {
        assertEquals(List.of("red", "#fff", "blue"), analysis.colors());
        assertEquals(3, analysis.colorsUsed());
        assertEquals(List.of("Arial"), analysis.fonts());
        assertEquals(1, analysis.fontsUsed());
    }

    @Test
    void mediaQueriesSkipEmptyBlocks() {
        assertEquals(List.of("(max-width: 600px)"), analysis.mediaQueries());
        assertEquals(1, analysis.mediaQueriesCount());
        MediaQueryDetail detail = analysis.mediaQueryDetails().get("(max-width: 600px)");
        assertEquals(List.of(".a"), detail.selectors());
        assertEquals(Map.of("color", 1), detail.properties());
    }

    @Test
    void commentsImportsAndSize() {
        assertEquals(List.of("c1"), analysis.comments());
        assertEquals(1, analysis.commentsCount());
        assertEquals(List.of("theme.css"), analysis.imports());
        assertEquals(1, analysis.importsCount());
        assertEquals(Map.of("theme.css", "screen"), analysis.importMediaQueries());
        assertEquals(CSS.getBytes(StandardCharsets.UTF_8).length, analysis.fileSizeBytes());
    }

    @Test
    void lastValueWinsPerSelector() {
        assertEquals(Map.of("color", "blue", "margin", "0", "padding", "1px"), analysis.selectorProperties().get(".a"));
        assertEquals(List.of("color", "margin", "padding"),
                List.copyOf(analysis.selectorProperties().get(".a").keySet()));
    }

    @Test
    void importRefParsing() {
        assertEquals(new ImportRef("a.css", ""), ImportRef.parse("\"a.css\""));
        assertEquals(new ImportRef("b.css", "screen and (min-width: 1px)"),
                ImportRef.parse("url(b.css) screen and (min-width: 1px)"));
        assertNull(ImportRef.parse("foo"));
    }
}
