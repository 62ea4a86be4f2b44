package com.ciro.jcss.process;

import com.ciro.jcss.CssTools;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CssProcessorTest {

    private final CssProcessor processor = new CssProcessor(new CssTools());

    @Test
    void productionRunsEveryStep() {
        assertEquals(".a{-moz-user-select:none;-ms-user-select:none;-webkit-user-select:none;color:red;user-select:none}"
                        + ".hide-scrollbar{display:none}",
                processor.processForProduction(".a { user-select: none; color: red }", ProductionOptions.defaults()));
    }

    @Test
    void productionWithNoStepsIsIdentity() {
        String css = ".a {color:red}";
        assertEquals(css, processor.processForProduction(css, new ProductionOptions(false, false, false, false)));
    }

    @Test
    void browserCompatibilityAddsHideScrollbar() {
        assertEquals(".hide-scrollbar {\n    display: none;\n}\n", processor.applyBrowserCompatibility(""));
    }

    @Test
    void criticalRulesFollowRequestedOrder() {
        CriticalCss split = processor.extractCriticalCss(
                ".a { x: 1 } .b, .c { y: 2 } .d { z: 3 }", List.of(".c", ".a"));

        assertEquals(".b, .c {\n    y: 2;\n}\n.a {\n    x: 1;\n}\n", split.critical());
        assertEquals(".d {\n    z: 3;\n}\n", split.nonCritical());
    }

    @Test
    void criticalWithNoMatches() {
        CriticalCss split = processor.extractCriticalCss(".a { x: 1 }", List.of(".zz"));
        assertEquals("", split.critical());
        assertEquals(".a {\n    x: 1;\n}\n", split.nonCritical());
    }

    @Test
    void mergeFilesInMapOrder() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("a.css", ".a { color: red }");
        files.put("b.css", ".a { color: blue }");

        assertEquals(".a{color:blue}",
                processor.mergeCssFiles(files, new ProductionOptions(true, false, false, false)));
    }

    @Test
    void developmentReport() {
        String css = ".used { color: red; font-family: Arial } .unused { margin: 0 }";

        DevelopmentReport withoutHtml = processor.processForDevelopment(css, null);
        assertEquals(List.of(), withoutHtml.unusedSelectors());
        assertEquals(2, withoutHtml.analytics().selectorsCount());
        assertTrue(withoutHtml.beautifiedCss().contains("\n\n.unused {"));
        assertEquals(Map.of(".used", List.of("color: red")), withoutHtml.colorsUsed());

        DevelopmentReport withHtml = processor.processForDevelopment(css, "<p class=\"used\"></p>");
        assertEquals(List.of(".unused"), withHtml.unusedSelectors());
    }
}
