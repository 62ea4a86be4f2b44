package com.ciro.jcss;

import com.ciro.jcss.ast.AtRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class CssTablesTest {

    @Test
    void keyframesAlwaysRecurse() {
        CssTables tables = CssTables.defaults();
        assertTrue(tables.recursesInto("media"));
        assertTrue(tables.recursesInto("-webkit-keyframes"));
        assertFalse(tables.recursesInto("font-face"));
    }

    @Test
    void builderExtendsDefaults() {
        CssTables tables = CssTables.builder()
                .addColorProperties(List.of(" FILL ", ""))
                .addRecurseKeywords(List.of("page-group"))
                .build();

        assertTrue(tables.isColorProperty("fill"));
        assertTrue(tables.isColorProperty("color"));
        assertTrue(tables.recursesInto("page-group"));
    }

    @Test
    void prefixTableKeepsOrder() {
        assertEquals(List.of("user-select", "appearance", "backdrop-filter", "text-size-adjust", "font-smoothing"),
                List.copyOf(CssTables.defaults().browserPrefixes().keySet()));
    }

    @Test
    void maxDepthMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> CssTables.builder().maxDepth(0));
    }

    @Test
    void extraRecurseKeywordReachesParser() {
        CssTools tools = new CssTools(CssTables.builder().addRecurseKeywords(List.of("page-group")).build());
        assertEquals(List.of("color: red"),
                tools.extractColors("@page-group x { .a { color: red } }").get(".a"));
    }

    @Test
    void keywordsIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            // en turco "I".toLowerCase() da una i sin punto
            assertEquals("import", AtRule.statement("IMPORT", "'x.css'").keyword());
            CssTables tables = CssTables.builder().addColorProperties(List.of("FILL")).build();
            assertTrue(tables.isColorProperty("fill"));
            CssTools tools = new CssTools();
            assertEquals(List.of("color: red"), tools.extractColors("@MEDIA print { .a { color: red } }").get(".a"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
