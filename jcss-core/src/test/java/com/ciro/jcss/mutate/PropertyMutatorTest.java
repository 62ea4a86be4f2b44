package com.ciro.jcss.mutate;

import com.ciro.jcss.CssTools;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PropertyMutatorTest {

    private final CssTools tools = new CssTools();

    @Test
    void addAppendsToExistingRule() {
        assertEquals(".a {\n    color: red;\n    margin: 0;\n}\n",
                tools.addProperty(".a { color: red }", ".a", "margin", "0", false));
    }

    @Test
    void addReplacesExistingDeclaration() {
        assertEquals(".a {\n    color: blue !important;\n}\n",
                tools.addProperty(".a { color: red }", ".a", "color", "blue", true));
    }

    @Test
    void addCreatesMissingRule() {
        assertEquals(".n {\n    color: red;\n}\n", tools.addProperty("", ".n", "color", "red", false));
    }

    @Test
    void removeDropsRuleLeftEmpty() {
        assertEquals(".a {\n    color: red;\n    margin: 0;\n}\n",
                tools.removeProperty(".a { color: red; margin: 0 } .b { color: red }", ".b", "color"));
    }

    @Test
    void modifyKeepsOrChangesImportance() {
        String css = ".a { color: red !important }";
        assertEquals(".a {\n    color: blue !important;\n}\n",
                tools.modifyPropertyValue(css, ".a", "color", "blue", Importance.KEEP));
        assertEquals(".a {\n    color: blue;\n}\n",
                tools.modifyPropertyValue(css, ".a", "color", "blue", Importance.NORMAL));
    }

    @Test
    void modifyAddsMissingProperty() {
        assertEquals(".a {\n    color: red;\n    margin: 1px;\n}\n",
                tools.modifyPropertyValue(".a { color: red }", ".a", "margin", "1px", Importance.KEEP));
    }

    @Test
    void importanceFromNullableFlag() {
        assertEquals(Importance.KEEP, Importance.of(null));
        assertTrue(Importance.of(true).apply(false));
        assertFalse(Importance.of(false).apply(true));
    }

    @Test
    void propertyNameIsCaseInsensitive() {
        assertEquals(".a {\n    color: blue;\n}\n", tools.addProperty(".a { color: red }", ".a", "COLOR", "blue", false));
        assertEquals(".a {\n    margin: 0;\n}\n", tools.removeProperty(".a { color: red; margin: 0 }", ".a", "Color"));
        assertEquals(".a {\n    color: blue;\n}\n",
                tools.modifyPropertyValue(".a { color: red }", ".a", " COLOR ", "blue", Importance.KEEP));
    }

    @Test
    void customPropertyKeepsCase() {
        assertEquals(":root {\n    --Main: 1;\n    --main: 2;\n}\n",
                tools.addProperty(":root { --Main: 1 }", ":root", "--main", "2", false));
    }
}
