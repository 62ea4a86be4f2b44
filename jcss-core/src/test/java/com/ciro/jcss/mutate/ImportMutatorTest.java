package com.ciro.jcss.mutate;

import com.ciro.jcss.CssTools;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImportMutatorTest {

    private final CssTools tools = new CssTools();

    @Test
    void addGoesAfterCharset() {
        assertEquals("@charset \"UTF-8\";\n@import 'theme.css';\n.a {\n    x: y;\n}\n",
                tools.addImport("@charset \"UTF-8\"; .a { x: y }", "theme.css", null));
    }

    @Test
    void addGoesAfterLastImport() {
        assertEquals("@import 'a.css';\n@import url('https://cdn.example.com/b.css') print;\n.a {\n    x: y;\n}\n",
                tools.addImport("@import 'a.css'; .a { x: y }", "https://cdn.example.com/b.css", "print"));
    }

    @Test
    void addSkipsDuplicate() {
        assertEquals("@import 'a.css';\n", tools.addImport("@import 'a.css';", "a.css", null));
    }

    @Test
    void removeByUrl() {
        assertEquals("@import 'b.css';\n", tools.removeImport("@import 'a.css'; @import 'b.css';", "a.css"));
    }

    @Test
    void preludeShape() {
        assertEquals("'x.css'", ImportMutator.prelude("x.css", " "));
        assertEquals("url('/x.css') screen", ImportMutator.prelude("/x.css", "screen"));
    }
}
