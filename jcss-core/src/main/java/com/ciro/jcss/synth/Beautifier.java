package com.ciro.jcss.synth;

import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.syntax.CssWriter;
import com.ciro.jcss.syntax.CssWriterSettings;

/** Un selector y una declaración por línea, sangría de 4 espacios, línea en blanco entre items. */
public final class Beautifier {

    private final CssWriter writer = new CssWriter(CssWriterSettings.beautified());

    public String beautify(Stylesheet sheet) {
        return writer.getCSSAsString(sheet);
    }
}
