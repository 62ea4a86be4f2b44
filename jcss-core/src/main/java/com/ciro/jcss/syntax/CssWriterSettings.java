package com.ciro.jcss.syntax;

/**
 * Opciones de salida de {@link CssWriter}.
 *
 * @param optimizedOutput      sin espacios ni saltos de línea, sin el último ';' de cada bloque
 * @param writeComments        escribir los comentarios (en salida optimizada nunca se escriben)
 * @param indent               sangría de un nivel
 * @param splitSelectorList    un selector por línea en listas separadas por comas
 * @param blankLineBetweenItems línea en blanco entre items del mismo nivel
 */
public record CssWriterSettings(boolean optimizedOutput,
                                boolean writeComments,
                                String indent,
                                boolean splitSelectorList,
                                boolean blankLineBetweenItems) {

    public static final String DEFAULT_INDENT = "    ";

    public CssWriterSettings {
        indent = indent == null ? DEFAULT_INDENT : indent;
    }

    public static CssWriterSettings standard() {
        return new CssWriterSettings(false, true, DEFAULT_INDENT, false, false);
    }

    public static CssWriterSettings beautified() {
        return new CssWriterSettings(false, true, DEFAULT_INDENT, true, true);
    }

    public static CssWriterSettings optimized() {
        return new CssWriterSettings(true, false, "", false, false);
    }

    public boolean writesComments() {
        return writeComments && !optimizedOutput;
    }
}
