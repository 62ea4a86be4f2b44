package com.ciro.jcss.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Utilidades de texto que respetan strings, paréntesis y corchetes.
 */
public final class CssText {

    private CssText() {}

    /** Parte {@code text} por {@code separator} solo en el nivel superior. Las partes salen recortadas. */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text == null) return parts;
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '(' || c == '[') depth++;
            else if ((c == ')' || c == ']') && depth > 0) depth--;
            else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
            i++;
        }
        parts.add(text.substring(Math.min(start, text.length())).trim());
        return parts;
    }

    /**
     * Quita los espacios alrededor de cualquiera de {@code chars}, fuera de strings.
     * {@code compactAround("a > b , c", ">,")} devuelve {@code "a>b,c"}.
     */
    public static String compactAround(String text, String chars) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int end = skipString(text, i);
                out.append(text, i, end);
                i = end;
                continue;
            }
            if (c == '\\' && i + 1 < text.length()) {
                out.append(c).append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            if (chars.indexOf(c) >= 0) {
                while (!out.isEmpty() && Character.isWhitespace(out.charAt(out.length() - 1))) {
                    out.setLength(out.length() - 1);
                }
                out.append(c);
                i++;
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /** {@code "'Roboto'"} → {@code Roboto}. Si no está entre comillas se devuelve tal cual. */
    public static String stripQuotes(String text) {
        String t = text.trim();
        if (t.length() >= 2) {
            char first = t.charAt(0);
            char last = t.charAt(t.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return t.substring(1, t.length() - 1);
            }
        }
        return t;
    }

    /** Primer token separado por espacios, o "" si no hay. */
    public static String firstWord(String text) {
        String t = text.trim();
        if (t.isEmpty()) return "";
        int i = 0;
        while (i < t.length() && !Character.isWhitespace(t.charAt(i))) i++;
        return t.substring(0, i);
    }

    private static int skipString(String text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            i++;
        }
        return text.length();
    }
}
