package com.ciro.jcss.extract;

import com.ciro.jcss.syntax.CssText;

/**
 * URL y media query de un {@code @import}. La URL sale de {@code url(...)} o de un string.
 */
public record ImportRef(String url, String media) {

    /** null si el prelude no empieza por {@code url(...)} ni por un string. */
    public static ImportRef parse(String prelude) {
        String p = prelude.trim();
        String url;
        String rest;
        if (p.regionMatches(true, 0, "url(", 0, 4)) {
            int close = closingParen(p, 3);
            if (close < 0) return null;
            url = CssText.stripQuotes(p.substring(4, close));
            rest = p.substring(close + 1);
        } else if (p.startsWith("\"") || p.startsWith("'")) {
            int close = p.indexOf(p.charAt(0), 1);
            if (close < 0) return null;
            url = p.substring(1, close);
            rest = p.substring(close + 1);
        } else {
            return null;
        }
        if (url.isEmpty()) return null;
        return new ImportRef(url, rest.trim());
    }

    private static int closingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
