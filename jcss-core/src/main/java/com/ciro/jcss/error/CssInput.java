package com.ciro.jcss.error;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Puerta de entrada del texto CSS: decodificación UTF-8 estricta y pre-chequeo de llaves.
 */
public final class CssInput {

    private CssInput() {}

    public static String decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return "";
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new CssDecodeException("Input is not valid UTF-8", e);
        }
    }

    /**
     * Falla si el número de '{' y '}' no coincide. Las llaves dentro de strings y
     * comentarios no cuentan.
     */
    public static String requireBalanced(String css) {
        if (css == null) return "";
        int open = 0;
        int close = 0;
        int i = 0;
        int len = css.length();
        while (i < len) {
            char c = css.charAt(i);
            if (c == '/' && i + 1 < len && css.charAt(i + 1) == '*') {
                int end = css.indexOf("*/", i + 2);
                i = end < 0 ? len : end + 2;
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipString(css, i);
                continue;
            }
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '{') open++;
            else if (c == '}') close++;
            i++;
        }
        if (open != close) {
            throw new CssSyntaxException("CSS syntax error: Unbalanced braces");
        }
        return css;
    }

    private static int skipString(String css, int start) {
        char quote = css.charAt(start);
        int i = start + 1;
        while (i < css.length()) {
            char c = css.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote || c == '\n') return i + 1;
            i++;
        }
        return i;
    }
}
