package com.ciro.jcss.syntax;

import com.ciro.jcss.error.CssParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer O(N) para CSS. Solo distingue lo que el parser necesita para encontrar la
 * estructura: llaves, ';', ':', at-keywords, strings, comentarios y espacios.
 * Un grupo entre paréntesis sale como un único token de texto, así un ';' dentro de
 * {@code url(data:...;base64,...)} nunca cierra una declaración.
 */
public final class CssLexer {

    public enum TokenType {
        WHITESPACE,
        COMMENT,
        AT_KEYWORD,
        OPEN_BRACE,
        CLOSE_BRACE,
        SEMICOLON,
        COLON,
        STRING,
        TEXT
    }

    /**
     * @param text   texto crudo (para COMMENT el contenido sin delimitadores, para AT_KEYWORD el nombre sin '@')
     * @param offset posición en la entrada, para los mensajes de error
     */
    public record Token(TokenType type, String text, int offset) {}

    private CssLexer() {}

    public static List<Token> lex(String input) {
        List<Token> tokens = new ArrayList<>();
        if (input == null || input.isEmpty()) return tokens;

        int i = 0;
        int len = input.length();
        StringBuilder textBuffer = new StringBuilder();
        int textStart = 0;

        while (i < len) {
            char c = input.charAt(i);

            if (Character.isWhitespace(c)) {
                flushText(tokens, textBuffer, textStart);
                int start = i;
                while (i < len && Character.isWhitespace(input.charAt(i))) i++;
                tokens.add(new Token(TokenType.WHITESPACE, input.substring(start, i), start));
                continue;
            }

            if (c == '/' && i + 1 < len && input.charAt(i + 1) == '*') {
                flushText(tokens, textBuffer, textStart);
                int end = input.indexOf("*/", i + 2);
                if (end < 0) throw error(input, i, "Unterminated comment");
                tokens.add(new Token(TokenType.COMMENT, input.substring(i + 2, end), i));
                i = end + 2;
                continue;
            }

            if (c == '"' || c == '\'') {
                flushText(tokens, textBuffer, textStart);
                int end = endOfString(input, i);
                tokens.add(new Token(TokenType.STRING, input.substring(i, end), i));
                i = end;
                continue;
            }

            if (c == '@' && i + 1 < len && isIdentStart(input, i + 1)) {
                flushText(tokens, textBuffer, textStart);
                int j = i + 1;
                while (j < len && isIdentChar(input.charAt(j))) j++;
                tokens.add(new Token(TokenType.AT_KEYWORD, input.substring(i + 1, j), i));
                i = j;
                continue;
            }

            TokenType single = switch (c) {
                case '{' -> TokenType.OPEN_BRACE;
                case '}' -> TokenType.CLOSE_BRACE;
                case ';' -> TokenType.SEMICOLON;
                case ':' -> TokenType.COLON;
                default -> null;
            };
            if (single != null) {
                flushText(tokens, textBuffer, textStart);
                tokens.add(new Token(single, String.valueOf(c), i));
                i++;
                continue;
            }

            if (textBuffer.isEmpty()) textStart = i;

            if (c == '(') {
                int end = endOfParens(input, i);
                textBuffer.append(input, i, end);
                i = end;
                continue;
            }

            if (c == '\\' && i + 1 < len) {
                textBuffer.append(c).append(input.charAt(i + 1));
                i += 2;
                continue;
            }

            textBuffer.append(c);
            i++;
        }

        flushText(tokens, textBuffer, textStart);
        return tokens;
    }

    private static void flushText(List<Token> tokens, StringBuilder sb, int start) {
        if (!sb.isEmpty()) {
            tokens.add(new Token(TokenType.TEXT, sb.toString(), start));
            sb.setLength(0);
        }
    }

    /** Índice justo después de la comilla de cierre. */
    private static int endOfString(String input, int start) {
        char quote = input.charAt(start);
        int i = start + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            if (c == '\n') break;
            i++;
        }
        throw error(input, start, "Unterminated string");
    }

    /** Índice justo después del ')' que cierra el grupo, respetando strings y comentarios. */
    private static int endOfParens(String input, int start) {
        int depth = 0;
        int i = start;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '"' || c == '\'') {
                i = endOfString(input, i);
                continue;
            }
            if (c == '/' && i + 1 < input.length() && input.charAt(i + 1) == '*') {
                int end = input.indexOf("*/", i + 2);
                if (end < 0) throw error(input, i, "Unterminated comment");
                i = end + 2;
                continue;
            }
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) return i + 1;
            }
            i++;
        }
        throw error(input, start, "Unterminated parenthesis");
    }

    private static boolean isIdentStart(String input, int i) {
        char c = input.charAt(i);
        if (c == '-') {
            return i + 1 < input.length() && (isIdentChar(input.charAt(i + 1)));
        }
        return Character.isLetter(c) || c == '_' || c > 0x7F;
    }

    private static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c > 0x7F;
    }

    static CssParseException error(String input, int offset, String reason) {
        int line = 1;
        int lineStart = 0;
        for (int k = 0; k < offset && k < input.length(); k++) {
            if (input.charAt(k) == '\n') {
                line++;
                lineStart = k + 1;
            }
        }
        return new CssParseException(reason, line, offset - lineStart + 1);
    }
}
