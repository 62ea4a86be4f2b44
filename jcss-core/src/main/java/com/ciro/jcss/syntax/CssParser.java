package com.ciro.jcss.syntax;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.error.CssParseException;
import com.ciro.jcss.error.DeclarationSyntaxException;
import com.ciro.jcss.syntax.CssLexer.Token;
import com.ciro.jcss.syntax.CssLexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ensamblador O(N). Convierte los tokens de {@link CssLexer} en el árbol de items.
 * Las at-rules cuyo keyword está en {@code ruleListKeywords} contienen reglas;
 * cualquier otra at-rule con bloque contiene declaraciones.
 */
public final class CssParser {

    private static final Logger log = LoggerFactory.getLogger(CssParser.class);

    public static final Set<String> DEFAULT_RULE_LIST_KEYWORDS = Set.of(
            "media", "supports", "document", "-moz-document", "layer", "container", "scope",
            "starting-style", "keyframes", "-webkit-keyframes", "-moz-keyframes", "-ms-keyframes",
            "-o-keyframes");

    static final int MAX_NESTING = 64;

    private static final Pattern IMPORTANT = Pattern.compile("!\\s*important\\s*$", Pattern.CASE_INSENSITIVE);

    private final Set<String> ruleListKeywords;

    public CssParser() {
        this(DEFAULT_RULE_LIST_KEYWORDS);
    }

    public CssParser(Set<String> ruleListKeywords) {
        this.ruleListKeywords = Set.copyOf(ruleListKeywords);
    }

    public Stylesheet parseStylesheet(String css) {
        Run run = new Run(css, CssLexer.lex(css), false);
        List<CssItem> items = run.items(0);
        return new Stylesheet(items);
    }

    /**
     * Lista de declaraciones suelta ({@code "color: red; margin: 0"}).
     * En modo estricto cualquier declaración inválida lanza {@link DeclarationSyntaxException};
     * si no, se descarta con un WARN.
     */
    public List<DeclarationItem> parseDeclarations(String text, boolean strict) {
        Run run = new Run(text, CssLexer.lex(text), strict);
        List<DeclarationItem> out = run.declarations(false, 0);
        if (run.pos < run.tokens.size()) {
            // Solo queda un '}' sin bloque abierto
            Token stray = run.tokens.get(run.pos);
            if (strict) throw new DeclarationSyntaxException("Invalid declaration syntax: Unexpected '}'");
            throw CssLexer.error(text, stray.offset(), "Unexpected '}'");
        }
        return out;
    }

    /** Estado de un parseo: los tokens y el cursor. */
    private final class Run {
        final String input;
        final List<Token> tokens;
        final boolean strict;
        int pos;

        Run(String input, List<Token> tokens, boolean strict) {
            this.input = input == null ? "" : input;
            this.tokens = tokens;
            this.strict = strict;
        }

        boolean atEnd() {
            return pos >= tokens.size();
        }

        Token peek() {
            return tokens.get(pos);
        }

        CssParseException error(Token at, String reason) {
            int offset = at == null ? input.length() : at.offset();
            return CssLexer.error(input, offset, reason);
        }

        /** Items de un nivel. Con depth > 0 consume el '}' de cierre. */
        List<CssItem> items(int depth) {
            List<CssItem> out = new ArrayList<>();
            while (!atEnd()) {
                Token t = peek();
                switch (t.type()) {
                    case WHITESPACE, SEMICOLON -> pos++;
                    case COMMENT -> {
                        out.add(new Comment(t.text()));
                        pos++;
                    }
                    case CLOSE_BRACE -> {
                        if (depth == 0) throw error(t, "Unexpected '}'");
                        pos++;
                        return out;
                    }
                    case AT_KEYWORD -> out.add(atRule(depth));
                    default -> out.add(qualifiedRule(depth));
                }
            }
            if (depth > 0) throw error(null, "Unterminated block");
            return out;
        }

        AtRule atRule(int depth) {
            Token start = tokens.get(pos++);
            String keyword = start.text().toLowerCase(Locale.ROOT);
            StringBuilder prelude = new StringBuilder();

            while (!atEnd()) {
                Token t = peek();
                switch (t.type()) {
                    case SEMICOLON -> {
                        pos++;
                        return AtRule.statement(keyword, normalize(prelude));
                    }
                    case CLOSE_BRACE -> {
                        // statement sin ';' al final de un bloque, el '}' es del padre
                        return AtRule.statement(keyword, normalize(prelude));
                    }
                    case OPEN_BRACE -> {
                        pos++;
                        if (depth + 1 > MAX_NESTING) throw error(t, "Nesting too deep");
                        if (ruleListKeywords.contains(keyword)) {
                            return AtRule.ofRules(keyword, normalize(prelude), items(depth + 1));
                        }
                        return AtRule.ofDeclarations(keyword, normalize(prelude), declarations(true, depth + 1));
                    }
                    default -> {
                        appendPrelude(prelude, t);
                        pos++;
                    }
                }
            }
            return AtRule.statement(keyword, normalize(prelude));
        }

        QualifiedRule qualifiedRule(int depth) {
            Token start = peek();
            StringBuilder prelude = new StringBuilder();
            while (!atEnd()) {
                Token t = peek();
                switch (t.type()) {
                    case OPEN_BRACE -> {
                        pos++;
                        if (depth + 1 > MAX_NESTING) throw error(t, "Nesting too deep");
                        return new QualifiedRule(normalize(prelude), declarations(true, depth + 1));
                    }
                    case SEMICOLON, CLOSE_BRACE -> throw error(t, "Expected '{' after '" + normalize(prelude) + "'");
                    default -> {
                        appendPrelude(prelude, t);
                        pos++;
                    }
                }
            }
            throw error(start, "Expected '{' after '" + normalize(prelude) + "'");
        }

        /**
         * Declaraciones hasta el '}' (que se consume si {@code closed}) o hasta el final.
         * Los bloques anidados ({@code @top-center { ... }}, {@code &:hover { ... }}) se conservan
         * como {@link AtRule} o {@link QualifiedRule} dentro de la lista.
         */
        List<DeclarationItem> declarations(boolean closed, int depth) {
            List<DeclarationItem> out = new ArrayList<>();
            List<Token> chunk = new ArrayList<>();
            while (!atEnd()) {
                Token t = peek();
                switch (t.type()) {
                    case SEMICOLON -> {
                        pos++;
                        declaration(chunk, out);
                        chunk.clear();
                    }
                    case CLOSE_BRACE -> {
                        declaration(chunk, out);
                        if (closed) pos++;
                        return out;
                    }
                    case OPEN_BRACE -> {
                        nestedBlock(chunk, out, depth);
                        chunk.clear();
                    }
                    default -> {
                        chunk.add(t);
                        pos++;
                    }
                }
            }
            if (closed) throw error(null, "Unterminated block");
            declaration(chunk, out);
            return out;
        }

        /** Bloque anidado dentro de una lista de declaraciones; el prefijo es su cabecera. */
        void nestedBlock(List<Token> prefix, List<DeclarationItem> out, int depth) {
            Token open = tokens.get(pos++);
            List<Token> head = new ArrayList<>();
            for (Token t : prefix) {
                if (t.type() == TokenType.COMMENT) out.add(new Comment(t.text()));
                else head.add(t);
            }
            String what = normalize(join(head));
            if (strict) throw new DeclarationSyntaxException("Invalid declaration syntax: Unexpected block after '" + what + "'");
            if (what.isEmpty()) throw error(open, "Expected selector before '{'");
            if (depth + 1 > MAX_NESTING) throw error(open, "Nesting too deep");

            int first = firstContent(head);
            if (head.get(first).type() == TokenType.AT_KEYWORD) {
                String keyword = head.get(first).text().toLowerCase(Locale.ROOT);
                String prelude = normalize(join(head.subList(first + 1, head.size())));
                if (ruleListKeywords.contains(keyword)) {
                    out.add(AtRule.ofRules(keyword, prelude, items(depth + 1)));
                } else {
                    out.add(AtRule.ofDeclarations(keyword, prelude, declarations(true, depth + 1)));
                }
            } else {
                out.add(new QualifiedRule(what, declarations(true, depth + 1)));
            }
        }

        void declaration(List<Token> chunk, List<DeclarationItem> out) {
            // los comentarios del trozo, también los de dentro del valor, van delante de su declaración
            List<Token> body = new ArrayList<>();
            for (Token t : chunk) {
                if (t.type() == TokenType.COMMENT) out.add(new Comment(t.text()));
                else body.add(t);
            }
            if (!hasContent(body)) return;

            int first = firstContent(body);
            if (body.get(first).type() == TokenType.AT_KEYWORD) {
                // @apply x; dentro de un bloque
                if (strict) throw new DeclarationSyntaxException("Invalid declaration syntax: '" + normalize(join(body)) + "'");
                String keyword = body.get(first).text().toLowerCase(Locale.ROOT);
                out.add(AtRule.statement(keyword, normalize(join(body.subList(first + 1, body.size())))));
                return;
            }

            int colon = -1;
            for (int i = 0; i < body.size(); i++) {
                if (body.get(i).type() == TokenType.COLON) {
                    colon = i;
                    break;
                }
            }
            String name = colon < 0 ? "" : normalize(join(body.subList(0, colon)));
            if (colon < 0 || name.isEmpty() || name.contains(" ")) {
                String raw = normalize(join(body));
                if (strict) throw new DeclarationSyntaxException("Invalid declaration syntax: '" + raw + "'");
                log.warn("Skipping invalid declaration '{}'", raw);
                return;
            }

            String value = normalize(join(body.subList(colon + 1, body.size())));
            boolean important = false;
            Matcher m = IMPORTANT.matcher(value);
            if (m.find()) {
                important = true;
                value = value.substring(0, m.start()).trim();
            }
            if (!name.startsWith("--")) name = name.toLowerCase(Locale.ROOT);

            out.add(new Declaration(name, value, important));
        }
    }

    private static int firstContent(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).type() != TokenType.WHITESPACE) return i;
        }
        return -1;
    }

    private static boolean hasContent(List<Token> tokens) {
        for (Token t : tokens) {
            if (t.type() != TokenType.WHITESPACE) return true;
        }
        return false;
    }

    private static void appendPrelude(StringBuilder sb, Token t) {
        switch (t.type()) {
            case COMMENT, WHITESPACE -> {
                // un solo espacio por hueco, nunca al principio
                if (!sb.isEmpty() && sb.charAt(sb.length() - 1) != ' ') sb.append(' ');
            }
            case AT_KEYWORD -> sb.append('@').append(t.text());
            default -> sb.append(t.text());
        }
    }

    private static StringBuilder join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) appendPrelude(sb, t);
        return sb;
    }

    private static String normalize(CharSequence joined) {
        return joined.toString().trim();
    }
}
