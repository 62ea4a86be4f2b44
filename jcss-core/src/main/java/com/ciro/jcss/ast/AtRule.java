package com.ciro.jcss.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Regla {@code @keyword prelude}. Tres formas:
 * <ul>
 *   <li>sentencia ({@code @import}, {@code @charset}): sin bloque,</li>
 *   <li>bloque de reglas ({@code @media}, {@code @keyframes}, ...): {@link #block()} no nulo,</li>
 *   <li>bloque de declaraciones ({@code @font-face}, {@code @page}, ...): {@link #declarations()} no nulo.</li>
 * </ul>
 */
public record AtRule(String keyword, String prelude, List<CssItem> block, List<DeclarationItem> declarations)
        implements CssItem, DeclarationItem {

    public AtRule {
        keyword = Objects.requireNonNull(keyword, "keyword").toLowerCase(Locale.ROOT);
        prelude = prelude == null ? "" : prelude.trim();
        block = block == null ? null : List.copyOf(block);
        declarations = declarations == null ? null : List.copyOf(declarations);
        if (block != null && declarations != null) {
            throw new IllegalArgumentException("@" + keyword + " cannot carry both rules and declarations");
        }
    }

    public static AtRule statement(String keyword, String prelude) {
        return new AtRule(keyword, prelude, null, null);
    }

    public static AtRule ofRules(String keyword, String prelude, List<CssItem> block) {
        return new AtRule(keyword, prelude, Objects.requireNonNull(block, "block"), null);
    }

    public static AtRule ofDeclarations(String keyword, String prelude, List<DeclarationItem> declarations) {
        return new AtRule(keyword, prelude, null, Objects.requireNonNull(declarations, "declarations"));
    }

    public boolean hasBlock() {
        return block != null;
    }

    public boolean hasDeclarations() {
        return declarations != null;
    }

    public boolean isStatement() {
        return block == null && declarations == null;
    }

    public AtRule withBlock(List<CssItem> newBlock) {
        return new AtRule(keyword, prelude, newBlock, null);
    }

    public AtRule withDeclarations(List<DeclarationItem> newDeclarations) {
        return new AtRule(keyword, prelude, null, newDeclarations);
    }

    /** Clave de condición: dos at-rules con misma clave son la misma condición. */
    public String conditionKey() {
        return keyword + " " + prelude;
    }
}
