package com.ciro.jcss.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Selector + bloque de declaraciones, ej: {@code .btn, .btn-primary { color: red; }}.
 * El selector se guarda tal cual (con espacios normalizados), no se descompone.
 */
public record QualifiedRule(String selector, List<DeclarationItem> declarations) implements CssItem, DeclarationItem {

    public QualifiedRule {
        selector = Objects.requireNonNull(selector, "selector").trim();
        declarations = List.copyOf(declarations);
    }

    /** Solo las declaraciones, en orden de aparición. */
    public List<Declaration> declarationsOnly() {
        List<Declaration> out = new ArrayList<>();
        for (DeclarationItem item : declarations) {
            if (item instanceof Declaration d) out.add(d);
        }
        return out;
    }

    /** Algo más que comentarios: declaraciones o bloques anidados. */
    public boolean hasDeclarations() {
        for (DeclarationItem item : declarations) {
            if (!(item instanceof Comment)) return true;
        }
        return false;
    }

    public QualifiedRule withSelector(String newSelector) {
        return new QualifiedRule(newSelector, declarations);
    }

    public QualifiedRule withDeclarations(List<DeclarationItem> newDeclarations) {
        return new QualifiedRule(selector, newDeclarations);
    }
}
