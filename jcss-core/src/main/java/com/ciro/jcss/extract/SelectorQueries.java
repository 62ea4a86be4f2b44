package com.ciro.jcss.extract;

import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.Declarations;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.traverse.CssVisitor;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Consultas puntuales por selector o por propiedad. */
public final class SelectorQueries {

    private final CssWalker walker;

    public SelectorQueries(CssWalker walker) {
        this.walker = walker;
    }

    /** ¿Hay una regla de nivel superior con exactamente ese selector? */
    public boolean exists(Stylesheet sheet, String selector) {
        return firstRule(sheet, selector).isPresent();
    }

    /** propiedad → valor (la última gana) de la primera regla de nivel superior con ese selector. */
    public Optional<Map<String, String>> properties(Stylesheet sheet, String selector) {
        return firstRule(sheet, selector).map(rule -> Declarations.valuesByName(rule.declarations()));
    }

    /** selector → valor de {@code property}, en cualquier bloque salvo fotogramas de keyframes. */
    public Map<String, String> selectorsByProperty(Stylesheet sheet, String property) {
        String name = Declaration.normalizeName(property);
        Map<String, String> out = new LinkedHashMap<>();
        walker.walk(sheet, new CssVisitor() {
            @Override
            public void visitRule(QualifiedRule rule, WalkContext ctx) {
                if (ctx.isInside(walker.tables().keyframesKeywords())) return;
                for (Declaration d : rule.declarationsOnly()) {
                    if (d.name().equals(name)) out.put(rule.selector(), d.value());
                }
            }
        });
        return out;
    }

    private static Optional<QualifiedRule> firstRule(Stylesheet sheet, String selector) {
        String wanted = selector == null ? "" : selector.trim();
        for (CssItem item : sheet.items()) {
            if (item instanceof QualifiedRule rule && rule.selector().equals(wanted)) return Optional.of(rule);
        }
        return Optional.empty();
    }
}
