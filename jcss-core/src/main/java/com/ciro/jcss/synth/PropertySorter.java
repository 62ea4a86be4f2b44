package com.ciro.jcss.synth;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declarations;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.traverse.CssRewriter;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.List;

/** Declaraciones por nombre (orden estable) y comentarios al final, en todos los niveles. */
public final class PropertySorter {

    private final CssWalker walker;

    public PropertySorter(CssWalker walker) {
        this.walker = walker;
    }

    public Stylesheet sort(Stylesheet sheet) {
        return walker.rewrite(sheet, new CssRewriter() {
            @Override
            public List<CssItem> rewriteRule(QualifiedRule rule, WalkContext ctx) {
                return List.of(rule.withDeclarations(Declarations.sortedByName(rule.declarations())));
            }

            @Override
            public List<CssItem> rewriteAtRule(AtRule atRule, WalkContext ctx) {
                if (!atRule.hasDeclarations()) return List.of(atRule);
                return List.of(atRule.withDeclarations(Declarations.sortedByName(atRule.declarations())));
            }
        });
    }
}
