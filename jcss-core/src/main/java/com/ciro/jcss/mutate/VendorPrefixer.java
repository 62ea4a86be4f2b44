package com.ciro.jcss.mutate;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.traverse.CssRewriter;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Antes de cada declaración {@code property} inserta una copia por prefijo, en el orden dado:
 * {@code transform} con {@code [-webkit-, -moz-]} queda {@code -webkit-transform, -moz-transform, transform}.
 */
public final class VendorPrefixer {

    private final CssWalker walker;

    public VendorPrefixer(CssWalker walker) {
        this.walker = walker;
    }

    public Stylesheet addVendorPrefix(Stylesheet sheet, String property, List<String> prefixes) {
        if (prefixes.isEmpty()) return sheet;
        return walker.rewrite(sheet, new CssRewriter() {
            @Override
            public List<CssItem> rewriteRule(QualifiedRule rule, WalkContext ctx) {
                return List.of(rule.withDeclarations(prefix(rule.declarations(), property, prefixes)));
            }

            @Override
            public List<CssItem> rewriteAtRule(AtRule atRule, WalkContext ctx) {
                if (!atRule.hasDeclarations()) return List.of(atRule);
                return List.of(atRule.withDeclarations(prefix(atRule.declarations(), property, prefixes)));
            }
        });
    }

    private static List<DeclarationItem> prefix(List<DeclarationItem> items, String property, List<String> prefixes) {
        String name = Declaration.normalizeName(property);
        List<DeclarationItem> out = new ArrayList<>(items.size());
        for (DeclarationItem item : items) {
            if (item instanceof Declaration d && d.name().equals(name)) {
                for (String prefix : prefixes) out.add(d.withName(prefix + name));
            }
            out.add(item);
        }
        return out;
    }
}
