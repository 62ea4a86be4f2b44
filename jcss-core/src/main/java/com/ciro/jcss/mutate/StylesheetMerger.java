package com.ciro.jcss.mutate;

import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declarations;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Une hojas en orden. Reglas de nivel superior con el mismo selector se funden en la primera
 * (la última declaración de cada nombre gana); at-rules y comentarios se agregan tal cual.
 */
public final class StylesheetMerger {

    public Stylesheet merge(List<Stylesheet> sheets) {
        List<CssItem> out = new ArrayList<>();
        Map<String, Integer> firstIndex = new HashMap<>();
        for (Stylesheet sheet : sheets) {
            for (CssItem item : sheet.items()) {
                if (item instanceof QualifiedRule rule) {
                    Integer at = firstIndex.get(rule.selector());
                    if (at == null) {
                        firstIndex.put(rule.selector(), out.size());
                        out.add(rule.withDeclarations(Declarations.collapse(rule.declarations())));
                    } else {
                        QualifiedRule existing = (QualifiedRule) out.get(at);
                        out.set(at, existing.withDeclarations(
                                Declarations.override(existing.declarations(), rule.declarations())));
                    }
                } else {
                    out.add(item);
                }
            }
        }
        return new Stylesheet(out);
    }
}
