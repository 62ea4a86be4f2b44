package com.ciro.jcss.extract;

import com.ciro.jcss.CssTables;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** selector → declaraciones tipográficas, en orden. Solo reglas del nivel superior. */
public final class FontExtractor {

    private final CssTables tables;

    public FontExtractor(CssTables tables) {
        this.tables = tables;
    }

    public Map<String, List<FontDeclaration>> extract(Stylesheet sheet) {
        Map<String, List<FontDeclaration>> fonts = new LinkedHashMap<>();
        for (CssItem item : sheet.items()) {
            if (!(item instanceof QualifiedRule rule)) continue;
            List<FontDeclaration> found = new ArrayList<>();
            for (Declaration d : rule.declarationsOnly()) {
                if (tables.isFontProperty(d.name())) found.add(new FontDeclaration(d.name(), d.value()));
            }
            if (!found.isEmpty()) {
                fonts.computeIfAbsent(rule.selector(), k -> new ArrayList<>()).addAll(found);
            }
        }
        return fonts;
    }
}
