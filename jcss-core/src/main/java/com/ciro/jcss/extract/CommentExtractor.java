package com.ciro.jcss.extract;

import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asocia cada racha de comentarios del nivel superior con lo que viene después:
 * una regla, una declaración o nada (standalone). Un comentario escrito dentro de un valor
 * ya llega del parser delante de su declaración, así que se asocia a ella.
 */
public final class CommentExtractor {

    public CommentReport extract(Stylesheet sheet) {
        List<String> standalone = new ArrayList<>();
        Map<String, List<String>> ruleComments = new LinkedHashMap<>();
        Map<String, Map<String, List<String>>> declarationComments = new LinkedHashMap<>();
        List<String> pending = new ArrayList<>();

        for (CssItem item : sheet.items()) {
            if (item instanceof Comment c) {
                pending.add(c.text());
            } else if (item instanceof QualifiedRule rule) {
                if (!pending.isEmpty()) {
                    ruleComments.computeIfAbsent(rule.selector(), k -> new ArrayList<>()).addAll(pending);
                    pending.clear();
                }
                collectDeclarationComments(rule, declarationComments);
            } else {
                standalone.addAll(pending);
                pending.clear();
            }
        }
        standalone.addAll(pending);
        return new CommentReport(standalone, ruleComments, declarationComments);
    }

    private static void collectDeclarationComments(QualifiedRule rule,
                                                   Map<String, Map<String, List<String>>> out) {
        List<String> pending = new ArrayList<>();
        for (DeclarationItem item : rule.declarations()) {
            if (item instanceof Comment c) {
                pending.add(c.text());
            } else if (item instanceof Declaration d && !pending.isEmpty()) {
                out.computeIfAbsent(rule.selector(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(d.name(), k -> new ArrayList<>())
                        .addAll(pending);
                pending.clear();
            } else if (!(item instanceof Declaration)) {
                // un bloque anidado corta la racha
                pending.clear();
            }
        }
        // los que quedan al final del bloque no tienen declaración a la que pegarse
    }
}
