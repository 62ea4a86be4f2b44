package com.ciro.jcss.extract;

import com.ciro.jcss.CssTables;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.traverse.CssVisitor;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * selector → ["propiedad: valor", ...] para toda declaración que sea de color,
 * por nombre de propiedad o por la forma del valor. Baja a los bloques recorribles.
 */
public final class ColorExtractor {

    private static final Pattern COLOR_VALUE = Pattern.compile(
            "#(?:[0-9a-fA-F]{3}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})"
                    + "|rgb\\(\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+\\s*\\)"
                    + "|rgba\\(\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*[0-9.]+\\s*\\)"
                    + "|hsl\\(\\s*\\d+\\s*,\\s*\\d+%\\s*,\\s*\\d+%\\s*\\)"
                    + "|hsla\\(\\s*\\d+\\s*,\\s*\\d+%\\s*,\\s*\\d+%\\s*,\\s*[0-9.]+\\s*\\)");

    private final CssWalker walker;

    public ColorExtractor(CssWalker walker) {
        this.walker = walker;
    }

    public Map<String, List<String>> extract(Stylesheet sheet) {
        CssTables tables = walker.tables();
        Map<String, List<String>> colors = new LinkedHashMap<>();
        walker.walk(sheet, new CssVisitor() {
            @Override
            public void visitRule(QualifiedRule rule, WalkContext ctx) {
                for (Declaration d : rule.declarationsOnly()) {
                    if (isColor(tables, d)) {
                        colors.computeIfAbsent(rule.selector(), k -> new ArrayList<>())
                                .add(d.name() + ": " + d.value());
                    }
                }
            }
        });
        return colors;
    }

    static boolean isColor(CssTables tables, Declaration d) {
        return tables.isColorProperty(d.name())
                || tables.isNamedColor(d.value())
                || COLOR_VALUE.matcher(d.value()).find();
    }
}
