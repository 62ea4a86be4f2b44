package com.ciro.jcss.extract;

import com.ciro.jcss.CssTables;
import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.traverse.CssVisitor;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Estadísticas de una hoja en un solo recorrido. Los fotogramas de {@code @keyframes}
 * no cuentan como reglas; sus comentarios sí.
 */
public final class StylesheetAnalyzer {

    private static final int TOP_PROPERTIES = 10;

    private final CssWalker walker;

    public StylesheetAnalyzer(CssWalker walker) {
        this.walker = walker;
    }

    public StylesheetAnalysis analyze(String css, Stylesheet sheet) {
        CssTables tables = walker.tables();
        Stats s = new Stats();

        walker.walk(sheet, new CssVisitor() {
            @Override
            public void visitRule(QualifiedRule rule, WalkContext ctx) {
                collectComments(rule.declarations(), s.comments);
                if (ctx.isInside(tables.keyframesKeywords())) return;
                s.rule(rule, ctx.nearest("media"), tables);
            }

            @Override
            public void visitAtRule(AtRule atRule, WalkContext ctx) {
                if (atRule.hasDeclarations()) {
                    collectComments(atRule.declarations(), s.comments);
                }
                if (ctx.isTopLevel() && "import".equals(atRule.keyword())) {
                    ImportRef ref = ImportRef.parse(atRule.prelude());
                    if (ref != null) {
                        s.imports.add(ref.url());
                        if (!ref.media().isEmpty()) s.importMedia.put(ref.url(), ref.media());
                    }
                }
            }

            @Override
            public void visitComment(Comment comment, WalkContext ctx) {
                s.comments.add(comment.text());
            }

            @Override
            public boolean enterBlock(AtRule block, WalkContext ctx) {
                if ("media".equals(block.keyword()) && !block.block().isEmpty()) {
                    s.mediaQueries.add(block.prelude());
                }
                return true;
            }
        });

        List<PropertyUsage> ranking = new ArrayList<>();
        s.propertyCounts.forEach((name, count) -> ranking.add(new PropertyUsage(name, count)));
        // sort estable: en empate se respeta el orden de primera aparición
        ranking.sort(Comparator.comparingInt(PropertyUsage::count).reversed());

        int total = 0;
        for (int c : s.propertyCounts.values()) total += c;

        Map<String, MediaQueryDetail> details = new LinkedHashMap<>();
        s.mediaDetails.forEach((condition, acc) ->
                details.put(condition, new MediaQueryDetail(acc.selectors, acc.properties)));

        return new StylesheetAnalysis(
                s.selectors,
                s.selectors.size(),
                new HashSet<>(s.selectors).size(),
                total,
                s.propertyCounts.size(),
                List.copyOf(ranking.subList(0, Math.min(TOP_PROPERTIES, ranking.size()))),
                s.colors.size(),
                new ArrayList<>(s.colors),
                s.fonts.size(),
                new ArrayList<>(s.fonts),
                s.mediaQueries.size(),
                s.mediaQueries,
                details,
                s.comments.size(),
                s.comments,
                css == null ? 0 : css.getBytes(StandardCharsets.UTF_8).length,
                s.selectorProperties,
                s.imports,
                s.imports.size(),
                s.importMedia);
    }

    private static void collectComments(List<DeclarationItem> items, List<String> out) {
        for (DeclarationItem item : items) {
            if (item instanceof Comment c) out.add(c.text());
        }
    }

    /** Acumuladores del recorrido. */
    private static final class Stats {
        final List<String> selectors = new ArrayList<>();
        final Map<String, Integer> propertyCounts = new LinkedHashMap<>();
        final Set<String> colors = new LinkedHashSet<>();
        final Set<String> fonts = new LinkedHashSet<>();
        final List<String> mediaQueries = new ArrayList<>();
        final Map<String, MediaAcc> mediaDetails = new LinkedHashMap<>();
        final List<String> comments = new ArrayList<>();
        final Map<String, Map<String, String>> selectorProperties = new LinkedHashMap<>();
        final List<String> imports = new ArrayList<>();
        final Map<String, String> importMedia = new LinkedHashMap<>();

        void rule(QualifiedRule rule, AtRule media, CssTables tables) {
            String selector = rule.selector();
            selectors.add(selector);
            MediaAcc acc = null;
            if (media != null) {
                acc = mediaDetails.computeIfAbsent(media.prelude(), k -> new MediaAcc());
                acc.selectors.add(selector);
            }
            Map<String, String> props = selectorProperties.computeIfAbsent(selector, k -> new LinkedHashMap<>());

            for (Declaration d : rule.declarationsOnly()) {
                propertyCounts.merge(d.name(), 1, Integer::sum);
                if (acc != null) acc.properties.merge(d.name(), 1, Integer::sum);
                props.put(d.name(), d.value());
                if (ColorExtractor.isColor(tables, d) || d.value().contains("#")) colors.add(d.value());
                if ("font".equals(d.name()) || "font-family".equals(d.name())) fonts.add(d.value());
            }
        }
    }

    private static final class MediaAcc {
        final List<String> selectors = new ArrayList<>();
        final Map<String, Integer> properties = new LinkedHashMap<>();
    }
}
