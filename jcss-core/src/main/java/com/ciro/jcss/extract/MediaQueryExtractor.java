package com.ciro.jcss.extract;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Declarations;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.traverse.CssVisitor;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * condición → reglas, agrupando cada regla bajo el {@code @media} más cercano.
 * Todo {@code @media} registra su condición aunque esté vacío. Los fotogramas de un
 * {@code @keyframes} no son reglas y no se listan.
 */
public final class MediaQueryExtractor {

    private static final String MEDIA = "media";

    private final CssWalker walker;

    public MediaQueryExtractor(CssWalker walker) {
        this.walker = walker;
    }

    public Map<String, List<MediaRule>> extract(Stylesheet sheet) {
        Map<String, List<MediaRule>> queries = new LinkedHashMap<>();
        walker.walk(sheet, new CssVisitor() {
            @Override
            public boolean enterBlock(AtRule block, WalkContext ctx) {
                if (MEDIA.equals(block.keyword())) {
                    queries.computeIfAbsent(block.prelude(), k -> new ArrayList<>());
                }
                return true;
            }

            @Override
            public void visitRule(QualifiedRule rule, WalkContext ctx) {
                AtRule media = ctx.nearest(MEDIA);
                if (media == null || ctx.isInside(walker.tables().keyframesKeywords())) return;
                queries.get(media.prelude())
                        .add(new MediaRule(rule.selector(), Declarations.valuesByName(rule.declarations())));
            }
        });
        return queries;
    }
}
