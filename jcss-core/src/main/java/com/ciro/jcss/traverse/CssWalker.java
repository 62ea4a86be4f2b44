package com.ciro.jcss.traverse;

import com.ciro.jcss.CssTables;
import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.error.CssSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Único motor de recorrido. Baja a los bloques de las at-rules cuyo keyword está en
 * {@link CssTables#recurseKeywords()} y corta con {@link CssSyntaxException} al pasar de
 * {@link CssTables#maxDepth()}.
 */
public final class CssWalker {

    private final CssTables tables;

    public CssWalker(CssTables tables) {
        this.tables = tables;
    }

    public CssTables tables() {
        return tables;
    }

    public boolean recurses(AtRule at) {
        return at.hasBlock() && tables.recursesInto(at.keyword());
    }

    // --- LECTURA ---

    public void walk(Stylesheet sheet, CssVisitor visitor) {
        walk(sheet.items(), visitor, WalkContext.root());
    }

    public void walk(List<CssItem> items, CssVisitor visitor, WalkContext ctx) {
        for (CssItem item : items) {
            if (item instanceof QualifiedRule rule) {
                visitor.visitRule(rule, ctx);
            } else if (item instanceof AtRule at) {
                if (recurses(at)) {
                    if (visitor.enterBlock(at, ctx)) {
                        walk(at.block(), visitor, enter(ctx, at));
                        visitor.exitBlock(at, ctx);
                    }
                } else {
                    visitor.visitAtRule(at, ctx);
                }
            } else if (item instanceof Comment c) {
                visitor.visitComment(c, ctx);
            }
        }
    }

    // --- REESCRITURA ITEM A ITEM ---

    public Stylesheet rewrite(Stylesheet sheet, CssRewriter rewriter) {
        return new Stylesheet(rewrite(sheet.items(), rewriter, WalkContext.root()));
    }

    public List<CssItem> rewrite(List<CssItem> items, CssRewriter rewriter, WalkContext ctx) {
        List<CssItem> out = new ArrayList<>(items.size());
        for (CssItem item : items) {
            if (item instanceof QualifiedRule rule) {
                out.addAll(rewriter.rewriteRule(rule, ctx));
            } else if (item instanceof AtRule at) {
                if (recurses(at)) {
                    List<CssItem> inner = rewrite(at.block(), rewriter, enter(ctx, at));
                    out.addAll(rewriter.rewriteBlock(at, inner, ctx));
                } else {
                    out.addAll(rewriter.rewriteAtRule(at, ctx));
                }
            } else if (item instanceof Comment c) {
                out.addAll(rewriter.rewriteComment(c, ctx));
            }
        }
        return out;
    }

    // --- TRANSFORMACIÓN POR NIVELES ---

    /**
     * Aplica {@code transform} al nivel y después, sobre el resultado, a cada bloque recorrible.
     */
    public Stylesheet transformLevels(Stylesheet sheet, LevelTransform transform) {
        return new Stylesheet(transformLevels(sheet.items(), transform, WalkContext.root()));
    }

    public List<CssItem> transformLevels(List<CssItem> items, LevelTransform transform, WalkContext ctx) {
        List<CssItem> level = transform.transform(items, ctx);
        List<CssItem> out = new ArrayList<>(level.size());
        for (CssItem item : level) {
            if (item instanceof AtRule at && recurses(at)) {
                out.add(at.withBlock(transformLevels(at.block(), transform, enter(ctx, at))));
            } else {
                out.add(item);
            }
        }
        return out;
    }

    private WalkContext enter(WalkContext ctx, AtRule at) {
        if (ctx.depth() + 1 > tables.maxDepth()) {
            throw new CssSyntaxException("CSS syntax error: Nesting deeper than " + tables.maxDepth() + " levels");
        }
        return ctx.enter(at);
    }
}
