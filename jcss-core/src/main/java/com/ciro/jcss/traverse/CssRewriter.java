package com.ciro.jcss.traverse;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.QualifiedRule;

import java.util.List;

/**
 * Reescritura item a item: cada método devuelve la lista que reemplaza al item
 * (vacía para borrarlo). Por defecto todo queda igual.
 */
public interface CssRewriter {

    default List<CssItem> rewriteRule(QualifiedRule rule, WalkContext ctx) {
        return List.of(rule);
    }

    default List<CssItem> rewriteAtRule(AtRule atRule, WalkContext ctx) {
        return List.of(atRule);
    }

    default List<CssItem> rewriteComment(Comment comment, WalkContext ctx) {
        return List.of(comment);
    }

    /**
     * Reensambla un bloque ya reescrito. {@code ctx} es el contexto exterior.
     */
    default List<CssItem> rewriteBlock(AtRule original, List<CssItem> newBlock, WalkContext ctx) {
        return List.of(original.withBlock(newBlock));
    }
}
