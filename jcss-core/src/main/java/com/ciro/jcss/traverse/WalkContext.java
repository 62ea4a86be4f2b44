package com.ciro.jcss.traverse;

import com.ciro.jcss.ast.AtRule;

import java.util.Set;

/**
 * Dónde está el walker: la at-rule que encierra el nivel actual (null en el nivel superior),
 * el contexto exterior y la profundidad.
 */
public record WalkContext(WalkContext outer, AtRule atRule, int depth) {

    private static final WalkContext ROOT = new WalkContext(null, null, 0);

    public static WalkContext root() {
        return ROOT;
    }

    public WalkContext enter(AtRule block) {
        return new WalkContext(this, block, depth + 1);
    }

    public boolean isTopLevel() {
        return atRule == null;
    }

    /** La at-rule más cercana cuyo keyword está en {@code keywords}, o null. */
    public AtRule nearest(Set<String> keywords) {
        for (WalkContext c = this; c != null; c = c.outer) {
            if (c.atRule != null && keywords.contains(c.atRule.keyword())) return c.atRule;
        }
        return null;
    }

    public AtRule nearest(String keyword) {
        return nearest(Set.of(keyword));
    }

    public boolean isInside(Set<String> keywords) {
        return nearest(keywords) != null;
    }
}
