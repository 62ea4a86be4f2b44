package com.ciro.jcss.synth;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.Declarations;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fusión estructural por nivel, en dos fases: primero clave → primer índice, después emisión.
 * Reglas con igual selector se funden en la primera (la última declaración gana) y los
 * {@code @media} con igual condición juntan sus cuerpos, que se deduplican a su vez.
 */
public final class Deduplicator {

    private static final String MEDIA = "media";

    private final CssWalker walker;

    public Deduplicator(CssWalker walker) {
        this.walker = walker;
    }

    public Stylesheet removeDuplicates(Stylesheet sheet) {
        return walker.transformLevels(sheet, this::dedupLevel);
    }

    List<CssItem> dedupLevel(List<CssItem> level, WalkContext ctx) {
        // fase 1: agrupar
        List<Slot> slots = new ArrayList<>(level.size());
        Map<String, Slot> byKey = new HashMap<>();
        for (CssItem item : level) {
            String key = keyOf(item);
            Slot existing = key == null ? null : byKey.get(key);
            if (existing != null) {
                existing.absorb(item);
                continue;
            }
            Slot slot = new Slot(item);
            slots.add(slot);
            if (key != null) byKey.put(key, slot);
        }

        // fase 2: emitir
        List<CssItem> out = new ArrayList<>(slots.size());
        for (Slot slot : slots) out.add(slot.emit());
        return out;
    }

    private static String keyOf(CssItem item) {
        if (item instanceof QualifiedRule rule) return "rule " + rule.selector();
        if (item instanceof AtRule at && at.hasBlock() && MEDIA.equals(at.keyword())) return "@" + at.conditionKey();
        return null;
    }

    /** Primer item de una clave y lo que se le va sumando. */
    private static final class Slot {
        final CssItem first;
        List<DeclarationItem> declarations;
        List<CssItem> block;

        Slot(CssItem first) {
            this.first = first;
            if (first instanceof QualifiedRule rule) declarations = rule.declarations();
            else if (first instanceof AtRule at && at.hasBlock()) block = new ArrayList<>(at.block());
        }

        void absorb(CssItem item) {
            if (item instanceof QualifiedRule rule) {
                declarations = Declarations.override(declarations, rule.declarations());
            } else if (item instanceof AtRule at) {
                block.addAll(at.block());
            }
        }

        CssItem emit() {
            if (first instanceof QualifiedRule rule) {
                return rule.withDeclarations(Declarations.sortedByName(Declarations.collapse(declarations)));
            }
            if (first instanceof AtRule at && block != null) {
                return at.withBlock(block);
            }
            return first;
        }
    }
}
