package com.ciro.jcss.ast;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reglas de override compartidas por merge y dedup: "last write wins" por nombre.
 */
public final class Declarations {

    private Declarations() {}

    /**
     * Concatena {@code base} + {@code incoming} dejando una sola declaración por nombre.
     * La superviviente ocupa la posición de la primera aparición y toma valor e
     * {@code !important} de la última. Los comentarios se conservan en orden de llegada.
     */
    public static List<DeclarationItem> override(List<DeclarationItem> base, List<DeclarationItem> incoming) {
        List<DeclarationItem> out = new ArrayList<>(base.size() + incoming.size());
        Map<String, Integer> positions = new HashMap<>();
        apply(out, positions, base);
        apply(out, positions, incoming);
        return out;
    }

    /** Colapsa duplicados dentro de una misma lista. */
    public static List<DeclarationItem> collapse(List<DeclarationItem> items) {
        return override(items, List.of());
    }

    private static void apply(List<DeclarationItem> out, Map<String, Integer> positions, List<DeclarationItem> items) {
        for (DeclarationItem item : items) {
            if (item instanceof Declaration d) {
                Integer at = positions.get(d.name());
                if (at != null) {
                    out.set(at, d);
                } else {
                    positions.put(d.name(), out.size());
                    out.add(d);
                }
            } else {
                out.add(item);
            }
        }
    }

    /**
     * Declaraciones ordenadas por nombre (orden estable en empates); comentarios y bloques
     * anidados al final, en su orden.
     */
    public static List<DeclarationItem> sortedByName(List<DeclarationItem> items) {
        List<Declaration> decls = new ArrayList<>();
        List<DeclarationItem> comments = new ArrayList<>();
        for (DeclarationItem item : items) {
            if (item instanceof Declaration d) decls.add(d);
            else comments.add(item);
        }
        decls.sort(Comparator.comparing(Declaration::name));

        List<DeclarationItem> out = new ArrayList<>(decls);
        out.addAll(comments);
        return out;
    }

    /** nombre → valor, la última aparición gana. */
    public static Map<String, String> valuesByName(List<DeclarationItem> items) {
        Map<String, String> props = new LinkedHashMap<>();
        for (DeclarationItem item : items) {
            if (item instanceof Declaration d) props.put(d.name(), d.value());
        }
        return props;
    }
}
