package com.ciro.jcss.mutate;

import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;

import java.util.ArrayList;
import java.util.List;

/**
 * Alta, baja y modificación de propiedades sobre las reglas de nivel superior.
 * El nombre recibido se compara como lo guarda el parser ({@link Declaration#normalizeName}).
 */
public final class PropertyMutator {

    /**
     * En la primera regla con ese selector reemplaza la primera declaración con ese nombre o la
     * agrega al final. Sin regla, crea una nueva al final de la hoja.
     */
    public Stylesheet addProperty(Stylesheet sheet, String selector, String property, String value, boolean important) {
        property = Declaration.normalizeName(property);
        Declaration incoming = new Declaration(property, value, important);
        List<CssItem> items = new ArrayList<>(sheet.items());
        int at = indexOfRule(items, selector);
        if (at < 0) {
            items.add(new QualifiedRule(selector, List.of(incoming)));
            return new Stylesheet(items);
        }

        QualifiedRule rule = (QualifiedRule) items.get(at);
        List<DeclarationItem> decls = new ArrayList<>(rule.declarations());
        boolean replaced = false;
        for (int i = 0; i < decls.size(); i++) {
            if (decls.get(i) instanceof Declaration d && d.name().equals(property)) {
                decls.set(i, incoming);
                replaced = true;
                break;
            }
        }
        if (!replaced) decls.add(incoming);
        items.set(at, rule.withDeclarations(decls));
        return new Stylesheet(items);
    }

    /** Quita todas las declaraciones con ese nombre; la regla que se queda sin declaraciones desaparece. */
    public Stylesheet removeProperty(Stylesheet sheet, String selector, String property) {
        property = Declaration.normalizeName(property);
        String wanted = selector.trim();
        List<CssItem> items = new ArrayList<>(sheet.items().size());
        for (CssItem item : sheet.items()) {
            if (item instanceof QualifiedRule rule && rule.selector().equals(wanted)) {
                List<DeclarationItem> kept = new ArrayList<>();
                for (DeclarationItem d : rule.declarations()) {
                    if (!(d instanceof Declaration decl && decl.name().equals(property))) kept.add(d);
                }
                QualifiedRule updated = rule.withDeclarations(kept);
                if (updated.hasDeclarations()) items.add(updated);
            } else {
                items.add(item);
            }
        }
        return new Stylesheet(items);
    }

    /**
     * Cambia el valor de todas las declaraciones con ese nombre en la primera regla con ese selector.
     * Si la propiedad no está se agrega; si el selector no está se crea la regla.
     */
    public Stylesheet modifyPropertyValue(Stylesheet sheet, String selector, String property, String value,
                                          Importance importance) {
        property = Declaration.normalizeName(property);
        List<CssItem> items = new ArrayList<>(sheet.items());
        int at = indexOfRule(items, selector);
        if (at < 0) {
            return addProperty(sheet, selector, property, value, importance.apply(false));
        }

        QualifiedRule rule = (QualifiedRule) items.get(at);
        List<DeclarationItem> decls = new ArrayList<>(rule.declarations());
        boolean found = false;
        for (int i = 0; i < decls.size(); i++) {
            if (decls.get(i) instanceof Declaration d && d.name().equals(property)) {
                decls.set(i, new Declaration(property, value, importance.apply(d.important())));
                found = true;
            }
        }
        if (!found) {
            return addProperty(sheet, selector, property, value, importance.apply(false));
        }
        items.set(at, rule.withDeclarations(decls));
        return new Stylesheet(items);
    }

    static int indexOfRule(List<CssItem> items, String selector) {
        String wanted = selector.trim();
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof QualifiedRule rule && rule.selector().equals(wanted)) return i;
        }
        return -1;
    }
}
