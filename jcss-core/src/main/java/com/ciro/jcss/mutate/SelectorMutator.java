package com.ciro.jcss.mutate;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.error.DeclarationSyntaxException;
import com.ciro.jcss.syntax.CssSyntax;
import com.ciro.jcss.syntax.CssText;
import com.ciro.jcss.traverse.CssRewriter;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;
import com.helger.css.ECSSVersion;
import com.helger.css.reader.CSSReaderDeclarationList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Operaciones sobre reglas completas, a cualquier profundidad.
 */
public final class SelectorMutator {

    private static final Logger log = LoggerFactory.getLogger(SelectorMutator.class);

    private final CssWalker walker;
    private final CssSyntax syntax;

    public SelectorMutator(CssWalker walker, CssSyntax syntax) {
        this.walker = walker;
        this.syntax = syntax;
    }

    /** Borra las reglas con ese selector; la at-rule cuyo bloque queda vacío también se va. */
    public Stylesheet removeSelector(Stylesheet sheet, String selector) {
        String wanted = selector.trim();
        return walker.rewrite(sheet, new CssRewriter() {
            @Override
            public List<CssItem> rewriteRule(QualifiedRule rule, WalkContext ctx) {
                return rule.selector().equals(wanted) ? List.of() : List.of(rule);
            }

            @Override
            public List<CssItem> rewriteBlock(AtRule original, List<CssItem> newBlock, WalkContext ctx) {
                return newBlock.isEmpty() ? List.of() : List.of(original.withBlock(newBlock));
            }
        });
    }

    /**
     * Reemplaza las declaraciones de toda regla con ese selector por {@code declarations}
     * ({@code "color: red; margin: 0"}). Sin coincidencias, agrega la regla al final.
     *
     * @throws DeclarationSyntaxException si la lista no es válida
     */
    public Stylesheet replaceSelectorRule(Stylesheet sheet, String selector, String declarations) {
        List<DeclarationItem> replacement = validateDeclarations(declarations);
        String wanted = selector.trim();
        boolean[] found = {false};

        Stylesheet out = walker.rewrite(sheet, new CssRewriter() {
            @Override
            public List<CssItem> rewriteRule(QualifiedRule rule, WalkContext ctx) {
                if (!rule.selector().equals(wanted)) return List.of(rule);
                found[0] = true;
                return List.of(rule.withDeclarations(replacement));
            }
        });
        if (found[0]) return out;

        List<CssItem> items = new ArrayList<>(out.items());
        items.add(new QualifiedRule(wanted, replacement));
        return new Stylesheet(items);
    }

    /**
     * Tres filtros: cada parte separada por ';' debe tener ':', la lista debe ser legible por
     * ph-css y debe pasar el parseo estricto propio.
     */
    List<DeclarationItem> validateDeclarations(String declarations) {
        String text = declarations == null ? "" : declarations;
        List<String> parts = new ArrayList<>();
        for (String part : CssText.splitTopLevel(text, ';')) {
            if (part.isEmpty()) continue;
            if (part.indexOf(':') < 0) {
                throw new DeclarationSyntaxException("Invalid declaration syntax: Missing colon in '" + part + "'");
            }
            parts.add(part);
        }
        String normalized = parts.isEmpty() ? "" : String.join("; ", parts) + ";";

        if (!normalized.isEmpty() && CSSReaderDeclarationList.readFromString(normalized, ECSSVersion.CSS30) == null) {
            log.debug("ph-css rejected declaration list '{}'", normalized);
            throw new DeclarationSyntaxException("Invalid declaration syntax: '" + normalized + "'");
        }
        return syntax.parseDeclarations(normalized);
    }
}
