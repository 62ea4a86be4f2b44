package com.ciro.jcss.synth;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.syntax.CssText;
import com.ciro.jcss.syntax.CssWriter;
import com.ciro.jcss.syntax.CssWriterSettings;
import com.ciro.jcss.traverse.CssRewriter;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Salida mínima: sin comentarios, sin espacios alrededor de combinadores y comas,
 * {@code #aabbcc} → {@code #abc}, sin reglas ni bloques vacíos.
 */
public final class Minifier {

    private static final String SELECTOR_SEPARATORS = ",>+~";

    private final CssWalker walker;
    private final CssWriter writer = new CssWriter(CssWriterSettings.optimized());

    public Minifier(CssWalker walker) {
        this.walker = walker;
    }

    public String minify(Stylesheet sheet) {
        return writer.getCSSAsString(compact(sheet));
    }

    public Stylesheet compact(Stylesheet sheet) {
        return walker.rewrite(sheet, new CssRewriter() {
            @Override
            public List<CssItem> rewriteRule(QualifiedRule rule, WalkContext ctx) {
                List<DeclarationItem> decls = compactDeclarations(rule.declarations());
                if (decls.isEmpty()) return List.of();
                return List.of(new QualifiedRule(CssText.compactAround(rule.selector(), SELECTOR_SEPARATORS), decls));
            }

            @Override
            public List<CssItem> rewriteAtRule(AtRule atRule, WalkContext ctx) {
                if (atRule.hasBlock()) {
                    // bloque de reglas que no se recorre: solo sobreviven las que no quedan vacías
                    return atRule.block().isEmpty() ? List.of() : List.of(atRule);
                }
                if (!atRule.hasDeclarations()) return List.of(atRule);
                List<DeclarationItem> decls = compactDeclarations(atRule.declarations());
                return decls.isEmpty() ? List.of() : List.of(atRule.withDeclarations(decls));
            }

            @Override
            public List<CssItem> rewriteComment(Comment comment, WalkContext ctx) {
                return List.of();
            }

            @Override
            public List<CssItem> rewriteBlock(AtRule original, List<CssItem> newBlock, WalkContext ctx) {
                return newBlock.isEmpty() ? List.of() : List.of(original.withBlock(newBlock));
            }
        });
    }

    private static List<DeclarationItem> compactDeclarations(List<DeclarationItem> items) {
        List<DeclarationItem> out = new ArrayList<>(items.size());
        for (DeclarationItem item : items) {
            if (item instanceof Declaration d) {
                out.add(d.withValue(shortenHex(CssText.compactAround(d.value(), ","))));
            } else if (item instanceof QualifiedRule nested) {
                List<DeclarationItem> inner = compactDeclarations(nested.declarations());
                if (!inner.isEmpty()) {
                    out.add(new QualifiedRule(CssText.compactAround(nested.selector(), SELECTOR_SEPARATORS), inner));
                }
            } else if (item instanceof AtRule nested) {
                if (nested.hasDeclarations()) {
                    List<DeclarationItem> inner = compactDeclarations(nested.declarations());
                    if (!inner.isEmpty()) out.add(nested.withDeclarations(inner));
                } else if (nested.isStatement() || !nested.block().isEmpty()) {
                    out.add(nested);
                }
            }
        }
        return out;
    }

    /** {@code #112233} → {@code #123}; {@code #112234} y {@code #1122334} quedan igual. Fuera de strings. */
    static String shortenHex(String value) {
        StringBuilder out = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '"' || c == '\'') {
                int end = value.indexOf(c, i + 1);
                end = end < 0 ? value.length() : end + 1;
                out.append(value, i, end);
                i = end;
                continue;
            }
            if (c == '#' && isShortenable(value, i + 1)) {
                out.append('#').append(value.charAt(i + 1)).append(value.charAt(i + 3)).append(value.charAt(i + 5));
                i += 7;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static boolean isShortenable(String value, int start) {
        if (start + 6 > value.length()) return false;
        for (int k = start; k < start + 6; k++) {
            if (Character.digit(value.charAt(k), 16) < 0) return false;
        }
        if (start + 6 < value.length()) {
            char next = value.charAt(start + 6);
            if (Character.isLetterOrDigit(next) || next == '-' || next == '_') return false;
        }
        return value.charAt(start) == value.charAt(start + 1)
                && value.charAt(start + 2) == value.charAt(start + 3)
                && value.charAt(start + 4) == value.charAt(start + 5);
    }
}
