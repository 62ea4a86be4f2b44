package com.ciro.jcss.syntax;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;

import java.util.ArrayList;
import java.util.List;

/**
 * Único serializador del árbol. El formato lo decide {@link CssWriterSettings}.
 */
public final class CssWriter {

    private final CssWriterSettings settings;

    public CssWriter(CssWriterSettings settings) {
        this.settings = settings;
    }

    public CssWriterSettings getSettings() {
        return settings;
    }

    public String getCSSAsString(Stylesheet sheet) {
        return getCSSAsString(sheet.items());
    }

    public String getCSSAsString(List<CssItem> items) {
        StringBuilder sb = new StringBuilder();
        writeItems(sb, items, 0);
        return sb.toString();
    }

    /** Solo el cuerpo de un bloque: {@code color: red; margin: 0} o {@code color:red;margin:0}. */
    public String getDeclarationsAsString(List<DeclarationItem> declarations) {
        List<String> parts = new ArrayList<>();
        for (DeclarationItem item : declarations) {
            if (item instanceof Declaration d) {
                parts.add(declaration(d));
            } else if (item instanceof Comment c) {
                if (settings.writesComments()) parts.add(comment(c));
            } else {
                StringBuilder nested = new StringBuilder();
                writeNested(nested, item, 0);
                String text = nested.toString().strip();
                // el ';' de una sentencia lo pone el separador
                parts.add(text.endsWith(";") ? text.substring(0, text.length() - 1) : text);
            }
        }
        return String.join(settings.optimizedOutput() ? ";" : "; ", parts);
    }

    private void writeItems(StringBuilder sb, List<CssItem> items, int level) {
        boolean first = true;
        for (CssItem item : items) {
            if (item instanceof Comment && !settings.writesComments()) continue;
            if (!first && settings.blankLineBetweenItems()) sb.append('\n');
            first = false;

            if (item instanceof QualifiedRule rule) {
                writeDeclarationBlock(sb, selector(rule.selector(), level), rule.declarations(), level);
            } else if (item instanceof AtRule at) {
                writeAtRule(sb, at, level);
            } else if (item instanceof Comment c) {
                indent(sb, level).append(comment(c)).append('\n');
            }
        }
    }

    private void writeAtRule(StringBuilder sb, AtRule at, int level) {
        String head = at.prelude().isEmpty() ? "@" + at.keyword() : "@" + at.keyword() + " " + at.prelude();
        if (at.isStatement()) {
            if (settings.optimizedOutput()) {
                sb.append(head).append(';');
            } else {
                indent(sb, level).append(head).append(";\n");
            }
            return;
        }
        if (at.hasDeclarations()) {
            writeDeclarationBlock(sb, head, at.declarations(), level);
            return;
        }
        if (settings.optimizedOutput()) {
            sb.append(head).append('{');
            writeItems(sb, at.block(), level + 1);
            sb.append('}');
        } else {
            indent(sb, level).append(head).append(" {\n");
            writeItems(sb, at.block(), level + 1);
            indent(sb, level).append("}\n");
        }
    }

    private void writeDeclarationBlock(StringBuilder sb, String head, List<DeclarationItem> declarations, int level) {
        if (settings.optimizedOutput()) {
            sb.append(head).append('{').append(getDeclarationsAsString(declarations)).append('}');
            return;
        }
        indent(sb, level).append(head).append(" {\n");
        for (DeclarationItem item : declarations) {
            if (item instanceof Declaration d) {
                indent(sb, level + 1).append(declaration(d)).append(";\n");
            } else if (item instanceof Comment c) {
                if (settings.writesComments()) indent(sb, level + 1).append(comment(c)).append('\n');
            } else {
                writeNested(sb, item, level + 1);
            }
        }
        indent(sb, level).append("}\n");
    }

    // --- BLOQUES ANIDADOS EN DECLARACIONES ---

    private void writeNested(StringBuilder sb, DeclarationItem item, int level) {
        if (item instanceof QualifiedRule rule) {
            writeDeclarationBlock(sb, selector(rule.selector(), level), rule.declarations(), level);
        } else if (item instanceof AtRule at) {
            writeAtRule(sb, at, level);
        }
    }

    private String selector(String selector, int level) {
        if (!settings.splitSelectorList()) return selector;
        List<String> parts = CssText.splitTopLevel(selector, ',');
        if (parts.size() < 2) return selector;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) indent(sb.append(",\n"), level);
            sb.append(parts.get(i));
        }
        return sb.toString();
    }

    private String declaration(Declaration d) {
        if (settings.optimizedOutput()) {
            return d.name() + ":" + d.value() + (d.important() ? "!important" : "");
        }
        return d.name() + ": " + d.value() + (d.important() ? " !important" : "");
    }

    private static String comment(Comment c) {
        return "/* " + c.text() + " */";
    }

    private StringBuilder indent(StringBuilder sb, int level) {
        if (!settings.optimizedOutput()) {
            for (int i = 0; i < level; i++) sb.append(settings.indent());
        }
        return sb;
    }
}
