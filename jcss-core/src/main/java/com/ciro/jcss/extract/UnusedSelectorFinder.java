package com.ciro.jcss.extract;

import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heurística por substring: {@code .x} no se usa si el HTML no contiene {@code class="x"}
 * ni {@code class='x'}; {@code #x} igual con {@code id=}. Los selectores de elemento nunca se reportan.
 */
public final class UnusedSelectorFinder {

    private static final Pattern PSEUDO = Pattern.compile("::?[a-zA-Z-]+(\\([^)]*\\))?");
    private static final Pattern COMBINATOR = Pattern.compile("\\s*[,>+~]\\s*");

    public List<String> find(Stylesheet sheet, String html) {
        String page = html == null ? "" : html;
        Set<String> simple = new LinkedHashSet<>();
        for (CssItem item : sheet.items()) {
            if (!(item instanceof QualifiedRule rule)) continue;
            String base = PSEUDO.matcher(rule.selector()).replaceAll("");
            for (String part : COMBINATOR.split(base)) {
                String p = part.trim();
                if (!p.isEmpty()) simple.add(p);
            }
        }

        List<String> unused = new ArrayList<>();
        for (String selector : simple) {
            if (selector.startsWith(".")) {
                if (!mentions(page, "class", selector.substring(1))) unused.add(selector);
            } else if (selector.startsWith("#")) {
                if (!mentions(page, "id", selector.substring(1))) unused.add(selector);
            }
        }
        return unused;
    }

    private static boolean mentions(String html, String attribute, String name) {
        return html.contains(attribute + "=\"" + name + "\"") || html.contains(attribute + "='" + name + "'");
    }
}
