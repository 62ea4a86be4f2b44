package com.ciro.jcss.process;

import com.ciro.jcss.CssTools;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.syntax.CssText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pipelines de alto nivel encadenando operaciones de {@link CssTools}.
 */
public final class CssProcessor {

    private static final Logger log = LoggerFactory.getLogger(CssProcessor.class);

    static final String HIDE_SCROLLBAR = ".hide-scrollbar";

    private final CssTools tools;

    public CssProcessor(CssTools tools) {
        this.tools = tools;
    }

    public CssTools tools() {
        return tools;
    }

    /** Compatibilidad → duplicados → orden → minificado, cada paso según {@code options}. */
    public String processForProduction(String css, ProductionOptions options) {
        log.debug("processForProduction {}", options);
        String out = css;
        if (options.addPrefixes()) out = applyBrowserCompatibility(out);
        if (options.removeDuplicates()) out = tools.removeDuplicates(out);
        if (options.sort()) out = tools.sortProperties(out);
        if (options.minify()) out = tools.minify(out);
        return out;
    }

    /** {@code html} puede ser null: entonces no se buscan selectores sin uso. */
    public DevelopmentReport processForDevelopment(String css, String html) {
        log.debug("processForDevelopment (html: {})", html != null);
        return new DevelopmentReport(
                tools.beautify(css),
                tools.analyzeStylesheet(css),
                html == null ? List.of() : tools.extractUnusedSelectors(css, html),
                tools.extractColors(css),
                tools.extractFonts(css));
    }

    /** Prefijos de la tabla de {@link com.ciro.jcss.CssTables} en orden y {@code .hide-scrollbar { display: none }}. */
    public String applyBrowserCompatibility(String css) {
        String out = css;
        for (Map.Entry<String, List<String>> e : tools.tables().browserPrefixes().entrySet()) {
            out = tools.addVendorPrefix(out, e.getKey(), e.getValue());
        }
        return tools.addProperty(out, HIDE_SCROLLBAR, "display", "none", false);
    }

    /**
     * Reglas de nivel superior cuyo selector es uno de {@code selectors} o lo lista entre sus
     * partes separadas por comas. Salen en el orden pedido y se quitan del resto.
     */
    public CriticalCss extractCriticalCss(String css, List<String> selectors) {
        Stylesheet sheet = tools.parse(css);
        List<CssItem> remaining = new ArrayList<>(sheet.items());
        List<CssItem> critical = new ArrayList<>();

        for (String wanted : selectors) {
            String target = wanted.trim();
            remaining.removeIf(item -> {
                if (item instanceof QualifiedRule rule && matches(rule, target)) {
                    critical.add(rule);
                    return true;
                }
                return false;
            });
        }
        log.debug("extractCriticalCss: {} critical rules", critical.size());
        return new CriticalCss(tools.serialize(new Stylesheet(critical)), tools.serialize(new Stylesheet(remaining)));
    }

    /** Une los contenidos en el orden del mapa y aplica {@link #processForProduction}. */
    public String mergeCssFiles(Map<String, String> files, ProductionOptions options) {
        log.debug("mergeCssFiles {}", files.keySet());
        String merged = tools.mergeStylesheets(new ArrayList<>(files.values()));
        return processForProduction(merged, options);
    }

    private static boolean matches(QualifiedRule rule, String selector) {
        return rule.selector().equals(selector) || CssText.splitTopLevel(rule.selector(), ',').contains(selector);
    }
}
