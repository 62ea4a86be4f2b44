package com.ciro.jcss;

import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.error.CssException;
import com.ciro.jcss.error.CssInput;
import com.ciro.jcss.extract.AnimationExtractor;
import com.ciro.jcss.extract.AnimationInfo;
import com.ciro.jcss.extract.ColorExtractor;
import com.ciro.jcss.extract.CommentExtractor;
import com.ciro.jcss.extract.CommentReport;
import com.ciro.jcss.extract.FontDeclaration;
import com.ciro.jcss.extract.FontExtractor;
import com.ciro.jcss.extract.MediaQueryExtractor;
import com.ciro.jcss.extract.MediaRule;
import com.ciro.jcss.extract.SelectorQueries;
import com.ciro.jcss.extract.StylesheetAnalysis;
import com.ciro.jcss.extract.StylesheetAnalyzer;
import com.ciro.jcss.extract.UnusedSelectorFinder;
import com.ciro.jcss.extract.ValidationResult;
import com.ciro.jcss.mutate.ImportMutator;
import com.ciro.jcss.mutate.Importance;
import com.ciro.jcss.mutate.PropertyMutator;
import com.ciro.jcss.mutate.SelectorMutator;
import com.ciro.jcss.mutate.StylesheetMerger;
import com.ciro.jcss.mutate.VendorPrefixer;
import com.ciro.jcss.synth.Beautifier;
import com.ciro.jcss.synth.Deduplicator;
import com.ciro.jcss.synth.Minifier;
import com.ciro.jcss.synth.PropertySorter;
import com.ciro.jcss.syntax.CssSyntax;
import com.ciro.jcss.syntax.CssWriterSettings;
import com.ciro.jcss.syntax.DefaultCssSyntax;
import com.ciro.jcss.traverse.CssWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fachada: texto CSS de entrada, texto o datos de salida. Cada llamada vuelve a parsear,
 * no hay estado entre llamadas.
 */
public final class CssTools {

    private static final Logger log = LoggerFactory.getLogger(CssTools.class);

    private final CssTables tables;
    private final CssSyntax syntax;
    private final CssWalker walker;

    private final ColorExtractor colors;
    private final MediaQueryExtractor mediaQueries;
    private final AnimationExtractor animations;
    private final FontExtractor fonts;
    private final CommentExtractor comments = new CommentExtractor();
    private final UnusedSelectorFinder unused = new UnusedSelectorFinder();
    private final StylesheetAnalyzer analyzer;
    private final SelectorQueries queries;

    private final PropertyMutator properties = new PropertyMutator();
    private final SelectorMutator selectors;
    private final VendorPrefixer prefixer;
    private final StylesheetMerger merger = new StylesheetMerger();
    private final ImportMutator imports = new ImportMutator();

    private final Minifier minifier;
    private final Beautifier beautifier = new Beautifier();
    private final PropertySorter sorter;
    private final Deduplicator deduplicator;

    public CssTools() {
        this(CssTables.defaults());
    }

    public CssTools(CssTables tables) {
        this.tables = tables;
        this.syntax = new DefaultCssSyntax(tables.recurseKeywords());
        this.walker = new CssWalker(tables);
        this.colors = new ColorExtractor(walker);
        this.mediaQueries = new MediaQueryExtractor(walker);
        this.animations = new AnimationExtractor(walker);
        this.fonts = new FontExtractor(tables);
        this.analyzer = new StylesheetAnalyzer(walker);
        this.queries = new SelectorQueries(walker);
        this.selectors = new SelectorMutator(walker, syntax);
        this.prefixer = new VendorPrefixer(walker);
        this.minifier = new Minifier(walker);
        this.sorter = new PropertySorter(walker);
        this.deduplicator = new Deduplicator(walker);
    }

    public CssTables tables() {
        return tables;
    }

    /** Pre-chequeo de llaves y parseo estructural. */
    public Stylesheet parse(String css) {
        return syntax.parse(CssInput.requireBalanced(css));
    }

    /** Salida estándar: 4 espacios de sangría, una declaración por línea. */
    public String serialize(Stylesheet sheet) {
        return syntax.serialize(sheet, CssWriterSettings.standard());
    }

    // --- EXTRACTORES ---

    public Map<String, List<String>> extractColors(String css) {
        log.debug("extractColors ({} chars)", length(css));
        return colors.extract(parse(css));
    }

    public Map<String, List<MediaRule>> extractMediaQueries(String css) {
        log.debug("extractMediaQueries ({} chars)", length(css));
        return mediaQueries.extract(parse(css));
    }

    public Map<String, AnimationInfo> extractAnimations(String css) {
        log.debug("extractAnimations ({} chars)", length(css));
        return animations.extract(parse(css));
    }

    public Map<String, List<FontDeclaration>> extractFonts(String css) {
        log.debug("extractFonts ({} chars)", length(css));
        return fonts.extract(parse(css));
    }

    public CommentReport extractComments(String css) {
        log.debug("extractComments ({} chars)", length(css));
        return comments.extract(parse(css));
    }

    public List<String> extractUnusedSelectors(String css, String html) {
        log.debug("extractUnusedSelectors ({} chars css, {} chars html)", length(css), length(html));
        return unused.find(parse(css), html);
    }

    public StylesheetAnalysis analyzeStylesheet(String css) {
        log.debug("analyzeStylesheet ({} chars)", length(css));
        return analyzer.analyze(css, parse(css));
    }

    public boolean selectorExists(String css, String selector) {
        return queries.exists(parse(css), selector);
    }

    public Optional<Map<String, String>> getSelectorProperties(String css, String selector) {
        return queries.properties(parse(css), selector);
    }

    public Map<String, String> extractSelectorsByProperty(String css, String property) {
        return queries.selectorsByProperty(parse(css), property);
    }

    /** Nunca lanza por CSS mal formado: el error va en el mensaje. */
    public ValidationResult validateCss(String css) {
        try {
            parse(css);
            return ValidationResult.ok();
        } catch (CssException e) {
            log.debug("validateCss: {}", e.getMessage());
            return ValidationResult.invalid(e.getMessage());
        }
    }

    // --- MUTADORES ---

    public String addProperty(String css, String selector, String property, String value, boolean important) {
        log.debug("addProperty {} / {}", selector, property);
        return serialize(properties.addProperty(parse(css), selector, property, value, important));
    }

    public String removeProperty(String css, String selector, String property) {
        log.debug("removeProperty {} / {}", selector, property);
        return serialize(properties.removeProperty(parse(css), selector, property));
    }

    public String removeSelector(String css, String selector) {
        log.debug("removeSelector {}", selector);
        return serialize(selectors.removeSelector(parse(css), selector));
    }

    public String modifyPropertyValue(String css, String selector, String property, String value,
                                      Importance importance) {
        log.debug("modifyPropertyValue {} / {} ({})", selector, property, importance);
        return serialize(properties.modifyPropertyValue(parse(css), selector, property, value, importance));
    }

    public String addVendorPrefix(String css, String property, List<String> prefixes) {
        log.debug("addVendorPrefix {} {}", property, prefixes);
        return serialize(prefixer.addVendorPrefix(parse(css), property, prefixes));
    }

    public String mergeStylesheets(List<String> stylesheets) {
        log.debug("mergeStylesheets ({} sheets)", stylesheets.size());
        List<Stylesheet> parsed = new ArrayList<>(stylesheets.size());
        for (String css : stylesheets) parsed.add(parse(css));
        return serialize(merger.merge(parsed));
    }

    public String replaceSelectorRule(String css, String selector, String declarations) {
        log.debug("replaceSelectorRule {}", selector);
        return serialize(selectors.replaceSelectorRule(parse(css), selector, declarations));
    }

    public String addImport(String css, String url, String media) {
        log.debug("addImport {}", url);
        return serialize(imports.addImport(parse(css), url, media));
    }

    public String removeImport(String css, String url) {
        log.debug("removeImport {}", url);
        return serialize(imports.removeImport(parse(css), url));
    }

    // --- SINTETIZADORES ---

    public String minify(String css) {
        log.debug("minify ({} chars)", length(css));
        return minifier.minify(parse(css));
    }

    public String beautify(String css) {
        log.debug("beautify ({} chars)", length(css));
        return beautifier.beautify(parse(css));
    }

    public String sortProperties(String css) {
        log.debug("sortProperties ({} chars)", length(css));
        return serialize(sorter.sort(parse(css)));
    }

    public String removeDuplicates(String css) {
        log.debug("removeDuplicates ({} chars)", length(css));
        return serialize(deduplicator.removeDuplicates(parse(css)));
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }
}
