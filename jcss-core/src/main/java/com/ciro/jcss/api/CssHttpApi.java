package com.ciro.jcss.api;

import com.ciro.jcss.CssTools;
import com.ciro.jcss.error.CssException;
import com.ciro.jcss.error.CssInput;
import com.ciro.jcss.mutate.Importance;
import com.ciro.jcss.process.CssProcessor;
import com.ciro.jcss.process.ProductionOptions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Todas las operaciones por nombre, con argumentos y resultado en JSON.
 * Éxito: {@code {"ok":true,"result":...}}. Error: {@code {"ok":false,"code":...,"error":...}}.
 * La usan tanto el servidor standalone como el controller de Spring.
 */
public class CssHttpApi {

    private static final Logger log = LoggerFactory.getLogger(CssHttpApi.class);

    static final int OK = 200;
    static final int BAD_REQUEST = 400;
    static final int NOT_FOUND = 404;
    static final int UNPROCESSABLE = 422;
    static final int INTERNAL = 500;

    private final CssProcessor processor;
    private final ObjectMapper objectMapper;
    private final Map<String, Function<ApiArgs, Object>> operations = new LinkedHashMap<>();

    public CssHttpApi(CssProcessor processor, ObjectMapper objectMapper) {
        this.processor = processor;
        // los resultados salen en snake_case: used_by, standalone_comments, ...
        this.objectMapper = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        register();
    }

    public Set<String> operations() {
        return operations.keySet();
    }

    /** Ejecuta {@code operation} con los argumentos de {@code body}. */
    public ApiResponse call(String operation, Map<String, Object> body) {
        Function<ApiArgs, Object> op = operations.get(operation);
        if (op == null) {
            return error(NOT_FOUND, "NOT_FOUND", "Unknown operation: " + operation);
        }
        try {
            Object result = op.apply(new ApiArgs(body));

            Map<String, Object> envelope = new HashMap<>();
            envelope.put("ok", true);
            if (result != null) envelope.put("result", result);
            return new ApiResponse(OK, objectMapper.writeValueAsString(envelope));

        } catch (BadRequestException e) {
            return error(BAD_REQUEST, "BAD_REQUEST", e.getMessage());
        } catch (CssException e) {
            log.debug("{} failed: {}", operation, e.getMessage());
            return error(UNPROCESSABLE, e.code(), e.getMessage());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("{} failed unexpectedly", operation, e);
            return error(INTERNAL, "INTERNAL", "Error in " + operation + ": " + e.getMessage());
        }
    }

    /**
     * Variante para cuerpos {@code text/css}: los bytes son el argumento {@code css}
     * (UTF-8 estricto) y el resto llega como parámetros de query.
     */
    public ApiResponse callWithCss(String operation, byte[] css, Map<String, String> params) {
        Map<String, Object> body = new HashMap<>(params);
        try {
            body.put("css", CssInput.decode(css));
        } catch (CssException e) {
            return error(UNPROCESSABLE, e.code(), e.getMessage());
        }
        return call(operation, body);
    }

    public ApiResponse error(int status, String code, String message) {
        return new ApiResponse(status, errorJson(code, message));
    }

    public String errorJson(String code, String msg) {
        try {
            return objectMapper.writeValueAsString(
                    Map.of(
                            "ok", false,
                            "error", msg == null ? code : msg,
                            "code", code
                    )
            );
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize error envelope", e);
            return "{\"ok\":false,\"error\":\"" + code + "\",\"code\":\"" + code + "\"}";
        }
    }

    private void register() {
        CssTools tools = processor.tools();

        // extractores
        operations.put("extract_colors", a -> tools.extractColors(a.string("css")));
        operations.put("extract_media_queries", a -> tools.extractMediaQueries(a.string("css")));
        operations.put("extract_animations", a -> tools.extractAnimations(a.string("css")));
        operations.put("extract_fonts", a -> tools.extractFonts(a.string("css")));
        operations.put("extract_comments", a -> tools.extractComments(a.string("css")));
        operations.put("extract_unused_selectors", a -> tools.extractUnusedSelectors(a.string("css"), a.string("html")));
        operations.put("analyze_stylesheet", a -> tools.analyzeStylesheet(a.string("css")));
        operations.put("selector_exists", a -> tools.selectorExists(a.string("css"), a.string("selector")));
        operations.put("get_selector_properties",
                a -> tools.getSelectorProperties(a.string("css"), a.string("selector")).orElse(null));
        operations.put("extract_selectors_by_property",
                a -> tools.extractSelectorsByProperty(a.string("css"), a.string("property")));
        operations.put("validate_css", a -> tools.validateCss(a.string("css")));

        // mutadores
        operations.put("add_property", a -> tools.addProperty(a.string("css"), a.string("selector"),
                a.string("property"), a.string("value"), a.bool("important", false)));
        operations.put("remove_property",
                a -> tools.removeProperty(a.string("css"), a.string("selector"), a.string("property")));
        operations.put("remove_selector", a -> tools.removeSelector(a.string("css"), a.string("selector")));
        operations.put("modify_property_value", a -> tools.modifyPropertyValue(a.string("css"), a.string("selector"),
                a.string("property"), a.string("value"), Importance.of(a.optBool("important"))));
        operations.put("add_vendor_prefix",
                a -> tools.addVendorPrefix(a.string("css"), a.string("property"), a.stringList("prefixes")));
        operations.put("merge_stylesheets", a -> tools.mergeStylesheets(a.stringList("stylesheets")));
        operations.put("replace_selector_rule",
                a -> tools.replaceSelectorRule(a.string("css"), a.string("selector"), a.string("declarations")));
        operations.put("add_import", a -> tools.addImport(a.string("css"), a.string("url"), a.optString("media")));
        operations.put("remove_import", a -> tools.removeImport(a.string("css"), a.string("url")));

        // sintetizadores
        operations.put("minify", a -> tools.minify(a.string("css")));
        operations.put("beautify", a -> tools.beautify(a.string("css")));
        operations.put("sort_properties", a -> tools.sortProperties(a.string("css")));
        operations.put("remove_duplicates", a -> tools.removeDuplicates(a.string("css")));

        // pipelines
        operations.put("process_for_production", a -> processor.processForProduction(a.string("css"), options(a)));
        operations.put("process_for_development",
                a -> processor.processForDevelopment(a.string("css"), a.optString("html")));
        operations.put("apply_browser_compatibility", a -> processor.applyBrowserCompatibility(a.string("css")));
        operations.put("extract_critical_css",
                a -> processor.extractCriticalCss(a.string("css"), a.stringList("selectors")));
        operations.put("merge_css_files", a -> processor.mergeCssFiles(a.stringMap("files"), options(a)));
    }

    private static ProductionOptions options(ApiArgs a) {
        ProductionOptions d = ProductionOptions.defaults();
        return new ProductionOptions(
                a.bool("minify", d.minify()),
                a.bool("add_prefixes", d.addPrefixes()),
                a.bool("sort", d.sort()),
                a.bool("remove_duplicates", d.removeDuplicates()));
    }
}
