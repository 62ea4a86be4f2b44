package com.ciro.jcss.api;

import com.ciro.jcss.CssTools;
import com.ciro.jcss.process.CssProcessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CssHttpApiTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final CssHttpApi api = new CssHttpApi(new CssProcessor(new CssTools()), mapper);

    private JsonNode json(ApiResponse response) throws Exception {
        return mapper.readTree(response.json());
    }

    @Test
    void registersEveryOperation() {
        assertEquals(29, api.operations().size());
        assertTrue(api.operations().containsAll(List.of(
                "extract_colors", "analyze_stylesheet", "replace_selector_rule", "remove_duplicates",
                "process_for_production", "merge_css_files")));
    }

    @Test
    void successEnvelope() throws Exception {
        ApiResponse res = api.call("minify", Map.of("css", "a { color: #ffffff }"));

        assertTrue(res.ok());
        JsonNode body = json(res);
        assertTrue(body.get("ok").asBoolean());
        assertEquals("a{color:#fff}", body.get("result").asText());
    }

    @Test
    void resultFieldsAreSnakeCase() throws Exception {
        JsonNode body = json(api.call("extract_animations",
                Map.of("css", "@keyframes k { from { opacity: 0 } } .a { animation: k 1s }")));

        assertEquals(".a", body.at("/result/k/used_by/0").asText());
    }

    @Test
    void unknownOperation() throws Exception {
        ApiResponse res = api.call("nope", Map.of());
        assertEquals(404, res.status());
        assertEquals("NOT_FOUND", json(res).get("code").asText());
    }

    @Test
    void missingArgument() throws Exception {
        ApiResponse res = api.call("add_property", Map.of("css", ".a {}"));
        assertEquals(400, res.status());
        assertEquals("Missing argument 'selector'", json(res).get("error").asText());
    }

    @Test
    void cssErrorsMapToCodes() throws Exception {
        ApiResponse unbalanced = api.call("minify", Map.of("css", ".a {"));
        assertEquals(422, unbalanced.status());
        assertEquals("SYNTAX_ERROR", json(unbalanced).get("code").asText());

        ApiResponse badDecls = api.call("replace_selector_rule",
                Map.of("css", ".a {}", "selector", ".a", "declarations", "color red"));
        assertEquals(422, badDecls.status());
        assertEquals("DECLARATION_ERROR", json(badDecls).get("code").asText());
    }

    @Test
    void validateNeverFails() throws Exception {
        JsonNode body = json(api.call("validate_css", Map.of("css", ".a {")));
        assertTrue(body.get("ok").asBoolean());
        assertFalse(body.at("/result/valid").asBoolean());
    }

    @Test
    void absentSelectorHasNoResult() throws Exception {
        JsonNode body = json(api.call("get_selector_properties", Map.of("css", ".a { x: y }", "selector", ".b")));
        assertTrue(body.get("ok").asBoolean());
        assertFalse(body.has("result"));
    }

    @Test
    void queryStyleArguments() throws Exception {
        ApiResponse res = api.callWithCss("add_vendor_prefix",
                ".a { transform: none }".getBytes(StandardCharsets.UTF_8),
                Map.of("property", "transform", "prefixes", "-webkit-, -ms-"));

        assertEquals(".a {\n    -webkit-transform: none;\n    -ms-transform: none;\n    transform: none;\n}\n",
                json(res).get("result").asText());
    }

    @Test
    void invalidUtf8IsRejected() throws Exception {
        ApiResponse res = api.callWithCss("minify", new byte[]{(byte) 0xC3, (byte) 0x28}, Map.of());
        assertEquals(422, res.status());
        assertEquals("DECODE_ERROR", json(res).get("code").asText());
    }

    @Test
    void productionOptionsFromBody() throws Exception {
        JsonNode body = json(api.call("process_for_production", Map.of(
                "css", ".a { color: red }",
                "add_prefixes", false, "sort", false, "remove_duplicates", false)));
        assertEquals(".a{color:red}", body.get("result").asText());
    }
}
