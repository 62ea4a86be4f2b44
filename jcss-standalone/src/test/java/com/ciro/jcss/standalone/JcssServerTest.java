package com.ciro.jcss.standalone;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JcssServerTest {

    private static JcssServer server;
    private static final HttpClient http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    private static final ObjectMapper mapper = new ObjectMapper();

    @BeforeAll
    static void start() {
        server = new JcssServer(new ServerConfig("127.0.0.1", 0, 100, Duration.ofMinutes(1)));
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop();
    }

    private HttpResponse<String> post(String path, String contentType, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
                .header("Content-Type", contentType)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void jsonBodyRunsOperation() throws Exception {
        HttpResponse<String> res = post("/css/minify", "application/json", "{\"css\":\"a { color: #112233; }\"}");
        assertEquals(200, res.statusCode());
        JsonNode json = mapper.readTree(res.body());
        assertTrue(json.get("ok").asBoolean());
        assertEquals("a{color:#123}", json.get("result").asText());
    }

    @Test
    void cssBodyTakesArgumentsFromQuery() throws Exception {
        HttpResponse<String> res = post("/css/selector_exists?selector=.btn", "text/css", ".btn { color: red; }");
        assertEquals(200, res.statusCode());
        assertTrue(mapper.readTree(res.body()).get("result").asBoolean());
    }

    @Test
    void unknownOperationIsNotFound() throws Exception {
        HttpResponse<String> res = post("/css/nope", "application/json", "{}");
        assertEquals(404, res.statusCode());
        assertEquals("NOT_FOUND", mapper.readTree(res.body()).get("code").asText());
    }

    @Test
    void unbalancedCssIsUnprocessable() throws Exception {
        HttpResponse<String> res = post("/css/minify", "application/json", "{\"css\":\"a { color: red;\"}");
        assertEquals(422, res.statusCode());
        assertFalse(mapper.readTree(res.body()).get("ok").asBoolean());
    }

    @Test
    void invalidJsonIsBadRequest() throws Exception {
        HttpResponse<String> res = post("/css/minify", "application/json", "{not json");
        assertEquals(400, res.statusCode());
        assertEquals("BAD_REQUEST", mapper.readTree(res.body()).get("code").asText());
    }

    @Test
    void getIsRejected() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/css/minify")).GET().build();
        HttpResponse<String> res = http.send(req, HttpResponse.BodyHandlers.ofString());
        assertEquals(405, res.statusCode());
        assertEquals("METHOD_NOT_ALLOWED", mapper.readTree(res.body()).get("code").asText());
    }

    @Test
    void repeatedRequestsHitTheCache() throws Exception {
        String body = "{\"css\":\".cached { margin: 0; }\"}";
        post("/css/beautify", "application/json", body);
        long before = server.cache().size();
        HttpResponse<String> again = post("/css/beautify", "application/json", body);
        assertEquals(200, again.statusCode());
        assertEquals(before, server.cache().size());
    }
}
