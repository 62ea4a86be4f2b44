package com.ciro.jcss.standalone;

import com.ciro.jcss.api.ApiResponse;
import com.ciro.jcss.api.CssHttpApi;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Deque;
import java.util.Locale;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /css/{operation}
 * - {@code application/json}: el cuerpo es el objeto de argumentos.
 * - {@code text/css}: el cuerpo es el argumento {@code css}, el resto va en la query.
 */
public class OperationEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(OperationEndpoint.class);
    private static final TypeReference<Map<String, Object>> BODY = new TypeReference<>() {};

    private final CssHttpApi api;
    private final ObjectMapper objectMapper;
    private final ResultCache cache;

    public OperationEndpoint(CssHttpApi api, ObjectMapper objectMapper, ResultCache cache) {
        this.api = api;
        this.objectMapper = objectMapper;
        this.cache = cache;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!Methods.POST.equals(exchange.getRequestMethod())) {
            send(exchange, api.error(405, "METHOD_NOT_ALLOWED", "Only POST is allowed"));
            return;
        }

        String path = exchange.getRequestPath();
        String operation = path.substring(path.lastIndexOf('/') + 1);
        String contentType = contentType(exchange);

        exchange.getRequestReceiver().receiveFullBytes(
            (ex, bytes) -> {
                String key = ResultCache.key(operation, contentType, ex.getQueryString(), bytes);
                ApiResponse response = cache.get(key, () -> dispatch(ex, operation, contentType, bytes));
                log.debug("POST {} -> {}", operation, response.status());
                send(ex, response);
            },
            (ex, err) -> {
                log.warn("Could not read body of {}", operation, err);
                send(ex, api.error(400, "BAD_REQUEST", "Could not read request body"));
            }
        );
    }

    private ApiResponse dispatch(HttpServerExchange ex, String operation, String contentType, byte[] bytes) {
        if (contentType.startsWith("text/css")) {
            return api.callWithCss(operation, bytes, queryParams(ex));
        }
        Map<String, Object> body;
        try {
            body = bytes.length == 0 ? Map.of() : objectMapper.readValue(bytes, BODY);
        } catch (JsonProcessingException e) {
            return api.error(400, "BAD_REQUEST", "Invalid JSON body: " + e.getOriginalMessage());
        } catch (IOException e) {
            return api.error(400, "BAD_REQUEST", "Could not read request body");
        }
        return api.call(operation, body == null ? Map.of() : body);
    }

    private static Map<String, String> queryParams(HttpServerExchange ex) {
        Map<String, String> params = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<String>> e : ex.getQueryParameters().entrySet()) {
            if (!e.getValue().isEmpty()) params.put(e.getKey(), e.getValue().getFirst());
        }
        return params;
    }

    private static String contentType(HttpServerExchange ex) {
        String ct = ex.getRequestHeaders().getFirst(Headers.CONTENT_TYPE);
        return ct == null ? "application/json" : ct.trim().toLowerCase(Locale.ROOT);
    }

    private static void send(HttpServerExchange ex, ApiResponse response) {
        ex.setStatusCode(response.status());
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        ex.getResponseSender().send(response.json());
    }
}
