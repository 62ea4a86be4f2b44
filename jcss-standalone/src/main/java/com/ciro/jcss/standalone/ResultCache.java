package com.ciro.jcss.standalone;

import com.ciro.jcss.api.ApiResponse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * Respuestas ya calculadas por operación + cuerpo. Las operaciones son puras, así que
 * la misma entrada siempre da la misma salida.
 * - expireAfterWrite: las entradas viejas se liberan solas.
 * - maximumSize: cuerpos distintos sin fin no agotan la RAM.
 */
public final class ResultCache {

    private final Cache<String, ApiResponse> cache;

    public ResultCache(ServerConfig config) {
        this.cache = config.cacheSize() <= 0 ? null : Caffeine.newBuilder()
                .maximumSize(config.cacheSize())
                .expireAfterWrite(config.cacheTtl())
                .build();
    }

    public ApiResponse get(String key, Supplier<ApiResponse> compute) {
        if (cache == null) return compute.get();
        ApiResponse cached = cache.getIfPresent(key);
        if (cached != null) return cached;
        ApiResponse fresh = compute.get();
        // los 500 pueden ser transitorios, no se guardan
        if (fresh.status() < 500) cache.put(key, fresh);
        return fresh;
    }

    public long size() {
        if (cache == null) return 0;
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public static String key(String operation, String contentType, String query, byte[] body) {
        return operation + '\n' + contentType + '\n' + query + '\n' + new String(body, StandardCharsets.ISO_8859_1);
    }
}
