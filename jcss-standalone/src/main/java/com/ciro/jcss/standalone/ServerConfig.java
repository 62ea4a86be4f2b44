package com.ciro.jcss.standalone;

import java.time.Duration;

/**
 * @param host      interfaz de escucha
 * @param port      0 para un puerto libre cualquiera
 * @param cacheSize entradas máximas de la caché de respuestas (0 la desactiva)
 * @param cacheTtl  vida de cada entrada desde que se escribe
 */
public record ServerConfig(String host, int port, long cacheSize, Duration cacheTtl) {

    public static final int DEFAULT_PORT = 8080;

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", DEFAULT_PORT, 1_000, Duration.ofMinutes(10));
    }

    /** Puerto en el primer argumento, el resto por defecto. */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig d = defaults();
        if (args == null || args.length == 0 || args[0].isBlank()) return d;
        try {
            return d.withPort(Integer.parseInt(args[0].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + args[0], e);
        }
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(host, newPort, cacheSize, cacheTtl);
    }

    public ServerConfig withCacheSize(long newCacheSize) {
        return new ServerConfig(host, port, newCacheSize, cacheTtl);
    }
}
