package com.ciro.jcss.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lectura tipada de los argumentos de una operación. Acepta tanto valores JSON como los
 * strings de un query string ({@code "true"}, {@code "a,b"}).
 */
final class ApiArgs {

    private final Map<String, Object> values;

    ApiArgs(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    String string(String name) {
        String v = optString(name);
        if (v == null) throw new BadRequestException("Missing argument '" + name + "'");
        return v;
    }

    String optString(String name) {
        Object v = values.get(name);
        if (v == null) return null;
        if (v instanceof String s) return s;
        throw new BadRequestException("Argument '" + name + "' must be a string");
    }

    boolean bool(String name, boolean fallback) {
        Boolean v = optBool(name);
        return v == null ? fallback : v;
    }

    Boolean optBool(String name) {
        Object v = values.get(name);
        if (v == null) return null;
        if (v instanceof Boolean b) return b;
        if (v instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        throw new BadRequestException("Argument '" + name + "' must be a boolean");
    }

    List<String> stringList(String name) {
        Object v = values.get(name);
        if (v == null) throw new BadRequestException("Missing argument '" + name + "'");
        if (v instanceof String s) {
            List<String> out = new ArrayList<>();
            for (String part : s.split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
            return out;
        }
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object item : list) {
                if (!(item instanceof String s)) {
                    throw new BadRequestException("Argument '" + name + "' must be a list of strings");
                }
                out.add(s);
            }
            return out;
        }
        throw new BadRequestException("Argument '" + name + "' must be a list of strings");
    }

    /** Objeto nombre → contenido, en el orden recibido. */
    Map<String, String> stringMap(String name) {
        Object v = values.get(name);
        if (v == null) throw new BadRequestException("Missing argument '" + name + "'");
        if (!(v instanceof Map<?, ?> map)) {
            throw new BadRequestException("Argument '" + name + "' must be an object");
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getValue() instanceof String s)) {
                throw new BadRequestException("Argument '" + name + "." + e.getKey() + "' must be a string");
            }
            out.put(String.valueOf(e.getKey()), s);
        }
        return out;
    }
}
