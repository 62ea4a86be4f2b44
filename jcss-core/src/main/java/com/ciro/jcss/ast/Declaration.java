package com.ciro.jcss.ast;

import java.util.Locale;
import java.util.Objects;

public record Declaration(String name, String value, boolean important) implements DeclarationItem {

    public Declaration {
        Objects.requireNonNull(name, "name");
        value = value == null ? "" : value.trim();
    }

    /** Nombre tal como lo guarda el parser: en minúsculas salvo las custom properties ({@code --x}). */
    public static String normalizeName(String name) {
        String trimmed = name.trim();
        return trimmed.startsWith("--") ? trimmed : trimmed.toLowerCase(Locale.ROOT);
    }

    public Declaration withName(String newName) {
        return new Declaration(newName, value, important);
    }

    public Declaration withValue(String newValue) {
        return new Declaration(name, newValue, important);
    }

    public Declaration withImportant(boolean newImportant) {
        return new Declaration(name, value, newImportant);
    }
}
