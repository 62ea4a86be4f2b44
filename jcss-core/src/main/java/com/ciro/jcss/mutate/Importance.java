package com.ciro.jcss.mutate;

/** Qué hacer con {@code !important} al reescribir un valor. */
public enum Importance {
    /** Conservar el flag actual. */
    KEEP,
    IMPORTANT,
    NORMAL;

    public boolean apply(boolean current) {
        return switch (this) {
            case KEEP -> current;
            case IMPORTANT -> true;
            case NORMAL -> false;
        };
    }

    /** null → {@link #KEEP}. */
    public static Importance of(Boolean important) {
        if (important == null) return KEEP;
        return important ? IMPORTANT : NORMAL;
    }
}
