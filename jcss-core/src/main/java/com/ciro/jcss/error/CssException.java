package com.ciro.jcss.error;

/**
 * Raíz de los errores de jcss. Ninguno se reintenta ni se recupera internamente:
 * o el CSS está bien formado para transformarse o la operación no continúa.
 */
public abstract class CssException extends RuntimeException {

    protected CssException(String message) {
        super(message);
    }

    protected CssException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Código estable para la API JSON (ej: "PARSE_ERROR"). */
    public abstract String code();
}
