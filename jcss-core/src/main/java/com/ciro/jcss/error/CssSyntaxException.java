package com.ciro.jcss.error;

/** Llaves desbalanceadas (pre-chequeo) o anidamiento por encima del límite. */
public class CssSyntaxException extends CssException {

    public CssSyntaxException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "SYNTAX_ERROR";
    }
}
