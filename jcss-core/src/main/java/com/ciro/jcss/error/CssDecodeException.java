package com.ciro.jcss.error;

public class CssDecodeException extends CssException {

    public CssDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "DECODE_ERROR";
    }
}
