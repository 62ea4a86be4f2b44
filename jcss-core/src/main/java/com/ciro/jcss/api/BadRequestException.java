package com.ciro.jcss.api;

/** Argumento ausente o con tipo incorrecto. */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
