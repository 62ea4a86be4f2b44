package com.ciro.jcss.api;

/** Código HTTP y cuerpo JSON ya serializado. */
public record ApiResponse(int status, String json) {

    public boolean ok() {
        return status == 200;
    }
}
