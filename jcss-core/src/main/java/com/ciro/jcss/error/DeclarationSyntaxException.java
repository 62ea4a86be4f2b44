package com.ciro.jcss.error;

/** Lista de declaraciones aportada por el llamador que no supera la validación. */
public class DeclarationSyntaxException extends CssException {

    public DeclarationSyntaxException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "DECLARATION_ERROR";
    }
}
