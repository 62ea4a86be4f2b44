package com.ciro.jcss.error;

/** Error estructural reportado por el parser, con su posición (base 1). */
public class CssParseException extends CssException {

    private final int line;
    private final int column;

    public CssParseException(String reason, int line, int column) {
        super("CSS parse error at line " + line + ", column " + column + ": " + reason);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String code() {
        return "PARSE_ERROR";
    }
}
