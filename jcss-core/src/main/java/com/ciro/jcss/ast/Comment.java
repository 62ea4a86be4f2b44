package com.ciro.jcss.ast;

import java.util.Objects;

/** Texto del comentario, sin los delimitadores. */
public record Comment(String text) implements CssItem, DeclarationItem {

    public Comment {
        text = Objects.requireNonNull(text, "text").trim();
    }
}
