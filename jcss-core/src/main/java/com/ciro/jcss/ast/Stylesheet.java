package com.ciro.jcss.ast;

import java.util.List;

public record Stylesheet(List<CssItem> items) {

    public Stylesheet {
        items = List.copyOf(items);
    }

    public static Stylesheet empty() {
        return new Stylesheet(List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
