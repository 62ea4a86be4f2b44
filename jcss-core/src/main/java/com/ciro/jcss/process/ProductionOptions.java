package com.ciro.jcss.process;

/** Pasos de {@link CssProcessor#processForProduction}; todos activos por defecto. */
public record ProductionOptions(boolean minify, boolean addPrefixes, boolean sort, boolean removeDuplicates) {

    public static ProductionOptions defaults() {
        return new ProductionOptions(true, true, true, true);
    }
}
