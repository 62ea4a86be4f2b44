package com.ciro.jcss.extract;

import java.util.Map;

/** Regla dentro de un {@code @media}: su selector y el último valor de cada propiedad. */
public record MediaRule(String selector, Map<String, String> properties) {}
