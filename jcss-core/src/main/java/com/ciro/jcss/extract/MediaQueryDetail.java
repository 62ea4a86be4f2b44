package com.ciro.jcss.extract;

import java.util.List;
import java.util.Map;

/** Selectores bajo una condición y cuántas veces aparece cada propiedad. */
public record MediaQueryDetail(List<String> selectors, Map<String, Integer> properties) {}
