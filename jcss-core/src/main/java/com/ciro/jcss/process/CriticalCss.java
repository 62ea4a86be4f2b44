package com.ciro.jcss.process;

/** Reglas críticas (above the fold) y el resto de la hoja. */
public record CriticalCss(String critical, String nonCritical) {}
