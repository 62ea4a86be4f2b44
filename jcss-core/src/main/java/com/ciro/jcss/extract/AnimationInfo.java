package com.ciro.jcss.extract;

import java.util.List;
import java.util.Map;

/**
 * @param keyframes fotograma ({@code 0%}, {@code from}, ...) → propiedad → valor
 * @param usedBy    selectores que referencian la animación, en orden de aparición
 */
public record AnimationInfo(Map<String, Map<String, String>> keyframes, List<String> usedBy) {}
