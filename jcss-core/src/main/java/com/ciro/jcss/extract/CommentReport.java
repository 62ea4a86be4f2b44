package com.ciro.jcss.extract;

import java.util.List;
import java.util.Map;

/**
 * @param standaloneComments  comentarios que no preceden a ninguna regla
 * @param ruleComments        selector → comentarios justo antes de la regla
 * @param declarationComments selector → propiedad → comentarios justo antes de la declaración
 */
public record CommentReport(List<String> standaloneComments,
                            Map<String, List<String>> ruleComments,
                            Map<String, Map<String, List<String>>> declarationComments) {}
