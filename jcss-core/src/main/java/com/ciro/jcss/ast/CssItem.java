package com.ciro.jcss.ast;

/**
 * Elemento de primer nivel (o de un bloque anidado) de una hoja de estilos.
 */
public sealed interface CssItem permits QualifiedRule, AtRule, Comment {
}
