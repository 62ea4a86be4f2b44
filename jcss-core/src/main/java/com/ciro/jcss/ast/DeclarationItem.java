package com.ciro.jcss.ast;

/**
 * Elemento dentro del bloque de una regla: una declaración, un comentario o un bloque anidado
 * ({@code @top-center { ... }} dentro de {@code @page}, {@code &:hover { ... }}).
 */
public sealed interface DeclarationItem permits Declaration, Comment, AtRule, QualifiedRule {
}
