package com.ciro.jcss.traverse;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.Comment;
import com.ciro.jcss.ast.QualifiedRule;

/**
 * Recorrido de solo lectura. Todos los métodos tienen implementación vacía;
 * cada extractor sobreescribe lo que necesita.
 */
public interface CssVisitor {

    default void visitRule(QualifiedRule rule, WalkContext ctx) {}

    /** At-rules que no se recorren: sentencias, bloques de declaraciones, keywords fuera del set. */
    default void visitAtRule(AtRule atRule, WalkContext ctx) {}

    default void visitComment(Comment comment, WalkContext ctx) {}

    /**
     * Antes de bajar a un bloque. {@code ctx} es el contexto exterior.
     *
     * @return false para no recorrer el bloque (no se llama a {@link #exitBlock})
     */
    default boolean enterBlock(AtRule block, WalkContext ctx) {
        return true;
    }

    default void exitBlock(AtRule block, WalkContext ctx) {}
}
