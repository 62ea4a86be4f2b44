package com.ciro.jcss.syntax;

import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.Stylesheet;

import java.util.List;

/**
 * Colaborador de parseo: lo único que el resto del código sabe del texto CSS.
 */
public interface CssSyntax {

    Stylesheet parse(String css);

    /** Lista de declaraciones aportada por el llamador; falla ante cualquier declaración inválida. */
    List<DeclarationItem> parseDeclarations(String declarations);

    String serialize(Stylesheet sheet, CssWriterSettings settings);
}
