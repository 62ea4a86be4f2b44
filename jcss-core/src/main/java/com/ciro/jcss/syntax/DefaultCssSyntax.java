package com.ciro.jcss.syntax;

import com.ciro.jcss.ast.DeclarationItem;
import com.ciro.jcss.ast.Stylesheet;

import java.util.List;
import java.util.Set;

public final class DefaultCssSyntax implements CssSyntax {

    private final CssParser parser;

    public DefaultCssSyntax() {
        this(CssParser.DEFAULT_RULE_LIST_KEYWORDS);
    }

    public DefaultCssSyntax(Set<String> ruleListKeywords) {
        this.parser = new CssParser(ruleListKeywords);
    }

    @Override
    public Stylesheet parse(String css) {
        return parser.parseStylesheet(css);
    }

    @Override
    public List<DeclarationItem> parseDeclarations(String declarations) {
        return parser.parseDeclarations(declarations, true);
    }

    @Override
    public String serialize(Stylesheet sheet, CssWriterSettings settings) {
        return new CssWriter(settings).getCSSAsString(sheet);
    }
}
