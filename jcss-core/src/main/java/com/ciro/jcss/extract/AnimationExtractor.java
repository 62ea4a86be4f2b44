package com.ciro.jcss.extract;

import com.ciro.jcss.CssTables;
import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Declaration;
import com.ciro.jcss.ast.Declarations;
import com.ciro.jcss.ast.QualifiedRule;
import com.ciro.jcss.ast.Stylesheet;
import com.ciro.jcss.syntax.CssText;
import com.ciro.jcss.traverse.CssVisitor;
import com.ciro.jcss.traverse.CssWalker;
import com.ciro.jcss.traverse.WalkContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cruza las definiciones {@code @keyframes} (y sus variantes con prefijo) con las reglas que
 * las usan. Solo se reportan animaciones definidas.
 */
public final class AnimationExtractor {

    private final CssWalker walker;

    public AnimationExtractor(CssWalker walker) {
        this.walker = walker;
    }

    public Map<String, AnimationInfo> extract(Stylesheet sheet) {
        CssTables tables = walker.tables();
        Map<String, Map<String, Map<String, String>>> defined = new LinkedHashMap<>();
        Map<String, List<String>> usage = new LinkedHashMap<>();

        walker.walk(sheet, new CssVisitor() {
            @Override
            public boolean enterBlock(AtRule block, WalkContext ctx) {
                if (!tables.isKeyframes(block.keyword())) return true;
                // una definición posterior con el mismo nombre reemplaza a la anterior
                defined.put(CssText.stripQuotes(block.prelude()), frames(block));
                return false;
            }

            @Override
            public void visitRule(QualifiedRule rule, WalkContext ctx) {
                for (Declaration d : rule.declarationsOnly()) {
                    if (!tables.isAnimationProperty(d.name())) continue;
                    String name = CssText.stripQuotes(CssText.firstWord(d.value()));
                    if (name.isEmpty()) continue;
                    usage.computeIfAbsent(name, k -> new ArrayList<>()).add(rule.selector());
                }
            }
        });

        Map<String, AnimationInfo> result = new LinkedHashMap<>();
        defined.forEach((name, frames) ->
                result.put(name, new AnimationInfo(frames, usage.getOrDefault(name, List.of()))));
        return result;
    }

    private static Map<String, Map<String, String>> frames(AtRule keyframes) {
        Map<String, Map<String, String>> frames = new LinkedHashMap<>();
        for (CssItem item : keyframes.block()) {
            if (item instanceof QualifiedRule frame) {
                frames.put(frame.selector(), Declarations.valuesByName(frame.declarations()));
            }
        }
        return frames;
    }
}
