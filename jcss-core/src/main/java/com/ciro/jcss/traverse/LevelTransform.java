package com.ciro.jcss.traverse;

import com.ciro.jcss.ast.CssItem;

import java.util.List;

/** Transformación de un nivel completo; el walker la aplica de arriba hacia abajo. */
@FunctionalInterface
public interface LevelTransform {

    List<CssItem> transform(List<CssItem> level, WalkContext ctx);
}
