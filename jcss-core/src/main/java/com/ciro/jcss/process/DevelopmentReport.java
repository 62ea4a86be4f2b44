package com.ciro.jcss.process;

import com.ciro.jcss.extract.FontDeclaration;
import com.ciro.jcss.extract.StylesheetAnalysis;

import java.util.List;
import java.util.Map;

public record DevelopmentReport(String beautifiedCss,
                                StylesheetAnalysis analytics,
                                List<String> unusedSelectors,
                                Map<String, List<String>> colorsUsed,
                                Map<String, List<FontDeclaration>> fonts) {}
