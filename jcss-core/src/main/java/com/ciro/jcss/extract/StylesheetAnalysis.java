package com.ciro.jcss.extract;

import java.util.List;
import java.util.Map;

/** Resultado de {@link StylesheetAnalyzer}. Los nombres se serializan en snake_case. */
public record StylesheetAnalysis(
        List<String> selectors,
        int selectorsCount,
        int uniqueSelectors,
        int propertiesCount,
        int uniqueProperties,
        List<PropertyUsage> mostUsedProperties,
        int colorsUsed,
        List<String> colors,
        int fontsUsed,
        List<String> fonts,
        int mediaQueriesCount,
        List<String> mediaQueries,
        Map<String, MediaQueryDetail> mediaQueryDetails,
        int commentsCount,
        List<String> comments,
        int fileSizeBytes,
        Map<String, Map<String, String>> selectorProperties,
        List<String> imports,
        int importsCount,
        Map<String, String> importMediaQueries) {}
