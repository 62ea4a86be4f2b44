package com.ciro.jcss;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tablas de propiedades y keywords que usan extractores, walker y pipelines.
 * Inmutable; para extenderla se parte de {@link #builder()}, que ya trae los valores por defecto.
 */
public final class CssTables {

    public static final int DEFAULT_MAX_DEPTH = 32;

    private static final List<String> COLOR_PROPERTIES = List.of(
            "color", "background-color", "border-color", "border-top-color", "border-right-color",
            "border-bottom-color", "border-left-color", "outline-color", "text-decoration-color",
            "box-shadow", "text-shadow");

    private static final List<String> NAMED_COLORS = List.of(
            "black", "white", "red", "green", "blue", "yellow", "purple", "orange", "brown", "gray",
            "transparent");

    private static final List<String> FONT_PROPERTIES = List.of(
            "font", "font-family", "font-size", "font-weight", "font-style", "font-variant",
            "line-height", "text-transform", "letter-spacing");

    private static final List<String> ANIMATION_PROPERTIES = List.of(
            "animation", "animation-name",
            "-webkit-animation", "-webkit-animation-name",
            "-moz-animation", "-moz-animation-name",
            "-ms-animation", "-ms-animation-name",
            "-o-animation", "-o-animation-name");

    private static final List<String> KEYFRAMES_KEYWORDS = List.of(
            "keyframes", "-webkit-keyframes", "-moz-keyframes", "-ms-keyframes", "-o-keyframes");

    private static final List<String> BLOCK_KEYWORDS = List.of(
            "media", "supports", "document", "-moz-document", "layer", "container", "scope",
            "starting-style");

    private static final CssTables DEFAULTS = builder().build();

    private final Set<String> colorProperties;
    private final Set<String> namedColors;
    private final Set<String> fontProperties;
    private final Set<String> animationProperties;
    private final Set<String> keyframesKeywords;
    private final Set<String> recurseKeywords;
    private final Map<String, List<String>> browserPrefixes;
    private final int maxDepth;

    private CssTables(Builder b) {
        this.colorProperties = Collections.unmodifiableSet(new LinkedHashSet<>(b.colorProperties));
        this.namedColors = Collections.unmodifiableSet(new LinkedHashSet<>(b.namedColors));
        this.fontProperties = Collections.unmodifiableSet(new LinkedHashSet<>(b.fontProperties));
        this.animationProperties = Collections.unmodifiableSet(new LinkedHashSet<>(b.animationProperties));
        this.keyframesKeywords = Collections.unmodifiableSet(new LinkedHashSet<>(b.keyframesKeywords));

        // un bloque de keyframes siempre se recorre
        Set<String> recurse = new LinkedHashSet<>(b.recurseKeywords);
        recurse.addAll(b.keyframesKeywords);
        this.recurseKeywords = Collections.unmodifiableSet(recurse);

        Map<String, List<String>> prefixes = new LinkedHashMap<>();
        b.browserPrefixes.forEach((k, v) -> prefixes.put(k, List.copyOf(v)));
        this.browserPrefixes = Collections.unmodifiableMap(prefixes);
        this.maxDepth = b.maxDepth;
    }

    public static CssTables defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isColorProperty(String name) {
        return colorProperties.contains(name);
    }

    public boolean isNamedColor(String value) {
        return namedColors.contains(value);
    }

    public boolean isFontProperty(String name) {
        return fontProperties.contains(name);
    }

    public boolean isAnimationProperty(String name) {
        return animationProperties.contains(name);
    }

    public boolean isKeyframes(String keyword) {
        return keyframesKeywords.contains(keyword);
    }

    public boolean recursesInto(String keyword) {
        return recurseKeywords.contains(keyword);
    }

    public Set<String> colorProperties() {
        return colorProperties;
    }

    public Set<String> namedColors() {
        return namedColors;
    }

    public Set<String> fontProperties() {
        return fontProperties;
    }

    public Set<String> animationProperties() {
        return animationProperties;
    }

    public Set<String> keyframesKeywords() {
        return keyframesKeywords;
    }

    public Set<String> recurseKeywords() {
        return recurseKeywords;
    }

    /** propiedad → prefijos, en el orden en que se aplican. */
    public Map<String, List<String>> browserPrefixes() {
        return browserPrefixes;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public static final class Builder {
        private final Set<String> colorProperties = new LinkedHashSet<>(COLOR_PROPERTIES);
        private final Set<String> namedColors = new LinkedHashSet<>(NAMED_COLORS);
        private final Set<String> fontProperties = new LinkedHashSet<>(FONT_PROPERTIES);
        private final Set<String> animationProperties = new LinkedHashSet<>(ANIMATION_PROPERTIES);
        private final Set<String> keyframesKeywords = new LinkedHashSet<>(KEYFRAMES_KEYWORDS);
        private final Set<String> recurseKeywords = new LinkedHashSet<>(BLOCK_KEYWORDS);
        private final Map<String, List<String>> browserPrefixes = new LinkedHashMap<>();
        private int maxDepth = DEFAULT_MAX_DEPTH;

        private Builder() {
            browserPrefixes.put("user-select", List.of("-webkit-", "-moz-", "-ms-"));
            browserPrefixes.put("appearance", List.of("-webkit-", "-moz-"));
            browserPrefixes.put("backdrop-filter", List.of("-webkit-"));
            browserPrefixes.put("text-size-adjust", List.of("-webkit-", "-ms-"));
            browserPrefixes.put("font-smoothing", List.of("-webkit-", "-moz-osx-"));
        }

        public Builder addColorProperties(Collection<String> names) {
            addLowercase(colorProperties, names);
            return this;
        }

        public Builder addNamedColors(Collection<String> names) {
            addLowercase(namedColors, names);
            return this;
        }

        public Builder addFontProperties(Collection<String> names) {
            addLowercase(fontProperties, names);
            return this;
        }

        public Builder addAnimationProperties(Collection<String> names) {
            addLowercase(animationProperties, names);
            return this;
        }

        public Builder addRecurseKeywords(Collection<String> keywords) {
            addLowercase(recurseKeywords, keywords);
            return this;
        }

        public Builder browserPrefixes(String property, List<String> prefixes) {
            browserPrefixes.put(Objects.requireNonNull(property, "property"), List.copyOf(prefixes));
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
            this.maxDepth = maxDepth;
            return this;
        }

        public CssTables build() {
            return new CssTables(this);
        }

        private static void addLowercase(Set<String> target, Collection<String> values) {
            if (values == null) return;
            for (String v : values) {
                if (v != null && !v.isBlank()) target.add(v.trim().toLowerCase(Locale.ROOT));
            }
        }
    }
}
