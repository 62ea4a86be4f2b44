package com.ciro.jcss.spring;

import com.ciro.jcss.CssTables;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Extensiones de las tablas por defecto, p.ej.:
 * <pre>
 * jcss.extra-color-properties=fill,stroke
 * jcss.max-depth=16
 * </pre>
 */
@ConfigurationProperties(prefix = "jcss")
public class JcssProperties {

    private List<String> extraColorProperties = new ArrayList<>();
    private List<String> extraNamedColors = new ArrayList<>();
    private List<String> extraFontProperties = new ArrayList<>();
    private List<String> extraAnimationProperties = new ArrayList<>();
    private List<String> extraRecurseKeywords = new ArrayList<>();
    private int maxDepth = CssTables.DEFAULT_MAX_DEPTH;
    /** Expone POST /css/{operation}. */
    private boolean endpointEnabled = true;

    public CssTables toTables() {
        return CssTables.builder()
                .addColorProperties(extraColorProperties)
                .addNamedColors(extraNamedColors)
                .addFontProperties(extraFontProperties)
                .addAnimationProperties(extraAnimationProperties)
                .addRecurseKeywords(extraRecurseKeywords)
                .maxDepth(maxDepth)
                .build();
    }

    public List<String> getExtraColorProperties() { return extraColorProperties; }
    public void setExtraColorProperties(List<String> v) { this.extraColorProperties = v; }

    public List<String> getExtraNamedColors() { return extraNamedColors; }
    public void setExtraNamedColors(List<String> v) { this.extraNamedColors = v; }

    public List<String> getExtraFontProperties() { return extraFontProperties; }
    public void setExtraFontProperties(List<String> v) { this.extraFontProperties = v; }

    public List<String> getExtraAnimationProperties() { return extraAnimationProperties; }
    public void setExtraAnimationProperties(List<String> v) { this.extraAnimationProperties = v; }

    public List<String> getExtraRecurseKeywords() { return extraRecurseKeywords; }
    public void setExtraRecurseKeywords(List<String> v) { this.extraRecurseKeywords = v; }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

    public boolean isEndpointEnabled() { return endpointEnabled; }
    public void setEndpointEnabled(boolean endpointEnabled) { this.endpointEnabled = endpointEnabled; }
}
