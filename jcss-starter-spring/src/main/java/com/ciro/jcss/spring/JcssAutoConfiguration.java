package com.ciro.jcss.spring;

import com.ciro.jcss.CssTables;
import com.ciro.jcss.CssTools;
import com.ciro.jcss.api.CssHttpApi;
import com.ciro.jcss.process.CssProcessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(JcssProperties.class)
public class JcssAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CssTables cssTables(JcssProperties props) {
        return props.toTables();
    }

    @Bean
    @ConditionalOnMissingBean
    public CssTools cssTools(CssTables tables) {
        return new CssTools(tables);
    }

    @Bean
    @ConditionalOnMissingBean
    public CssProcessor cssProcessor(CssTools tools) {
        return new CssProcessor(tools);
    }

    @Bean
    @ConditionalOnMissingBean
    public CssHttpApi cssHttpApi(CssProcessor processor, ObjectProvider<ObjectMapper> mapper) {
        return new CssHttpApi(processor, mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(prefix = "jcss", name = "endpoint-enabled", havingValue = "true", matchIfMissing = true)
    public CssController cssController(CssHttpApi api) {
        return new CssController(api);
    }
}
