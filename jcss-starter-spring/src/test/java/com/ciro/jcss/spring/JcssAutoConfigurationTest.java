package com.ciro.jcss.spring;

import com.ciro.jcss.CssTables;
import com.ciro.jcss.CssTools;
import com.ciro.jcss.api.CssHttpApi;
import com.ciro.jcss.process.CssProcessor;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JcssAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class, JcssAutoConfiguration.class));

    @Test
    void registersCoreBeans() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(CssTables.class);
            assertThat(ctx).hasSingleBean(CssTools.class);
            assertThat(ctx).hasSingleBean(CssProcessor.class);
            assertThat(ctx).hasSingleBean(CssHttpApi.class);
            // no es una aplicación web
            assertThat(ctx).doesNotHaveBean(CssController.class);
        });
    }

    @Test
    void propertiesExtendTables() {
        runner.withPropertyValues("jcss.extra-color-properties=fill,stroke", "jcss.max-depth=4")
                .run(ctx -> {
                    CssTables tables = ctx.getBean(CssTables.class);
                    assertThat(tables.isColorProperty("fill")).isTrue();
                    assertThat(tables.isColorProperty("color")).isTrue();
                    assertThat(tables.maxDepth()).isEqualTo(4);
                    assertThat(ctx.getBean(CssTools.class).extractColors(".icon { fill: red; }"))
                            .containsEntry(".icon", List.of("fill: red"));
                });
    }

    @Test
    void userTablesWin() {
        runner.withUserConfiguration(CustomTables.class).run(ctx ->
                assertThat(ctx.getBean(CssTables.class).maxDepth()).isEqualTo(2));
    }

    @Test
    void webApplicationGetsController() {
        new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class, JcssAutoConfiguration.class))
                .run(ctx -> {
                    CssController controller = ctx.getBean(CssController.class);
                    ResponseEntity<String> res = controller.call("minify", Map.of("css", "a { color: red; }"));
                    assertThat(res.getStatusCode().value()).isEqualTo(200);
                    assertThat(res.getBody()).contains("\"result\":\"a{color:red}\"");
                });
    }

    @Test
    void endpointCanBeDisabled() {
        new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class, JcssAutoConfiguration.class))
                .withPropertyValues("jcss.endpoint-enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(CssController.class));
    }

    @Test
    void cssBodyUsesQueryArguments() {
        runner.run(ctx -> {
            CssController controller = new CssController(ctx.getBean(CssHttpApi.class));
            ResponseEntity<String> res = controller.callWithCss("selector_exists",
                    ".btn { color: red; }".getBytes(StandardCharsets.UTF_8), Map.of("selector", ".missing"));
            assertThat(res.getStatusCode().value()).isEqualTo(200);
            assertThat(res.getBody()).contains("\"result\":false");
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomTables {
        @Bean
        CssTables cssTables() {
            return CssTables.builder().maxDepth(2).build();
        }
    }
}
