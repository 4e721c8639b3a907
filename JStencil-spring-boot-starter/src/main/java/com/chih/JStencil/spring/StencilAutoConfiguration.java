package com.chih.JStencil.spring;

import com.chih.JStencil.core.engine.Environment;
import com.chih.JStencil.core.engine.EnvironmentOptions;
import com.chih.JStencil.core.impl.MustacheTemplateEngine;
import com.chih.JStencil.core.impl.NoOpRenderMetrics;
import com.chih.JStencil.core.spi.ArtifactStore;
import com.chih.JStencil.core.spi.Extension;
import com.chih.JStencil.core.spi.Loader;
import com.chih.JStencil.core.spi.RenderMetrics;
import com.chih.JStencil.core.spi.TemplateEngine;
import com.chih.JStencil.spring.health.JStencilHealthIndicator;
import com.chih.JStencil.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

import java.nio.charset.Charset;

/**
 * JStencil Spring Boot 自动配置类。
 * <p>
 * 按需创建 Loader、TemplateEngine、RenderMetrics 和 Environment，
 * 用户自定义的同类型 Bean 优先。容器中的 {@link Extension} Bean 会按顺序注册到 Environment。
 * </p>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * j-stencil:
 *   locations:
 *     - file:./templates/
 *     - classpath:/templates/
 *   cache: /var/cache/j-stencil
 *   auto-reload: true
 *
 * // 使用编译产物缓存的自定义存储（可选）
 * @Bean
 * public ArtifactStore artifactStore() {
 *     return new CaffeineArtifactStore();
 * }
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 * @see JStencilProperties
 * @see SpringResourceLoader
 * @see Environment
 */
@Configuration
@EnableConfigurationProperties(JStencilProperties.class)
public class StencilAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Loader.class)
    public Loader stencilLoader(JStencilProperties properties, ResourceLoader resourceLoader) {
        return new SpringResourceLoader(properties.getLocations(), Charset.forName(normalizeCharset(properties.getCharset())),
                resourceLoader);
    }

    @Bean
    @ConditionalOnMissingBean(TemplateEngine.class)
    public TemplateEngine stencilTemplateEngine() {
        return new MustacheTemplateEngine();
    }

    /**
     * Micrometer 在类路径中时，优先使用容器中的 MeterRegistry
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean(RenderMetrics.class)
        public RenderMetrics renderMetrics(ObjectProvider<MeterRegistry> registry) {
            MeterRegistry meterRegistry = registry.getIfAvailable();
            return meterRegistry != null ? new MicrometerRenderMetrics(meterRegistry) : new NoOpRenderMetrics();
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(RenderMetrics.class)
    public RenderMetrics defaultRenderMetrics() {
        return new NoOpRenderMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(Environment.class)
    public Environment stencilEnvironment(JStencilProperties properties,
            Loader loader,
            TemplateEngine engine,
            RenderMetrics metrics,
            ObjectProvider<ArtifactStore> artifactStore,
            ObjectProvider<Extension> extensions) {
        EnvironmentOptions options = new EnvironmentOptions();
        options.setDebug(properties.isDebug());
        options.setAutoReload(properties.getAutoReload());
        options.setStrictVariables(properties.isStrictVariables());
        options.setCharset(properties.getCharset());
        options.setOptimizations(properties.getOptimizations());
        options.setTemplateEngine(engine);
        options.setMetrics(metrics);
        options.setCache(resolveCache(properties, artifactStore.getIfAvailable()));

        Environment environment = new Environment(loader, options);
        extensions.orderedStream().forEach(environment::addExtension);
        return environment;
    }

    // 自定义 ArtifactStore Bean 优先于 j-stencil.cache 目录
    private static Object resolveCache(JStencilProperties properties, ArtifactStore store) {
        if (store != null) {
            return store;
        }
        String cache = properties.getCache();
        if (!StringUtils.hasText(cache) || "false".equalsIgnoreCase(cache.trim())) {
            return Boolean.FALSE;
        }
        return cache.trim();
    }

    private static String normalizeCharset(String charset) {
        return "UTF8".equalsIgnoreCase(charset) ? "UTF-8" : charset;
    }

    /**
     * 健康检查自动配置
     * 只有当引入了 Actuator (存在 HealthIndicator 类) 时才生效
     */
    @Configuration
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthCheckConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "jStencilHealthIndicator")
        public JStencilHealthIndicator jStencilHealthIndicator(Environment environment) {
            return new JStencilHealthIndicator(environment);
        }
    }
}
