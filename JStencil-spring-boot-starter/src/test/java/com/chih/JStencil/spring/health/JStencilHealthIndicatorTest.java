package com.chih.JStencil.spring.health;

import com.chih.JStencil.core.engine.Environment;
import com.chih.JStencil.core.engine.EnvironmentOptions;
import com.chih.JStencil.core.impl.ArrayLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JStencilHealthIndicatorTest {

    @TempDir
    Path tempDir;

    @Test
    void testReportsCacheAndLoadedTemplates() {
        EnvironmentOptions options = new EnvironmentOptions();
        options.setCache(tempDir.resolve("cache").toString());
        Environment env = new Environment(new ArrayLoader(Map.of("page", "x")), options);
        env.loadTemplate("page");

        Health health = new JStencilHealthIndicator(env).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("loadedTemplates", 1)
                .containsEntry("extensionsInitialized", true)
                .containsEntry("cache", "filesystem:" + tempDir.resolve("cache"));
    }

    @Test
    void testDisabledCache() {
        Health health = new JStencilHealthIndicator(new Environment(new ArrayLoader())).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("cache", "disabled").containsEntry("loadedTemplates", 0);
    }
}
