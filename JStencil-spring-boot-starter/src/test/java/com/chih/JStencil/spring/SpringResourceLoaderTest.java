package com.chih.JStencil.spring;

import com.chih.JStencil.core.exception.LoaderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SpringResourceLoader 单元测试
 *
 * 测试基于 Spring Resource 抽象的模板来源，包括：
 * - classpath: 和 file: 位置
 * - 查找顺序
 * - 新鲜度判断
 * - 错误处理
 */
@DisplayName("SpringResourceLoader 测试")
class SpringResourceLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("从 classpath 加载模板")
    void testClasspathLocation() {
        SpringResourceLoader loader = new SpringResourceLoader(List.of("classpath:/templates"));

        assertThat(loader.getSource("greeting.mustache")).isEqualTo("Hello {{name}}!");
        assertThat(loader.getSource("/mail/footer.mustache")).isEqualTo("-- {{team}}");
        assertThat(loader.getCacheKey("greeting.mustache")).endsWith("templates/greeting.mustache");
        assertThat(loader.getLocations()).containsExactly("classpath:/templates/");
    }

    @Test
    @DisplayName("文件系统位置优先于 classpath")
    void testFileLocationOverridesClasspath() throws IOException {
        Files.writeString(tempDir.resolve("greeting.mustache"), "Overridden {{name}}");
        SpringResourceLoader loader = new SpringResourceLoader(
                List.of("file:" + tempDir.toAbsolutePath() + "/", "classpath:/templates/"));

        assertThat(loader.getSource("greeting.mustache")).isEqualTo("Overridden {{name}}");
        assertThat(loader.getSource("mail/footer.mustache")).isEqualTo("-- {{team}}");
    }

    @Test
    @DisplayName("按修改时间判断新鲜度")
    void testIsFresh() throws IOException {
        Path page = tempDir.resolve("page.mustache");
        Files.writeString(page, "page");
        Files.setLastModifiedTime(page, FileTime.fromMillis(5_000L));
        SpringResourceLoader loader = new SpringResourceLoader(List.of("file:" + tempDir.toAbsolutePath() + "/"));

        assertThat(loader.isFresh("page.mustache", 5_000L)).isTrue();
        assertThat(loader.isFresh("page.mustache", 4_999L)).isFalse();
    }

    @Test
    @DisplayName("模板不存在或名称非法")
    void testErrors() {
        SpringResourceLoader loader = new SpringResourceLoader(List.of("classpath:/templates/"));

        assertThat(loader.exists("missing.mustache")).isFalse();
        assertThatThrownBy(() -> loader.getSource("missing.mustache"))
                .isInstanceOf(LoaderException.class)
                .hasMessageContaining("Unable to find template \"missing.mustache\"");
        assertThatThrownBy(() -> loader.getSource("../secret"))
                .isInstanceOf(LoaderException.class)
                .hasMessageContaining("outside configured directories");
        assertThatThrownBy(() -> loader.getSource(""))
                .isInstanceOf(LoaderException.class);
    }
}
