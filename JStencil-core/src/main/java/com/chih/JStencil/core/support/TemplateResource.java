package com.chih.JStencil.core.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.net.URLConnection;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 模板资源
 * <p>
 * FilesystemLoader 解析出的模板文件，来源可能是本地目录，也可能是 Classpath (目录或 jar)。
 * {@link #getResourcePath()} 对同一个物理资源稳定，直接作为 Loader 的缓存 Key 使用：
 * 文件资源为规范化后的绝对路径，Classpath 资源为 "classpath:" 加相对路径。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public final class TemplateResource {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final Path filePath;

    private final URL classpathUrl;

    private final String resourcePath;

    private TemplateResource(Path filePath, URL classpathUrl, String resourcePath) {
        this.filePath = filePath;
        this.classpathUrl = classpathUrl;
        this.resourcePath = resourcePath;
    }

    /**
     * @throws IllegalArgumentException filePath 为 null
     */
    public static TemplateResource fromFile(Path filePath) {
        if (filePath == null) {
            throw new IllegalArgumentException("Template file path cannot be null");
        }
        Path absolute = filePath.toAbsolutePath().normalize();
        return new TemplateResource(absolute, null, absolute.toString());
    }

    /**
     * @param classpathUrl  ClassLoader 返回的 URL
     * @param resourcePath  相对 Classpath 根的路径
     * @throws IllegalArgumentException 任一参数为空
     */
    public static TemplateResource fromClasspath(URL classpathUrl, String resourcePath) {
        if (classpathUrl == null || resourcePath == null || resourcePath.isBlank()) {
            throw new IllegalArgumentException("Classpath template requires both a URL and a resource path");
        }
        return new TemplateResource(null, classpathUrl, CLASSPATH_PREFIX + resourcePath);
    }

    /**
     * 按给定字符集读取全部内容
     *
     * @throws UncheckedIOException 读取失败
     */
    public String readContent(Charset charset) {
        try (InputStream in = openStream()) {
            return new String(in.readAllBytes(), charset);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template resource: " + resourcePath, e);
        }
    }

    public boolean exists() {
        if (isFileSystemResource()) {
            return Files.isRegularFile(filePath);
        }
        // jar 内资源只能通过打开流确认
        try (InputStream ignored = classpathUrl.openStream()) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * 最后修改时间 (epoch 毫秒)，无法获取时为 0
     */
    public long getLastModified() {
        try {
            if (isFileSystemResource()) {
                return Files.getLastModifiedTime(filePath).toMillis();
            }
            URLConnection connection = classpathUrl.openConnection();
            connection.setUseCaches(false);
            return connection.getLastModified();
        } catch (IOException e) {
            return 0L;
        }
    }

    private InputStream openStream() throws IOException {
        return isFileSystemResource() ? Files.newInputStream(filePath) : classpathUrl.openStream();
    }

    public String getResourcePath() {
        return resourcePath;
    }

    public boolean isFileSystemResource() {
        return filePath != null;
    }

    /**
     * @return 文件路径，Classpath 资源返回 null
     */
    public Path getFilePath() {
        return filePath;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TemplateResource && resourcePath.equals(((TemplateResource) obj).resourcePath);
    }

    @Override
    public int hashCode() {
        return resourcePath.hashCode();
    }

    @Override
    public String toString() {
        return "TemplateResource[" + resourcePath + "]";
    }
}
