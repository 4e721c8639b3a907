package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.exception.LoaderException;
import com.chih.JStencil.core.spi.Loader;
import com.chih.JStencil.core.support.TemplateResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于文件的模板来源
 * <p>
 * 特性：
 * 1. 支持多个根路径，按配置顺序查找，先找到的生效
 * 2. 根路径在文件系统中不存在时，作为 Classpath 前缀查找 (只读)
 * 3. 新鲜度基于文件修改时间
 * 4. 禁止通过 ".." 访问根路径以外的文件
 * </p>
 *
 * <pre>{@code
 * FilesystemLoader loader = new FilesystemLoader("/opt/app/templates", "templates/");
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class FilesystemLoader implements Loader {

    private static final Logger log = LoggerFactory.getLogger(FilesystemLoader.class);

    private final List<String> paths;

    private final Charset charset;

    // 模板名称 -> 已解析的资源，避免重复的文件系统探测
    private final Map<String, TemplateResource> resolved = new ConcurrentHashMap<>();

    public FilesystemLoader(String... paths) {
        this(Arrays.asList(paths), StandardCharsets.UTF_8);
    }

    /**
     * @param paths 根路径列表，支持文件系统路径和 Classpath 路径
     * @param charset 模板文件编码
     */
    public FilesystemLoader(List<String> paths, Charset charset) {
        this.paths = new ArrayList<>(paths);
        this.charset = charset != null ? charset : StandardCharsets.UTF_8;
    }

    public List<String> getPaths() {
        return List.copyOf(paths);
    }

    @Override
    public String getSource(String name) {
        TemplateResource resource = findTemplate(name);
        try {
            return resource.readContent(charset);
        } catch (UncheckedIOException e) {
            throw new LoaderException(String.format("Unable to read template \"%s\".", name), e);
        }
    }

    @Override
    public String getCacheKey(String name) {
        return findTemplate(name).getResourcePath();
    }

    @Override
    public boolean isFresh(String name, long time) {
        return findTemplate(name).getLastModified() <= time;
    }

    @Override
    public boolean exists(String name) {
        try {
            findTemplate(name);
            return true;
        } catch (LoaderException e) {
            return false;
        }
    }

    protected TemplateResource findTemplate(String name) {
        String normalized = normalizeName(name);

        TemplateResource cached = resolved.get(normalized);
        if (cached != null && cached.exists()) {
            return cached;
        }

        validateName(normalized);

        for (String basePath : paths) {
            TemplateResource resource = resolve(basePath, normalized);
            if (resource != null) {
                resolved.put(normalized, resource);
                log.debug("Template {} resolved to {}", normalized, resource.getResourcePath());
                return resource;
            }
        }

        resolved.remove(normalized);
        throw new LoaderException(String.format("Unable to find template \"%s\" (looked into: %s).",
                normalized, String.join(", ", paths)));
    }

    private TemplateResource resolve(String basePath, String name) {
        File base = new File(basePath);

        // 1. 文件系统中存在的目录
        if (base.isDirectory()) {
            Path candidate = base.toPath().resolve(name);
            return candidate.toFile().isFile() ? TemplateResource.fromFile(candidate) : null;
        }

        // 2. 作为 Classpath 前缀查找，ClassLoader 资源路径不应以 / 开头
        String prefix = basePath.startsWith("/") ? basePath.substring(1) : basePath;
        if (!prefix.isEmpty() && !prefix.endsWith("/")) {
            prefix = prefix + "/";
        }
        String resourcePath = prefix + name;
        URL url = getClass().getClassLoader().getResource(resourcePath);
        return url != null ? TemplateResource.fromClasspath(url, resourcePath) : null;
    }

    private String normalizeName(String name) {
        if (name == null || name.isEmpty()) {
            throw new LoaderException("A template name cannot be empty.");
        }
        String normalized = name.replace('\\', '/');
        while (normalized.contains("//")) {
            normalized = normalized.replace("//", "/");
        }
        return normalized.startsWith("/") ? normalized.substring(1) : normalized;
    }

    private void validateName(String name) {
        if (name.indexOf('\0') >= 0) {
            throw new LoaderException("A template name cannot contain NUL bytes.");
        }
        int level = 0;
        for (String part : name.split("/")) {
            if ("..".equals(part)) {
                level--;
            } else if (!".".equals(part) && !part.isEmpty()) {
                level++;
            }
            if (level < 0) {
                throw new LoaderException(String.format(
                        "Looks like you try to load a template outside configured directories (%s).", name));
            }
        }
    }
}
