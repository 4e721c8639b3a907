package com.chih.JStencil.spring;

import com.chih.JStencil.core.exception.LoaderException;
import com.chih.JStencil.core.spi.Loader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Spring Resource 的模板来源。
 * <p>
 * 模板名称拼接在每个根路径之后，通过 Spring 的 {@link ResourceLoader} 解析，
 * 因此 classpath:、file: 以及 jar 内的资源都可以作为模板根路径。
 * </p>
 *
 * <h3>支持的位置模式：</h3>
 * <ul>
 *   <li>Classpath 资源：classpath:/templates/</li>
 *   <li>文件系统资源：file:/opt/app/templates/</li>
 *   <li>混合模式：先查找 file:./templates/，再回退到 classpath:/templates/</li>
 * </ul>
 *
 * @author lizhiyuan
 * @see org.springframework.core.io.Resource
 */
public class SpringResourceLoader implements Loader {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceLoader.class);

    private final ResourceLoader resourceLoader;

    private final List<String> locations;

    private final Charset charset;

    // 模板名称 -> 已解析的资源
    private final Map<String, Resource> resolved = new ConcurrentHashMap<>();

    public SpringResourceLoader(List<String> locations) {
        this(locations, StandardCharsets.UTF_8, new PathMatchingResourcePatternResolver());
    }

    public SpringResourceLoader(List<String> locations, Charset charset, ResourceLoader resourceLoader) {
        this.locations = new ArrayList<>();
        for (String location : locations) {
            if (StringUtils.hasText(location)) {
                this.locations.add(location.endsWith("/") ? location : location + "/");
            }
        }
        this.charset = charset != null ? charset : StandardCharsets.UTF_8;
        this.resourceLoader = resourceLoader;
    }

    public List<String> getLocations() {
        return List.copyOf(locations);
    }

    @Override
    public String getSource(String name) {
        Resource resource = findTemplate(name);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, charset);
        } catch (IOException e) {
            throw new LoaderException(String.format("Unable to read template \"%s\".", name), e);
        }
    }

    @Override
    public String getCacheKey(String name) {
        Resource resource = findTemplate(name);
        try {
            return resource.getURL().toString();
        } catch (IOException e) {
            return resource.getDescription();
        }
    }

    @Override
    public boolean isFresh(String name, long time) {
        Resource resource = findTemplate(name);
        try {
            return resource.lastModified() <= time;
        } catch (IOException e) {
            // 无法获取修改时间的资源 (例如部分 jar 内资源) 视为未修改
            log.debug("Unable to determine last modified time of {}", resource.getDescription(), e);
            return true;
        }
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

    private Resource findTemplate(String name) {
        if (!StringUtils.hasText(name)) {
            throw new LoaderException("A template name cannot be empty.");
        }
        String normalized = StringUtils.cleanPath(name);
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.startsWith("..") || normalized.contains("/../")) {
            throw new LoaderException(String.format(
                    "Looks like you try to load a template outside configured directories (%s).", name));
        }

        Resource cached = resolved.get(normalized);
        if (cached != null && cached.exists()) {
            return cached;
        }

        for (String location : locations) {
            Resource resource = resourceLoader.getResource(location + normalized);
            if (resource.exists() && resource.isReadable()) {
                resolved.put(normalized, resource);
                log.debug("Template {} resolved to {}", normalized, resource.getDescription());
                return resource;
            }
        }

        resolved.remove(normalized);
        throw new LoaderException(String.format("Unable to find template \"%s\" (looked into: %s).",
                normalized, String.join(", ", locations)));
    }
}
