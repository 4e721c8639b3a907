package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.exception.LoaderException;
import com.chih.JStencil.core.spi.Loader;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存 Map 的模板来源
 * <p>
 * 缓存 Key 由模板名称和源码组成，源码变化时 identity 随之变化，因此内存模板永远是新鲜的。
 * 主要用于单元测试和 {@code Environment#createTemplate}。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class ArrayLoader implements Loader {

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public ArrayLoader() {
    }

    public ArrayLoader(Map<String, String> templates) {
        if (templates != null) {
            this.templates.putAll(templates);
        }
    }

    public void setTemplate(String name, String source) {
        templates.put(name, source);
    }

    @Override
    public String getSource(String name) {
        return require(name);
    }

    @Override
    public String getCacheKey(String name) {
        return name + ":" + require(name);
    }

    @Override
    public boolean isFresh(String name, long time) {
        require(name);
        return true;
    }

    @Override
    public boolean exists(String name) {
        return name != null && templates.containsKey(name);
    }

    private String require(String name) {
        String source = name != null ? templates.get(name) : null;
        if (source == null) {
            throw new LoaderException(String.format("Template \"%s\" is not defined.", name));
        }
        return source;
    }
}
