package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.exception.TemplateRecursionException;
import com.chih.JStencil.core.spi.TemplateEngine;
import com.chih.JStencil.core.support.StencilObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mustachejava.Code;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheNotFoundException;
import com.github.mustachejava.codes.IterableCode;
import com.github.mustachejava.codes.NotIterableCode;
import com.github.mustachejava.codes.ValueCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 基于 Mustache 的模板引擎实现
 * 支持 {{user.name}}, {{#list}}循环, {{> partial}} 子模板 等特性
 * <p>
 * 编译产物是一个自包含的 JSON 包：主模板源码 + 编译期解析到的全部子模板源码。
 * 激活时只从包内读取子模板，不再访问 Loader。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class MustacheTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(MustacheTemplateEngine.class);

    public static final String NAME = "mustache";

    private final ObjectMapper objectMapper = StencilObjectMapperFactory.shared();

    /**
     * 编译产物内容
     */
    record MustacheBundle(String template, Map<String, String> partials) {
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String compile(String source, String name, Function<String, String> partialLoader) {
        if (source == null) {
            throw new IllegalArgumentException("Template source cannot be null: " + name);
        }
        // 每次编译创建一个临时的 Factory，绑定当前的 partialLoader
        StencilMustacheFactory mf = new StencilMustacheFactory(name, partialLoader);
        mf.compile(new StringReader(source), name);

        MustacheBundle bundle = new MustacheBundle(source, new TreeMap<>(mf.getRecordedPartials()));
        try {
            return objectMapper.writeValueAsString(bundle);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize mustache bundle: " + name, e);
        }
    }

    @Override
    public Object define(String content, String name) {
        MustacheBundle bundle;
        try {
            bundle = objectMapper.readValue(content, MustacheBundle.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed mustache bundle for template: " + name, e);
        }
        Map<String, String> partials = bundle.partials() != null ? bundle.partials() : Collections.emptyMap();
        StencilMustacheFactory mf = new StencilMustacheFactory(name, partials::get);
        return mf.compile(new StringReader(bundle.template()), name);
    }

    @Override
    public void execute(Object executable, Map<String, Object> context, Writer writer) {
        Mustache mustache = (Mustache) executable;
        mustache.execute(writer, context);
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Set<String> getTopLevelVariables(Object executable) {
        Set<String> names = new LinkedHashSet<>();
        Code[] codes = ((Mustache) executable).getCodes();
        if (codes == null) {
            return names;
        }
        for (Code code : codes) {
            // 只检查顶层的变量标签，section 内部的名称相对于 section 作用域解析
            if (code instanceof ValueCode) {
                String variable = code.getName();
                if (variable == null || variable.isEmpty() || ".".equals(variable)) {
                    continue;
                }
                int dot = variable.indexOf('.');
                names.add(dot > 0 ? variable.substring(0, dot) : variable);
            }
        }
        return names;
    }

    @Override
    public Set<String> getTopLevelSections(Object executable) {
        Set<String> names = new LinkedHashSet<>();
        Code[] codes = ((Mustache) executable).getCodes();
        if (codes == null) {
            return names;
        }
        for (Code code : codes) {
            // {{^name}} 反向 section 不会调用 lambda
            if (code instanceof IterableCode && !(code instanceof NotIterableCode)) {
                String section = code.getName();
                if (section != null && !section.isEmpty() && section.indexOf('.') < 0) {
                    names.add(section);
                }
            }
        }
        return names;
    }

    /**
     * 自定义 Mustache 工厂，子模板源码来自 partialLoader
     */
    private static class StencilMustacheFactory extends DefaultMustacheFactory {
        private final Function<String, String> partialLoader;
        // 用于检测循环引用：记录本次编译链路中涉及的所有模板名称
        private final Set<String> visiting = new HashSet<>();
        // 记录编译期遇到的所有子模板及其源码
        private final Map<String, String> recordedPartials = new TreeMap<>();

        StencilMustacheFactory(String rootName, Function<String, String> partialLoader) {
            this.partialLoader = partialLoader;
            if (rootName != null) {
                visiting.add(rootName);
            }
        }

        @Override
        public Reader getReader(String resourceName) {
            // 1. 循环引用检测
            if (visiting.contains(resourceName)) {
                throw new TemplateRecursionException(
                        String.format("Circular reference detected! Template \"%s\" is referenced recursively.", resourceName));
            }

            // 2. 加载内容
            // 同一个 Factory 内 Mustache 会缓存已编译的子模板，getReader 对同一个名称只会调用一次
            if (partialLoader != null) {
                String content = partialLoader.apply(resourceName);
                if (content != null) {
                    visiting.add(resourceName);
                    recordedPartials.put(resourceName, content);
                    return new StringReader(content);
                }
            }
            log.debug("Partial not found: {}", resourceName);
            throw new MustacheNotFoundException(resourceName);
        }

        Map<String, String> getRecordedPartials() {
            return recordedPartials;
        }
    }
}
