package com.chih.JStencil.core.extension;

import com.chih.JStencil.core.engine.Environment;
import com.chih.JStencil.core.exception.LogicException;
import com.chih.JStencil.core.spi.Extension;
import com.chih.JStencil.core.support.StencilObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mustachejava.TemplateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 扩展集合
 * <p>
 * 聚合所有已注册的扩展，负责：
 * 1. 计算扩展组合的签名 (参与编译产物 identity)
 * 2. 计算扩展的最后修改时间 (参与新鲜度判断)
 * 3. 汇总扩展贡献的过滤器、函数和全局变量，以及未定义名称的回调
 * 4. 一次性的运行时初始化，初始化之后不再接受新的注册
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class ExtensionSet {

    private static final Logger log = LoggerFactory.getLogger(ExtensionSet.class);

    private final ObjectMapper objectMapper = StencilObjectMapperFactory.shared();

    // 保持注册顺序：后注册的扩展覆盖同名过滤器和全局变量
    private final Map<String, Extension> extensions = new LinkedHashMap<>();

    // 直接通过 Environment#addFilter 注册的过滤器
    private final Map<String, Function<String, String>> stagingFilters = new LinkedHashMap<>();

    private final Map<String, TemplateFunction> stagingFunctions = new LinkedHashMap<>();

    // 按注册顺序询问，第一个非 null 的结果生效
    private final List<Function<String, Function<String, String>>> filterCallbacks = new CopyOnWriteArrayList<>();
    private final List<Function<String, TemplateFunction>> functionCallbacks = new CopyOnWriteArrayList<>();

    private volatile boolean initialized;

    // 以下字段在初始化之后才会缓存
    private Map<String, Function<String, String>> filters;
    private Map<String, TemplateFunction> functions;
    private Map<String, Object> globals;
    private String signature;
    private Long lastModified;

    public synchronized void addExtension(Extension extension) {
        if (extension == null) {
            throw new IllegalArgumentException("Extension cannot be null");
        }
        String name = extension.getName();
        if (initialized) {
            throw new LogicException(String.format(
                    "Unable to register extension \"%s\" as extensions have already been initialized.", name));
        }
        if (extensions.containsKey(name)) {
            throw new LogicException(String.format(
                    "Unable to register extension \"%s\" as it is already registered.", name));
        }
        extensions.put(name, extension);
        log.debug("Extension registered: {}", name);
    }

    public void setExtensions(List<? extends Extension> extensions) {
        extensions.forEach(this::addExtension);
    }

    public synchronized boolean hasExtension(String name) {
        return extensions.containsKey(name);
    }

    /**
     * @throws LogicException 扩展未注册
     */
    public synchronized Extension getExtension(String name) {
        Extension extension = extensions.get(name);
        if (extension == null) {
            throw new LogicException(String.format("The \"%s\" extension is not enabled.", name));
        }
        return extension;
    }

    public synchronized List<Extension> getExtensions() {
        return List.copyOf(extensions.values());
    }

    public synchronized void addFilter(String name, Function<String, String> filter) {
        if (initialized) {
            throw new LogicException(String.format(
                    "Unable to add filter \"%s\" as extensions have already been initialized.", name));
        }
        stagingFilters.put(name, filter);
    }

    /**
     * 先查找已注册的过滤器，再依次询问未定义过滤器回调
     *
     * @return 过滤器，不存在时返回 null
     */
    public Function<String, String> getFilter(String name) {
        Function<String, String> filter = getFilters().get(name);
        if (filter != null) {
            return filter;
        }
        for (Function<String, Function<String, String>> callback : filterCallbacks) {
            filter = callback.apply(name);
            if (filter != null) {
                return filter;
            }
        }
        return null;
    }

    /**
     * 注册未定义过滤器回调：输入过滤器名称，无法处理时返回 null。
     * 回调提供的过滤器不会出现在 {@link #getFilters()} 中，也不参与签名计算。
     */
    public void registerUndefinedFilterCallback(Function<String, Function<String, String>> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("Undefined filter callback cannot be null");
        }
        filterCallbacks.add(callback);
    }

    public synchronized Map<String, Function<String, String>> getFilters() {
        if (filters != null) {
            return filters;
        }
        Map<String, Function<String, String>> merged = new LinkedHashMap<>();
        for (Extension extension : extensions.values()) {
            merged.putAll(extension.getFilters());
        }
        merged.putAll(stagingFilters);
        Map<String, Function<String, String>> result = Collections.unmodifiableMap(merged);
        if (initialized) {
            filters = result;
        }
        return result;
    }

    public synchronized void addFunction(String name, TemplateFunction function) {
        if (initialized) {
            throw new LogicException(String.format(
                    "Unable to add function \"%s\" as extensions have already been initialized.", name));
        }
        stagingFunctions.put(name, function);
    }

    /**
     * 先查找已注册的函数，再依次询问未定义函数回调
     *
     * @return 函数，不存在时返回 null
     */
    public TemplateFunction getFunction(String name) {
        TemplateFunction function = getFunctions().get(name);
        if (function != null) {
            return function;
        }
        for (Function<String, TemplateFunction> callback : functionCallbacks) {
            function = callback.apply(name);
            if (function != null) {
                return function;
            }
        }
        return null;
    }

    public void registerUndefinedFunctionCallback(Function<String, TemplateFunction> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("Undefined function callback cannot be null");
        }
        functionCallbacks.add(callback);
    }

    public synchronized Map<String, TemplateFunction> getFunctions() {
        if (functions != null) {
            return functions;
        }
        Map<String, TemplateFunction> merged = new LinkedHashMap<>();
        for (Extension extension : extensions.values()) {
            Map<String, TemplateFunction> extFunctions = extension.getFunctions();
            if (extFunctions != null) {
                merged.putAll(extFunctions);
            }
        }
        merged.putAll(stagingFunctions);
        Map<String, TemplateFunction> result = Collections.unmodifiableMap(merged);
        if (initialized) {
            functions = result;
        }
        return result;
    }

    public synchronized Map<String, Object> getGlobals() {
        if (globals != null) {
            return globals;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Extension extension : extensions.values()) {
            Map<String, Object> extGlobals = extension.getGlobals();
            if (extGlobals != null) {
                merged.putAll(extGlobals);
            }
        }
        Map<String, Object> result = Collections.unmodifiableMap(merged);
        if (initialized) {
            globals = result;
        }
        return result;
    }

    /**
     * 扩展组合签名：扩展名称 (注册顺序) + 过滤器名称和函数名称 (排序)
     */
    public synchronized String getSignature() {
        if (signature != null) {
            return signature;
        }
        Map<String, Object> composition = new LinkedHashMap<>();
        composition.put("extensions", new ArrayList<>(extensions.keySet()));
        composition.put("filters", new ArrayList<>(new TreeSet<>(getFilters().keySet())));
        composition.put("functions", new ArrayList<>(new TreeSet<>(getFunctions().keySet())));
        String result;
        try {
            result = objectMapper.writeValueAsString(composition);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to compute extension signature", e);
        }
        if (initialized) {
            signature = result;
        }
        return result;
    }

    /**
     * 所有扩展类文件 (或其所在 jar) 的最大修改时间，epoch 毫秒
     */
    public synchronized long getLastModified() {
        if (lastModified != null) {
            return lastModified;
        }
        long max = 0L;
        for (Extension extension : extensions.values()) {
            max = Math.max(max, classLastModified(extension.getClass()));
        }
        if (initialized) {
            lastModified = max;
        }
        return max;
    }

    static long classLastModified(Class<?> type) {
        try {
            CodeSource codeSource = type.getProtectionDomain().getCodeSource();
            if (codeSource == null || codeSource.getLocation() == null) {
                return 0L;
            }
            URL location = codeSource.getLocation();
            if (!"file".equals(location.getProtocol())) {
                return 0L;
            }
            Path path = Path.of(location.toURI());
            if (Files.isDirectory(path)) {
                path = path.resolve(type.getName().replace('.', '/') + ".class");
            }
            return Files.exists(path) ? Files.getLastModifiedTime(path).toMillis() : 0L;
        } catch (URISyntaxException | IOException | SecurityException e) {
            log.debug("Unable to resolve last modified time of {}", type.getName(), e);
            return 0L;
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * 运行时初始化，只有第一次调用生效
     */
    public synchronized void initRuntime(Environment environment) {
        if (initialized) {
            return;
        }
        initialized = true;
        for (Extension extension : extensions.values()) {
            extension.initRuntime(environment);
        }
        log.info("Extensions initialized: {}", extensions.keySet());
    }
}
