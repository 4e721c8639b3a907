package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.domain.ArtifactEnvelope;
import com.chih.JStencil.core.domain.CacheTarget;
import com.chih.JStencil.core.exception.JStencilException;
import com.chih.JStencil.core.exception.LoaderException;
import com.chih.JStencil.core.exception.LogicException;
import com.chih.JStencil.core.exception.SyntaxException;
import com.chih.JStencil.core.extension.CoreExtension;
import com.chih.JStencil.core.extension.ExtensionSet;
import com.chih.JStencil.core.impl.ArrayLoader;
import com.chih.JStencil.core.impl.ChainLoader;
import com.chih.JStencil.core.impl.FilesystemArtifactStore;
import com.chih.JStencil.core.impl.MustacheTemplateEngine;
import com.chih.JStencil.core.impl.NoOpRenderMetrics;
import com.chih.JStencil.core.impl.NullArtifactStore;
import com.chih.JStencil.core.spi.ArtifactStore;
import com.chih.JStencil.core.spi.Extension;
import com.chih.JStencil.core.spi.Loader;
import com.chih.JStencil.core.spi.RenderMetrics;
import com.chih.JStencil.core.spi.TemplateEngine;
import com.chih.JStencil.core.support.Digests;
import com.chih.JStencil.core.support.HostCapabilities;
import com.chih.JStencil.core.support.JStencilVersion;
import com.chih.JStencil.core.support.StencilObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.mustachejava.TemplateFunction;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Writer;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 模板环境 (核心入口)
 * <p>
 * 负责把模板名称变成可复用的 {@link Template}：
 * identity 计算 -> 实例缓存 -> 编译产物存储/新鲜度 -> 编译或加载 -> 激活 -> 实例化 -> 缓存。
 * 同时管理全局变量的生命周期和多候选模板的解析。
 * </p>
 *
 * <h3>线程安全：</h3>
 * <ul>
 *   <li>同一个 identity 的加载通过 Caffeine 持有的锁串行化，防止重复编译</li>
 *   <li>激活通过 {@link UnitRegistry#define} 原子完成，同一个 identity 只激活一次</li>
 *   <li>全局变量的读写在 globalsLock 下进行</li>
 *   <li>{@link #createTemplate} 在同一个 Environment 上串行执行，并与 {@link #setLoader} 互斥</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class Environment {

    private static final Logger log = LoggerFactory.getLogger(Environment.class);

    public static final String VERSION = JStencilVersion.VERSION;

    static final String STRING_TEMPLATE_PREFIX = "__string_template__";

    private volatile Loader loader;
    private volatile TemplateEngine templateEngine;
    private volatile RenderMetrics metrics;

    private final ExtensionSet extensionSet = new ExtensionSet();
    private final UnitRegistry unitRegistry;
    private final CacheIdentityDeriver identityDeriver;
    private final FreshnessChecker freshnessChecker;
    private final ObjectMapper objectMapper = StencilObjectMapperFactory.shared();

    private volatile boolean debug;
    private volatile boolean autoReload;
    private volatile boolean strictVariables;
    private volatile Charset charset;
    private final Class<? extends Template> baseTemplateClass;
    private final int optimizations;

    private volatile Object cacheOption;
    private volatile CacheTarget cacheTarget;
    private volatile ArtifactStore artifactStore;

    // identity -> 已加载的模板实例
    private final ConcurrentMap<String, Template> loadedTemplates = new ConcurrentHashMap<>();

    // 加载锁：防止同一个 identity 被并发重复编译
    private final Cache<String, ReentrantLock> loadLocks = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .build();

    private final Object globalsLock = new Object();
    private final Map<String, Object> stagingGlobals = new LinkedHashMap<>();
    // 扩展初始化之后才会生成
    private Map<String, Object> resolvedGlobals;

    private final Object loaderOverrideLock = new Object();

    public Environment(Loader loader) {
        this(loader, new EnvironmentOptions());
    }

    public Environment(Loader loader, EnvironmentOptions options) {
        if (options == null) {
            options = new EnvironmentOptions();
        }
        this.loader = loader;
        this.templateEngine = options.getTemplateEngine() != null
                ? options.getTemplateEngine() : new MustacheTemplateEngine();
        this.metrics = options.getMetrics() != null ? options.getMetrics() : new NoOpRenderMetrics();
        this.unitRegistry = options.getUnitRegistry() != null ? options.getUnitRegistry() : new UnitRegistry();

        HostCapabilities capabilities = options.getHostCapabilities() != null
                ? options.getHostCapabilities() : HostCapabilities.detect();
        this.identityDeriver = new CacheIdentityDeriver(this::getLoader, extensionSet, this::getTemplateEngine, capabilities);
        this.freshnessChecker = new FreshnessChecker(extensionSet, this::getLoader);

        this.debug = options.isDebug();
        this.autoReload = options.getAutoReload() != null ? options.getAutoReload() : debug;
        this.strictVariables = options.isStrictVariables();
        this.charset = resolveCharset(options.getCharset());
        this.baseTemplateClass = options.getBaseTemplateClass() != null
                ? options.getBaseTemplateClass() : Template.class;
        this.optimizations = options.getOptimizations();
        setCache(options.getCache());

        extensionSet.addExtension(new CoreExtension());
    }

    // ---------------------------------------------------------------- render

    public String render(String name, Map<String, Object> context) {
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            String result = loadTemplate(name).render(context);
            success = true;
            return result;
        } finally {
            metrics.recordRender(name, System.nanoTime() - startTime, success);
        }
    }

    public void display(String name, Map<String, Object> context, Writer writer) {
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            loadTemplate(name).display(context, writer);
            success = true;
        } finally {
            metrics.recordRender(name, System.nanoTime() - startTime, success);
        }
    }

    // ---------------------------------------------------------------- load

    public Template loadTemplate(String name) {
        return loadTemplate(name, null);
    }

    /**
     * 加载模板
     *
     * @param name 模板名称
     * @param index 内嵌子模板的序号，可为 null
     * @throws LoaderException 模板不存在
     * @throws SyntaxException 编译失败
     */
    public Template loadTemplate(String name, Integer index) {
        String identity = getTemplateIdentity(name, index);

        Template template = loadedTemplates.get(identity);
        if (template != null) {
            return template;
        }

        ReentrantLock lock = loadLocks.get(identity, k -> new ReentrantLock());
        lock.lock();
        try {
            // Double-check
            template = loadedTemplates.get(identity);
            if (template != null) {
                return template;
            }

            TemplateUnit unit = unitRegistry.get(identity);
            if (unit == null) {
                unit = loadUnit(name, identity);
            } else {
                log.debug("Template unit already defined: {} ({})", name, identity);
            }

            extensionSet.initRuntime(this);

            Template created = instantiate(unit);
            // 锁被淘汰的极端情况下，以先放入的实例为准
            Template existing = loadedTemplates.putIfAbsent(identity, created);
            return existing != null ? existing : created;
        } finally {
            lock.unlock();
        }
    }

    private TemplateUnit loadUnit(String name, String identity) {
        ArtifactStore store = artifactStore;
        String key = store.generateKey(name, identity);

        long timestamp = autoReload ? store.getTimestamp(key) : 0L;
        if (!autoReload || isTemplateFresh(name, timestamp)) {
            TemplateUnit cached = activateCached(store, key, name, identity, timestamp);
            if (cached != null) {
                log.debug("Template loaded from cache: {} ({})", name, key);
                return cached;
            }
        }

        Map<String, String> dependencies = new TreeMap<>();
        String content = compileSource(getLoader().getSource(name), name, dependencies);
        TemplateEngine engine = templateEngine;
        ArtifactEnvelope envelope = new ArtifactEnvelope(identity, name, engine.getName(), content, dependencies);
        store.write(key, writeEnvelope(envelope));

        return unitRegistry.define(identity, () -> activate(envelope, engine));
    }

    /**
     * 从存储中读取并激活编译产物
     *
     * @return 产物不存在或不可用时返回 null，由调用方重新编译
     */
    private TemplateUnit activateCached(ArtifactStore store, String key, String name, String identity, long timestamp) {
        Optional<String> payload = store.load(key);
        if (payload.isEmpty()) {
            return null;
        }

        ArtifactEnvelope envelope;
        try {
            envelope = objectMapper.readValue(payload.get(), ArtifactEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable artifact {} for template {}", key, name, e);
            return null;
        }

        TemplateEngine engine = templateEngine;
        if (!identity.equals(envelope.getIdentity()) || !engine.getName().equals(envelope.getEngine())) {
            log.warn("Discarding mismatched artifact {} for template {} (identity={}, engine={})",
                    key, name, envelope.getIdentity(), envelope.getEngine());
            return null;
        }

        String changed = findChangedDependency(envelope.getDependencies(), timestamp);
        if (changed != null) {
            log.debug("Recompiling template {}: partial {} changed since artifact {} was written", name, changed, key);
            return null;
        }

        try {
            return unitRegistry.define(identity, () -> activate(envelope, engine));
        } catch (RuntimeException e) {
            log.warn("Discarding artifact {} for template {} as it cannot be activated", key, name, e);
            return null;
        }
    }

    /**
     * 子模板的源码被打包在产物里，但不参与 identity 计算，因此激活前逐个确认：
     * 子模板仍然存在、Loader 缓存 Key 没有变化，并且在 auto-reload 下没有在产物写入之后被修改。
     *
     * @return 第一个发生变化的子模板名称，全部有效时返回 null
     */
    private String findChangedDependency(Map<String, String> dependencies, long timestamp) {
        if (dependencies.isEmpty()) {
            return null;
        }
        Loader current = getLoader();
        for (Map.Entry<String, String> dependency : dependencies.entrySet()) {
            String partial = dependency.getKey();
            if (!current.exists(partial)
                    || !dependency.getValue().equals(current.getCacheKey(partial))
                    || (autoReload && !current.isFresh(partial, timestamp))) {
                return partial;
            }
        }
        return null;
    }

    private TemplateUnit activate(ArtifactEnvelope envelope, TemplateEngine engine) {
        Object executable = engine.define(envelope.getContent(), envelope.getTemplateName());
        return new TemplateUnit(envelope.getIdentity(), envelope.getTemplateName(), engine, executable);
    }

    private String writeEnvelope(ArtifactEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new JStencilException("Unable to serialize compiled template.", envelope.getTemplateName(), e);
        }
    }

    private Template instantiate(TemplateUnit unit) {
        try {
            Constructor<? extends Template> constructor =
                    baseTemplateClass.getConstructor(Environment.class, TemplateUnit.class);
            return constructor.newInstance(this, unit);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new LogicException(String.format(
                    "Unable to instantiate template class \"%s\".", baseTemplateClass.getName()), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new LogicException(String.format(
                    "Template class \"%s\" must declare a public (Environment, TemplateUnit) constructor.",
                    baseTemplateClass.getName()), e);
        }
    }

    /**
     * 编译模板源码
     * <p>
     * 编译过程中的任何异常都会被包装为 {@link SyntaxException}；
     * 已经是 JStencilException 的异常原样抛出，并补全模板名称。
     * </p>
     *
     * @return 可持久化的产物内容
     */
    public String compileSource(String source, String name) {
        return compileSource(source, name, new TreeMap<>());
    }

    /**
     * @param dependencies 收集编译期读取过的子模板 (名称 -> Loader 缓存 Key)
     */
    private String compileSource(String source, String name, Map<String, String> dependencies) {
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            String content = templateEngine.compile(source, name, partialLoader(dependencies));
            success = true;
            log.debug("Template compiled: {}", name);
            return content;
        } catch (JStencilException e) {
            if (e.getTemplateName() == null) {
                e.setTemplateName(name);
            }
            log.error("Failed to compile template: {}", name, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to compile template: {}", name, e);
            throw new SyntaxException(String.format(
                    "An exception has been thrown during the compilation of a template (\"%s\").", e.getMessage()),
                    name, e);
        } finally {
            metrics.recordCompile(name, System.nanoTime() - startTime, success);
        }
    }

    // 子模板不存在时返回 null，由引擎报告
    private Function<String, String> partialLoader(Map<String, String> dependencies) {
        Loader current = getLoader();
        return partial -> {
            if (!current.exists(partial)) {
                return null;
            }
            String source = current.getSource(partial);
            dependencies.put(partial, current.getCacheKey(partial));
            return source;
        };
    }

    /**
     * 按顺序尝试多个候选模板，返回第一个可以加载的模板
     *
     * @param candidates 模板名称、已加载的 Template，或者二者混合的 Iterable / 数组
     * @throws LoaderException 所有候选都无法加载
     */
    public Template resolveTemplate(Object candidates) {
        List<Object> list = normalizeCandidates(candidates);
        if (list.isEmpty()) {
            throw new LoaderException("Unable to resolve a template from an empty list of candidates.");
        }

        List<String> attempted = new ArrayList<>();
        LoaderException lastError = null;
        for (Object candidate : list) {
            if (candidate instanceof Template) {
                return (Template) candidate;
            }
            String name = (String) candidate;
            attempted.add(name);
            try {
                return loadTemplate(name);
            } catch (LoaderException e) {
                log.debug("Template candidate not found: {}", name);
                lastError = e;
            }
        }

        if (attempted.size() == 1) {
            throw lastError;
        }
        throw new LoaderException(String.format("Unable to find one of the following templates: %s.",
                attempted.stream().map(n -> "\"" + n + "\"").collect(Collectors.joining(", "))));
    }

    private List<Object> normalizeCandidates(Object candidates) {
        List<Object> list = new ArrayList<>();
        if (candidates instanceof Iterable) {
            ((Iterable<?>) candidates).forEach(list::add);
        } else if (candidates instanceof Object[]) {
            list.addAll(Arrays.asList((Object[]) candidates));
        } else {
            list.add(candidates);
        }

        for (Object candidate : list) {
            if (!(candidate instanceof String) && !(candidate instanceof Template)) {
                throw new LogicException(String.format(
                        "Template candidates must be names or loaded templates, got \"%s\".",
                        candidate == null ? "null" : candidate.getClass().getName()));
            }
        }
        return list;
    }

    /**
     * 直接从源码创建模板
     * <p>
     * 使用随机生成的名称，临时把 [内联 Loader, 当前 Loader] 组成的链作为当前 Loader，
     * 加载结束后无论成功与否都会恢复原来的 Loader。
     * </p>
     */
    public Template createTemplate(String source) {
        String name = STRING_TEMPLATE_PREFIX + Digests.sha256Hex(UUID.randomUUID() + ":" + System.nanoTime());

        synchronized (loaderOverrideLock) {
            List<Loader> chain = new ArrayList<>();
            chain.add(new ArrayLoader(Collections.singletonMap(name, source)));
            if (loader != null) {
                chain.add(loader);
            }
            try (LoaderOverride ignored = overrideLoader(new ChainLoader(chain))) {
                return loadTemplate(name);
            }
        }
    }

    private LoaderOverride overrideLoader(Loader temporary) {
        LoaderOverride override = new LoaderOverride(loader);
        this.loader = temporary;
        return override;
    }

    /**
     * 恢复被临时替换的 Loader
     */
    private final class LoaderOverride implements AutoCloseable {

        private final Loader previous;

        private LoaderOverride(Loader previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            loader = previous;
        }
    }

    // ---------------------------------------------------------------- identity & freshness

    public String getTemplateIdentity(String name) {
        return getTemplateIdentity(name, null);
    }

    public String getTemplateIdentity(String name, Integer index) {
        return identityDeriver.derive(name, index);
    }

    /**
     * 判断编译产物在给定时间戳之后，扩展和模板源码是否都没有被修改
     */
    public boolean isTemplateFresh(String name, long time) {
        return freshnessChecker.isFresh(name, time);
    }

    public int getLoadedTemplateCount() {
        return loadedTemplates.size();
    }

    public UnitRegistry getUnitRegistry() {
        return unitRegistry;
    }

    // ---------------------------------------------------------------- globals

    /**
     * 注册全局变量
     * <p>
     * 扩展初始化之前可以随意注册和覆盖；初始化之后只能更新已存在的全局变量。
     * </p>
     *
     * @throws LogicException 初始化之后注册新的全局变量
     */
    public void addGlobal(String name, Object value) {
        synchronized (globalsLock) {
            if (extensionSet.isInitialized()) {
                Map<String, Object> globals = resolveGlobals();
                if (!globals.containsKey(name)) {
                    throw new LogicException(String.format(
                            "Unable to add global \"%s\" as the runtime or the extensions have already been initialized.",
                            name));
                }
                globals.put(name, value);
            } else {
                stagingGlobals.put(name, value);
            }
        }
    }

    /**
     * @return 全局变量的只读副本 (本地注册的覆盖扩展贡献的)
     */
    public Map<String, Object> getGlobals() {
        synchronized (globalsLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(resolveGlobals()));
        }
    }

    /**
     * 把全局变量合并到上下文中，上下文中已有的 key 优先
     *
     * @return 新的 Map，不会修改传入的上下文
     */
    public Map<String, Object> mergeGlobals(Map<String, Object> context) {
        Map<String, Object> merged = context != null ? new HashMap<>(context) : new HashMap<>();
        synchronized (globalsLock) {
            for (Map.Entry<String, Object> global : resolveGlobals().entrySet()) {
                if (!merged.containsKey(global.getKey())) {
                    merged.put(global.getKey(), global.getValue());
                }
            }
        }
        return merged;
    }

    // 调用方需持有 globalsLock
    private Map<String, Object> resolveGlobals() {
        if (resolvedGlobals != null) {
            return resolvedGlobals;
        }
        Map<String, Object> globals = new LinkedHashMap<>(extensionSet.getGlobals());
        globals.putAll(stagingGlobals);
        if (extensionSet.isInitialized()) {
            resolvedGlobals = globals;
        }
        return globals;
    }

    // ---------------------------------------------------------------- extensions

    public void addExtension(Extension extension) {
        extensionSet.addExtension(extension);
    }

    public void setExtensions(List<? extends Extension> extensions) {
        extensionSet.setExtensions(extensions);
    }

    public boolean hasExtension(String name) {
        return extensionSet.hasExtension(name);
    }

    public Extension getExtension(String name) {
        return extensionSet.getExtension(name);
    }

    public List<Extension> getExtensions() {
        return extensionSet.getExtensions();
    }

    public void addFilter(String name, Function<String, String> filter) {
        extensionSet.addFilter(name, filter);
    }

    public Function<String, String> getFilter(String name) {
        return extensionSet.getFilter(name);
    }

    /**
     * 不包含未定义过滤器回调提供的过滤器
     */
    public Map<String, Function<String, String>> getFilters() {
        return extensionSet.getFilters();
    }

    public void registerUndefinedFilterCallback(Function<String, Function<String, String>> callback) {
        extensionSet.registerUndefinedFilterCallback(callback);
    }

    public void addFunction(String name, TemplateFunction function) {
        extensionSet.addFunction(name, function);
    }

    public TemplateFunction getFunction(String name) {
        return extensionSet.getFunction(name);
    }

    public Map<String, TemplateFunction> getFunctions() {
        return extensionSet.getFunctions();
    }

    public void registerUndefinedFunctionCallback(Function<String, TemplateFunction> callback) {
        extensionSet.registerUndefinedFunctionCallback(callback);
    }

    public ExtensionSet getExtensionSet() {
        return extensionSet;
    }

    // ---------------------------------------------------------------- configuration

    public Loader getLoader() {
        Loader current = loader;
        if (current == null) {
            throw new LogicException("You must set a loader first.");
        }
        return current;
    }

    /**
     * 与 {@link #createTemplate} 互斥，内联模板加载期间的替换不会被恢复逻辑覆盖
     */
    public void setLoader(Loader loader) {
        synchronized (loaderOverrideLock) {
            this.loader = loader;
        }
    }

    public TemplateEngine getTemplateEngine() {
        return templateEngine;
    }

    public void setTemplateEngine(TemplateEngine templateEngine) {
        if (templateEngine == null) {
            throw new IllegalArgumentException("Template engine cannot be null");
        }
        this.templateEngine = templateEngine;
    }

    public RenderMetrics getMetrics() {
        return metrics;
    }

    public void setMetrics(RenderMetrics metrics) {
        this.metrics = metrics != null ? metrics : new NoOpRenderMetrics();
    }

    /**
     * 设置编译产物缓存
     *
     * @param cache 目录路径 (String / Path)、{@code false}、{@link ArtifactStore} 实现或 {@link CacheTarget}
     * @throws LogicException 不支持的类型
     */
    public void setCache(Object cache) {
        CacheTarget target = CacheTarget.of(cache);
        ArtifactStore store;
        switch (target.getKind()) {
            case FILESYSTEM:
                store = new FilesystemArtifactStore(target.getPath());
                break;
            case CUSTOM:
                store = target.getStore();
                break;
            default:
                store = new NullArtifactStore();
        }
        this.cacheOption = cache;
        this.cacheTarget = target;
        this.artifactStore = store;
        log.debug("Artifact cache configured: {}", target);
    }

    /**
     * @param original true 返回设置时传入的原始值，false 返回实际使用的 ArtifactStore
     */
    public Object getCache(boolean original) {
        return original ? cacheOption : artifactStore;
    }

    public Object getCache() {
        return getCache(true);
    }

    public CacheTarget getCacheTarget() {
        return cacheTarget;
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    public Charset getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = resolveCharset(charset);
    }

    private static Charset resolveCharset(String name) {
        if (name == null || name.isBlank()) {
            throw new LogicException("Charset cannot be empty.");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("UTF8".equals(normalized)) {
            normalized = "UTF-8";
        }
        try {
            return Charset.forName(normalized);
        } catch (IllegalArgumentException e) {
            throw new LogicException(String.format("Unsupported charset \"%s\".", name), e);
        }
    }

    public boolean isDebug() {
        return debug;
    }

    public void enableDebug() {
        this.debug = true;
    }

    public void disableDebug() {
        this.debug = false;
    }

    public boolean isAutoReload() {
        return autoReload;
    }

    public void enableAutoReload() {
        this.autoReload = true;
    }

    public void disableAutoReload() {
        this.autoReload = false;
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    public void enableStrictVariables() {
        this.strictVariables = true;
    }

    public void disableStrictVariables() {
        this.strictVariables = false;
    }

    public Class<? extends Template> getBaseTemplateClass() {
        return baseTemplateClass;
    }

    public int getOptimizations() {
        return optimizations;
    }
}
