package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.extension.ExtensionSet;
import com.chih.JStencil.core.spi.Loader;
import com.chih.JStencil.core.spi.TemplateEngine;
import com.chih.JStencil.core.support.Digests;
import com.chih.JStencil.core.support.HostCapabilities;

import java.util.function.Supplier;

/**
 * 编译产物 identity 计算
 * <p>
 * identity = 前缀 + SHA-256(Loader 缓存 Key + 扩展签名 + 引擎名称 + 加速层标记 + 宿主版本) [+ "_" + index]。
 * 任何会影响编译结果的输入发生变化，identity 都会随之变化，旧产物自然不会再被命中。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class CacheIdentityDeriver {

    public static final String IDENTITY_PREFIX = "__JStencil_";

    private final Supplier<Loader> loader;

    private final ExtensionSet extensionSet;

    private final Supplier<TemplateEngine> engine;

    private final HostCapabilities hostCapabilities;

    /**
     * Loader 和引擎在 Environment 生命周期内可以被替换，因此以 Supplier 的形式传入
     */
    public CacheIdentityDeriver(Supplier<Loader> loader, ExtensionSet extensionSet,
            Supplier<TemplateEngine> engine, HostCapabilities hostCapabilities) {
        this.loader = loader;
        this.extensionSet = extensionSet;
        this.engine = engine;
        this.hostCapabilities = hostCapabilities;
    }

    /**
     * @param name 模板名称，不能为空
     * @param index 内嵌子模板的序号，可为 null
     * @return identity
     */
    public String derive(String name, Integer index) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Template name cannot be null or empty");
        }
        if (index != null && index < 0) {
            throw new IllegalArgumentException("Embedded template index cannot be negative: " + index);
        }

        StringBuilder key = new StringBuilder(loader.get().getCacheKey(name));
        key.append(extensionSet.getSignature());
        key.append(engine.get().getName());
        key.append(hostCapabilities.isAccelerated() ? "1" : "");
        key.append(':').append(hostCapabilities.getHostVersion());

        return IDENTITY_PREFIX + Digests.sha256Hex(key.toString()) + (index == null ? "" : "_" + index);
    }
}
