package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.extension.ExtensionSet;
import com.chih.JStencil.core.spi.Loader;

import java.util.function.Supplier;

/**
 * 判断缓存的编译产物是否仍然有效
 * <p>
 * 只在 auto-reload 开启时使用：生产环境不需要每次都探测文件修改时间。
 * </p>
 */
public class FreshnessChecker {

    private final ExtensionSet extensionSet;

    private final Supplier<Loader> loader;

    public FreshnessChecker(ExtensionSet extensionSet, Supplier<Loader> loader) {
        this.extensionSet = extensionSet;
        this.loader = loader;
    }

    /**
     * 扩展没有在产物写入之后被修改，并且模板源码也没有被修改
     *
     * @param name 模板名称
     * @param cachedTimestamp 产物时间戳 (epoch 毫秒)
     */
    public boolean isFresh(String name, long cachedTimestamp) {
        return extensionSet.getLastModified() <= cachedTimestamp
                && loader.get().isFresh(name, cachedTimestamp);
    }
}
