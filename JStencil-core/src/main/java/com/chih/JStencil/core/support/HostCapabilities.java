package com.chih.JStencil.core.support;

/**
 * 宿主环境能力探测
 * <p>
 * 编译产物的 identity 需要区分"有无可选加速层"以及宿主版本，
 * 否则在不同运行环境之间共享缓存目录时会激活不兼容的产物。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class HostCapabilities {

    /**
     * mustache.java 的 invokedynamic 加速模块 (com.github.spullara.mustache.java:indy)
     */
    public static final String DEFAULT_ACCELERATOR_CLASS = "com.github.mustachejava.indy.IndyObjectHandler";

    private final boolean accelerated;

    private final String hostVersion;

    public HostCapabilities(boolean accelerated, String hostVersion) {
        this.accelerated = accelerated;
        this.hostVersion = hostVersion;
    }

    /**
     * 探测当前进程的能力：加速模块是否在 Classpath 上 + Java 主版本 + JStencil 版本
     */
    public static HostCapabilities detect() {
        return new HostCapabilities(isClassPresent(DEFAULT_ACCELERATOR_CLASS),
                Runtime.version().feature() + ":" + JStencilVersion.VERSION);
    }

    static boolean isClassPresent(String className) {
        try {
            Class.forName(className, false, HostCapabilities.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    public boolean isAccelerated() {
        return accelerated;
    }

    public String getHostVersion() {
        return hostVersion;
    }
}
