package com.chih.JStencil.core.domain;

import com.chih.JStencil.core.exception.LogicException;
import com.chih.JStencil.core.impl.FilesystemArtifactStore;
import com.chih.JStencil.core.impl.NullArtifactStore;
import com.chih.JStencil.core.spi.ArtifactStore;

import java.nio.file.Path;

/**
 * 编译缓存目标
 * <p>
 * 配置阶段把"路径 / 禁用 / 自定义实现"三种写法一次性解析成确定的类型，
 * 之后的加载流程只和 {@link ArtifactStore} 打交道。
 * </p>
 *
 * <pre>{@code
 * CacheTarget.disabled();
 * CacheTarget.filesystem(Path.of("/var/cache/templates"));
 * CacheTarget.custom(new CaffeineArtifactStore());
 * CacheTarget.of("/var/cache/templates");   // 来自配置文件的字符串
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public final class CacheTarget {

    public enum Kind {
        DISABLED,
        FILESYSTEM,
        CUSTOM
    }

    private final Kind kind;

    private final Path path;

    private final ArtifactStore store;

    /**
     * 私有构造函数，强制使用工厂方法创建实例
     */
    private CacheTarget(Kind kind, Path path, ArtifactStore store) {
        this.kind = kind;
        this.path = path;
        this.store = store;
    }

    public static CacheTarget disabled() {
        return new CacheTarget(Kind.DISABLED, null, new NullArtifactStore());
    }

    public static CacheTarget filesystem(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Cache path cannot be null");
        }
        return new CacheTarget(Kind.FILESYSTEM, path, new FilesystemArtifactStore(path));
    }

    public static CacheTarget custom(ArtifactStore store) {
        if (store == null) {
            throw new IllegalArgumentException("Artifact store cannot be null");
        }
        return new CacheTarget(Kind.CUSTOM, null, store);
    }

    /**
     * 解析松散类型的缓存配置
     *
     * @param option 字符串路径、{@code Boolean.FALSE}、{@link ArtifactStore} 或 {@link CacheTarget}
     * @throws LogicException 其他任何类型
     */
    public static CacheTarget of(Object option) {
        if (option instanceof CacheTarget) {
            return (CacheTarget) option;
        }
        if (option instanceof String) {
            return filesystem(Path.of((String) option));
        }
        if (option instanceof Path) {
            return filesystem((Path) option);
        }
        if (Boolean.FALSE.equals(option)) {
            return disabled();
        }
        if (option instanceof ArtifactStore) {
            return custom((ArtifactStore) option);
        }
        throw new LogicException("Cache can only be a string, false, or an ArtifactStore implementation.");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 仅 FILESYSTEM 类型有值
     */
    public Path getPath() {
        return path;
    }

    public ArtifactStore getStore() {
        return store;
    }

    @Override
    public String toString() {
        switch (kind) {
            case FILESYSTEM:
                return "filesystem:" + path;
            case CUSTOM:
                return "custom:" + store.getClass().getName();
            default:
                return "disabled";
        }
    }
}
