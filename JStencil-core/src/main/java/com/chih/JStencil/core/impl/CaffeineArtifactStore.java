package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.spi.ArtifactStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;

/**
 * 基于 Caffeine 的进程内编译产物存储
 * <p>
 * 多个 Environment 共享同一个实例时，后创建的 Environment 可以直接激活已编译的产物。
 * 被淘汰的产物在下次加载时重新编译。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class CaffeineArtifactStore implements ArtifactStore {

    private final Cache<String, StoredArtifact> artifacts;

    private record StoredArtifact(String content, long timestamp) {
    }

    public CaffeineArtifactStore() {
        this(10_000);
    }

    public CaffeineArtifactStore(long maximumSize) {
        this.artifacts = Caffeine.newBuilder()
                // 最大缓存数，防止 OOM
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public String generateKey(String name, String identity) {
        return identity;
    }

    @Override
    public void write(String key, String content) {
        artifacts.put(key, new StoredArtifact(content, System.currentTimeMillis()));
    }

    @Override
    public Optional<String> load(String key) {
        StoredArtifact artifact = artifacts.getIfPresent(key);
        return artifact != null ? Optional.of(artifact.content()) : Optional.empty();
    }

    @Override
    public long getTimestamp(String key) {
        StoredArtifact artifact = artifacts.getIfPresent(key);
        return artifact != null ? artifact.timestamp() : 0L;
    }

    public long size() {
        return artifacts.estimatedSize();
    }
}
