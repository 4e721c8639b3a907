package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.spi.ArtifactStore;

import java.util.Optional;

/**
 * 禁用持久化缓存时使用：什么都不存，什么都读不到
 */
public class NullArtifactStore implements ArtifactStore {

    @Override
    public String generateKey(String name, String identity) {
        return "";
    }

    @Override
    public void write(String key, String content) {
        // Do nothing
    }

    @Override
    public Optional<String> load(String key) {
        return Optional.empty();
    }

    @Override
    public long getTimestamp(String key) {
        return 0L;
    }
}
