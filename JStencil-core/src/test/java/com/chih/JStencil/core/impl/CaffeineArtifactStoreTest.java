package com.chih.JStencil.core.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineArtifactStoreTest {

    @Test
    void testWriteAndLoad() {
        CaffeineArtifactStore store = new CaffeineArtifactStore(10);
        String key = store.generateKey("page", "__JStencil_abc");

        assertThat(store.load(key)).isEmpty();
        assertThat(store.getTimestamp(key)).isZero();

        long before = System.currentTimeMillis();
        store.write(key, "content");

        assertThat(store.load(key)).contains("content");
        assertThat(store.getTimestamp(key)).isGreaterThanOrEqualTo(before);
        assertThat(store.size()).isEqualTo(1);
    }
}
