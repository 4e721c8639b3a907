package com.chih.JStencil.core.domain;

import com.chih.JStencil.core.exception.LogicException;
import com.chih.JStencil.core.impl.CaffeineArtifactStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheTargetTest {

    @Test
    void testResolveOptions() {
        assertThat(CacheTarget.of(false).getKind()).isEqualTo(CacheTarget.Kind.DISABLED);
        assertThat(CacheTarget.of("/var/cache/stencil").getPath()).isEqualTo(Path.of("/var/cache/stencil"));
        assertThat(CacheTarget.of(Path.of("cache")).getKind()).isEqualTo(CacheTarget.Kind.FILESYSTEM);

        CaffeineArtifactStore store = new CaffeineArtifactStore();
        CacheTarget custom = CacheTarget.of(store);
        assertThat(custom.getKind()).isEqualTo(CacheTarget.Kind.CUSTOM);
        assertThat(custom.getStore()).isSameAs(store);
        assertThat(CacheTarget.of(custom)).isSameAs(custom);
    }

    @Test
    void testRejectUnsupportedOptions() {
        assertThatThrownBy(() -> CacheTarget.of(true)).isInstanceOf(LogicException.class);
        assertThatThrownBy(() -> CacheTarget.of(null)).isInstanceOf(LogicException.class);
        assertThatThrownBy(() -> CacheTarget.of(1L))
                .isInstanceOf(LogicException.class)
                .hasMessage("Cache can only be a string, false, or an ArtifactStore implementation.");
    }

    @Test
    void testToString() {
        assertThat(CacheTarget.disabled().toString()).isEqualTo("disabled");
        assertThat(CacheTarget.filesystem(Path.of("cache")).toString()).isEqualTo("filesystem:cache");
    }
}
