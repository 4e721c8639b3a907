package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.extension.ExtensionSet;
import com.chih.JStencil.core.spi.Loader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FreshnessCheckerTest {

    @Mock
    private ExtensionSet extensionSet;

    @Mock
    private Loader loader;

    private FreshnessChecker checker;

    @BeforeEach
    void setUp() {
        checker = new FreshnessChecker(extensionSet, () -> loader);
    }

    @Test
    void testFreshWhenExtensionsAndSourceUnchanged() {
        when(extensionSet.getLastModified()).thenReturn(100L);
        when(loader.isFresh("page", 100L)).thenReturn(true);

        assertThat(checker.isFresh("page", 100L)).isTrue();
    }

    @Test
    void testStaleWhenSourceChanged() {
        when(extensionSet.getLastModified()).thenReturn(100L);
        when(loader.isFresh("page", 100L)).thenReturn(false);

        assertThat(checker.isFresh("page", 100L)).isFalse();
    }

    @Test
    void testStaleWhenExtensionsNewerRegardlessOfLoader() {
        when(extensionSet.getLastModified()).thenReturn(100L);

        assertThat(checker.isFresh("page", 99L)).isFalse();
        verifyNoInteractions(loader);
    }
}
