package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.exception.LoaderException;
import com.chih.JStencil.core.spi.Loader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainLoaderTest {

    @Mock
    private Loader failing;

    @Test
    void testFirstLoaderWins() {
        ChainLoader chain = new ChainLoader(List.of(
                new ArrayLoader(Map.of("page", "first")),
                new ArrayLoader(Map.of("page", "second", "only", "second-only"))));

        assertThat(chain.getSource("page")).isEqualTo("first");
        assertThat(chain.getSource("only")).isEqualTo("second-only");
        assertThat(chain.exists("only")).isTrue();
        assertThat(chain.exists("missing")).isFalse();
    }

    @Test
    void testMissingTemplate() {
        ChainLoader chain = new ChainLoader(List.of(new ArrayLoader()));

        assertThatThrownBy(() -> chain.getCacheKey("missing"))
                .isInstanceOf(LoaderException.class)
                .hasMessage("Template \"missing\" is not defined.");
    }

    @Test
    void testErrorsAreAggregated() {
        when(failing.exists("page")).thenReturn(true);
        when(failing.getSource("page")).thenThrow(new LoaderException("Unable to read template \"page\"."));
        ChainLoader chain = new ChainLoader(List.of(failing));

        assertThatThrownBy(() -> chain.getSource("page"))
                .isInstanceOf(LoaderException.class)
                .hasMessageContaining("Unable to read template");
    }

    @Test
    void testAddLoader() {
        ChainLoader chain = new ChainLoader(List.of());
        chain.addLoader(new ArrayLoader(Map.of("late", "added")));

        assertThat(chain.getLoaders()).hasSize(1);
        assertThat(chain.getSource("late")).isEqualTo("added");
        assertThatThrownBy(() -> chain.addLoader(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
