package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.impl.MustacheTemplateEngine;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnitRegistryTest {

    private final MustacheTemplateEngine engine = new MustacheTemplateEngine();

    @Test
    void testDefineIsIdempotent() {
        UnitRegistry registry = new UnitRegistry();
        TemplateUnit unit = new TemplateUnit("id", "page", engine, new Object());

        TemplateUnit first = registry.define("id", () -> unit);
        TemplateUnit second = registry.define("id", () -> new TemplateUnit("id", "page", engine, new Object()));

        assertThat(second).isSameAs(first).isSameAs(unit);
        assertThat(registry.isDefined("id")).isTrue();
        assertThat(registry.get("missing")).isNull();
    }

    @Test
    void testFailedActivationLeavesNoRecord() {
        UnitRegistry registry = new UnitRegistry();

        assertThatThrownBy(() -> registry.define("id", () -> {
            throw new IllegalStateException("broken");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.isDefined("id")).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    void testConcurrentDefineActivatesOnce() throws InterruptedException {
        UnitRegistry registry = new UnitRegistry();
        AtomicInteger activations = new AtomicInteger();
        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    registry.define("id", () -> {
                        activations.incrementAndGet();
                        return new TemplateUnit("id", "page", engine, new Object());
                    });
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(activations.get()).isEqualTo(1);
    }
}
