package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.impl.ArrayLoader;
import com.chih.JStencil.core.impl.CaffeineArtifactStore;
import com.chih.JStencil.core.impl.MustacheTemplateEngine;
import com.chih.JStencil.core.spi.TemplateEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 并发加载测试：同一个模板只编译一次，所有线程拿到同一个实例
 */
class ConcurrentLoadTest {

    @Test
    void testConcurrentLoadCompilesOnce() throws Exception {
        TemplateEngine engine = spy(new MustacheTemplateEngine());
        EnvironmentOptions options = new EnvironmentOptions();
        options.setTemplateEngine(engine);
        options.setCache(new CaffeineArtifactStore());
        Environment env = new Environment(new ArrayLoader(Map.of("page", "Hello {{name}}")), options);

        int threadCount = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Template>> futures = new CopyOnWriteArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return env.loadTemplate("page");
            }));
        }

        start.countDown();
        Set<Template> instances = ConcurrentHashMap.newKeySet();
        for (Future<Template> future : futures) {
            instances.add(future.get(10, TimeUnit.SECONDS));
        }
        executor.shutdown();

        assertThat(instances).hasSize(1);
        verify(engine, times(1)).compile(anyString(), eq("page"), any());
    }

    @Test
    void testConcurrentRenderWithGlobalUpdates() throws Exception {
        Environment env = new Environment(new ArrayLoader(Map.of("page", "{{greeting}} {{name}}")));
        env.addGlobal("greeting", "Hello");
        env.loadTemplate("page");

        int threadCount = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        List<Future<String>> futures = new CopyOnWriteArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            final int id = i;
            futures.add(executor.submit(() -> {
                env.addGlobal("greeting", "Hi");
                return env.render("page", Map.of("name", "user" + id));
            }));
        }

        for (int i = 0; i < threadCount; i++) {
            assertThat(futures.get(i).get(10, TimeUnit.SECONDS)).isEqualTo("Hi user" + i);
        }
        executor.shutdown();
    }
}
