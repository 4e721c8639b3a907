package com.chih.JStencil.spring.metrics;

import com.chih.JStencil.core.spi.RenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jstencil.render.timer: 模板渲染耗时，tags: template={name}, result={success|failure}</li>
 *   <li>jstencil.render.count: 模板渲染次数，tags 同上</li>
 *   <li>jstencil.compile.timer: 模板编译耗时 (只在产物缓存未命中时产生)，tags 同上</li>
 * </ul>
 * </p>
 * <p>
 * <strong>注意</strong>：{@code Environment#createTemplate} 生成的模板名称是随机的，
 * 大量使用内联模板时 template tag 的基数会持续增长。
 * </p>
 */
public class MicrometerRenderMetrics implements RenderMetrics {

    private final MeterRegistry registry;

    public MicrometerRenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String templateName, long durationNs, boolean success) {
        Timer.builder("jstencil.render.timer")
                .description("Timer for template rendering")
                .tag("template", templateName)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder("jstencil.render.count")
                .description("Counter for template rendering")
                .tag("template", templateName)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCompile(String templateName, long durationNs, boolean success) {
        Timer.builder("jstencil.compile.timer")
                .description("Timer for template compilation")
                .tag("template", templateName)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);
    }
}
