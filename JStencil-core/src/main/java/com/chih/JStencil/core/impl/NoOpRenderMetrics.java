package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.spi.RenderMetrics;

public class NoOpRenderMetrics implements RenderMetrics {
    @Override
    public void recordRender(String templateName, long durationNs, boolean success) {
        // Do nothing
    }

    @Override
    public void recordCompile(String templateName, long durationNs, boolean success) {
        // Do nothing
    }
}
