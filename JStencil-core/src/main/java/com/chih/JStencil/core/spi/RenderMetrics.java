package com.chih.JStencil.core.spi;

/**
 * 监控指标 SPI 接口
 *
 * @author lizhiyuan
 */
public interface RenderMetrics {

    /**
     * 记录一次模板渲染
     *
     * @param templateName 模板名称
     * @param durationNs 耗时 (纳秒)
     * @param success 是否成功
     */
    void recordRender(String templateName, long durationNs, boolean success);

    /**
     * 记录一次模板编译 (缓存未命中时)
     */
    void recordCompile(String templateName, long durationNs, boolean success);
}
