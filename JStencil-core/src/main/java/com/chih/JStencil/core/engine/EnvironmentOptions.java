package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.spi.RenderMetrics;
import com.chih.JStencil.core.spi.TemplateEngine;
import com.chih.JStencil.core.support.HostCapabilities;

/**
 * Environment 配置项
 *
 * <h3>默认值：</h3>
 * <ul>
 *   <li>debug: false</li>
 *   <li>charset: UTF-8</li>
 *   <li>baseTemplateClass: {@link Template}</li>
 *   <li>strictVariables: false - 开启后模板引用不存在的顶层变量会抛出 RenderException</li>
 *   <li>cache: false - 字符串路径、false 或 ArtifactStore 实现</li>
 *   <li>autoReload: null - 未设置时跟随 debug</li>
 *   <li>optimizations: -1 - 全部开启，0 表示关闭</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class EnvironmentOptions {

    private boolean debug = false;

    private String charset = "UTF-8";

    private Class<? extends Template> baseTemplateClass = Template.class;

    private boolean strictVariables = false;

    private Object cache = Boolean.FALSE;

    private Boolean autoReload;

    private int optimizations = -1;

    // 以下为可选的协作者，为 null 时由 Environment 创建默认实现
    private TemplateEngine templateEngine;

    private RenderMetrics metrics;

    private UnitRegistry unitRegistry;

    private HostCapabilities hostCapabilities;

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public Class<? extends Template> getBaseTemplateClass() {
        return baseTemplateClass;
    }

    public void setBaseTemplateClass(Class<? extends Template> baseTemplateClass) {
        this.baseTemplateClass = baseTemplateClass;
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    public void setStrictVariables(boolean strictVariables) {
        this.strictVariables = strictVariables;
    }

    public Object getCache() {
        return cache;
    }

    public void setCache(Object cache) {
        this.cache = cache;
    }

    public Boolean getAutoReload() {
        return autoReload;
    }

    public void setAutoReload(Boolean autoReload) {
        this.autoReload = autoReload;
    }

    public int getOptimizations() {
        return optimizations;
    }

    public void setOptimizations(int optimizations) {
        this.optimizations = optimizations;
    }

    public TemplateEngine getTemplateEngine() {
        return templateEngine;
    }

    public void setTemplateEngine(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    public RenderMetrics getMetrics() {
        return metrics;
    }

    public void setMetrics(RenderMetrics metrics) {
        this.metrics = metrics;
    }

    public UnitRegistry getUnitRegistry() {
        return unitRegistry;
    }

    public void setUnitRegistry(UnitRegistry unitRegistry) {
        this.unitRegistry = unitRegistry;
    }

    public HostCapabilities getHostCapabilities() {
        return hostCapabilities;
    }

    public void setHostCapabilities(HostCapabilities hostCapabilities) {
        this.hostCapabilities = hostCapabilities;
    }
}
