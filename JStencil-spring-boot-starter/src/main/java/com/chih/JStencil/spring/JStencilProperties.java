package com.chih.JStencil.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板环境配置
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
@ConfigurationProperties(prefix = "j-stencil")
public class JStencilProperties {

    /**
     * 模板根路径列表，按顺序查找
     * 支持 classpath: 和 file:
     */
    private List<String> locations = new ArrayList<>();

    private boolean debug = false;

    /**
     * 未设置时跟随 debug
     */
    private Boolean autoReload;

    private boolean strictVariables = false;

    private String charset = "UTF-8";

    /**
     * 编译产物缓存目录，为空或 "false" 表示不缓存
     */
    private String cache;

    private int optimizations = -1;

    public JStencilProperties() {
        // 默认约定：classpath 下的 templates 目录
        locations.add("classpath:/templates/");
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public Boolean getAutoReload() {
        return autoReload;
    }

    public void setAutoReload(Boolean autoReload) {
        this.autoReload = autoReload;
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    public void setStrictVariables(boolean strictVariables) {
        this.strictVariables = strictVariables;
    }

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public String getCache() {
        return cache;
    }

    public void setCache(String cache) {
        this.cache = cache;
    }

    public int getOptimizations() {
        return optimizations;
    }

    public void setOptimizations(int optimizations) {
        this.optimizations = optimizations;
    }
}
