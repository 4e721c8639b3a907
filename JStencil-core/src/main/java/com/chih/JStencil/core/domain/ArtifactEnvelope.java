package com.chih.JStencil.core.domain;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 编译产物信封
 * <p>
 * 持久化到 ArtifactStore 的内容。信封携带 identity，激活时据此注册到 UnitRegistry，
 * 并校验产物确实属于当前请求的 identity 和引擎。
 * 同一个 identity 的信封内容必须完全相同，因此这里不记录编译时间等易变字段。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class ArtifactEnvelope {

    private String identity;

    private String templateName;

    /**
     * 产出该产物的模板引擎名称
     */
    private String engine;

    /**
     * 引擎产出的内容，只有对应引擎能理解
     */
    private String content;

    /**
     * 编译期读取过的子模板：名称 -> 当时的 Loader 缓存 Key (按名称排序)
     */
    private Map<String, String> dependencies = new TreeMap<>();

    /**
     * 无参构造函数 (Jackson 反序列化必须)
     */
    public ArtifactEnvelope() {
    }

    public ArtifactEnvelope(String identity, String templateName, String engine, String content) {
        this.identity = identity;
        this.templateName = templateName;
        this.engine = engine;
        this.content = content;
    }

    public ArtifactEnvelope(String identity, String templateName, String engine, String content,
            Map<String, String> dependencies) {
        this(identity, templateName, engine, content);
        setDependencies(dependencies);
    }

    public String getIdentity() {
        return identity;
    }

    public void setIdentity(String identity) {
        this.identity = identity;
    }

    public String getTemplateName() {
        return templateName;
    }

    public void setTemplateName(String templateName) {
        this.templateName = templateName;
    }

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Map<String, String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(Map<String, String> dependencies) {
        this.dependencies = dependencies != null ? new TreeMap<>(dependencies) : new TreeMap<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ArtifactEnvelope that = (ArtifactEnvelope) o;
        return Objects.equals(identity, that.identity)
                && Objects.equals(templateName, that.templateName)
                && Objects.equals(engine, that.engine)
                && Objects.equals(content, that.content)
                && Objects.equals(dependencies, that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, templateName, engine, content, dependencies);
    }

    @Override
    public String toString() {
        return "ArtifactEnvelope{identity='" + identity + "', templateName='" + templateName
                + "', engine='" + engine + "', dependencies=" + dependencies.keySet() + "}";
    }
}
