package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.exception.JStencilException;
import com.chih.JStencil.core.exception.RenderException;
import com.github.mustachejava.TemplateFunction;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;
import java.util.function.Function;

/**
 * 已加载的模板实例
 * <p>
 * 由 {@link Environment#loadTemplate} 创建并缓存，同一个 Environment 内同一个 identity 只有一个实例。
 * 渲染时的上下文 = 调用方上下文 + 全局变量 (调用方优先) + 函数 + 过滤器 (均不覆盖已有变量)。
 * 顶层 section 引用了仍未定义的名称时，再通过未定义函数/过滤器回调解析。
 * </p>
 * <p>
 * 可以通过 {@link EnvironmentOptions#setBaseTemplateClass} 替换为子类，子类必须保留
 * {@code (Environment, TemplateUnit)} 构造函数。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class Template {

    protected final Environment environment;

    protected final TemplateUnit unit;

    public Template(Environment environment, TemplateUnit unit) {
        this.environment = environment;
        this.unit = unit;
    }

    public String getTemplateName() {
        return unit.templateName();
    }

    public String getIdentity() {
        return unit.identity();
    }

    public Environment getEnvironment() {
        return environment;
    }

    public TemplateUnit getUnit() {
        return unit;
    }

    public String render(Map<String, Object> context) {
        StringWriter writer = new StringWriter();
        display(context, writer);
        return writer.toString();
    }

    /**
     * 按 Environment 的字符集输出到字节流
     */
    public void display(Map<String, Object> context, OutputStream out) {
        Writer writer = new OutputStreamWriter(out, environment.getCharset());
        display(context, writer);
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void display(Map<String, Object> context, Writer writer) {
        Map<String, Object> scope = buildContext(context);

        if (environment.isStrictVariables()) {
            checkVariables(scope);
        }

        try {
            unit.engine().execute(unit.executable(), scope, writer);
        } catch (JStencilException e) {
            if (e.getTemplateName() == null) {
                e.setTemplateName(getTemplateName());
            }
            throw e;
        } catch (RuntimeException e) {
            throw new RenderException(String.format(
                    "An exception has been thrown during the rendering of a template (\"%s\").", e.getMessage()),
                    getTemplateName(), e);
        }
    }

    protected Map<String, Object> buildContext(Map<String, Object> context) {
        Map<String, Object> scope = environment.mergeGlobals(context);
        for (Map.Entry<String, TemplateFunction> function : environment.getFunctions().entrySet()) {
            scope.putIfAbsent(function.getKey(), function.getValue());
        }
        for (Map.Entry<String, Function<String, String>> filter : environment.getFilters().entrySet()) {
            scope.putIfAbsent(filter.getKey(), filter.getValue());
        }
        for (String section : unit.engine().getTopLevelSections(unit.executable())) {
            if (scope.containsKey(section)) {
                continue;
            }
            Function<String, String> lambda = environment.getFunction(section);
            if (lambda == null) {
                lambda = environment.getFilter(section);
            }
            if (lambda != null) {
                scope.put(section, lambda);
            }
        }
        return scope;
    }

    private void checkVariables(Map<String, Object> scope) {
        for (String variable : unit.engine().getTopLevelVariables(unit.executable())) {
            if (!scope.containsKey(variable)) {
                throw new RenderException(String.format("Variable \"%s\" does not exist.", variable),
                        getTemplateName());
            }
        }
    }

    @Override
    public String toString() {
        return "Template{name='" + getTemplateName() + "', identity='" + getIdentity() + "'}";
    }
}
