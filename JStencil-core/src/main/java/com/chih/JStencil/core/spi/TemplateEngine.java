package com.chih.JStencil.core.spi;

import java.io.Writer;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 模板引擎 SPI 接口
 * 允许用户替换底层的编译和渲染逻辑
 * <p>
 * 编译分为两段：{@link #compile} 产出可持久化的产物内容，{@link #define} 把产物内容激活为进程内的可执行对象。
 * 缓存命中时只会调用 define，不会重新编译。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public interface TemplateEngine {

    /**
     * 引擎名称，参与编译产物 identity 的计算
     */
    String getName();

    /**
     * 1. 编译阶段：将模板源码编译为可持久化的产物内容
     *
     * @param source 模板源码
     * @param name 模板名称
     * @param partialLoader 子模板加载器 (输入子模板名称，返回子模板源码)。如果为 null，则不支持子模板。
     * @return 产物内容
     */
    String compile(String source, String name, Function<String, String> partialLoader);

    /**
     * 2. 激活阶段：把产物内容转换为可执行对象
     *
     * @param content 来自 compile 的产物内容
     * @param name 模板名称
     * @return 可执行对象
     */
    Object define(String content, String name);

    /**
     * 3. 执行阶段：使用可执行对象进行渲染
     *
     * @param executable 来自 define 的可执行对象
     * @param context 变量上下文
     * @param writer 输出
     */
    void execute(Object executable, Map<String, Object> context, Writer writer);

    /**
     * 列出模板顶层引用的变量名 (用于 strict variables 检查)
     */
    default Set<String> getTopLevelVariables(Object executable) {
        return Collections.emptySet();
    }

    /**
     * 列出模板顶层 section 的名称 (用于按需解析未定义的过滤器和函数)
     */
    default Set<String> getTopLevelSections(Object executable) {
        return Collections.emptySet();
    }
}
