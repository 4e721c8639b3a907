package com.chih.JStencil.core.spi;

import com.chih.JStencil.core.engine.Environment;
import com.github.mustachejava.TemplateFunction;

import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

/**
 * 扩展 SPI
 * <p>
 * 一个扩展可以向 Environment 贡献过滤器、函数和全局变量。
 * 扩展的组合会参与编译产物 identity 的计算，扩展类文件的修改时间会参与新鲜度判断。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public interface Extension {

    /**
     * 扩展名称，同一个 Environment 内唯一
     */
    default String getName() {
        return getClass().getName();
    }

    /**
     * 过滤器：名称 -> 对渲染后的文本做转换
     */
    default Map<String, Function<String, String>> getFilters() {
        return Collections.emptyMap();
    }

    /**
     * 函数：名称 -> 接收 section 的原始文本，返回的文本会作为模板在当前上下文中渲染
     */
    default Map<String, TemplateFunction> getFunctions() {
        return Collections.emptyMap();
    }

    /**
     * 全局变量
     */
    default Map<String, Object> getGlobals() {
        return Collections.emptyMap();
    }

    /**
     * 首次加载模板前调用一次
     */
    default void initRuntime(Environment environment) {
        // Default no-op
    }
}
