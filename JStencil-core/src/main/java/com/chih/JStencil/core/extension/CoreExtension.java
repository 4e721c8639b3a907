package com.chih.JStencil.core.extension;

import com.chih.JStencil.core.spi.Extension;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 默认注册的核心扩展
 * <p>
 * 过滤器以 Mustache section lambda 的形式使用，作用于 section 渲染后的文本：
 * {@code {{#upper}}Hello {{name}}{{/upper}}}
 * </p>
 */
public class CoreExtension implements Extension {

    public static final String NAME = "core";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Map<String, Function<String, String>> getFilters() {
        Map<String, Function<String, String>> filters = new LinkedHashMap<>();
        filters.put("upper", text -> text.toUpperCase(Locale.ROOT));
        filters.put("lower", text -> text.toLowerCase(Locale.ROOT));
        filters.put("trim", String::trim);
        filters.put("capitalize", CoreExtension::capitalize);
        return filters;
    }

    static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1).toLowerCase(Locale.ROOT);
    }
}
