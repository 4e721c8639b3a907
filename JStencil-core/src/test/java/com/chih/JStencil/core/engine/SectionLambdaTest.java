package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.impl.ArrayLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 函数、过滤器以及未定义名称回调在渲染时的行为
 */
@DisplayName("section lambda 测试")
class SectionLambdaTest {

    private ArrayLoader loader;
    private Environment env;

    @BeforeEach
    void setUp() {
        loader = new ArrayLoader();
        env = new Environment(loader);
    }

    private String render(String source, Map<String, Object> context) {
        loader.setTemplate("page", source);
        return env.render("page", context);
    }

    @Test
    @DisplayName("函数接收原始文本，返回值作为模板渲染")
    void testFunctionRendersReturnedTemplate() {
        env.addFunction("twice", text -> text + text);

        assertThat(render("{{#twice}}{{name}};{{/twice}}", Map.of("name", "Bo"))).isEqualTo("Bo;Bo;");
        assertThat(env.getFunctions()).containsOnlyKeys("twice");
    }

    @Test
    @DisplayName("过滤器接收渲染后的文本")
    void testFilterReceivesRenderedText() {
        env.addFilter("brackets", text -> "[" + text + "]");

        assertThat(render("{{#brackets}}{{name}}{{/brackets}}", Map.of("name", "Bo"))).isEqualTo("[Bo]");
    }

    @Test
    @DisplayName("未定义的过滤器通过回调解析")
    void testUndefinedFilterCallback() {
        env.registerUndefinedFilterCallback(name -> name.startsWith("wrap_")
                ? text -> name.substring(5) + "(" + text + ")" : null);

        assertThat(render("{{#wrap_em}}{{name}}{{/wrap_em}}|{{#nothing}}x{{/nothing}}", Map.of("name", "Bo")))
                .isEqualTo("em(Bo)|");
        assertThat(env.getFilter("wrap_b").apply("x")).isEqualTo("b(x)");
        assertThat(env.getFilters()).doesNotContainKey("wrap_em");
    }

    @Test
    @DisplayName("未定义的函数优先于未定义的过滤器")
    void testUndefinedFunctionCallbackWinsOverFilterCallback() {
        env.registerUndefinedFilterCallback(name -> text -> "filter");
        env.registerUndefinedFunctionCallback(name -> "dup".equals(name) ? text -> text + text : null);

        assertThat(render("{{#dup}}{{n}}{{/dup}} {{#other}}{{n}}{{/other}}", Map.of("n", 1))).isEqualTo("11 filter");
    }

    @Test
    @DisplayName("上下文中的同名变量优先")
    void testContextShadowsCallbacks() {
        env.registerUndefinedFilterCallback(name -> text -> "filter");

        assertThat(render("{{#flag}}on{{/flag}}", Map.of("flag", true))).isEqualTo("on");
    }

    @Test
    @DisplayName("函数参与 identity 计算")
    void testFunctionChangesIdentity() {
        loader.setTemplate("page", "x");
        String before = env.getTemplateIdentity("page");

        env.addFunction("noop", text -> text);

        assertThat(env.getTemplateIdentity("page")).isNotEqualTo(before);
    }
}
