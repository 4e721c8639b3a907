package com.chih.JStencil.core.engine;

import com.chih.JStencil.core.spi.TemplateEngine;

/**
 * 已激活的编译产物
 *
 * @param identity 编译产物 identity
 * @param templateName 模板名称
 * @param engine 激活该产物的引擎，渲染时也由它执行
 * @param executable 引擎的可执行对象
 */
public record TemplateUnit(String identity, String templateName, TemplateEngine engine, Object executable) {
}
