package com.chih.JStencil.core.exception;

/**
 * 模板编译失败 (词法、语法或代码生成阶段)
 */
public class SyntaxException extends JStencilException {

    public SyntaxException(String message, String templateName) {
        super(message, templateName, null);
    }

    public SyntaxException(String message, String templateName, Throwable cause) {
        super(message, templateName, cause);
    }
}
