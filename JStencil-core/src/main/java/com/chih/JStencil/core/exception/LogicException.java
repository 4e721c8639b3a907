package com.chih.JStencil.core.exception;

/**
 * API 或配置的错误用法，属于调用方的 Bug，不应被重试
 */
public class LogicException extends JStencilException {

    public LogicException(String message) {
        super(message);
    }

    public LogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
