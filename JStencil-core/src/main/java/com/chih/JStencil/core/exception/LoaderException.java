package com.chih.JStencil.core.exception;

/**
 * 模板无法被 Loader 解析时抛出
 * <p>
 * 在 {@code Environment#resolveTemplate} 中可以被跳过并尝试下一个候选模板，其他场景下原样抛给调用方。
 * </p>
 */
public class LoaderException extends JStencilException {

    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
