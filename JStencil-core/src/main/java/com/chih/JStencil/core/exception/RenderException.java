package com.chih.JStencil.core.exception;

public class RenderException extends JStencilException {

    public RenderException(String message, String templateName) {
        super(message, templateName, null);
    }

    public RenderException(String message, String templateName, Throwable cause) {
        super(message, templateName, cause);
    }
}
