package com.chih.JStencil.core.exception;

public class TemplateRecursionException extends SyntaxException {

    public TemplateRecursionException(String message) {
        super(message, null);
    }
}
