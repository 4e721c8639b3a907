package com.chih.JStencil.core.support;

public final class JStencilVersion {

    public static final String VERSION = "1.0.0";

    private JStencilVersion() {
    }
}
