package com.chih.JStencil.core.exception;

/**
 * JStencil 框架根异常
 * <p>
 * 携带出错模板的名称。名称可能在异常向上传播的过程中才被补全（例如编译阶段抛出的异常），
 * 因此 {@link #getMessage()} 每次都根据当前的模板名称重新拼装。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class JStencilException extends RuntimeException {

    private final String rawMessage;

    private String templateName;

    public JStencilException(String message) {
        this(message, null, null);
    }

    public JStencilException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public JStencilException(String message, String templateName, Throwable cause) {
        super(message, cause);
        this.rawMessage = message;
        this.templateName = templateName;
    }

    /**
     * 不带模板名称的原始信息
     */
    public String getRawMessage() {
        return rawMessage;
    }

    public String getTemplateName() {
        return templateName;
    }

    public void setTemplateName(String templateName) {
        this.templateName = templateName;
    }

    @Override
    public String getMessage() {
        if (templateName == null) {
            return rawMessage;
        }
        String message = rawMessage != null ? rawMessage : "";
        // 和原始信息的句号对齐：'Foo.' -> 'Foo in "bar".'
        if (message.endsWith(".")) {
            return message.substring(0, message.length() - 1) + " in \"" + templateName + "\".";
        }
        return message + " in \"" + templateName + "\"";
    }
}
