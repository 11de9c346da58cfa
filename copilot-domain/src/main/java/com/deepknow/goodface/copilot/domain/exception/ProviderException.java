package com.deepknow.goodface.copilot.domain.exception;

/**
 * 外部服务商（STT/LLM/TTS）调用失败。
 */
public class ProviderException extends CopilotException {
    private final String provider;
    private final ProviderErrorKind kind;
    private final int statusCode;

    public ProviderException(String provider, ProviderErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public ProviderException(String provider, ProviderErrorKind kind, String message) {
        this(provider, kind, -1, message, null);
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    /**
     * HTTP 状态码；非 HTTP 失败为 -1。
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 面向用户的描述：原始信息加分类提示。
     */
    public String getUserMessage() {
        return getMessage() + " (" + kind.getHint() + ")";
    }
}
