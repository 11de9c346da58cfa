package com.deepknow.goodface.copilot.domain.exception;

public class LlmException extends ProviderException {

    public LlmException(String provider, ProviderErrorKind kind, int statusCode, String message, Throwable cause) {
        super(provider, kind, statusCode, message, cause);
    }

    public LlmException(String provider, ProviderErrorKind kind, String message) {
        super(provider, kind, message);
    }
}
