package com.deepknow.goodface.copilot.domain.exception;

public class TtsException extends ProviderException {

    public TtsException(String provider, ProviderErrorKind kind, int statusCode, String message, Throwable cause) {
        super(provider, kind, statusCode, message, cause);
    }

    public TtsException(String provider, ProviderErrorKind kind, String message) {
        super(provider, kind, message);
    }
}
