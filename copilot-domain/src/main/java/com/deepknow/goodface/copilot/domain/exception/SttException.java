package com.deepknow.goodface.copilot.domain.exception;

public class SttException extends ProviderException {

    public SttException(String provider, ProviderErrorKind kind, int statusCode, String message, Throwable cause) {
        super(provider, kind, statusCode, message, cause);
    }

    public SttException(String provider, ProviderErrorKind kind, String message) {
        super(provider, kind, message);
    }
}
