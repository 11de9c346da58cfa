package com.deepknow.goodface.copilot.domain.exception;

/**
 * STT 连接在超时时间内未建立。
 */
public class SttConnectTimeoutException extends SttException {

    public SttConnectTimeoutException(String provider, long timeoutMs) {
        super(provider, ProviderErrorKind.NETWORK, -1,
                "STT connection timeout after " + timeoutMs + "ms", null);
    }
}
