package com.deepknow.goodface.copilot.domain.exception;

/**
 * 服务商错误分类，附带可展示给用户的提示。
 */
public enum ProviderErrorKind {
    INVALID_REQUEST("The request was rejected, check the input text and voice settings"),
    UNAUTHORIZED("Check that the API key is valid"),
    QUOTA_EXCEEDED("Quota or rate limit exceeded, try again later"),
    SERVER_ERROR("The provider is temporarily unavailable"),
    NETWORK("Network error while contacting the provider"),
    NOT_CONFIGURED("The provider API key is not configured");

    private final String hint;

    ProviderErrorKind(String hint) {
        this.hint = hint;
    }

    public String getHint() {
        return hint;
    }

    /**
     * 按 HTTP 状态码归类；2xx/3xx 不应调用。
     */
    public static ProviderErrorKind fromStatus(int status) {
        if (status == 401 || status == 403) {
            return UNAUTHORIZED;
        }
        if (status == 402 || status == 429) {
            return QUOTA_EXCEEDED;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        return INVALID_REQUEST;
    }
}
