package com.deepknow.goodface.copilot.domain.exception;

/**
 * 会话管线异常基类。
 */
public class CopilotException extends RuntimeException {

    public CopilotException(String message) {
        super(message);
    }

    public CopilotException(String message, Throwable cause) {
        super(message, cause);
    }
}
