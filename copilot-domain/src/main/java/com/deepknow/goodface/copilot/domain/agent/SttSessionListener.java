package com.deepknow.goodface.copilot.domain.agent;

/**
 * STT 会话对外事件：open / transcript / error / close。
 */
public interface SttSessionListener {

    SttSessionListener NO_OP = new SttSessionListener() {};

    default void onOpen() {}

    default void onTranscript(TranscriptEvent event) {}

    default void onError(Throwable error) {}

    default void onClose() {}
}
