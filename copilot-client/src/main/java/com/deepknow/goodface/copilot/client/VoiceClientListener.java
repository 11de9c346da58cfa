package com.deepknow.goodface.copilot.client;

import com.deepknow.goodface.copilot.client.connection.ConnectionState;

/**
 * 服务端事件回调，全部为可选实现。
 */
public interface VoiceClientListener {

    default void onConnectionStateChange(ConnectionState state) {}

    default void onReady(String message) {}

    default void onRecordingStarted() {}

    default void onRecordingStopped(String fullTranscript) {}

    default void onTranscript(String text, boolean isFinal) {}

    default void onAiResponse(String text) {}

    default void onAudioChunk(int chunkIndex, String format, int bytes) {}

    default void onAudioEnd(int totalChunks) {}

    default void onError(String message) {}

    default void onMuted(boolean muted) {}

    default void onSessionEnded() {}
}
