package com.deepknow.goodface.copilot.domain.session.util;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 下行消息构造。
 */
public final class ServerMessages {
    public static final String READY = "ready";
    public static final String RECORDING_STARTED = "recording_started";
    public static final String RECORDING_STOPPED = "recording_stopped";
    public static final String TRANSCRIPT = "transcript";
    public static final String AI_RESPONSE = "ai_response";
    public static final String AUDIO = "audio";
    public static final String AUDIO_END = "audio_end";
    public static final String ERROR = "error";
    public static final String MUTED = "muted";
    public static final String UNMUTED = "unmuted";
    public static final String SESSION_ENDED = "session_ended";

    private ServerMessages() {}

    public static Map<String, Object> ready(String message) {
        Map<String, Object> m = of(READY);
        m.put("message", message);
        return m;
    }

    public static Map<String, Object> recordingStarted() {
        return of(RECORDING_STARTED);
    }

    public static Map<String, Object> recordingStopped(String fullTranscript) {
        Map<String, Object> m = of(RECORDING_STOPPED);
        m.put("fullTranscript", fullTranscript);
        return m;
    }

    public static Map<String, Object> transcript(String data, boolean isFinal) {
        Map<String, Object> m = of(TRANSCRIPT);
        m.put("data", data);
        m.put("isFinal", isFinal);
        return m;
    }

    public static Map<String, Object> aiResponse(String data) {
        Map<String, Object> m = of(AI_RESPONSE);
        m.put("data", data);
        return m;
    }

    public static Map<String, Object> audio(byte[] chunk, String format, int chunkIndex) {
        Map<String, Object> m = of(AUDIO);
        m.put("data", Base64.getEncoder().encodeToString(chunk));
        m.put("format", format);
        m.put("chunkIndex", chunkIndex);
        return m;
    }

    public static Map<String, Object> audioEnd(int totalChunks) {
        Map<String, Object> m = of(AUDIO_END);
        m.put("totalChunks", totalChunks);
        return m;
    }

    public static Map<String, Object> error(String message) {
        Map<String, Object> m = of(ERROR);
        m.put("message", message);
        return m;
    }

    public static Map<String, Object> muted() {
        return of(MUTED);
    }

    public static Map<String, Object> unmuted() {
        return of(UNMUTED);
    }

    public static Map<String, Object> sessionEnded() {
        return of(SESSION_ENDED);
    }

    private static Map<String, Object> of(String type) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        return m;
    }
}
