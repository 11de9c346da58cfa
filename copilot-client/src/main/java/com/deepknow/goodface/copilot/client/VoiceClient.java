package com.deepknow.goodface.copilot.client;

import com.deepknow.goodface.copilot.client.connection.ChannelFactory;
import com.deepknow.goodface.copilot.client.connection.ConnectionManager;
import com.deepknow.goodface.copilot.client.connection.ConnectionState;
import com.deepknow.goodface.copilot.client.playback.PlaybackBufferManager;
import com.deepknow.goodface.copilot.domain.audio.AudioContainer;
import com.deepknow.goodface.copilot.domain.audio.AudioSignatures;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Base64;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 语音会话客户端：组合连接管理与播放缓冲，解析下行消息并分发给 {@link VoiceClientListener}。
 */
public class VoiceClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VoiceClient.class);

    private final ObjectMapper objectMapper;
    private final ConnectionManager connection;
    private final PlaybackBufferManager playback;
    private final VoiceClientListener listener;
    // 每轮回复只检查第一个分片的格式
    private volatile boolean firstChunkChecked;

    public VoiceClient(URI uri, ChannelFactory channelFactory, ScheduledExecutorService scheduler,
                       PlaybackBufferManager playback, ObjectMapper objectMapper, VoiceClientListener listener) {
        this.objectMapper = objectMapper;
        this.playback = playback;
        this.listener = listener == null ? new VoiceClientListener() {} : listener;
        this.connection = new ConnectionManager(uri, channelFactory, scheduler, new ConnectionManager.Listener() {
            @Override
            public void onStateChange(ConnectionState state) {
                VoiceClient.this.listener.onConnectionStateChange(state);
            }

            @Override
            public void onText(String text) {
                handleServerMessage(text);
            }

            @Override
            public void onBinary(byte[] data) {
                log.debug("Ignore binary frame from server, bytes={}", data.length);
            }
        });
    }

    public void connect() {
        connection.connect();
    }

    public ConnectionState getConnectionState() {
        return connection.getState();
    }

    public boolean startRecording() {
        return sendType("start_recording");
    }

    public boolean stopRecording() {
        return sendType("stop_recording");
    }

    public boolean sendAudio(byte[] pcm) {
        return connection.send(pcm);
    }

    public boolean sendText(String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "text_input");
        node.put("message", message);
        return sendJson(node);
    }

    public boolean mute() {
        return sendControl("mute");
    }

    public boolean unmute() {
        return sendControl("unmute");
    }

    public boolean endSession() {
        playback.clear();
        return sendControl("end_session");
    }

    /**
     * 播放首次被拦截后重试。
     */
    public void resumePlayback() {
        playback.resume();
    }

    @Override
    public void close() {
        playback.clear();
        connection.disconnect();
    }

    void handleServerMessage(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Drop malformed server message: {}", e.getOriginalMessage());
            return;
        }
        if (node == null || !node.isObject()) {
            log.warn("Drop non-object server message");
            return;
        }
        String type = node.path("type").asText("");
        switch (type) {
            case "ready":
                listener.onReady(node.path("message").asText(""));
                break;
            case "recording_started":
                listener.onRecordingStarted();
                break;
            case "recording_stopped":
                listener.onRecordingStopped(node.path("fullTranscript").asText(""));
                break;
            case "transcript":
                listener.onTranscript(node.path("data").asText(""), node.path("isFinal").asBoolean(false));
                break;
            case "ai_response":
                listener.onAiResponse(node.path("data").asText(""));
                break;
            case "audio":
                handleAudio(node);
                break;
            case "audio_end":
                firstChunkChecked = false;
                listener.onAudioEnd(node.path("totalChunks").asInt(0));
                break;
            case "error":
                listener.onError(node.path("message").asText(""));
                break;
            case "muted":
                listener.onMuted(true);
                break;
            case "unmuted":
                listener.onMuted(false);
                break;
            case "session_ended":
                playback.clear();
                listener.onSessionEnded();
                break;
            default:
                log.debug("Unknown server message type: {}", type);
        }
    }

    private void handleAudio(JsonNode node) {
        String format = node.path("format").asText("");
        int chunkIndex = node.path("chunkIndex").asInt(-1);
        byte[] chunk;
        try {
            chunk = Base64.getDecoder().decode(node.path("data").asText(""));
        } catch (IllegalArgumentException e) {
            log.warn("Drop audio chunk with invalid base64: chunkIndex={}", chunkIndex);
            return;
        }
        if (chunk.length == 0) {
            return;
        }
        if (!firstChunkChecked) {
            firstChunkChecked = true;
            AudioContainer detected = AudioSignatures.detect(chunk);
            if (AudioSignatures.isMismatch(chunk, format)) {
                log.warn("Audio format mismatch: declared={}, detected={}, head={}",
                        format, detected, AudioSignatures.hexPreview(chunk, 16));
            } else {
                log.debug("First audio chunk: format={}, detected={}", format, detected);
            }
        }
        playback.enqueue(chunk);
        listener.onAudioChunk(chunkIndex, format, chunk.length);
    }

    private boolean sendType(String type) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type);
        return sendJson(node);
    }

    private boolean sendControl(String action) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "control");
        node.put("action", action);
        return sendJson(node);
    }

    private boolean sendJson(JsonNode node) {
        try {
            return connection.send(objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            log.warn("Serialize client message failed: {}", e.getOriginalMessage());
            return false;
        }
    }
}
