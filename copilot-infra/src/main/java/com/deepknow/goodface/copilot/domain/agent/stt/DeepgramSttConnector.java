package com.deepknow.goodface.copilot.domain.agent.stt;

import com.deepknow.goodface.copilot.domain.agent.ApiKeys;
import com.deepknow.goodface.copilot.domain.agent.SttConnection;
import com.deepknow.goodface.copilot.domain.agent.SttConnector;
import com.deepknow.goodface.copilot.domain.agent.SttOptions;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.SttException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Deepgram 实时转写（WebSocket）。识别参数以查询参数传递，结果为 Results/Metadata JSON 消息。
 */
public class DeepgramSttConnector implements SttConnector {
    private static final Logger log = LoggerFactory.getLogger(DeepgramSttConnector.class);
    private static final String NAME = "deepgram";
    private static final String CLOSE_STREAM = "{\"type\":\"CloseStream\"}";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String url;
    private final String apiKey;

    public DeepgramSttConnector(HttpClient httpClient, ObjectMapper mapper, String url, String apiKey) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.url = url;
        this.apiKey = apiKey;
        log.info("Deepgram STT init: url={} apiKey={}", url, ApiKeys.mask(apiKey));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SttConnection create(SttOptions options, SttConnection.Listener listener) {
        return new DeepgramConnection(buildUri(options), listener);
    }

    URI buildUri(SttOptions o) {
        String query = "model=" + enc(o.getModel())
                + "&language=" + enc(o.getLanguage())
                + "&smart_format=" + o.isSmartFormat()
                + "&punctuate=" + o.isPunctuate()
                + "&interim_results=" + o.isInterimResults()
                + "&endpointing=" + o.getEndpointingMs();
        return URI.create(url + (url.contains("?") ? "&" : "?") + query);
    }

    private static String enc(String v) {
        return URLEncoder.encode(v == null ? "" : v, StandardCharsets.UTF_8);
    }

    /**
     * 解析一条服务端消息并分发到监听器。
     */
    void dispatch(String message, SttConnection.Listener listener) {
        JsonNode root;
        try {
            root = mapper.readTree(message);
        } catch (Exception e) {
            log.warn("Deepgram message parse failed: {}", e.getMessage());
            return;
        }
        String type = root.path("type").asText("");
        if ("Results".equals(type)) {
            String text = root.path("channel").path("alternatives").path(0).path("transcript").asText("");
            if (!text.isEmpty()) {
                listener.onTranscript(text, root.path("is_final").asBoolean(false));
            }
        } else if ("Metadata".equals(type)) {
            listener.onMetadata("request_id=" + root.path("request_id").asText("-")
                    + " models=" + root.path("models"));
        } else {
            log.debug("Deepgram message ignored: type={}", type);
        }
    }

    private final class DeepgramConnection implements SttConnection, WebSocket.Listener {
        private final URI uri;
        private final Listener events;
        private final StringBuilder textBuffer = new StringBuilder();
        private volatile WebSocket webSocket;
        private volatile boolean closed;
        private volatile boolean sendFailed;
        private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

        DeepgramConnection(URI uri, Listener events) {
            this.uri = uri;
            this.events = events;
        }

        @Override
        public void open() {
            if (apiKey == null || apiKey.isBlank()) {
                throw new SttException(NAME, ProviderErrorKind.NOT_CONFIGURED, "Deepgram API key not configured");
            }
            httpClient.newWebSocketBuilder()
                    .header("Authorization", "Token " + apiKey)
                    .buildAsync(uri, this)
                    .whenComplete((ws, err) -> {
                        if (err != null) {
                            log.warn("Deepgram connect failed: {}", err.toString());
                            events.onError(new SttException(NAME, ProviderErrorKind.NETWORK, -1,
                                    "Deepgram connect failed: " + err.getMessage(), err));
                        } else if (closed) {
                            ws.abort();
                        }
                    });
        }

        @Override
        public boolean isOpen() {
            WebSocket ws = webSocket;
            return !closed && ws != null && !ws.isOutputClosed() && !ws.isInputClosed();
        }

        @Override
        public synchronized void sendAudio(byte[] chunk) {
            WebSocket ws = webSocket;
            if (ws == null) {
                throw new IllegalStateException("Deepgram connection not open");
            }
            ByteBuffer data = ByteBuffer.wrap(Arrays.copyOf(chunk, chunk.length));
            // JDK WebSocket 不允许并发发送，串成一条链
            lastSend = lastSend.handle((r, e) -> null)
                    .thenCompose(ignored -> ws.sendBinary(data, true));
            lastSend.whenComplete((r, e) -> {
                if (e != null) {
                    onSendFailed(e);
                }
            });
        }

        private void onSendFailed(Throwable error) {
            // 发送链上后续帧会连带失败，只上报一次；主动关闭后的失败不上报
            if (closed || sendFailed) {
                return;
            }
            sendFailed = true;
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.warn("Deepgram send failed: {}", cause.toString());
            events.onError(new SttException(NAME, ProviderErrorKind.NETWORK, -1,
                    "Deepgram audio send failed: " + cause.getMessage(), cause));
        }

        @Override
        public synchronized void finish() {
            WebSocket ws = webSocket;
            if (ws == null || ws.isOutputClosed()) {
                return;
            }
            lastSend = lastSend.handle((r, e) -> null)
                    .thenCompose(ignored -> ws.sendText(CLOSE_STREAM, true));
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            WebSocket ws = webSocket;
            if (ws == null) {
                return;
            }
            if (ws.isOutputClosed()) {
                ws.abort();
                return;
            }
            lastSend.handle((r, e) -> null)
                    .thenCompose(ignored -> ws.sendClose(WebSocket.NORMAL_CLOSURE, "client closed"))
                    .whenComplete((r, e) -> {
                        if (e != null) {
                            ws.abort();
                        }
                    });
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            this.webSocket = webSocket;
            webSocket.request(1);
            events.onOpen();
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String message = textBuffer.toString();
                textBuffer.setLength(0);
                dispatch(message, events);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("Deepgram connection closed: status={} reason={}", statusCode, reason);
            events.onClose();
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            events.onError(error);
        }
    }
}
