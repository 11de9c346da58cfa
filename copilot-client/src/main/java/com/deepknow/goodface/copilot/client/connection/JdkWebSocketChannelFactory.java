package com.deepknow.goodface.copilot.client.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 基于 java.net.http.WebSocket 的通道实现：文本分片重组，二进制帧整帧交付。
 */
public class JdkWebSocketChannelFactory implements ChannelFactory {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketChannelFactory.class);

    private final HttpClient httpClient;

    public JdkWebSocketChannelFactory(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ClientChannel open(URI uri, ClientChannel.Handler handler) {
        JdkChannel channel = new JdkChannel(handler);
        httpClient.newWebSocketBuilder()
                .buildAsync(uri, channel)
                .whenComplete((ws, err) -> {
                    if (err != null) {
                        channel.onConnectFailed(err);
                    }
                });
        return channel;
    }

    private static final class JdkChannel implements ClientChannel, WebSocket.Listener {
        private volatile Handler handler;
        private volatile WebSocket webSocket;
        private volatile ReadyState readyState = ReadyState.CONNECTING;
        private final StringBuilder text = new StringBuilder();
        private final ByteArrayOutputStream binary = new ByteArrayOutputStream();
        private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

        JdkChannel(Handler handler) {
            this.handler = handler;
        }

        void onConnectFailed(Throwable err) {
            log.warn("WebSocket connect failed: {}", err.toString());
            readyState = ReadyState.CLOSED;
            handler.onError(err);
        }

        @Override
        public ReadyState readyState() {
            return readyState;
        }

        @Override
        public synchronized void sendText(String data) {
            WebSocket ws = requireOpen();
            lastSend = lastSend.handle((r, e) -> null).thenCompose(i -> ws.sendText(data, true));
        }

        @Override
        public synchronized void sendBinary(byte[] data) {
            WebSocket ws = requireOpen();
            ByteBuffer buf = ByteBuffer.wrap(data.clone());
            lastSend = lastSend.handle((r, e) -> null).thenCompose(i -> ws.sendBinary(buf, true));
        }

        @Override
        public synchronized void close(int code, String reason) {
            WebSocket ws = webSocket;
            if (readyState == ReadyState.CLOSED || readyState == ReadyState.CLOSING) {
                return;
            }
            readyState = ReadyState.CLOSING;
            if (ws == null) {
                // 仍在握手：连接建立后立即关闭
                return;
            }
            lastSend.handle((r, e) -> null)
                    .thenCompose(i -> ws.sendClose(code, reason))
                    .whenComplete((r, e) -> {
                        if (e != null) {
                            ws.abort();
                        }
                        readyState = ReadyState.CLOSED;
                    });
        }

        @Override
        public void detachHandlers() {
            handler = Handler.NO_OP;
        }

        private WebSocket requireOpen() {
            WebSocket ws = webSocket;
            if (ws == null || readyState != ReadyState.OPEN) {
                throw new IllegalStateException("WebSocket not open");
            }
            return ws;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            this.webSocket = webSocket;
            if (readyState == ReadyState.CLOSING) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "closed during connect");
                return;
            }
            readyState = ReadyState.OPEN;
            webSocket.request(1);
            handler.onOpen();
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                handler.onText(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] part = new byte[data.remaining()];
            data.get(part);
            binary.writeBytes(part);
            if (last) {
                byte[] message = binary.toByteArray();
                binary.reset();
                handler.onBinary(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            readyState = ReadyState.CLOSED;
            handler.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            readyState = ReadyState.CLOSED;
            handler.onError(error);
        }
    }
}
