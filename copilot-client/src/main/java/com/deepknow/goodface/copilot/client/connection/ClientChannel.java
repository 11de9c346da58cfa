package com.deepknow.goodface.copilot.client.connection;

/**
 * 客户端到服务端的一条 WebSocket 通道。事件通过 {@link Handler} 回调。
 */
public interface ClientChannel {

    enum ReadyState { CONNECTING, OPEN, CLOSING, CLOSED }

    ReadyState readyState();

    void sendText(String text);

    void sendBinary(byte[] data);

    void close(int code, String reason);

    /**
     * 之后不再回调任何事件。
     */
    void detachHandlers();

    interface Handler {
        Handler NO_OP = new Handler() {};

        default void onOpen() {}

        default void onText(String text) {}

        default void onBinary(byte[] data) {}

        default void onClose(int code, String reason) {}

        default void onError(Throwable error) {}
    }
}
