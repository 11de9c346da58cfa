package com.deepknow.goodface.copilot.domain.agent;

/**
 * 到 STT 服务商的一条实时识别连接。
 * 由 {@link SttConnector#create} 创建，调用 {@link #open()} 后异步建立，结果通过 {@link Listener} 回调。
 */
public interface SttConnection {

    /**
     * 发起连接；不阻塞，连接建立后回调 {@link Listener#onOpen()}。
     */
    void open();

    /**
     * 底层传输当前是否处于可写状态。
     */
    boolean isOpen();

    void sendAudio(byte[] chunk);

    /**
     * 通知服务商音频结束，促使其输出尾部转写并关闭连接。
     */
    void finish();

    /**
     * 立即释放连接，可重复调用。
     */
    void close();

    /**
     * 服务商侧事件。transcript/metadata 只做通知，不应改变连接状态。
     */
    interface Listener {
        void onOpen();

        void onTranscript(String text, boolean isFinal);

        default void onMetadata(String summary) {}

        void onError(Throwable error);

        void onClose();
    }
}
