package com.deepknow.goodface.copilot.client.playback;

/**
 * 只追加的媒体缓冲：同一时刻只允许一次 append，完成情况通过 {@link Listener} 回报。
 */
public interface MediaSink {

    boolean isReady();

    /**
     * 异步追加；可能在调用线程上同步回调 {@link Listener#onAppendFinished()}。
     */
    void append(byte[] chunk);

    void play() throws PlaybackBlockedException;

    void pause();

    void setListener(Listener listener);

    interface Listener {
        void onReady();

        void onAppendFinished();

        void onAppendError(Throwable error);
    }
}
