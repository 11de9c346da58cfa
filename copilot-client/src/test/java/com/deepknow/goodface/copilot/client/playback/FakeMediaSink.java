package com.deepknow.goodface.copilot.client.playback;

import java.util.ArrayList;
import java.util.List;

/**
 * 可控的 sink：completeSynchronously 为 true 时在 append 内直接回调完成，
 * 否则由测试调用 {@link #finishAppend()} / {@link #failAppend()}。
 */
class FakeMediaSink implements MediaSink {
    boolean ready = true;
    boolean completeSynchronously;
    boolean blockPlay;
    RuntimeException appendFailure;
    final List<byte[]> appended = new ArrayList<>();
    int inFlight;
    int maxInFlight;
    int playCalls;
    int pauseCalls;
    private Listener listener;

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public void append(byte[] chunk) {
        if (appendFailure != null) {
            throw appendFailure;
        }
        appended.add(chunk);
        inFlight++;
        maxInFlight = Math.max(maxInFlight, inFlight);
        if (completeSynchronously) {
            inFlight--;
            listener.onAppendFinished();
        }
    }

    @Override
    public void play() throws PlaybackBlockedException {
        playCalls++;
        if (blockPlay) {
            throw new PlaybackBlockedException("user gesture required");
        }
    }

    @Override
    public void pause() {
        pauseCalls++;
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    void becomeReady() {
        ready = true;
        listener.onReady();
    }

    void finishAppend() {
        inFlight--;
        listener.onAppendFinished();
    }

    void failAppend() {
        inFlight--;
        listener.onAppendError(new IllegalStateException("QuotaExceededError"));
    }
}
