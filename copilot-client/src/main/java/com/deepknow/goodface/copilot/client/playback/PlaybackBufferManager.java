package com.deepknow.goodface.copilot.client.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 音频分片排队写入 {@link MediaSink}，保证任意时刻最多一个 append 在途。
 */
public class PlaybackBufferManager implements MediaSink.Listener {
    private static final Logger log = LoggerFactory.getLogger(PlaybackBufferManager.class);

    private final MediaSink sink;
    private final Deque<byte[]> queue = new ArrayDeque<>();
    private boolean appending;
    // 防止 sink 同步回调时重入 drain
    private boolean draining;
    private boolean started;

    public PlaybackBufferManager(MediaSink sink) {
        this.sink = sink;
        sink.setListener(this);
    }

    public synchronized void enqueue(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return;
        }
        queue.addLast(chunk);
        if (!sink.isReady()) {
            log.debug("Sink not ready, queued chunk: queued={}", queue.size());
            return;
        }
        drain();
    }

    @Override
    public synchronized void onReady() {
        log.debug("Sink ready, draining {} queued chunks", queue.size());
        drain();
    }

    @Override
    public synchronized void onAppendFinished() {
        appending = false;
        drain();
    }

    @Override
    public synchronized void onAppendError(Throwable error) {
        log.warn("Append chunk failed, skip: {}", error == null ? "unknown" : error.toString());
        appending = false;
        drain();
    }

    /**
     * 重新尝试播放，用于首次播放被拦截之后。
     */
    public synchronized void resume() {
        try {
            sink.play();
            started = true;
        } catch (PlaybackBlockedException e) {
            log.warn("Playback still blocked: {}", e.getMessage());
        }
    }

    public synchronized void clear() {
        queue.clear();
        appending = false;
        started = false;
        sink.pause();
    }

    public synchronized int queuedCount() {
        return queue.size();
    }

    public synchronized boolean isAppending() {
        return appending;
    }

    private void drain() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            while (!appending && !queue.isEmpty() && sink.isReady()) {
                byte[] next = queue.pollFirst();
                appending = true;
                try {
                    sink.append(next);
                } catch (RuntimeException e) {
                    log.warn("Append chunk threw, skip: {}", e.toString());
                    appending = false;
                    continue;
                }
                startIfNeeded();
            }
        } finally {
            draining = false;
        }
    }

    private void startIfNeeded() {
        if (started) {
            return;
        }
        started = true;
        try {
            sink.play();
        } catch (PlaybackBlockedException e) {
            log.warn("Playback blocked, call resume() after user interaction: {}", e.getMessage());
        }
    }
}
