package com.deepknow.goodface.copilot.client.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 把音频分片顺序写入 OutputStream 的 sink，写入在独立线程上完成。
 */
public class OutputStreamMediaSink implements MediaSink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OutputStreamMediaSink.class);

    private final OutputStream out;
    private final ExecutorService writer;
    private volatile Listener listener;
    private volatile boolean playing;
    private volatile boolean closed;

    public OutputStreamMediaSink(OutputStream out) {
        this.out = out;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "copilot-media-sink");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean isReady() {
        return !closed;
    }

    @Override
    public void append(byte[] chunk) {
        try {
            writer.execute(() -> write(chunk));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Media sink closed", e);
        }
    }

    private void write(byte[] chunk) {
        Listener l = listener;
        try {
            out.write(chunk);
            out.flush();
        } catch (IOException e) {
            if (l != null) {
                l.onAppendError(e);
            }
            return;
        }
        if (l != null) {
            l.onAppendFinished();
        }
    }

    @Override
    public void play() {
        playing = true;
    }

    @Override
    public void pause() {
        playing = false;
    }

    public boolean isPlaying() {
        return playing;
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
        if (listener != null && !closed) {
            listener.onReady();
        }
    }

    @Override
    public void close() throws IOException {
        closed = true;
        writer.shutdown();
        try {
            writer.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        out.close();
        log.debug("Media sink closed");
    }
}
