package com.deepknow.goodface.copilot.domain.agent.stt;

import com.deepknow.goodface.copilot.domain.agent.SttConnection;
import com.deepknow.goodface.copilot.domain.agent.SttConnector;
import com.deepknow.goodface.copilot.domain.agent.SttOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 开发用 Mock STT：不解析音频，连接建立后推送一条 interim 和一条 final 文本。
 */
public class MockSttConnector implements SttConnector {
    private static final Logger log = LoggerFactory.getLogger(MockSttConnector.class);

    private final ScheduledExecutorService scheduler;

    public MockSttConnector(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public SttConnection create(SttOptions options, SttConnection.Listener listener) {
        return new MockConnection(listener);
    }

    private final class MockConnection implements SttConnection {
        private final Listener events;
        private final AtomicLong bytes = new AtomicLong();
        private volatile boolean open;
        private volatile boolean closed;

        MockConnection(Listener events) {
            this.events = events;
        }

        @Override
        public void open() {
            scheduler.schedule(() -> {
                if (closed) {
                    return;
                }
                open = true;
                events.onOpen();
            }, 50, TimeUnit.MILLISECONDS);
            scheduler.schedule(() -> { if (open) events.onTranscript("[mock] explain the", false); }, 300, TimeUnit.MILLISECONDS);
            scheduler.schedule(() -> { if (open) events.onTranscript("[mock] explain the current file", true); }, 1000, TimeUnit.MILLISECONDS);
        }

        @Override
        public boolean isOpen() {
            return open && !closed;
        }

        @Override
        public void sendAudio(byte[] chunk) {
            // mock 下不处理音频
            bytes.addAndGet(chunk.length);
        }

        @Override
        public void finish() {
            scheduler.schedule(() -> {
                open = false;
                events.onClose();
            }, 20, TimeUnit.MILLISECONDS);
        }

        @Override
        public void close() {
            closed = true;
            open = false;
            log.info("Mock STT closed, received {} bytes", bytes.get());
        }
    }
}
