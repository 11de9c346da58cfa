package com.deepknow.goodface.copilot.domain.agent.stt;

import com.deepknow.goodface.copilot.domain.agent.SttConnection;
import com.deepknow.goodface.copilot.domain.agent.SttConnector;
import com.deepknow.goodface.copilot.domain.agent.SttOptions;
import com.deepknow.goodface.copilot.domain.agent.SttSessionListener;
import com.deepknow.goodface.copilot.domain.agent.TranscriptEvent;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.SttConnectTimeoutException;
import com.deepknow.goodface.copilot.domain.exception.SttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 一次录音对应的 STT 会话：持有至多一条服务商连接，生命周期由单一状态机描述。
 * 所有状态变化都经过 {@link #transition(State)}，并在同一把锁内完成。
 * 会话不可复用，stop 之后需要重新创建。
 */
public class SttSession {
    private static final Logger log = LoggerFactory.getLogger(SttSession.class);

    public enum State { IDLE, STARTING, CONNECTED, STOPPING, STOPPED }

    private static final Map<State, Set<State>> ALLOWED = Map.of(
            State.IDLE, EnumSet.of(State.STARTING, State.STOPPING),
            State.STARTING, EnumSet.of(State.CONNECTED, State.IDLE, State.STOPPING),
            State.CONNECTED, EnumSet.of(State.IDLE, State.STOPPING),
            State.STOPPING, EnumSet.of(State.STOPPED),
            State.STOPPED, EnumSet.noneOf(State.class));

    private final String wsSessionId;
    private final SttConnector connector;
    private final SttOptions options;
    private final ScheduledExecutorService scheduler;
    private final long openTimeoutMs;
    private final long closeGraceMs;

    private final Object lock = new Object();
    private State state = State.IDLE;
    private SttConnection connection;
    private ProviderEvents currentEvents;
    private CompletableFuture<Void> pendingOpen;
    private CompletableFuture<Void> closeSignal;
    private ScheduledFuture<?> openTimeout;
    private boolean closeNotified;

    private volatile SttSessionListener listener;

    public SttSession(String wsSessionId, SttConnector connector, SttOptions options,
                      ScheduledExecutorService scheduler, long openTimeoutMs, long closeGraceMs,
                      SttSessionListener listener) {
        this.wsSessionId = wsSessionId;
        this.connector = connector;
        this.options = options;
        this.scheduler = scheduler;
        this.openTimeoutMs = openTimeoutMs;
        this.closeGraceMs = closeGraceMs;
        this.listener = listener == null ? SttSessionListener.NO_OP : listener;
    }

    /**
     * 幂等启动：已连接时立即完成；启动中时复用同一次连接；已停止时失败。
     * 返回的 future 在服务商报告 open 后完成，超时则以 {@link SttConnectTimeoutException} 失败。
     */
    public CompletableFuture<Void> start() {
        synchronized (lock) {
            switch (state) {
                case CONNECTED:
                    return CompletableFuture.completedFuture(null);
                case STARTING:
                    log.debug("STT start while starting, join pending open: wsSessionId={}", wsSessionId);
                    return pendingOpen.copy();
                case STOPPING:
                case STOPPED:
                    return CompletableFuture.failedFuture(
                            new IllegalStateException("STT session already stopped"));
                default:
                    break;
            }
            transition(State.STARTING);
            pendingOpen = new CompletableFuture<>();
            closeSignal = new CompletableFuture<>();
            CompletableFuture<Void> result = pendingOpen.copy();
            ProviderEvents events = new ProviderEvents();
            try {
                connection = connector.create(options, events);
                currentEvents = events;
                openTimeout = scheduler.schedule(() -> onOpenTimeout(events), openTimeoutMs, TimeUnit.MILLISECONDS);
                log.info("STT connecting: provider={}, wsSessionId={}", connector.name(), wsSessionId);
                connection.open();
            } catch (RuntimeException e) {
                log.warn("STT connect failed: provider={}, wsSessionId={}", connector.name(), wsSessionId, e);
                failPendingOpen(events, e);
            }
            return result;
        }
    }

    /**
     * 仅在已连接且底层传输可写时转发；否则忽略。传输失败时回到 IDLE 并通知 onError，不抛出。
     *
     * @return 是否已交给服务商
     */
    public boolean sendAudio(byte[] chunk) {
        Throwable failure;
        synchronized (lock) {
            if (state != State.CONNECTED || connection == null) {
                log.trace("STT not connected, drop audio: state={}, wsSessionId={}", state, wsSessionId);
                return false;
            }
            if (!connection.isOpen()) {
                transition(State.IDLE);
                releaseConnection();
                failure = new SttException(connector.name(), ProviderErrorKind.NETWORK,
                        "STT transport closed unexpectedly");
            } else {
                try {
                    connection.sendAudio(chunk);
                    return true;
                } catch (RuntimeException e) {
                    transition(State.IDLE);
                    failure = e;
                }
            }
        }
        log.warn("STT send failed, drop audio: wsSessionId={}, error={}", wsSessionId, failure.toString());
        listener.onError(failure);
        return false;
    }

    /**
     * 幂等停止：先进入 STOPPING 阻止后续转发，再通知服务商收尾，等待尾部转写后释放连接。
     */
    public void stop() {
        SttConnection conn;
        CompletableFuture<Void> pending;
        CompletableFuture<Void> closeWait;
        synchronized (lock) {
            if (state == State.STOPPING || state == State.STOPPED) {
                return;
            }
            transition(State.STOPPING);
            cancelOpenTimeout();
            pending = pendingOpen;
            pendingOpen = null;
            conn = connection;
            closeWait = closeSignal;
        }
        if (pending != null) {
            pending.completeExceptionally(new SttException(connector.name(), ProviderErrorKind.NETWORK,
                    "STT session stopped before connection opened"));
        }
        if (conn != null) {
            try {
                conn.finish();
            } catch (RuntimeException e) {
                log.warn("STT finish failed: wsSessionId={}, error={}", wsSessionId, e.toString());
            }
            awaitClose(closeWait);
            try {
                conn.close();
            } catch (RuntimeException e) {
                log.warn("STT close failed: wsSessionId={}, error={}", wsSessionId, e.toString());
            }
        }
        boolean notifyClose;
        synchronized (lock) {
            connection = null;
            currentEvents = null;
            transition(State.STOPPED);
            notifyClose = markCloseNotified();
        }
        log.info("STT session stopped: wsSessionId={}", wsSessionId);
        if (notifyClose) {
            listener.onClose();
        }
    }

    public void detachListener() {
        listener = SttSessionListener.NO_OP;
    }

    public boolean isReady() {
        synchronized (lock) {
            return state == State.CONNECTED && connection != null && connection.isOpen();
        }
    }

    public boolean isStopRequested() {
        synchronized (lock) {
            return state == State.STOPPING || state == State.STOPPED;
        }
    }

    public State getState() {
        synchronized (lock) {
            return state;
        }
    }

    private void transition(State next) {
        // 调用方必须持有 lock
        if (state == next) {
            return;
        }
        if (!ALLOWED.get(state).contains(next)) {
            throw new IllegalStateException("Illegal STT transition " + state + " -> " + next);
        }
        log.debug("STT state {} -> {}: wsSessionId={}", state, next, wsSessionId);
        state = next;
    }

    private void awaitClose(CompletableFuture<Void> closeWait) {
        if (closeWait == null || closeGraceMs <= 0) {
            return;
        }
        try {
            closeWait.get(closeGraceMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("STT close grace elapsed: wsSessionId={}", wsSessionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.debug("STT close signal failed: wsSessionId={}", wsSessionId);
        }
    }

    private void cancelOpenTimeout() {
        if (openTimeout != null) {
            openTimeout.cancel(false);
            openTimeout = null;
        }
    }

    private boolean markCloseNotified() {
        if (closeNotified) {
            return false;
        }
        closeNotified = true;
        return true;
    }

    private void releaseConnection() {
        SttConnection conn = connection;
        connection = null;
        currentEvents = null;
        if (conn != null) {
            try {
                conn.close();
            } catch (RuntimeException e) {
                log.debug("STT close after failure: wsSessionId={}, error={}", wsSessionId, e.toString());
            }
        }
    }

    private void failPendingOpen(ProviderEvents events, Throwable cause) {
        CompletableFuture<Void> pending;
        synchronized (lock) {
            if (state != State.STARTING || (currentEvents != null && currentEvents != events)) {
                return;
            }
            cancelOpenTimeout();
            pending = pendingOpen;
            pendingOpen = null;
            releaseConnection();
            transition(State.IDLE);
        }
        if (pending != null) {
            pending.completeExceptionally(cause);
        }
    }

    private void onOpenTimeout(ProviderEvents events) {
        synchronized (lock) {
            if (events != currentEvents || state != State.STARTING) {
                return;
            }
        }
        log.warn("STT connection timeout after {}ms: provider={}, wsSessionId={}", openTimeoutMs, connector.name(), wsSessionId);
        failPendingOpen(events, new SttConnectTimeoutException(connector.name(), openTimeoutMs));
    }

    private void handleOpen(ProviderEvents events) {
        CompletableFuture<Void> pending;
        synchronized (lock) {
            if (events != currentEvents || state != State.STARTING) {
                log.debug("Ignore stale STT open: state={}, wsSessionId={}", state, wsSessionId);
                return;
            }
            cancelOpenTimeout();
            transition(State.CONNECTED);
            pending = pendingOpen;
            pendingOpen = null;
        }
        log.info("STT connected: provider={}, wsSessionId={}", connector.name(), wsSessionId);
        if (pending != null) {
            pending.complete(null);
        }
        listener.onOpen();
    }

    private void handleTranscript(ProviderEvents events, String text, boolean isFinal) {
        synchronized (lock) {
            if (events != currentEvents || state == State.STOPPED) {
                return;
            }
        }
        if (text == null || text.isBlank()) {
            return;
        }
        listener.onTranscript(new TranscriptEvent(text, isFinal));
    }

    private void handleError(ProviderEvents events, Throwable error) {
        boolean notify = false;
        synchronized (lock) {
            if (events != currentEvents) {
                return;
            }
            switch (state) {
                case STARTING:
                    break;
                case CONNECTED:
                    transition(State.IDLE);
                    releaseConnection();
                    notify = true;
                    break;
                case STOPPING:
                    if (closeSignal != null) {
                        closeSignal.complete(null);
                    }
                    log.debug("STT error while stopping: wsSessionId={}, error={}", wsSessionId, String.valueOf(error));
                    return;
                default:
                    return;
            }
        }
        if (!notify) {
            failPendingOpen(events, error);
            return;
        }
        log.warn("STT error: provider={}, wsSessionId={}, error={}", connector.name(), wsSessionId, String.valueOf(error));
        listener.onError(error);
    }

    private void handleClose(ProviderEvents events) {
        boolean notify = false;
        boolean failStart = false;
        synchronized (lock) {
            if (events != currentEvents) {
                return;
            }
            if (closeSignal != null) {
                closeSignal.complete(null);
            }
            switch (state) {
                case STARTING:
                    failStart = true;
                    break;
                case CONNECTED:
                    transition(State.IDLE);
                    releaseConnection();
                    notify = markCloseNotified();
                    break;
                default:
                    // STOPPING 由 stop() 负责通知；其余状态忽略
                    return;
            }
        }
        if (failStart) {
            failPendingOpen(events, new SttException(connector.name(), ProviderErrorKind.NETWORK,
                    "STT connection closed before open"));
            return;
        }
        log.info("STT connection closed by provider: wsSessionId={}", wsSessionId);
        if (notify) {
            listener.onClose();
        }
    }

    /**
     * 每条连接一个事件入口，用身份比较丢弃已被替换连接的迟到事件。
     */
    private final class ProviderEvents implements SttConnection.Listener {
        @Override
        public void onOpen() {
            handleOpen(this);
        }

        @Override
        public void onTranscript(String text, boolean isFinal) {
            handleTranscript(this, text, isFinal);
        }

        @Override
        public void onMetadata(String summary) {
            log.info("STT metadata: wsSessionId={}, {}", wsSessionId, summary);
        }

        @Override
        public void onError(Throwable error) {
            handleError(this, error);
        }

        @Override
        public void onClose() {
            handleClose(this);
        }
    }
}
