package com.deepknow.goodface.copilot.client.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 客户端连接管理：区分主动断开与传输断开，传输断开时有限次数重连。
 */
public class ConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    public static final int DEFAULT_RECONNECT_ATTEMPTS = 5;
    public static final long DEFAULT_RECONNECT_INTERVAL_MS = 3000;

    public interface Listener {
        default void onStateChange(ConnectionState state) {}

        default void onText(String text) {}

        default void onBinary(byte[] data) {}
    }

    private final URI uri;
    private final ChannelFactory channelFactory;
    private final ScheduledExecutorService scheduler;
    private final int reconnectAttempts;
    private final long reconnectIntervalMs;
    private final Listener listener;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private ClientChannel channel;
    private ChannelEvents currentEvents;
    private boolean intentionalDisconnect;
    private boolean shouldReconnect = true;
    private int reconnectAttemptCount;
    private ScheduledFuture<?> pendingReconnect;

    public ConnectionManager(URI uri, ChannelFactory channelFactory, ScheduledExecutorService scheduler, Listener listener) {
        this(uri, channelFactory, scheduler, DEFAULT_RECONNECT_ATTEMPTS, DEFAULT_RECONNECT_INTERVAL_MS, listener);
    }

    public ConnectionManager(URI uri, ChannelFactory channelFactory, ScheduledExecutorService scheduler,
                             int reconnectAttempts, long reconnectIntervalMs, Listener listener) {
        this.uri = uri;
        this.channelFactory = channelFactory;
        this.scheduler = scheduler;
        this.reconnectAttempts = reconnectAttempts;
        this.reconnectIntervalMs = reconnectIntervalMs;
        this.listener = listener == null ? new Listener() {} : listener;
    }

    public synchronized void connect() {
        intentionalDisconnect = false;
        shouldReconnect = true;
        openChannel();
    }

    /**
     * 主动断开：先关闭重连开关，再摘除事件处理并关闭通道，保证不会触发重连。
     */
    public synchronized void disconnect() {
        intentionalDisconnect = true;
        shouldReconnect = false;
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
        ClientChannel ch = channel;
        channel = null;
        currentEvents = null;
        if (ch != null) {
            ch.detachHandlers();
            ClientChannel.ReadyState rs = ch.readyState();
            if (rs == ClientChannel.ReadyState.OPEN || rs == ClientChannel.ReadyState.CONNECTING) {
                ch.close(1000, "Client initiated disconnect");
            }
        }
        setState(ConnectionState.DISCONNECTED);
        log.info("Disconnected by client");
    }

    public synchronized boolean send(String text) {
        ClientChannel ch = connectedChannel();
        if (ch == null) {
            log.warn("Cannot send text, not connected: state={}", state);
            return false;
        }
        try {
            ch.sendText(text);
            return true;
        } catch (RuntimeException e) {
            log.warn("Send text failed: {}", e.toString());
            return false;
        }
    }

    public synchronized boolean send(byte[] data) {
        ClientChannel ch = connectedChannel();
        if (ch == null) {
            log.warn("Cannot send binary, not connected: state={}", state);
            return false;
        }
        try {
            ch.sendBinary(data);
            return true;
        } catch (RuntimeException e) {
            log.warn("Send binary failed: {}", e.toString());
            return false;
        }
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized int getReconnectAttemptCount() {
        return reconnectAttemptCount;
    }

    public synchronized boolean isIntentionalDisconnect() {
        return intentionalDisconnect;
    }

    public synchronized boolean isShouldReconnect() {
        return shouldReconnect;
    }

    private ClientChannel connectedChannel() {
        if (state != ConnectionState.CONNECTED || channel == null
                || channel.readyState() != ClientChannel.ReadyState.OPEN) {
            return null;
        }
        return channel;
    }

    private void openChannel() {
        if (channel != null) {
            ClientChannel.ReadyState rs = channel.readyState();
            if (rs == ClientChannel.ReadyState.OPEN || rs == ClientChannel.ReadyState.CONNECTING) {
                log.debug("Connect skipped, channel already {}", rs);
                return;
            }
        }
        setState(ConnectionState.CONNECTING);
        ChannelEvents events = new ChannelEvents();
        currentEvents = events;
        try {
            channel = channelFactory.open(uri, events);
            log.info("Connecting to {}", uri);
        } catch (RuntimeException e) {
            log.warn("Open channel failed: {}", e.toString());
            handleDrop(events, ConnectionState.ERROR);
        }
    }

    private synchronized void reconnect() {
        pendingReconnect = null;
        if (intentionalDisconnect || !shouldReconnect) {
            return;
        }
        log.info("Reconnecting ({}/{})", reconnectAttemptCount, reconnectAttempts);
        openChannel();
    }

    private synchronized void handleOpen(ChannelEvents events) {
        if (events != currentEvents) {
            return;
        }
        reconnectAttemptCount = 0;
        setState(ConnectionState.CONNECTED);
        log.info("Connected to {}", uri);
    }

    private synchronized void handleDrop(ChannelEvents events, ConnectionState dropState) {
        if (events != currentEvents) {
            return;
        }
        channel = null;
        currentEvents = null;
        setState(dropState);
        if (intentionalDisconnect || !shouldReconnect) {
            return;
        }
        if (reconnectAttemptCount >= reconnectAttempts) {
            log.warn("Max reconnect attempts reached: {}", reconnectAttempts);
            return;
        }
        reconnectAttemptCount++;
        log.info("Schedule reconnect {}/{} in {}ms", reconnectAttemptCount, reconnectAttempts, reconnectIntervalMs);
        pendingReconnect = scheduler.schedule(this::reconnect, reconnectIntervalMs, TimeUnit.MILLISECONDS);
    }

    private synchronized boolean isCurrent(ChannelEvents events) {
        if (events != currentEvents) {
            log.debug("Drop message from replaced channel");
            return false;
        }
        return true;
    }

    private void setState(ConnectionState next) {
        if (state == next) {
            return;
        }
        state = next;
        listener.onStateChange(next);
    }

    private final class ChannelEvents implements ClientChannel.Handler {
        @Override
        public void onOpen() {
            handleOpen(this);
        }

        @Override
        public void onText(String text) {
            if (isCurrent(this)) {
                listener.onText(text);
            }
        }

        @Override
        public void onBinary(byte[] data) {
            if (isCurrent(this)) {
                listener.onBinary(data);
            }
        }

        @Override
        public void onClose(int code, String reason) {
            log.info("Connection closed: code={} reason={}", code, reason);
            handleDrop(this, ConnectionState.DISCONNECTED);
        }

        @Override
        public void onError(Throwable error) {
            log.warn("Connection error: {}", error.toString());
            handleDrop(this, ConnectionState.ERROR);
        }
    }
}
