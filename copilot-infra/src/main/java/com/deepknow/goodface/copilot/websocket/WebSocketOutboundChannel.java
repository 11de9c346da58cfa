package com.deepknow.goodface.copilot.websocket;

import com.deepknow.goodface.copilot.domain.session.service.OutboundChannel;

import javax.websocket.CloseReason;
import javax.websocket.Session;
import java.io.IOException;

/**
 * javax.websocket 会话的下行通道。BasicRemote 不允许并发写，这里按通道串行化。
 */
public class WebSocketOutboundChannel implements OutboundChannel {
    private final Session session;

    public WebSocketOutboundChannel(Session session) {
        this.session = session;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void sendText(String payload) throws IOException {
        synchronized (this) {
            session.getBasicRemote().sendText(payload);
        }
    }

    @Override
    public void close() throws IOException {
        if (session.isOpen()) {
            session.close(new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, "Session ended"));
        }
    }
}
