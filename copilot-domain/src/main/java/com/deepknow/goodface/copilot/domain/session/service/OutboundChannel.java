package com.deepknow.goodface.copilot.domain.session.service;

import java.io.IOException;

/**
 * 到客户端的下行通道，WebSocket 会话的抽象。
 */
public interface OutboundChannel {

    String getId();

    boolean isOpen();

    void sendText(String payload) throws IOException;

    void close() throws IOException;
}
