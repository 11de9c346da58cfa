package com.deepknow.goodface.copilot.websocket;

import com.deepknow.goodface.copilot.domain.session.model.InboundMessage;
import com.deepknow.goodface.copilot.domain.session.service.VoiceSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.websocket.CloseReason;
import javax.websocket.OnClose;
import javax.websocket.OnError;
import javax.websocket.OnMessage;
import javax.websocket.OnOpen;
import javax.websocket.Session;
import javax.websocket.server.ServerEndpoint;
import java.nio.ByteBuffer;

@Component
@ServerEndpoint(value = "/ws")
public class VoiceStreamWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(VoiceStreamWebSocketHandler.class);

    // 端点由容器按连接实例化，服务通过静态字段配合 Injector 注入
    private static VoiceSessionService voiceSessionService;
    private static InboundMessageDecoder decoder;

    public static void setVoiceSessionService(VoiceSessionService service) { voiceSessionService = service; }
    public static void setDecoder(InboundMessageDecoder d) { decoder = d; }

    private static boolean ensureServices() {
        try {
            if (voiceSessionService == null) {
                voiceSessionService = SpringContextHolder.getBean(VoiceSessionService.class);
            }
            if (decoder == null) {
                decoder = SpringContextHolder.getBean(InboundMessageDecoder.class);
            }
        } catch (Exception e) {
            log.warn("Lookup voice session beans failed: {}", e.getMessage());
        }
        return voiceSessionService != null && decoder != null;
    }

    @OnOpen
    public void onOpen(Session session) {
        String wsId = session.getId();
        log.info("WS connected: {}", wsId);
        if (!ensureServices()) {
            log.warn("VoiceSessionService not injected; refuse open for ws {}", wsId);
            try {
                session.close(new CloseReason(CloseReason.CloseCodes.UNEXPECTED_CONDITION, "SERVICE_NOT_READY"));
            } catch (Exception e) {
                log.debug("Close refused ws failed: {}", e.getMessage());
            }
            return;
        }
        try {
            voiceSessionService.open(wsId, new WebSocketOutboundChannel(session));
        } catch (Exception e) {
            log.error("Open session failed: wsSessionId={}", wsId, e);
        }
    }

    @OnMessage
    public void onBinaryMessage(ByteBuffer message, Session session) {
        byte[] bytes = new byte[message.remaining()];
        message.get(bytes);
        log.trace("Received binary frame, bytes={}", bytes.length);
        if (!ensureServices()) {
            log.warn("VoiceSessionService not injected; drop binary frame for ws {}", session.getId());
            return;
        }
        dispatch(session, decoder.decodeBinary(bytes));
    }

    @OnMessage
    public void onTextMessage(String text, Session session) {
        log.trace("Received text frame, len={}", text == null ? 0 : text.length());
        if (!ensureServices()) {
            log.warn("VoiceSessionService not injected; drop text frame for ws {}", session.getId());
            return;
        }
        decoder.decodeText(text).ifPresent(m -> dispatch(session, m));
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        String wsId = session.getId();
        log.info("WS closed: {} status={}", wsId, reason);
        if (!ensureServices()) {
            return;
        }
        try {
            voiceSessionService.onDisconnect(wsId);
        } catch (Exception e) {
            log.error("Disconnect cleanup failed: wsSessionId={}", wsId, e);
        }
    }

    @OnError
    public void onError(Session session, Throwable throwable) {
        String wsId = session != null ? session.getId() : null;
        log.warn("WS error: {} {}", wsId, throwable != null ? throwable.getMessage() : "unknown", throwable);
        if (wsId == null || !ensureServices()) {
            return;
        }
        try {
            voiceSessionService.onDisconnect(wsId);
        } catch (Exception e) {
            log.error("Cleanup after WS error failed: wsSessionId={}", wsId, e);
        }
    }

    private void dispatch(Session session, InboundMessage message) {
        if (message.getType() != InboundMessage.Type.AUDIO) {
            log.info("WS message: wsSessionId={}, {}", session.getId(), message);
        }
        try {
            voiceSessionService.onMessage(session.getId(), message);
        } catch (Exception e) {
            log.error("Handle message failed: wsSessionId={}, {}", session.getId(), message, e);
        }
    }
}
