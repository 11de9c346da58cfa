package com.deepknow.goodface.copilot.domain.session.util;

import com.deepknow.goodface.copilot.domain.session.service.OutboundChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * 下行发送守卫：所有发往客户端的消息都经过这里，发送失败只记录日志并返回 false，从不抛出。
 */
@Component
public class TransmissionGuard {
    private static final Logger log = LoggerFactory.getLogger(TransmissionGuard.class);

    private final ObjectMapper objectMapper;

    public TransmissionGuard(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public boolean send(OutboundChannel channel, String payload, String context) {
        if (channel == null) {
            log.warn("Skip send {}: no channel", context);
            return false;
        }
        if (!channel.isOpen()) {
            log.warn("Skip send {}: channel not open, wsSessionId={}", context, channel.getId());
            return false;
        }
        try {
            channel.sendText(payload);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Send {} failed: wsSessionId={}, error={}", context, channel.getId(), e.toString());
            return false;
        }
    }

    public boolean sendJson(OutboundChannel channel, Map<String, Object> message, String context) {
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Serialize {} failed: wsSessionId={}", context, channel == null ? null : channel.getId(), e);
            return false;
        }
        return send(channel, json, context);
    }
}
