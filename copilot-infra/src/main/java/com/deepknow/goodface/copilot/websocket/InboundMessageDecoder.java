package com.deepknow.goodface.copilot.websocket;

import com.deepknow.goodface.copilot.domain.session.model.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 上行帧解码：文本帧必须是带 type 的 JSON 对象；二进制帧能解析为这样的对象时按结构化消息处理，否则视为音频。
 */
@Component
public class InboundMessageDecoder {
    private static final Logger log = LoggerFactory.getLogger(InboundMessageDecoder.class);

    private final ObjectMapper objectMapper;

    public InboundMessageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return 无法解析的文本帧返回 empty，调用方丢弃
     */
    public Optional<InboundMessage> decodeText(String text) {
        JsonNode node = parseObject(text);
        if (node == null) {
            log.warn("Malformed text frame dropped: len={}", text == null ? 0 : text.length());
            return Optional.empty();
        }
        return Optional.of(toMessage(node));
    }

    public InboundMessage decodeBinary(byte[] bytes) {
        if (looksLikeJson(bytes)) {
            JsonNode node = parseObject(new String(bytes, StandardCharsets.UTF_8));
            if (node != null) {
                return toMessage(node);
            }
        }
        return InboundMessage.audio(bytes);
    }

    private JsonNode parseObject(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node != null && node.isObject() && node.hasNonNull("type")) {
                return node;
            }
        } catch (Exception e) {
            log.trace("Not a JSON message: {}", e.getMessage());
        }
        return null;
    }

    private static boolean looksLikeJson(byte[] bytes) {
        for (byte b : bytes) {
            if (b == ' ' || b == '\t' || b == '\r' || b == '\n') {
                continue;
            }
            return b == '{';
        }
        return false;
    }

    private static InboundMessage toMessage(JsonNode node) {
        String type = node.path("type").asText("");
        switch (type) {
            case "start_recording":
                return InboundMessage.startRecording();
            case "stop_recording":
                return InboundMessage.stopRecording();
            case "text_input":
                return InboundMessage.textInput(textOrNull(node, "message"));
            case "transcript":
                return InboundMessage.transcript(textOrNull(node, "data"));
            case "control":
                return InboundMessage.control(textOrNull(node, "action"));
            default:
                return InboundMessage.unknown(type);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }
}
