package com.deepknow.goodface.copilot.domain.session.service;

import com.deepknow.goodface.copilot.domain.session.model.InboundMessage;

/**
 * 会话级语音管线编排接口：管理 WebSocket 会话与 STT/LLM/TTS 的调用。
 * 端点层应仅依赖此接口，具体实现放在 infra 层。
 */
public interface VoiceSessionService {

    void open(String wsSessionId, OutboundChannel channel);

    void onMessage(String wsSessionId, InboundMessage message);

    /**
     * 连接关闭或传输错误：无条件释放该会话的 STT 资源。
     */
    void onDisconnect(String wsSessionId);
}
