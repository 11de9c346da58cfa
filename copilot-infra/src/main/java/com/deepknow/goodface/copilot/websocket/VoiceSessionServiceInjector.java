package com.deepknow.goodface.copilot.websocket;

import com.deepknow.goodface.copilot.domain.session.service.VoiceSessionService;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

@Component
public class VoiceSessionServiceInjector {

    private final VoiceSessionService voiceSessionService;
    private final InboundMessageDecoder decoder;

    public VoiceSessionServiceInjector(VoiceSessionService voiceSessionService, InboundMessageDecoder decoder) {
        this.voiceSessionService = voiceSessionService;
        this.decoder = decoder;
    }

    @PostConstruct
    public void inject() {
        VoiceStreamWebSocketHandler.setVoiceSessionService(voiceSessionService);
        VoiceStreamWebSocketHandler.setDecoder(decoder);
    }
}
