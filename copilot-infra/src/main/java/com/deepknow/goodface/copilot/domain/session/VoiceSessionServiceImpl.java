package com.deepknow.goodface.copilot.domain.session;

import com.deepknow.goodface.copilot.domain.agent.ContextProvider;
import com.deepknow.goodface.copilot.domain.agent.LlmClient;
import com.deepknow.goodface.copilot.domain.agent.SessionSchedulers;
import com.deepknow.goodface.copilot.domain.agent.SttSessionListener;
import com.deepknow.goodface.copilot.domain.agent.TranscriptEvent;
import com.deepknow.goodface.copilot.domain.agent.TtsChunkStream;
import com.deepknow.goodface.copilot.domain.agent.TtsClient;
import com.deepknow.goodface.copilot.domain.agent.stt.SttSession;
import com.deepknow.goodface.copilot.domain.agent.stt.SttSessionFactory;
import com.deepknow.goodface.copilot.domain.exception.ProviderException;
import com.deepknow.goodface.copilot.domain.session.model.InboundMessage;
import com.deepknow.goodface.copilot.domain.session.model.SessionPhase;
import com.deepknow.goodface.copilot.domain.session.service.OutboundChannel;
import com.deepknow.goodface.copilot.domain.session.service.VoiceSessionService;
import com.deepknow.goodface.copilot.domain.session.util.SerialExecutor;
import com.deepknow.goodface.copilot.domain.session.util.ServerMessages;
import com.deepknow.goodface.copilot.domain.session.util.TransmissionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 会话协调器：每个 WebSocket 连接一个阶段机，串起 STT → 上下文 → LLM → TTS → 下行发送。
 */
@Service
public class VoiceSessionServiceImpl implements VoiceSessionService {
    private static final Logger logger = LoggerFactory.getLogger(VoiceSessionServiceImpl.class);

    private final ConcurrentHashMap<String, ConversationSession> sessions = new ConcurrentHashMap<>();

    private final SttSessionFactory sttSessionFactory;
    private final LlmClient llmClient;
    private final TtsClient ttsClient;
    private final ContextProvider contextProvider;
    private final TransmissionGuard guard;
    private final Executor pipeline;
    private final SessionProperties props;

    public VoiceSessionServiceImpl(SttSessionFactory sttSessionFactory,
                                   LlmClient llmClient,
                                   TtsClient ttsClient,
                                   ContextProvider contextProvider,
                                   TransmissionGuard guard,
                                   SessionSchedulers schedulers,
                                   SessionProperties props) {
        this.sttSessionFactory = sttSessionFactory;
        this.llmClient = llmClient;
        this.ttsClient = ttsClient;
        this.contextProvider = contextProvider;
        this.guard = guard;
        this.pipeline = schedulers.pipeline();
        this.props = props;
    }

    @Override
    public void open(String wsSessionId, OutboundChannel channel) {
        ConversationSession session = new ConversationSession(wsSessionId, channel, new SerialExecutor(pipeline));
        ConversationSession previous = sessions.put(wsSessionId, session);
        if (previous != null) {
            logger.warn("Replace existing session: wsSessionId={}", wsSessionId);
            release(previous);
        }
        logger.info("Open session: wsSessionId={}", wsSessionId);
        send(session, ServerMessages.ready(props.getReadyMessage()), "ready");
    }

    @Override
    public void onMessage(String wsSessionId, InboundMessage message) {
        ConversationSession session = sessions.get(wsSessionId);
        if (session == null) {
            logger.debug("Message for unknown session dropped: wsSessionId={}, {}", wsSessionId, message);
            return;
        }
        try {
            switch (message.getType()) {
                case START_RECORDING:
                    startRecording(session);
                    break;
                case STOP_RECORDING:
                    stopRecording(session);
                    break;
                case AUDIO:
                    forwardAudio(session, message.getAudio());
                    break;
                case TEXT_INPUT:
                case TRANSCRIPT:
                    handleTextInput(session, message.getText());
                    break;
                case CONTROL:
                    handleControl(session, message.getText());
                    break;
                default:
                    logger.warn("Unknown message type ignored: wsSessionId={}, type={}", wsSessionId, message.getText());
            }
        } catch (RuntimeException e) {
            logger.error("Handle message failed: wsSessionId={}, {}", wsSessionId, message, e);
            send(session, ServerMessages.error(describe(e)), "message handler error");
        }
    }

    @Override
    public void onDisconnect(String wsSessionId) {
        ConversationSession session = sessions.remove(wsSessionId);
        if (session == null) {
            return;
        }
        logger.info("Close session: wsSessionId={}", wsSessionId);
        release(session);
    }

    int activeSessions() {
        return sessions.size();
    }

    private void release(ConversationSession session) {
        session.markClosed();
        SttSession stt = session.takeSttSession();
        if (stt != null) {
            stt.detachListener();
            stt.stop();
        }
    }

    private void startRecording(ConversationSession session) {
        String wsId = session.getWsSessionId();
        SttSession previous = session.takeSttSession();
        if (previous != null) {
            logger.info("Discard previous STT session before restart: wsSessionId={}", wsId);
            previous.detachListener();
            previous.stop();
        }
        session.drainTranscript();
        SttCallbacks callbacks = new SttCallbacks(session);
        SttSession stt = sttSessionFactory.create(wsId, callbacks);
        callbacks.stt = stt;
        session.setSttSession(stt);
        logger.info("Start recording: wsSessionId={}", wsId);
        stt.start().whenComplete((ignored, error) -> onStartCompleted(session, stt, error));
    }

    private void onStartCompleted(ConversationSession session, SttSession stt, Throwable error) {
        String wsId = session.getWsSessionId();
        if (session.isClosed() || session.getSttSession() != stt) {
            logger.info("Ignore superseded STT start: wsSessionId={}", wsId);
            stt.detachListener();
            stt.stop();
            return;
        }
        if (error != null && stt.isStopRequested()) {
            // 连接建立前客户端已 stop_recording，不属于失败
            logger.info("STT start cancelled by stop: wsSessionId={}", wsId);
            return;
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            logger.warn("Failed to start recording: wsSessionId={}, error={}", wsId, cause.toString());
            session.clearSttSession(stt);
            stt.detachListener();
            stt.stop();
            send(session, ServerMessages.error("Failed to start recording: " + describe(cause)), "start recording error");
            session.transitionIf(SessionPhase.LISTENING, SessionPhase.IDLE);
            return;
        }
        // 回复链路进行中时由链路结束时决定阶段
        session.transitionIf(SessionPhase.IDLE, SessionPhase.LISTENING);
        send(session, ServerMessages.recordingStarted(), "recording started");
    }

    private void stopRecording(ConversationSession session) {
        String wsId = session.getWsSessionId();
        SttSession stt = session.getSttSession();
        if (stt == null) {
            logger.warn("stop_recording without active STT session: wsSessionId={}", wsId);
            return;
        }
        // 先停止再摘除监听，使尾部转写仍能累积
        stt.stop();
        stt.detachListener();
        session.clearSttSession(stt);
        String full = session.drainTranscript();
        logger.info("Stop recording: wsSessionId={}, transcriptLen={}", wsId, full.length());
        send(session, ServerMessages.recordingStopped(full), "recording stopped");
        session.transitionIf(SessionPhase.LISTENING, SessionPhase.IDLE);
    }

    private void forwardAudio(ConversationSession session, byte[] audio) {
        if (audio == null || audio.length == 0) {
            return;
        }
        SttSession stt = session.getSttSession();
        // 是否可转发由 SttSession 判定，传输已失效时它负责上报 onError
        if (stt != null && stt.sendAudio(audio)) {
            return;
        }
        if (stt != null) {
            logger.debug("Audio dropped, STT not ready: wsSessionId={}, state={}", session.getWsSessionId(), stt.getState());
        } else if (session.getPhase() == SessionPhase.LISTENING) {
            logger.warn("Audio dropped, STT not ready: wsSessionId={}, bytes={}", session.getWsSessionId(), audio.length);
        } else {
            logger.trace("Audio dropped before recording started: wsSessionId={}", session.getWsSessionId());
        }
    }

    private void handleTextInput(ConversationSession session, String text) {
        if (text == null || text.trim().isEmpty()) {
            logger.warn("Blank text input dropped: wsSessionId={}", session.getWsSessionId());
            return;
        }
        submitReply(session, text.trim());
    }

    private void handleControl(ConversationSession session, String action) {
        String wsId = session.getWsSessionId();
        if (action == null) {
            logger.warn("Control without action ignored: wsSessionId={}", wsId);
            return;
        }
        switch (action) {
            // 静音由客户端停止采集实现，服务端只确认
            case "mute":
                send(session, ServerMessages.muted(), "muted");
                break;
            case "unmute":
                send(session, ServerMessages.unmuted(), "unmuted");
                break;
            case "end_session":
                SttSession stt = session.takeSttSession();
                if (stt != null) {
                    stt.detachListener();
                    stt.stop();
                }
                send(session, ServerMessages.sessionEnded(), "session ended");
                try {
                    session.getChannel().close();
                } catch (IOException e) {
                    logger.warn("Close channel failed: wsSessionId={}, error={}", wsId, e.toString());
                }
                break;
            default:
                logger.info("Unknown control action ignored: wsSessionId={}, action={}", wsId, action);
        }
    }

    private void submitReply(ConversationSession session, String userText) {
        session.getReplyExecutor().execute(() -> {
            try {
                runReplyLeg(session, userText);
            } catch (RuntimeException e) {
                logger.error("Reply leg failed: wsSessionId={}", session.getWsSessionId(), e);
                send(session, ServerMessages.error(describe(e)), "reply error");
                failLeg(session);
            }
        });
    }

    /**
     * 一次回复：上下文 → LLM → ai_response → TTS 分片 → audio_end。
     */
    void runReplyLeg(ConversationSession session, String userText) {
        String wsId = session.getWsSessionId();
        session.transitionTo(SessionPhase.PROCESSING);
        logger.info("Reply leg start: wsSessionId={}, textLen={}", wsId, userText.length());

        String reply;
        try {
            String context = contextProvider.contextFor(userText);
            reply = llmClient.complete(userText, context);
        } catch (ProviderException e) {
            logger.warn("LLM failed: wsSessionId={}, kind={}, error={}", wsId, e.getKind(), e.getMessage());
            send(session, ServerMessages.error("Failed to get AI response: " + e.getUserMessage()), "llm error");
            failLeg(session);
            return;
        }
        send(session, ServerMessages.aiResponse(reply), "AI response");

        session.transitionTo(SessionPhase.SPEAKING);
        int sent = 0;
        try (TtsChunkStream stream = ttsClient.synthesize(reply)) {
            while (stream.hasNext()) {
                byte[] chunk = stream.next();
                if (!send(session, ServerMessages.audio(chunk, ttsClient.format(), sent), "audio chunk " + sent)) {
                    logger.warn("Send failed, stop audio stream: wsSessionId={}, sent={}", wsId, sent);
                    break;
                }
                sent++;
            }
        } catch (RuntimeException e) {
            if (sent == 0) {
                logger.warn("TTS failed: wsSessionId={}, error={}", wsId, e.toString());
                String detail = e instanceof ProviderException ? ((ProviderException) e).getUserMessage() : describe(e);
                send(session, ServerMessages.error("Failed to generate speech: " + detail), "TTS error");
                failLeg(session);
                return;
            }
            logger.warn("TTS stream aborted after {} chunks: wsSessionId={}, error={}", sent, wsId, e.toString());
        }
        send(session, ServerMessages.audioEnd(sent), "audio end");
        session.transitionTo(session.isRecording() ? SessionPhase.LISTENING : SessionPhase.IDLE);
        logger.info("Reply leg complete: wsSessionId={}, chunks={}", wsId, sent);
    }

    private void failLeg(ConversationSession session) {
        session.transitionTo(SessionPhase.ERROR);
        session.transitionTo(SessionPhase.IDLE);
    }

    private boolean send(ConversationSession session, Map<String, Object> message, String context) {
        return guard.sendJson(session.getChannel(), message, context);
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static String describe(Throwable t) {
        if (t instanceof ProviderException) {
            return ((ProviderException) t).getUserMessage();
        }
        return t.getMessage() == null ? "Unknown error" : t.getMessage();
    }

    /**
     * 单次录音的 STT 事件处理；会话被替换或停止后由 detachListener 断开。
     */
    private final class SttCallbacks implements SttSessionListener {
        private final ConversationSession session;
        private volatile SttSession stt;

        SttCallbacks(ConversationSession session) {
            this.session = session;
        }

        @Override
        public void onTranscript(TranscriptEvent event) {
            String text = event.getText();
            if (!event.isFinal()) {
                send(session, ServerMessages.transcript(text, false), "interim transcript");
                return;
            }
            session.appendTranscript(text);
            send(session, ServerMessages.transcript(text, true), "final transcript");
            String trimmed = text.trim();
            if (trimmed.length() > props.getMinTranscriptChars()) {
                submitReply(session, trimmed);
            } else {
                logger.debug("Final transcript too short for reply: wsSessionId={}, len={}", session.getWsSessionId(), trimmed.length());
            }
        }

        @Override
        public void onError(Throwable error) {
            logger.warn("Transcription error: wsSessionId={}, error={}", session.getWsSessionId(), String.valueOf(error));
            send(session, ServerMessages.error("Transcription error: " + describe(error)), "transcriber error");
            session.transitionIf(SessionPhase.LISTENING, SessionPhase.IDLE);
        }

        @Override
        public void onClose() {
            SttSession s = stt;
            if (s != null && s.isStopRequested()) {
                logger.debug("STT closed after stop: wsSessionId={}", session.getWsSessionId());
                return;
            }
            logger.warn("STT connection closed unexpectedly: wsSessionId={}", session.getWsSessionId());
            session.transitionIf(SessionPhase.LISTENING, SessionPhase.IDLE);
        }
    }
}
