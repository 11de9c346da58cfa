package com.deepknow.goodface.copilot.domain.session;

import com.deepknow.goodface.copilot.domain.agent.stt.SttSession;
import com.deepknow.goodface.copilot.domain.session.model.SessionPhase;
import com.deepknow.goodface.copilot.domain.session.service.OutboundChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;

/**
 * 单个客户端连接的会话状态，只由 {@link VoiceSessionServiceImpl} 修改。
 */
public class ConversationSession {
    private static final Logger log = LoggerFactory.getLogger(ConversationSession.class);

    private final String wsSessionId;
    private final OutboundChannel channel;
    private final Executor replyExecutor;

    private SessionPhase phase = SessionPhase.IDLE;
    private final StringBuilder transcript = new StringBuilder();
    private SttSession sttSession;
    private boolean closed;

    public ConversationSession(String wsSessionId, OutboundChannel channel, Executor replyExecutor) {
        this.wsSessionId = wsSessionId;
        this.channel = channel;
        this.replyExecutor = replyExecutor;
    }

    public String getWsSessionId() {
        return wsSessionId;
    }

    public OutboundChannel getChannel() {
        return channel;
    }

    public Executor getReplyExecutor() {
        return replyExecutor;
    }

    public synchronized SessionPhase getPhase() {
        return phase;
    }

    /**
     * 按阶段机迁移；非法迁移记录日志并忽略。
     */
    public synchronized boolean transitionTo(SessionPhase next) {
        if (!phase.canTransitionTo(next)) {
            log.warn("Illegal phase transition {} -> {}: wsSessionId={}", phase, next, wsSessionId);
            return false;
        }
        if (phase != next) {
            log.debug("Phase {} -> {}: wsSessionId={}", phase, next, wsSessionId);
            phase = next;
        }
        return true;
    }

    /**
     * 仅当当前阶段为 expected 时迁移。
     */
    public synchronized boolean transitionIf(SessionPhase expected, SessionPhase next) {
        return phase == expected && transitionTo(next);
    }

    public synchronized void appendTranscript(String text) {
        if (transcript.length() > 0) {
            transcript.append(' ');
        }
        transcript.append(text);
    }

    public synchronized String drainTranscript() {
        String full = transcript.toString();
        transcript.setLength(0);
        return full;
    }

    public synchronized SttSession getSttSession() {
        return sttSession;
    }

    public synchronized void setSttSession(SttSession sttSession) {
        this.sttSession = sttSession;
    }

    /**
     * 取走当前 STT 会话。
     */
    public synchronized SttSession takeSttSession() {
        SttSession s = sttSession;
        sttSession = null;
        return s;
    }

    /**
     * 仅当当前 STT 会话仍是 expected 时清空。
     */
    public synchronized boolean clearSttSession(SttSession expected) {
        if (sttSession != expected) {
            return false;
        }
        sttSession = null;
        return true;
    }

    public boolean isRecording() {
        // 不在本对象锁内访问 SttSession，避免与 STT 回调形成锁顺序反转
        SttSession s = getSttSession();
        return s != null && !s.isStopRequested();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized void markClosed() {
        closed = true;
    }
}
