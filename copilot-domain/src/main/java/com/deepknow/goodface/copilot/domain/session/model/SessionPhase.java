package com.deepknow.goodface.copilot.domain.session.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 会话阶段：IDLE → LISTENING → PROCESSING → SPEAKING → IDLE，ERROR 可由任意阶段进入且只能回到 IDLE。
 */
public enum SessionPhase {
    IDLE,
    LISTENING,
    PROCESSING,
    SPEAKING,
    ERROR;

    public boolean canTransitionTo(SessionPhase next) {
        if (next == ERROR || next == this) {
            return true;
        }
        return allowedNext().contains(next);
    }

    private Set<SessionPhase> allowedNext() {
        switch (this) {
            case IDLE:
                return EnumSet.of(LISTENING, PROCESSING);
            case LISTENING:
                return EnumSet.of(IDLE, PROCESSING);
            case PROCESSING:
                return EnumSet.of(SPEAKING, LISTENING, IDLE);
            case SPEAKING:
                return EnumSet.of(LISTENING, IDLE);
            case ERROR:
                return EnumSet.of(IDLE);
            default:
                return EnumSet.noneOf(SessionPhase.class);
        }
    }
}
