package com.deepknow.goodface.copilot.domain.session.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionPhaseTest {

    @Test
    void replyCycleIsAllowed() {
        assertThat(SessionPhase.IDLE.canTransitionTo(SessionPhase.LISTENING)).isTrue();
        assertThat(SessionPhase.LISTENING.canTransitionTo(SessionPhase.PROCESSING)).isTrue();
        assertThat(SessionPhase.PROCESSING.canTransitionTo(SessionPhase.SPEAKING)).isTrue();
        assertThat(SessionPhase.SPEAKING.canTransitionTo(SessionPhase.IDLE)).isTrue();
    }

    @Test
    void errorIsReachableFromAnywhereAndOnlyReturnsToIdle() {
        for (SessionPhase phase : SessionPhase.values()) {
            assertThat(phase.canTransitionTo(SessionPhase.ERROR)).isTrue();
        }
        assertThat(SessionPhase.ERROR.canTransitionTo(SessionPhase.IDLE)).isTrue();
        assertThat(SessionPhase.ERROR.canTransitionTo(SessionPhase.LISTENING)).isFalse();
        assertThat(SessionPhase.ERROR.canTransitionTo(SessionPhase.SPEAKING)).isFalse();
    }

    @Test
    void speakingCannotSkipBackToProcessing() {
        assertThat(SessionPhase.SPEAKING.canTransitionTo(SessionPhase.PROCESSING)).isFalse();
        assertThat(SessionPhase.IDLE.canTransitionTo(SessionPhase.SPEAKING)).isFalse();
    }
}
