package com.deepknow.goodface.copilot.domain.agent.tts;

import com.deepknow.goodface.copilot.domain.audio.AudioContainer;
import com.deepknow.goodface.copilot.domain.audio.AudioSignatures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MockTtsClientTest {

    @Test
    void synthesizeAllReturnsMp3TaggedAudio() {
        MockTtsClient client = new MockTtsClient(3, 32);

        byte[] audio = client.synthesizeAll("hello");

        assertThat(audio).hasSize(96);
        assertThat(AudioSignatures.detect(audio)).isEqualTo(AudioContainer.MP3);
        assertThat(AudioSignatures.isMismatch(audio, client.format())).isFalse();
    }
}
