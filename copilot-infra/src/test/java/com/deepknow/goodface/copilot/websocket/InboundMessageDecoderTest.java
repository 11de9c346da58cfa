package com.deepknow.goodface.copilot.websocket;

import com.deepknow.goodface.copilot.domain.session.model.InboundMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InboundMessageDecoderTest {

    private final InboundMessageDecoder decoder = new InboundMessageDecoder(new ObjectMapper());

    @Test
    void decodesStructuredTextFrames() {
        assertThat(decoder.decodeText("{\"type\":\"start_recording\"}"))
                .get().extracting(InboundMessage::getType).isEqualTo(InboundMessage.Type.START_RECORDING);

        InboundMessage text = decoder.decodeText("{\"type\":\"text_input\",\"message\":\"explain Main.java\"}").orElseThrow();
        assertThat(text.getType()).isEqualTo(InboundMessage.Type.TEXT_INPUT);
        assertThat(text.getText()).isEqualTo("explain Main.java");

        InboundMessage control = decoder.decodeText("{\"type\":\"control\",\"action\":\"mute\"}").orElseThrow();
        assertThat(control.getType()).isEqualTo(InboundMessage.Type.CONTROL);
        assertThat(control.getText()).isEqualTo("mute");
    }

    @Test
    void malformedTextFrameIsDropped() {
        Optional<InboundMessage> decoded = decoder.decodeText("{not json");

        assertThat(decoded).isEmpty();
        assertThat(decoder.decodeText("[1,2]")).isEmpty();
        assertThat(decoder.decodeText("{\"message\":\"no type\"}")).isEmpty();
    }

    @Test
    void unknownTypeKeepsRawType() {
        InboundMessage m = decoder.decodeText("{\"type\":\"ping\"}").orElseThrow();

        assertThat(m.getType()).isEqualTo(InboundMessage.Type.UNKNOWN);
        assertThat(m.getText()).isEqualTo("ping");
    }

    @Test
    void binaryJsonObjectWithTypeIsStructured() {
        byte[] frame = "  {\"type\":\"stop_recording\"}".getBytes(StandardCharsets.UTF_8);

        assertThat(decoder.decodeBinary(frame).getType()).isEqualTo(InboundMessage.Type.STOP_RECORDING);
    }

    @Test
    void otherBinaryFramesAreAudio() {
        byte[] pcm = {0x10, 0x00, (byte) 0xF0, 0x7F};
        byte[] braceButNotJson = "{garbage".getBytes(StandardCharsets.UTF_8);

        InboundMessage audio = decoder.decodeBinary(pcm);
        assertThat(audio.getType()).isEqualTo(InboundMessage.Type.AUDIO);
        assertThat(audio.getAudio()).isEqualTo(pcm);
        assertThat(decoder.decodeBinary(braceButNotJson).getType()).isEqualTo(InboundMessage.Type.AUDIO);
    }
}
