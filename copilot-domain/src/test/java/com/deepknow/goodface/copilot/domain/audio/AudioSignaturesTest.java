package com.deepknow.goodface.copilot.domain.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioSignaturesTest {

    @Test
    void detectsKnownContainers() {
        assertThat(AudioSignatures.detect(ascii("RIFF\0\0\0\0WAVE"))).isEqualTo(AudioContainer.WAV);
        assertThat(AudioSignatures.detect(ascii("OggS\0\2"))).isEqualTo(AudioContainer.OGG);
        assertThat(AudioSignatures.detect(ascii("ID3\4\0\0"))).isEqualTo(AudioContainer.MP3);
        assertThat(AudioSignatures.detect(bytes(0xFF, 0xFB, 0x90, 0x64))).isEqualTo(AudioContainer.MP3);
        assertThat(AudioSignatures.detect(bytes(0x1A, 0x45, 0xDF, 0xA3, 0x9F))).isEqualTo(AudioContainer.WEBM);
        assertThat(AudioSignatures.detect(ascii("\0\0\0 ftypM4A "))).isEqualTo(AudioContainer.MP4);
        assertThat(AudioSignatures.detect(ascii("fLaC\0\0"))).isEqualTo(AudioContainer.FLAC);
    }

    @Test
    void adtsFrameIsNotMistakenForMp3() {
        assertThat(AudioSignatures.detect(bytes(0xFF, 0xF1, 0x50, 0x80))).isEqualTo(AudioContainer.UNKNOWN);
    }

    @Test
    void shortOrEmptyInputIsUnknown() {
        assertThat(AudioSignatures.detect(null)).isEqualTo(AudioContainer.UNKNOWN);
        assertThat(AudioSignatures.detect(new byte[]{1, 2})).isEqualTo(AudioContainer.UNKNOWN);
    }

    @Test
    void mismatchOnlyReportedForFormatsWithSignature() {
        byte[] wav = ascii("RIFF\0\0\0\0WAVE");
        assertThat(AudioSignatures.isMismatch(wav, "mp3")).isTrue();
        assertThat(AudioSignatures.isMismatch(wav, "wav")).isFalse();
        assertThat(AudioSignatures.isMismatch(wav, "pcm")).isFalse();
        assertThat(AudioSignatures.isMismatch(ascii("ID3\4"), "MP3")).isFalse();
    }

    @Test
    void hexPreviewIsBounded() {
        assertThat(AudioSignatures.hexPreview(bytes(0x49, 0x44, 0x33, 0x04, 0x00), 4)).isEqualTo("49 44 33 04");
        assertThat(AudioSignatures.hexPreview(null, 4)).isEmpty();
    }

    private static byte[] ascii(String s) {
        return s.getBytes(java.nio.charset.StandardCharsets.ISO_8859_1);
    }

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }
}
