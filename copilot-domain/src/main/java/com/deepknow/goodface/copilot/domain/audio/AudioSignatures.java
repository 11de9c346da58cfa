package com.deepknow.goodface.copilot.domain.audio;

/**
 * 通过首字节识别音频容器，仅用于诊断日志。
 */
public final class AudioSignatures {

    private AudioSignatures() {}

    public static AudioContainer detect(byte[] head) {
        if (head == null || head.length < 4) {
            return AudioContainer.UNKNOWN;
        }
        if (startsWith(head, 0, 'R', 'I', 'F', 'F')) {
            return AudioContainer.WAV;
        }
        if (startsWith(head, 0, 'O', 'g', 'g', 'S')) {
            return AudioContainer.OGG;
        }
        if (startsWith(head, 0, 'f', 'L', 'a', 'C')) {
            return AudioContainer.FLAC;
        }
        if (startsWith(head, 0, 'I', 'D', '3')) {
            return AudioContainer.MP3;
        }
        if ((head[0] & 0xFF) == 0x1A && (head[1] & 0xFF) == 0x45
                && (head[2] & 0xFF) == 0xDF && (head[3] & 0xFF) == 0xA3) {
            return AudioContainer.WEBM;
        }
        if (head.length >= 8 && startsWith(head, 4, 'f', 't', 'y', 'p')) {
            return AudioContainer.MP4;
        }
        // MPEG 帧同步字，layer 位为 00 的是 AAC ADTS
        if ((head[0] & 0xFF) == 0xFF && (head[1] & 0xE0) == 0xE0 && (head[1] & 0x06) != 0) {
            return AudioContainer.MP3;
        }
        return AudioContainer.UNKNOWN;
    }

    /**
     * 声明格式有已知签名而实际字节不符时返回 true。
     */
    public static boolean isMismatch(byte[] head, String declaredFormat) {
        AudioContainer expected = AudioContainer.forFormat(declaredFormat);
        return expected != AudioContainer.UNKNOWN && detect(head) != expected;
    }

    public static String hexPreview(byte[] data, int max) {
        if (data == null) {
            return "";
        }
        int n = Math.min(max, data.length);
        StringBuilder sb = new StringBuilder(n * 3);
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("%02x", data[i] & 0xFF));
        }
        return sb.toString();
    }

    private static boolean startsWith(byte[] data, int offset, char... expected) {
        if (data.length < offset + expected.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (data[offset + i] != (byte) expected[i]) {
                return false;
            }
        }
        return true;
    }
}
