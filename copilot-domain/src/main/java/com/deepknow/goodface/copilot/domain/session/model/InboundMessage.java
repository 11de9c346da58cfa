package com.deepknow.goodface.copilot.domain.session.model;

/**
 * 客户端上行消息。结构化消息按 type 区分，无法识别为 JSON 的二进制帧即原始音频。
 */
public final class InboundMessage {

    public enum Type {
        START_RECORDING,
        STOP_RECORDING,
        TEXT_INPUT,
        TRANSCRIPT,
        CONTROL,
        AUDIO,
        UNKNOWN
    }

    private final Type type;
    private final String text;
    private final byte[] audio;

    private InboundMessage(Type type, String text, byte[] audio) {
        this.type = type;
        this.text = text;
        this.audio = audio;
    }

    public static InboundMessage startRecording() {
        return new InboundMessage(Type.START_RECORDING, null, null);
    }

    public static InboundMessage stopRecording() {
        return new InboundMessage(Type.STOP_RECORDING, null, null);
    }

    public static InboundMessage textInput(String message) {
        return new InboundMessage(Type.TEXT_INPUT, message, null);
    }

    public static InboundMessage transcript(String data) {
        return new InboundMessage(Type.TRANSCRIPT, data, null);
    }

    public static InboundMessage control(String action) {
        return new InboundMessage(Type.CONTROL, action, null);
    }

    public static InboundMessage audio(byte[] bytes) {
        return new InboundMessage(Type.AUDIO, null, bytes);
    }

    /**
     * @param rawType 客户端发送的原始 type，便于日志排查
     */
    public static InboundMessage unknown(String rawType) {
        return new InboundMessage(Type.UNKNOWN, rawType, null);
    }

    public Type getType() {
        return type;
    }

    /**
     * text_input 的 message、transcript 的 data、control 的 action，或未知消息的原始 type。
     */
    public String getText() {
        return text;
    }

    public byte[] getAudio() {
        return audio;
    }

    @Override
    public String toString() {
        if (type == Type.AUDIO) {
            return "InboundMessage{AUDIO, bytes=" + (audio == null ? 0 : audio.length) + "}";
        }
        return "InboundMessage{" + type + (text == null ? "" : ", " + text) + "}";
    }
}
