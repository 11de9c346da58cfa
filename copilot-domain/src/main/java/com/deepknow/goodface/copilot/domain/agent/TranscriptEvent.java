package com.deepknow.goodface.copilot.domain.agent;

public final class TranscriptEvent {
    private final String text;
    private final boolean isFinal;

    public TranscriptEvent(String text, boolean isFinal) {
        this.text = text == null ? "" : text;
        this.isFinal = isFinal;
    }

    public static TranscriptEvent interim(String text) { return new TranscriptEvent(text, false); }

    public static TranscriptEvent fin(String text) { return new TranscriptEvent(text, true); }

    public String getText() { return text; }

    public boolean isFinal() { return isFinal; }

    @Override
    public String toString() {
        return "TranscriptEvent{final=" + isFinal + ", len=" + text.length() + "}";
    }
}
