package com.deepknow.goodface.copilot.domain.audio;

import java.util.Locale;

public enum AudioContainer {
    WAV("wav"),
    OGG("ogg", "opus"),
    MP3("mp3", "mpeg"),
    WEBM("webm"),
    MP4("mp4", "m4a"),
    FLAC("flac"),
    UNKNOWN;

    private final String[] formats;

    AudioContainer(String... formats) {
        this.formats = formats;
    }

    /**
     * 声明格式对应的容器；pcm 等无头格式返回 UNKNOWN。
     */
    public static AudioContainer forFormat(String declared) {
        if (declared == null) {
            return UNKNOWN;
        }
        String f = declared.trim().toLowerCase(Locale.ROOT);
        for (AudioContainer c : values()) {
            for (String name : c.formats) {
                if (name.equals(f)) {
                    return c;
                }
            }
        }
        return UNKNOWN;
    }
}
