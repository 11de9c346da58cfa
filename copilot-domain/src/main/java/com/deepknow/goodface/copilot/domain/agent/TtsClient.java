package com.deepknow.goodface.copilot.domain.agent;

import java.io.ByteArrayOutputStream;

public interface TtsClient {

    String name();

    /**
     * 返回音频的声明格式，例如 mp3。
     */
    String format();

    /**
     * 发起一次流式合成请求。请求被拒绝时立即抛出
     * {@link com.deepknow.goodface.copilot.domain.exception.TtsException}。
     */
    TtsChunkStream synthesize(String text);

    /**
     * 非流式场景：读取完整音频。
     */
    default byte[] synthesizeAll(String text) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (TtsChunkStream stream = synthesize(text)) {
            while (stream.hasNext()) {
                out.writeBytes(stream.next());
            }
        }
        return out.toByteArray();
    }
}
