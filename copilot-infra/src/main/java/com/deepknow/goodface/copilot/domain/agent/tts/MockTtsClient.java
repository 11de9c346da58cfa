package com.deepknow.goodface.copilot.domain.agent.tts;

import com.deepknow.goodface.copilot.domain.agent.TtsChunkStream;
import com.deepknow.goodface.copilot.domain.agent.TtsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;

/**
 * 开发用 Mock TTS：返回固定数量、以 ID3 头开始的小分片。
 */
public class MockTtsClient implements TtsClient {
    private static final Logger log = LoggerFactory.getLogger(MockTtsClient.class);

    private final int chunks;
    private final int chunkSize;

    public MockTtsClient(int chunks, int chunkSize) {
        this.chunks = Math.max(1, chunks);
        this.chunkSize = Math.max(16, chunkSize);
    }

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public String format() {
        return "mp3";
    }

    @Override
    public TtsChunkStream synthesize(String text) {
        byte[] audio = new byte[chunks * chunkSize];
        audio[0] = 'I';
        audio[1] = 'D';
        audio[2] = '3';
        audio[3] = 4;
        log.info("Mock TTS synthesize: textLen={} chunks={}", text == null ? 0 : text.length(), chunks);
        return new InputStreamTtsChunkStream("mock", new ByteArrayInputStream(audio), chunkSize, format());
    }
}
