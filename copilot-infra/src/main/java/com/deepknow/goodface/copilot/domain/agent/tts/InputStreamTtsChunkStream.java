package com.deepknow.goodface.copilot.domain.agent.tts;

import com.deepknow.goodface.copilot.domain.agent.TtsChunkStream;
import com.deepknow.goodface.copilot.domain.audio.AudioContainer;
import com.deepknow.goodface.copilot.domain.audio.AudioSignatures;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.TtsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * 将响应体按读取到的连续字节段切成音频分片。
 * 已交付至少一个分片后的传输中断视为正常结束；首个分片之前的中断以 {@link TtsException} 抛出。
 */
public class InputStreamTtsChunkStream implements TtsChunkStream {
    private static final Logger log = LoggerFactory.getLogger(InputStreamTtsChunkStream.class);

    private final String provider;
    private final InputStream body;
    private final byte[] buffer;
    private final String declaredFormat;

    private byte[] next;
    private int delivered;
    private boolean done;

    public InputStreamTtsChunkStream(String provider, InputStream body, int bufferSize, String declaredFormat) {
        this.provider = provider;
        this.body = body;
        this.buffer = new byte[bufferSize > 0 ? bufferSize : 4096];
        this.declaredFormat = declaredFormat;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (done) {
            return false;
        }
        readNext();
        return next != null;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        byte[] chunk = next;
        next = null;
        delivered++;
        return chunk;
    }

    @Override
    public int chunkCount() {
        return delivered;
    }

    @Override
    public void close() {
        done = true;
        next = null;
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Close TTS body failed: {}", e.toString());
        }
    }

    private void readNext() {
        while (true) {
            int n;
            try {
                n = body.read(buffer);
            } catch (IOException e) {
                close();
                if (delivered > 0) {
                    log.warn("TTS stream ended early after {} chunks: provider={}, error={}", delivered, provider, e.toString());
                    return;
                }
                throw new TtsException(provider, ProviderErrorKind.NETWORK, -1,
                        "TTS stream failed before any audio: " + e.getMessage(), e);
            }
            if (n < 0) {
                close();
                return;
            }
            if (n == 0) {
                continue;
            }
            next = Arrays.copyOf(buffer, n);
            if (delivered == 0) {
                inspectFirstChunk(next);
            }
            return;
        }
    }

    private void inspectFirstChunk(byte[] chunk) {
        AudioContainer detected = AudioSignatures.detect(chunk);
        log.info("TTS first chunk: provider={}, bytes={}, head=[{}], detected={}",
                provider, chunk.length, AudioSignatures.hexPreview(chunk, 16), detected);
        if (AudioSignatures.isMismatch(chunk, declaredFormat)) {
            log.warn("TTS audio signature mismatch: declared={}, detected={}", declaredFormat, detected);
        }
    }
}
