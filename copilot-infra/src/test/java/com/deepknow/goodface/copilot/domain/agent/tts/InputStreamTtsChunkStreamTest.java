package com.deepknow.goodface.copilot.domain.agent.tts;

import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.TtsException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputStreamTtsChunkStreamTest {

    @Test
    void deliversBodyInBufferSizedChunks() {
        byte[] audio = new byte[10];
        audio[0] = 'I';
        audio[1] = 'D';
        audio[2] = '3';
        InputStreamTtsChunkStream stream = new InputStreamTtsChunkStream("test", new ByteArrayInputStream(audio), 4, "mp3");

        List<byte[]> chunks = drain(stream);

        assertThat(chunks).extracting(c -> c.length).containsExactly(4, 4, 2);
        assertThat(stream.chunkCount()).isEqualTo(3);
        assertThat(stream.hasNext()).isFalse();
    }

    @Test
    void transportFailureAfterFirstChunkEndsStreamQuietly() {
        ScriptedInputStream body = new ScriptedInputStream();
        body.reads.add(new byte[]{1, 2, 3});
        body.reads.add(new byte[]{4, 5});
        body.failAtEnd = true;
        InputStreamTtsChunkStream stream = new InputStreamTtsChunkStream("test", body, 16, "mp3");

        List<byte[]> chunks = drain(stream);

        assertThat(chunks).hasSize(2);
        assertThat(body.closed).isTrue();
    }

    @Test
    void transportFailureBeforeAnyChunkIsReported() {
        ScriptedInputStream body = new ScriptedInputStream();
        body.failAtEnd = true;
        InputStreamTtsChunkStream stream = new InputStreamTtsChunkStream("test", body, 16, "mp3");

        assertThatThrownBy(stream::hasNext)
                .isInstanceOf(TtsException.class)
                .satisfies(e -> assertThat(((TtsException) e).getKind()).isEqualTo(ProviderErrorKind.NETWORK));
        assertThat(body.closed).isTrue();
    }

    @Test
    void closeStopsIterationAndReleasesBody() {
        ScriptedInputStream body = new ScriptedInputStream();
        body.reads.add(new byte[]{1});
        body.reads.add(new byte[]{2});
        InputStreamTtsChunkStream stream = new InputStreamTtsChunkStream("test", body, 16, "mp3");

        stream.next();
        stream.close();

        assertThat(stream.hasNext()).isFalse();
        assertThat(body.closed).isTrue();
    }

    private static List<byte[]> drain(InputStreamTtsChunkStream stream) {
        List<byte[]> out = new ArrayList<>();
        while (stream.hasNext()) {
            out.add(stream.next());
        }
        return out;
    }

    /**
     * 按脚本逐次返回字节段，脚本读完后可选择抛出 IOException。
     */
    private static final class ScriptedInputStream extends InputStream {
        final Deque<byte[]> reads = new LinkedList<>();
        boolean failAtEnd;
        boolean closed;

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (closed) {
                throw new IOException("closed");
            }
            byte[] next = reads.poll();
            if (next == null) {
                if (failAtEnd) {
                    throw new IOException("connection reset");
                }
                return -1;
            }
            int n = Math.min(len, next.length);
            System.arraycopy(next, 0, b, off, n);
            if (n < next.length) {
                reads.addFirst(Arrays.copyOfRange(next, n, next.length));
            }
            return n;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
