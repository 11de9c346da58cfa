package com.deepknow.goodface.copilot.client.playback;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlaybackBufferManagerTest {

    private static byte[] chunk(int n) {
        return new byte[]{(byte) n};
    }

    @Test
    void chunksQueueWhileAnAppendIsInFlight() {
        FakeMediaSink sink = new FakeMediaSink();
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);

        manager.enqueue(chunk(1));
        manager.enqueue(chunk(2));
        manager.enqueue(chunk(3));

        assertThat(sink.appended).hasSize(1);
        assertThat(manager.queuedCount()).isEqualTo(2);
        assertThat(manager.isAppending()).isTrue();

        sink.finishAppend();
        sink.finishAppend();
        sink.finishAppend();

        assertThat(sink.appended).extracting(b -> b[0]).containsExactly((byte) 1, (byte) 2, (byte) 3);
        assertThat(sink.maxInFlight).isEqualTo(1);
        assertThat(manager.isAppending()).isFalse();
    }

    @Test
    void synchronousCompletionDrainsWithoutRecursion() {
        FakeMediaSink sink = new FakeMediaSink();
        sink.ready = false;
        sink.completeSynchronously = true;
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);
        for (int i = 0; i < 10_000; i++) {
            manager.enqueue(chunk(i));
        }

        sink.becomeReady();

        assertThat(sink.appended).hasSize(10_000);
        assertThat(sink.maxInFlight).isEqualTo(1);
        assertThat(manager.queuedCount()).isZero();
    }

    @Test
    void chunksWaitUntilSinkIsReady() {
        FakeMediaSink sink = new FakeMediaSink();
        sink.ready = false;
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);

        manager.enqueue(chunk(1));
        manager.enqueue(chunk(2));

        assertThat(sink.appended).isEmpty();

        sink.becomeReady();

        assertThat(sink.appended).hasSize(1);
        assertThat(manager.queuedCount()).isEqualTo(1);
    }

    @Test
    void failedAppendIsSkippedAndNextChunkFollows() {
        FakeMediaSink sink = new FakeMediaSink();
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);
        manager.enqueue(chunk(1));
        manager.enqueue(chunk(2));

        sink.failAppend();

        assertThat(sink.appended).extracting(b -> b[0]).containsExactly((byte) 1, (byte) 2);
        assertThat(manager.isAppending()).isTrue();
    }

    @Test
    void synchronousAppendExceptionIsTreatedAsFailure() {
        FakeMediaSink sink = new FakeMediaSink();
        sink.appendFailure = new IllegalStateException("InvalidStateError");
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);

        manager.enqueue(chunk(1));
        manager.enqueue(chunk(2));

        assertThat(manager.isAppending()).isFalse();
        assertThat(manager.queuedCount()).isZero();
    }

    @Test
    void firstChunkStartsPlaybackAndBlockedPlayIsNotFatal() {
        FakeMediaSink sink = new FakeMediaSink();
        sink.blockPlay = true;
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);

        manager.enqueue(chunk(1));
        sink.finishAppend();
        manager.enqueue(chunk(2));

        assertThat(sink.playCalls).isEqualTo(1);
        assertThat(sink.appended).hasSize(2);

        sink.blockPlay = false;
        manager.resume();

        assertThat(sink.playCalls).isEqualTo(2);
    }

    @Test
    void clearEmptiesQueuePausesAndRearmsStart() {
        FakeMediaSink sink = new FakeMediaSink();
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);
        manager.enqueue(chunk(1));
        manager.enqueue(chunk(2));

        manager.clear();

        assertThat(manager.queuedCount()).isZero();
        assertThat(manager.isAppending()).isFalse();
        assertThat(sink.pauseCalls).isEqualTo(1);

        manager.enqueue(chunk(3));

        assertThat(sink.playCalls).isEqualTo(2);
    }

    @Test
    void emptyChunksAreIgnored() {
        FakeMediaSink sink = new FakeMediaSink();
        PlaybackBufferManager manager = new PlaybackBufferManager(sink);

        manager.enqueue(new byte[0]);
        manager.enqueue(null);

        assertThat(sink.appended).isEmpty();
    }
}
