package com.deepknow.goodface.copilot.domain.session;

import com.deepknow.goodface.copilot.domain.agent.ContextProvider;
import com.deepknow.goodface.copilot.domain.agent.SessionSchedulers;
import com.deepknow.goodface.copilot.domain.agent.stt.SttConfigProperties;
import com.deepknow.goodface.copilot.domain.agent.stt.SttSession;
import com.deepknow.goodface.copilot.domain.agent.stt.SttSessionFactory;
import com.deepknow.goodface.copilot.domain.context.FileContextCache;
import com.deepknow.goodface.copilot.domain.exception.LlmException;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.SttException;
import com.deepknow.goodface.copilot.domain.exception.TtsException;
import com.deepknow.goodface.copilot.domain.session.model.InboundMessage;
import com.deepknow.goodface.copilot.domain.session.model.SessionPhase;
import com.deepknow.goodface.copilot.domain.session.util.TransmissionGuard;
import com.deepknow.goodface.copilot.testutil.FakeLlmClient;
import com.deepknow.goodface.copilot.testutil.FakeSttConnector;
import com.deepknow.goodface.copilot.testutil.FakeTtsClient;
import com.deepknow.goodface.copilot.testutil.RecordingOutboundChannel;
import com.deepknow.goodface.copilot.testutil.SyncExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 协调器端到端行为：回复链路在同步执行器上运行，STT 由可控的假连接器驱动。
 */
class VoiceSessionServiceImplTest {

    private static final String WS = "ws-1";

    private ScheduledExecutorService scheduler;
    private FakeSttConnector sttConnector;
    private SttConfigProperties sttProps;
    private SttSessionFactory sttSessionFactory;
    private FakeLlmClient llm;
    private FakeTtsClient tts;
    private FileContextCache cache;
    private RecordingOutboundChannel channel;
    private VoiceSessionServiceImpl service;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        SessionSchedulers schedulers = new SessionSchedulers(scheduler, new SyncExecutor(), new SyncExecutor());
        sttConnector = new FakeSttConnector();
        sttProps = new SttConfigProperties();
        sttProps.setCloseGraceMs(200);
        llm = new FakeLlmClient();
        tts = new FakeTtsClient();
        tts.chunks = List.of(new byte[]{'I', 'D', '3', 4}, new byte[]{1, 2}, new byte[]{3, 4});
        cache = new FileContextCache();
        channel = new RecordingOutboundChannel(WS);
        sttSessionFactory = new SttSessionFactory(sttConnector, sttProps, schedulers);
        service = new VoiceSessionServiceImpl(sttSessionFactory, llm, tts, cache,
                new TransmissionGuard(new ObjectMapper()), schedulers, new SessionProperties());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void openSendsReady() {
        service.open(WS, channel);

        assertThat(channel.types()).containsExactly("ready");
        assertThat(channel.messages().get(0).path("message").asText()).isEqualTo("WebSocket connection established");
        assertThat(service.activeSessions()).isEqualTo(1);
    }

    @Test
    void startStreamStopStopOpensOneConnectionAndStopsForwarding() {
        service.open(WS, channel);

        service.onMessage(WS, InboundMessage.startRecording());
        service.onMessage(WS, InboundMessage.audio(new byte[]{1, 2, 3}));
        sttConnector.last().fireTranscript("ok", true);
        service.onMessage(WS, InboundMessage.stopRecording());
        service.onMessage(WS, InboundMessage.stopRecording());
        service.onMessage(WS, InboundMessage.audio(new byte[]{4, 5, 6}));

        assertThat(sttConnector.connections).hasSize(1);
        FakeSttConnector.FakeConnection conn = sttConnector.last();
        assertThat(conn.audio).hasSize(1);
        assertThat(conn.finishCalls).isEqualTo(1);
        assertThat(conn.closeCalls).isEqualTo(1);
        assertThat(channel.types()).containsExactly("ready", "recording_started", "transcript", "recording_stopped");
        assertThat(channel.ofType("recording_stopped").get(0).path("fullTranscript").asText()).isEqualTo("ok");
        assertThat(llm.prompts).isEmpty();
    }

    @Test
    void streamedFramesAreForwardedInOrder() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());

        List<byte[]> frames = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            byte[] frame = new byte[]{(byte) i, (byte) (i * 3), 7};
            frames.add(frame);
            service.onMessage(WS, InboundMessage.audio(frame));
        }

        assertThat(sttConnector.last().audio).containsExactlyElementsOf(frames);
    }

    @Test
    void stopBeforeTranscriberOpensIsNotAnError() {
        sttConnector.autoOpen = false;
        service.open(WS, channel);

        service.onMessage(WS, InboundMessage.startRecording());
        service.onMessage(WS, InboundMessage.stopRecording());
        sttConnector.last().fireOpen();

        assertThat(channel.types()).containsExactly("ready", "recording_stopped");
        assertThat(sttConnector.last().closeCalls).isEqualTo(1);
    }

    @Test
    void muteOnlyAcknowledgesAndKeepsForwarding() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());

        service.onMessage(WS, InboundMessage.control("mute"));
        service.onMessage(WS, InboundMessage.audio(new byte[]{1}));

        assertThat(channel.types()).containsExactly("ready", "recording_started", "muted");
        assertThat(sttConnector.last().audio).hasSize(1);
    }

    @Test
    void audioBeforeRecordingIsDropped() {
        service.open(WS, channel);

        service.onMessage(WS, InboundMessage.audio(new byte[]{1}));

        assertThat(sttConnector.connections).isEmpty();
        assertThat(channel.types()).containsExactly("ready");
    }

    @Test
    void finalTranscriptTriggersReplyWithOrderedAudio() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());
        channel.reset();

        sttConnector.last().fireTranscript("explain the", false);
        sttConnector.last().fireTranscript("explain the main function", true);

        assertThat(channel.types()).containsExactly(
                "transcript", "transcript", "ai_response", "audio", "audio", "audio", "audio_end");
        List<JsonNode> transcripts = channel.ofType("transcript");
        assertThat(transcripts.get(0).path("isFinal").asBoolean()).isFalse();
        assertThat(transcripts.get(1).path("isFinal").asBoolean()).isTrue();
        assertThat(channel.ofType("ai_response").get(0).path("data").asText()).isEqualTo(llm.cannedReply);

        List<JsonNode> audio = channel.ofType("audio");
        assertThat(audio).extracting(n -> n.path("chunkIndex").asInt()).containsExactly(0, 1, 2);
        assertThat(audio).extracting(n -> n.path("format").asText()).containsOnly("mp3");
        assertThat(Base64.getDecoder().decode(audio.get(1).path("data").asText())).isEqualTo(new byte[]{1, 2});
        assertThat(channel.ofType("audio_end").get(0).path("totalChunks").asInt()).isEqualTo(3);
        assertThat(llm.prompts).containsExactly("explain the main function");
    }

    @Test
    void shortFinalTranscriptDoesNotTriggerReply() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());

        sttConnector.last().fireTranscript("  yes  ", true);

        assertThat(llm.prompts).isEmpty();
        assertThat(channel.types()).doesNotContain("ai_response");
    }

    @Test
    void textInputWithEmptyCacheUsesNoContextMarker() {
        service.open(WS, channel);
        channel.reset();

        service.onMessage(WS, InboundMessage.textInput("what does this project do"));

        assertThat(llm.contexts).containsExactly(ContextProvider.NO_CONTEXT);
        assertThat(channel.types()).containsExactly("ai_response", "audio", "audio", "audio", "audio_end");
    }

    @Test
    void textInputIncludesMentionedCachedFile() {
        cache.put("src/Main.java", "public class Main {}", 1L);
        service.open(WS, channel);

        service.onMessage(WS, InboundMessage.textInput("what is in Main.java"));

        assertThat(llm.contexts.get(0)).contains("--- START FILE: src/Main.java ---");
    }

    @Test
    void blankTextInputIsIgnored() {
        service.open(WS, channel);

        service.onMessage(WS, InboundMessage.textInput("   "));

        assertThat(llm.prompts).isEmpty();
        assertThat(channel.types()).containsExactly("ready");
    }

    @Test
    void ttsFailureAfterSomeChunksStillEndsAudio() {
        tts.failAfter = 2;
        tts.streamFailure = new TtsException("fake", ProviderErrorKind.NETWORK, "reset by peer");
        ConversationSession session = openSession();

        service.runReplyLeg(session, "describe the build");

        assertThat(channel.types()).containsExactly("ai_response", "audio", "audio", "audio_end");
        assertThat(channel.ofType("audio_end").get(0).path("totalChunks").asInt()).isEqualTo(2);
        assertThat(session.getPhase()).isEqualTo(SessionPhase.IDLE);
        assertThat(tts.closedStreams).isEqualTo(1);
    }

    @Test
    void ttsRejectionBeforeAudioReportsOneError() {
        tts.requestFailure = new TtsException("fake", ProviderErrorKind.QUOTA_EXCEEDED, 429, "TTS HTTP 429", null);
        ConversationSession session = openSession();

        service.runReplyLeg(session, "describe the build");

        assertThat(channel.types()).containsExactly("ai_response", "error");
        assertThat(channel.ofType("error").get(0).path("message").asText())
                .startsWith("Failed to generate speech: TTS HTTP 429")
                .contains(ProviderErrorKind.QUOTA_EXCEEDED.getHint());
        assertThat(session.getPhase()).isEqualTo(SessionPhase.IDLE);
    }

    @Test
    void llmFailureReportsErrorAndSkipsSpeech() {
        llm.failure = new LlmException("fake", ProviderErrorKind.UNAUTHORIZED, 401, "LLM HTTP 401", null);
        ConversationSession session = openSession();

        service.runReplyLeg(session, "describe the build");

        assertThat(channel.types()).containsExactly("error");
        assertThat(channel.messages().get(0).path("message").asText())
                .startsWith("Failed to get AI response: LLM HTTP 401");
        assertThat(session.getPhase()).isEqualTo(SessionPhase.IDLE);
    }

    @Test
    void brokenChannelStopsAudioWithoutThrowing() {
        ConversationSession session = openSession();
        channel.failAfter = 2;

        service.runReplyLeg(session, "describe the build");

        assertThat(channel.types()).containsExactly("ai_response", "audio");
        assertThat(tts.closedStreams).isEqualTo(1);
        assertThat(session.getPhase()).isEqualTo(SessionPhase.IDLE);
    }

    @Test
    void replyDuringRecordingReturnsToListening() {
        ConversationSession session = openSession();
        SttSession stt = sttSessionFactory.create(WS, null);
        stt.start().join();
        session.setSttSession(stt);
        session.transitionTo(SessionPhase.LISTENING);

        service.runReplyLeg(session, "explain the loop");

        assertThat(session.getPhase()).isEqualTo(SessionPhase.LISTENING);
    }

    @Test
    void restartingRecordingReplacesProviderConnection() {
        service.open(WS, channel);

        service.onMessage(WS, InboundMessage.startRecording());
        service.onMessage(WS, InboundMessage.startRecording());
        service.onMessage(WS, InboundMessage.audio(new byte[]{9}));

        assertThat(sttConnector.connections).hasSize(2);
        assertThat(sttConnector.connections.get(0).finishCalls).isEqualTo(1);
        assertThat(sttConnector.connections.get(0).audio).isEmpty();
        assertThat(sttConnector.connections.get(1).audio).hasSize(1);
        assertThat(channel.types()).containsExactly("ready", "recording_started", "recording_started");
    }

    @Test
    void sttOpenTimeoutReportsStartFailure() {
        sttConnector.autoOpen = false;
        sttProps.setOpenTimeoutMs(50);
        service.open(WS, channel);

        service.onMessage(WS, InboundMessage.startRecording());

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> channel.types().contains("error"));
        assertThat(channel.ofType("error").get(0).path("message").asText())
                .startsWith("Failed to start recording: STT connection timeout after 50ms");
        assertThat(channel.types()).doesNotContain("recording_started");
    }

    @Test
    void transcriberErrorIsReported() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());

        sttConnector.last().fireError(new SttException("fake", ProviderErrorKind.NETWORK, "socket reset"));

        assertThat(channel.ofType("error").get(0).path("message").asText())
                .startsWith("Transcription error: socket reset");
    }

    @Test
    void deadTranscriberTransportIsReportedOnce() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());
        sttConnector.last().open = false;

        service.onMessage(WS, InboundMessage.audio(new byte[]{1}));
        service.onMessage(WS, InboundMessage.audio(new byte[]{2}));

        assertThat(channel.ofType("error")).hasSize(1);
        assertThat(channel.ofType("error").get(0).path("message").asText())
                .startsWith("Transcription error: STT transport closed unexpectedly");
        assertThat(sttConnector.last().audio).isEmpty();
    }

    @Test
    void controlActionsAreAcknowledged() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());

        service.onMessage(WS, InboundMessage.control("mute"));
        service.onMessage(WS, InboundMessage.control("unmute"));
        service.onMessage(WS, InboundMessage.control("rewind"));
        service.onMessage(WS, InboundMessage.control("end_session"));

        assertThat(channel.types()).containsExactly("ready", "recording_started", "muted", "unmuted", "session_ended");
        assertThat(channel.closeCalls).isEqualTo(1);
        assertThat(sttConnector.last().finishCalls).isEqualTo(1);
    }

    @Test
    void disconnectStopsRecordingAndDropsSession() {
        service.open(WS, channel);
        service.onMessage(WS, InboundMessage.startRecording());

        service.onDisconnect(WS);
        service.onMessage(WS, InboundMessage.audio(new byte[]{1}));
        service.onDisconnect(WS);

        FakeSttConnector.FakeConnection conn = sttConnector.last();
        assertThat(conn.finishCalls).isEqualTo(1);
        assertThat(conn.closeCalls).isEqualTo(1);
        assertThat(conn.audio).isEmpty();
        assertThat(service.activeSessions()).isZero();
    }

    private ConversationSession openSession() {
        ConversationSession session = new ConversationSession(WS, channel, new SyncExecutor());
        channel.reset();
        return session;
    }
}
