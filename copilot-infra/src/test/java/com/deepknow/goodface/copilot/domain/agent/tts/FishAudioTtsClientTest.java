package com.deepknow.goodface.copilot.domain.agent.tts;

import com.deepknow.goodface.copilot.domain.agent.TtsChunkStream;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.TtsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FishAudioTtsClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private final AtomicReference<String> authHeader = new AtomicReference<>();
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile byte[] responseBody = new byte[0];

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/tts", exchange -> {
            authHeader.set(exchange.getRequestHeaders().getFirst("Authorization"));
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(status, responseBody.length == 0 ? -1 : responseBody.length);
            if (responseBody.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(responseBody);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private FishAudioTtsClient client(String apiKey) {
        TtsConfigProperties props = new TtsConfigProperties();
        props.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        props.setReferenceId("voice-42");
        props.setChunkBufferSize(64);
        return new FishAudioTtsClient(HttpClient.newHttpClient(), mapper, props, apiKey);
    }

    @Test
    void streamsResponseBodyAsChunks() throws Exception {
        byte[] audio = new byte[200];
        audio[0] = 'I';
        audio[1] = 'D';
        audio[2] = '3';
        responseBody = audio;

        ByteArrayOutputStream received = new ByteArrayOutputStream();
        try (TtsChunkStream stream = client("fish-key-1234").synthesize("hello world")) {
            while (stream.hasNext()) {
                byte[] chunk = stream.next();
                assertThat(chunk.length).isLessThanOrEqualTo(64);
                received.write(chunk);
            }
        }

        assertThat(received.toByteArray()).isEqualTo(audio);
        assertThat(authHeader.get()).isEqualTo("Bearer fish-key-1234");
        JsonNode body = mapper.readTree(requestBody.get());
        assertThat(body.path("text").asText()).isEqualTo("hello world");
        assertThat(body.path("format").asText()).isEqualTo("mp3");
        assertThat(body.path("reference_id").asText()).isEqualTo("voice-42");
    }

    @Test
    void rejectedRequestFailsWithStatusAndDiagnostic() {
        status = 401;
        responseBody = "{\"message\":\"invalid token\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> client("bad-key").synthesize("hello"))
                .isInstanceOf(TtsException.class)
                .hasMessageContaining("invalid token")
                .satisfies(e -> {
                    TtsException tts = (TtsException) e;
                    assertThat(tts.getStatusCode()).isEqualTo(401);
                    assertThat(tts.getKind()).isEqualTo(ProviderErrorKind.UNAUTHORIZED);
                });
    }

    @Test
    void missingApiKeyFailsWithoutRequest() {
        assertThatThrownBy(() -> client(" ").synthesize("hello"))
                .isInstanceOf(TtsException.class)
                .satisfies(e -> assertThat(((TtsException) e).getKind()).isEqualTo(ProviderErrorKind.NOT_CONFIGURED));
        assertThat(requestBody.get()).isNull();
    }
}
