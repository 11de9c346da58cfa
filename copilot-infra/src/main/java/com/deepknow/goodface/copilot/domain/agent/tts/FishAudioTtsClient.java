package com.deepknow.goodface.copilot.domain.agent.tts;

import com.deepknow.goodface.copilot.domain.agent.ApiKeys;
import com.deepknow.goodface.copilot.domain.agent.TtsChunkStream;
import com.deepknow.goodface.copilot.domain.agent.TtsClient;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.TtsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fish Audio 流式 TTS：一次合成对应一次 HTTP 请求，响应体按读取边界交付。
 */
public class FishAudioTtsClient implements TtsClient {
    private static final Logger log = LoggerFactory.getLogger(FishAudioTtsClient.class);
    private static final String NAME = "fishaudio";
    private static final int MAX_DIAGNOSTIC = 500;

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final TtsConfigProperties props;
    private final String apiKey;

    public FishAudioTtsClient(HttpClient httpClient, ObjectMapper mapper, TtsConfigProperties props, String apiKey) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.props = props;
        this.apiKey = apiKey;
        log.info("TTS init: provider={} baseUrl={} format={} apiKey={}",
                NAME, props.getBaseUrl(), props.getFormat(), ApiKeys.mask(apiKey));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String format() {
        return props.getFormat();
    }

    @Override
    public TtsChunkStream synthesize(String text) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new TtsException(NAME, ProviderErrorKind.NOT_CONFIGURED, "Fish Audio API key not configured");
        }
        HttpRequest req = HttpRequest.newBuilder(URI.create(trimSlash(props.getBaseUrl()) + "/tts"))
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(text), StandardCharsets.UTF_8))
                .build();
        HttpResponse<InputStream> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new TtsException(NAME, ProviderErrorKind.NETWORK, -1, "TTS request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TtsException(NAME, ProviderErrorKind.NETWORK, -1, "TTS request interrupted", e);
        }
        int status = resp.statusCode();
        if (status / 100 != 2) {
            String diagnostic = readDiagnostic(resp.body());
            log.warn("TTS request rejected: status={} body={}", status, diagnostic);
            throw new TtsException(NAME, ProviderErrorKind.fromStatus(status), status,
                    "TTS HTTP " + status + ": " + diagnostic, null);
        }
        log.info("TTS stream started: status={} textLen={}", status, text == null ? 0 : text.length());
        return new InputStreamTtsChunkStream(NAME, resp.body(), props.getChunkBufferSize(), props.getFormat());
    }

    String requestBody(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text == null ? "" : text);
        body.put("format", props.getFormat());
        body.put("mp3_bitrate", props.getMp3Bitrate());
        body.put("latency", props.getLatency());
        if (props.getReferenceId() != null && !props.getReferenceId().isBlank()) {
            body.put("reference_id", props.getReferenceId());
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TtsException(NAME, ProviderErrorKind.INVALID_REQUEST, -1, "TTS request not serializable", e);
        }
    }

    private static String readDiagnostic(InputStream in) {
        try (InputStream body = in) {
            byte[] head = body.readNBytes(MAX_DIAGNOSTIC);
            return new String(head, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable: " + e.getMessage() + ">";
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
