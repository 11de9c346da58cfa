package com.deepknow.goodface.copilot.domain.agent.llm;

import com.deepknow.goodface.copilot.domain.agent.ApiKeys;
import com.deepknow.goodface.copilot.domain.agent.LlmClient;
import com.deepknow.goodface.copilot.domain.exception.LlmException;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages 接口（REST，非流式）。文件上下文放在 system prompt 中。
 */
public class AnthropicLlmClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(AnthropicLlmClient.class);
    private static final String NAME = "anthropic";
    private static final String API_VERSION = "2023-06-01";
    static final String NO_RESPONSE = "No response generated.";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicLlmClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl,
                              String apiKey, String model, int maxTokens) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        log.info("LLM init: provider={} model={} maxTokens={} apiKey={}", NAME, model, maxTokens, ApiKeys.mask(apiKey));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String complete(String userMessage, String context) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new LlmException(NAME, ProviderErrorKind.NOT_CONFIGURED, "Anthropic API key not configured");
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("model", model);
        root.put("max_tokens", maxTokens);
        root.put("system", systemPrompt(context));
        root.put("messages", List.of(Map.of("role", "user", "content", userMessage == null ? "" : userMessage)));

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/v1/messages"))
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(root), StandardCharsets.UTF_8))
                    .build();
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LlmException(NAME, ProviderErrorKind.NETWORK, -1, "LLM request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException(NAME, ProviderErrorKind.NETWORK, -1, "LLM request interrupted", e);
        }
        log.info("LLM call status: {} model={}", resp.statusCode(), model);
        if (resp.statusCode() / 100 != 2) {
            throw new LlmException(NAME, ProviderErrorKind.fromStatus(resp.statusCode()), resp.statusCode(),
                    "LLM HTTP " + resp.statusCode() + ": " + preview(resp.body(), 300), null);
        }
        return extractText(resp.body());
    }

    String extractText(String body) {
        try {
            JsonNode content = mapper.readTree(body).path("content");
            if (content.isArray()) {
                for (JsonNode block : content) {
                    if ("text".equals(block.path("type").asText())) {
                        return block.path("text").asText(NO_RESPONSE);
                    }
                }
            }
        } catch (IOException e) {
            throw new LlmException(NAME, ProviderErrorKind.SERVER_ERROR, -1, "LLM response not parseable", e);
        }
        return NO_RESPONSE;
    }

    static String systemPrompt(String context) {
        return "You are a helpful coding assistant. You have access to the user's codebase through file monitoring.\n\n"
                + "Current codebase context:\n" + (context == null ? "" : context) + "\n\n"
                + "Provide concise, accurate coding assistance based on the available context.";
    }

    private static String preview(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
