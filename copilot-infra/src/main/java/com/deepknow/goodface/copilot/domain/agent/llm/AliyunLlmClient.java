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
import java.util.HashMap;
import java.util.Map;

/**
 * 阿里云百炼文本模型客户端（REST）。
 */
public class AliyunLlmClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(AliyunLlmClient.class);
    private static final String NAME = "aliyun";
    static final String GEN_URL = "https://dashscope.aliyuncs.com/api/v1/services/aigc/text-generation/generation";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String url;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final double topP;
    private final int maxTokens;

    public AliyunLlmClient(HttpClient httpClient, ObjectMapper mapper, String url, String apiKey,
                           String model, double temperature, double topP, int maxTokens) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.url = url == null ? GEN_URL : url;
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.topP = topP;
        this.maxTokens = maxTokens;
        log.info("LLM init: provider={} model={} temperature={} topP={} maxTokens={} apiKey={}",
                NAME, model, temperature, topP, maxTokens, ApiKeys.mask(apiKey));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String complete(String userMessage, String context) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new LlmException(NAME, ProviderErrorKind.NOT_CONFIGURED, "DashScope API key not configured");
        }
        JsonNode root = call(AnthropicLlmClient.systemPrompt(context), userMessage == null ? "" : userMessage);
        JsonNode choices = root.path("output").path("choices");
        if (choices.isArray() && choices.size() > 0) {
            String content = choices.get(0).path("message").path("content").asText("");
            if (!content.isEmpty()) {
                return content;
            }
        }
        return AnthropicLlmClient.NO_RESPONSE;
    }

    private JsonNode call(String system, String user) {
        Map<String, Object> root = new HashMap<>();
        root.put("model", model);
        Map<String, Object> params = new HashMap<>();
        params.put("temperature", temperature);
        params.put("top_p", topP);
        params.put("max_tokens", maxTokens);
        // 统一返回为消息格式，便于稳定解析
        params.put("result_format", "message");
        root.put("parameters", params);

        Map<String, Object> mSystem = new HashMap<>();
        mSystem.put("role", "system");
        mSystem.put("content", system);
        Map<String, Object> mUser = new HashMap<>();
        mUser.put("role", "user");
        mUser.put("content", user);
        root.put("input", Map.of("messages", new Object[]{mSystem, mUser}));

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .header("Authorization", "Bearer " + apiKey)
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
                    "LLM HTTP " + resp.statusCode() + ": " + resp.body(), null);
        }
        try {
            return mapper.readTree(resp.body());
        } catch (IOException e) {
            throw new LlmException(NAME, ProviderErrorKind.SERVER_ERROR, -1, "LLM response not parseable", e);
        }
    }
}
