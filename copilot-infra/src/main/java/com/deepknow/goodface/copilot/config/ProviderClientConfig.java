package com.deepknow.goodface.copilot.config;

import com.deepknow.goodface.copilot.domain.agent.ApiKeys;
import com.deepknow.goodface.copilot.domain.agent.LlmClient;
import com.deepknow.goodface.copilot.domain.agent.SessionSchedulers;
import com.deepknow.goodface.copilot.domain.agent.SttConnector;
import com.deepknow.goodface.copilot.domain.agent.TtsClient;
import com.deepknow.goodface.copilot.domain.agent.llm.AliyunLlmClient;
import com.deepknow.goodface.copilot.domain.agent.llm.AnthropicLlmClient;
import com.deepknow.goodface.copilot.domain.agent.llm.LlmConfigProperties;
import com.deepknow.goodface.copilot.domain.agent.llm.MockLlmClient;
import com.deepknow.goodface.copilot.domain.agent.stt.AliyunSttConnector;
import com.deepknow.goodface.copilot.domain.agent.stt.DeepgramSttConnector;
import com.deepknow.goodface.copilot.domain.agent.stt.MockSttConnector;
import com.deepknow.goodface.copilot.domain.agent.stt.SttConfigProperties;
import com.deepknow.goodface.copilot.domain.agent.tts.FishAudioTtsClient;
import com.deepknow.goodface.copilot.domain.agent.tts.MockTtsClient;
import com.deepknow.goodface.copilot.domain.agent.tts.TtsConfigProperties;
import com.deepknow.goodface.copilot.domain.session.SessionProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;

/**
 * 服务商客户端在启动时按配置构造一次，注入到会话协调器。
 */
@Configuration
@EnableConfigurationProperties({SttConfigProperties.class, LlmConfigProperties.class,
        TtsConfigProperties.class, SessionProperties.class})
public class ProviderClientConfig {
    private static final Logger log = LoggerFactory.getLogger(ProviderClientConfig.class);

    @Bean(destroyMethod = "shutdown")
    public SessionSchedulers sessionSchedulers(SessionProperties props) {
        return SessionSchedulers.create(props.getPipelineThreads());
    }

    @Bean
    public HttpClient providerHttpClient(LlmConfigProperties llmProps) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(llmProps.getConnectTimeoutMs()))
                .build();
    }

    @Bean
    public SttConnector sttConnector(SttConfigProperties props, HttpClient providerHttpClient,
                                     ObjectMapper objectMapper, SessionSchedulers schedulers) {
        String provider = normalize(props.getProvider());
        String apiKey = ApiKeys.resolve(props.getApiKey(), props.getApiKeyEnv());
        log.info("STT provider: {}", provider);
        switch (provider) {
            case "aliyun":
                return new AliyunSttConnector(apiKey, props.getModel(), schedulers.io());
            case "mock":
                return new MockSttConnector(schedulers.scheduler());
            case "deepgram":
                return new DeepgramSttConnector(providerHttpClient, objectMapper, props.getUrl(), apiKey);
            default:
                throw new IllegalStateException("Unsupported stt.provider: " + props.getProvider());
        }
    }

    @Bean
    public LlmClient llmClient(LlmConfigProperties props, HttpClient providerHttpClient, ObjectMapper objectMapper) {
        String provider = normalize(props.getProvider());
        String apiKey = ApiKeys.resolve(props.getApiKey(), props.getApiKeyEnv());
        log.info("LLM provider: {}", provider);
        switch (provider) {
            case "aliyun":
                return new AliyunLlmClient(providerHttpClient, objectMapper, null, apiKey,
                        props.getModel(), props.getTemperature(), props.getTopP(), props.getMaxTokens());
            case "mock":
                return new MockLlmClient();
            case "anthropic":
                return new AnthropicLlmClient(providerHttpClient, objectMapper, props.getBaseUrl(), apiKey,
                        props.getModel(), props.getMaxTokens());
            default:
                throw new IllegalStateException("Unsupported llm.provider: " + props.getProvider());
        }
    }

    @Bean
    public TtsClient ttsClient(TtsConfigProperties props, HttpClient providerHttpClient, ObjectMapper objectMapper) {
        String provider = normalize(props.getProvider());
        log.info("TTS provider: {}", provider);
        switch (provider) {
            case "mock":
                return new MockTtsClient(3, 1024);
            case "fishaudio":
                return new FishAudioTtsClient(providerHttpClient, objectMapper, props,
                        ApiKeys.resolve(props.getApiKey(), props.getApiKeyEnv()));
            default:
                throw new IllegalStateException("Unsupported tts.provider: " + props.getProvider());
        }
    }

    private static String normalize(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }
}
