package com.deepknow.goodface.copilot.domain.agent.tts;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tts")
public class TtsConfigProperties {
    private String provider = "fishaudio"; // fishaudio | mock
    private String apiKeyEnv = "FISH_AUDIO_API_KEY";
    private String apiKey; // 直接配置的密钥（优先于 apiKeyEnv）
    private String baseUrl = "https://api.fish.audio";
    private String referenceId; // 音色 ID，可为空
    private String format = "mp3";
    private int mp3Bitrate = 128;
    private String latency = "normal";
    private int requestTimeoutMs = 30000;
    private int chunkBufferSize = 4096;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getReferenceId() { return referenceId; }
    public void setReferenceId(String referenceId) { this.referenceId = referenceId; }
    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }
    public int getMp3Bitrate() { return mp3Bitrate; }
    public void setMp3Bitrate(int mp3Bitrate) { this.mp3Bitrate = mp3Bitrate; }
    public String getLatency() { return latency; }
    public void setLatency(String latency) { this.latency = latency; }
    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    public int getChunkBufferSize() { return chunkBufferSize; }
    public void setChunkBufferSize(int chunkBufferSize) { this.chunkBufferSize = chunkBufferSize; }
}
