package com.deepknow.goodface.copilot.domain.agent.stt;

import com.deepknow.goodface.copilot.domain.agent.SttOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "stt")
public class SttConfigProperties {
    private String provider = "deepgram"; // deepgram | aliyun | mock
    private String apiKeyEnv = "DEEPGRAM_API_KEY";
    private String apiKey; // 直接配置的密钥（优先级高于 apiKeyEnv）
    private String url = "wss://api.deepgram.com/v1/listen";
    private String model = "nova-2";
    private String language = "en";
    private boolean smartFormat = true;
    private boolean punctuate = true;
    private boolean interimResults = true;
    private int endpointingMs = 300;
    private int sampleRate = 16000;
    private long openTimeoutMs = 5000;
    private long closeGraceMs = 100;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }
    public boolean isSmartFormat() { return smartFormat; }
    public void setSmartFormat(boolean smartFormat) { this.smartFormat = smartFormat; }
    public boolean isPunctuate() { return punctuate; }
    public void setPunctuate(boolean punctuate) { this.punctuate = punctuate; }
    public boolean isInterimResults() { return interimResults; }
    public void setInterimResults(boolean interimResults) { this.interimResults = interimResults; }
    public int getEndpointingMs() { return endpointingMs; }
    public void setEndpointingMs(int endpointingMs) { this.endpointingMs = endpointingMs; }
    public int getSampleRate() { return sampleRate; }
    public void setSampleRate(int sampleRate) { this.sampleRate = sampleRate; }
    public long getOpenTimeoutMs() { return openTimeoutMs; }
    public void setOpenTimeoutMs(long openTimeoutMs) { this.openTimeoutMs = openTimeoutMs; }
    public long getCloseGraceMs() { return closeGraceMs; }
    public void setCloseGraceMs(long closeGraceMs) { this.closeGraceMs = closeGraceMs; }

    public SttOptions toOptions() {
        SttOptions o = new SttOptions();
        o.setModel(model);
        o.setLanguage(language);
        o.setSmartFormat(smartFormat);
        o.setPunctuate(punctuate);
        o.setInterimResults(interimResults);
        o.setEndpointingMs(endpointingMs);
        o.setSampleRate(sampleRate);
        return o;
    }
}
