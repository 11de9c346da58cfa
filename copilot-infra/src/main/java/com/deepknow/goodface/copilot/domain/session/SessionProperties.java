package com.deepknow.goodface.copilot.domain.session;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "copilot.session")
public class SessionProperties {
    private int minTranscriptChars = 5; // 最终转写超过该长度才触发回复
    private int pipelineThreads = 4;
    private String readyMessage = "WebSocket connection established";

    public int getMinTranscriptChars() { return minTranscriptChars; }
    public void setMinTranscriptChars(int minTranscriptChars) { this.minTranscriptChars = minTranscriptChars; }
    public int getPipelineThreads() { return pipelineThreads; }
    public void setPipelineThreads(int pipelineThreads) { this.pipelineThreads = pipelineThreads; }
    public String getReadyMessage() { return readyMessage; }
    public void setReadyMessage(String readyMessage) { this.readyMessage = readyMessage; }
}
