package com.deepknow.goodface.copilot.domain.agent;

import lombok.Data;

/**
 * 识别参数：每次录音使用同一组固定参数。
 */
@Data
public class SttOptions {
    private String model = "nova-2";
    private String language = "en";
    private boolean smartFormat = true;
    private boolean punctuate = true;
    private boolean interimResults = true;
    private int endpointingMs = 300;
    private int sampleRate = 16000;
}
