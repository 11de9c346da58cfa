package com.deepknow.goodface.copilot.domain.agent;

public interface LlmClient {

    String name();

    /**
     * 基于用户输入与文件上下文生成一次完整回复。
     *
     * @throws com.deepknow.goodface.copilot.domain.exception.LlmException 服务商调用失败
     */
    String complete(String userMessage, String context);
}
