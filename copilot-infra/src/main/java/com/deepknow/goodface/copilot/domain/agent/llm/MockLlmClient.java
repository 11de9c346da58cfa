package com.deepknow.goodface.copilot.domain.agent.llm;

import com.deepknow.goodface.copilot.domain.agent.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 开发用 Mock LLM：不调用外部服务，返回演示用答案。
 */
public class MockLlmClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(MockLlmClient.class);

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public String complete(String userMessage, String context) {
        int files = context == null ? 0 : context.split("--- START FILE:", -1).length - 1;
        String answer = "[mock] You asked: " + (userMessage == null ? "-" : userMessage)
                + " (" + files + " file(s) in context)";
        log.info("Mock LLM complete: {}", answer.length() <= 120 ? answer : answer.substring(0, 120) + "...");
        return answer;
    }
}
