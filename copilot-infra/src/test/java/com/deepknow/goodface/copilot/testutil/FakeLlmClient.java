package com.deepknow.goodface.copilot.testutil;

import com.deepknow.goodface.copilot.domain.agent.LlmClient;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 返回固定回复的 LLM，记录每次调用的输入和上下文。
 */
public class FakeLlmClient implements LlmClient {
    public String cannedReply = "Here is what the code does.";
    public RuntimeException failure;
    public final List<String> prompts = new CopyOnWriteArrayList<>();
    public final List<String> contexts = new CopyOnWriteArrayList<>();

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public String complete(String userMessage, String context) {
        prompts.add(userMessage);
        contexts.add(context);
        if (failure != null) {
            throw failure;
        }
        return cannedReply;
    }
}
