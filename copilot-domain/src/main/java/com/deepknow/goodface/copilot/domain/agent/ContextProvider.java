package com.deepknow.goodface.copilot.domain.agent;

/**
 * 为 LLM 选择上下文的外部协作者（文件缓存、语义检索等）。
 */
public interface ContextProvider {

    String NO_CONTEXT = "--- No file context available ---";

    String contextFor(String query);
}
