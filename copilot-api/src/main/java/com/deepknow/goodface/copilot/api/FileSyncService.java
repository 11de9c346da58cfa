package com.deepknow.goodface.copilot.api;

import com.deepknow.goodface.copilot.api.model.CachedFileInfo;
import com.deepknow.goodface.copilot.api.model.FileSyncResult;
import com.deepknow.goodface.copilot.api.request.FileUpdateRequest;

import java.util.List;

/**
 * 编辑器插件推送文件内容，供语音会话作为 LLM 上下文。
 */
public interface FileSyncService {
    FileSyncResult updateFile(FileUpdateRequest req);
    List<CachedFileInfo> listFiles();
}
