package com.deepknow.goodface.copilot.domain.context;

import com.deepknow.goodface.copilot.domain.agent.ContextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 编辑器推送的文件内容缓存（内存，按更新顺序排列）。
 * 上下文选择：查询中提到文件名的文件全部带上；没有提到则带上最近更新的文件。
 */
@Component
public class FileContextCache implements ContextProvider {
    private static final Logger log = LoggerFactory.getLogger(FileContextCache.class);

    private final Map<String, CachedFile> files = new LinkedHashMap<>();

    /**
     * 写入或覆盖文件；被更新的文件移到末尾。
     *
     * @return 更新后的缓存文件数
     */
    public synchronized int put(String path, String content, long lastModified) {
        files.remove(path);
        files.put(path, new CachedFile(path, content, lastModified));
        log.info("File cached: path={}, size={}, cacheSize={}", path, content.length(), files.size());
        return files.size();
    }

    public synchronized CachedFile get(String path) {
        return files.get(path);
    }

    public synchronized boolean remove(String path) {
        return files.remove(path) != null;
    }

    public synchronized void clear() {
        files.clear();
    }

    public synchronized int size() {
        return files.size();
    }

    public synchronized List<CachedFile> entries() {
        return new ArrayList<>(files.values());
    }

    @Override
    public String contextFor(String query) {
        List<CachedFile> snapshot = entries();
        if (snapshot.isEmpty()) {
            log.info("No files cached, proceed without file context");
            return NO_CONTEXT;
        }
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        StringBuilder context = new StringBuilder();
        int included = 0;
        for (CachedFile f : snapshot) {
            String name = f.fileName();
            if (!name.isEmpty() && q.contains(name)) {
                appendBlock(context, f);
                included++;
            }
        }
        if (included == 0) {
            appendBlock(context, snapshot.get(snapshot.size() - 1));
            included = 1;
            log.info("No file mentioned, include last updated file: {}", snapshot.get(snapshot.size() - 1).getPath());
        }
        log.info("Context selection complete: included {} file(s)", included);
        return context.toString();
    }

    private static void appendBlock(StringBuilder sb, CachedFile f) {
        sb.append("\n\n--- START FILE: ").append(f.getPath()).append(" ---\n")
                .append(f.getContent())
                .append("\n--- END FILE: ").append(f.getPath()).append(" ---\n");
    }
}
