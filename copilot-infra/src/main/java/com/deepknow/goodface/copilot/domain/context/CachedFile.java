package com.deepknow.goodface.copilot.domain.context;

import java.util.Locale;

public final class CachedFile {
    private final String path;
    private final String content;
    private final long lastModified;

    public CachedFile(String path, String content, long lastModified) {
        this.path = path;
        this.content = content;
        this.lastModified = lastModified;
    }

    public String getPath() { return path; }
    public String getContent() { return content; }
    public long getLastModified() { return lastModified; }

    /**
     * 路径最后一段，小写。
     */
    public String fileName() {
        String[] parts = path.split("[\\\\/]");
        return parts[parts.length - 1].toLowerCase(Locale.ROOT);
    }
}
