package com.deepknow.goodface.copilot.service;

import com.deepknow.goodface.copilot.api.FileSyncService;
import com.deepknow.goodface.copilot.api.model.CachedFileInfo;
import com.deepknow.goodface.copilot.api.model.FileSyncResult;
import com.deepknow.goodface.copilot.api.request.FileUpdateRequest;
import com.deepknow.goodface.copilot.domain.context.CachedFile;
import com.deepknow.goodface.copilot.domain.context.FileContextCache;
import org.apache.dubbo.config.annotation.DubboService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@DubboService
@Service
public class FileSyncServiceImpl implements FileSyncService {
    private static final Logger log = LoggerFactory.getLogger(FileSyncServiceImpl.class);

    private final FileContextCache fileContextCache;

    public FileSyncServiceImpl(FileContextCache fileContextCache) {
        this.fileContextCache = fileContextCache;
    }

    @Override
    public FileSyncResult updateFile(FileUpdateRequest req) {
        FileSyncResult result = new FileSyncResult();
        if (req == null || req.getFilePath() == null || req.getFilePath().isBlank() || req.getContent() == null) {
            log.warn("Reject file update: filePath and content are required");
            result.setSuccess(false);
            result.setFilePath(req == null ? null : req.getFilePath());
            result.setCacheSize(fileContextCache.size());
            result.setMessage("filePath and content are required");
            return result;
        }
        long modified = req.getTimestamp() != null ? req.getTimestamp() : System.currentTimeMillis();
        int size = fileContextCache.put(req.getFilePath(), req.getContent(), modified);
        result.setSuccess(true);
        result.setFilePath(req.getFilePath());
        result.setCacheSize(size);
        result.setMessage("File cached");
        return result;
    }

    @Override
    public List<CachedFileInfo> listFiles() {
        List<CachedFileInfo> out = new ArrayList<>();
        for (CachedFile f : fileContextCache.entries()) {
            CachedFileInfo info = new CachedFileInfo();
            info.setPath(f.getPath());
            info.setSize(f.getContent().length());
            info.setLastModified(f.getLastModified());
            out.add(info);
        }
        return out;
    }
}
