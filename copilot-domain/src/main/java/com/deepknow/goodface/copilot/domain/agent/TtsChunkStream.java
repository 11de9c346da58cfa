package com.deepknow.goodface.copilot.domain.agent;

import java.util.Iterator;

/**
 * 一次合成请求的音频分片序列：惰性、有限、不可重复遍历。
 * 调用方提前结束消费时必须 {@link #close()}。
 */
public interface TtsChunkStream extends Iterator<byte[]>, AutoCloseable {

    /**
     * 已交付的分片数。
     */
    int chunkCount();

    @Override
    void close();
}
