package com.deepknow.goodface.copilot.domain.agent.stt;

import com.alibaba.dashscope.audio.asr.translation.TranslationRecognizerParam;
import com.alibaba.dashscope.audio.asr.translation.TranslationRecognizerRealtime;
import com.alibaba.dashscope.audio.asr.translation.results.TranslationRecognizerResult;
import com.alibaba.dashscope.common.ResultCallback;
import com.deepknow.goodface.copilot.domain.agent.ApiKeys;
import com.deepknow.goodface.copilot.domain.agent.SttConnection;
import com.deepknow.goodface.copilot.domain.agent.SttConnector;
import com.deepknow.goodface.copilot.domain.agent.SttOptions;
import com.deepknow.goodface.copilot.domain.exception.ProviderErrorKind;
import com.deepknow.goodface.copilot.domain.exception.SttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.concurrent.Executor;

/**
 * 阿里云百炼语音 STT（官方 Java SDK 接入）。
 * 参考示例：TranslationRecognizerRealtime，发送 ByteBuffer 音频帧并以回调接收转写结果。
 */
public class AliyunSttConnector implements SttConnector {
    private static final Logger log = LoggerFactory.getLogger(AliyunSttConnector.class);
    private static final String NAME = "aliyun";

    private final String apiKey;
    private final String model;
    private final Executor io;

    public AliyunSttConnector(String apiKey, String model, Executor io) {
        this.apiKey = apiKey;
        this.model = model == null ? "gummy-realtime-v1" : model;
        this.io = io;
        log.info("Aliyun STT init: model={} apiKey={}", this.model, ApiKeys.mask(apiKey));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SttConnection create(SttOptions options, SttConnection.Listener listener) {
        var builder = TranslationRecognizerParam.builder()
                .model(model)
                .format("pcm")
                .sampleRate(options.getSampleRate() <= 0 ? 16000 : options.getSampleRate())
                .transcriptionEnabled(true)
                .sourceLanguage("auto");
        // 未配置时 SDK 读取 DASHSCOPE_API_KEY 环境变量
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.apiKey(apiKey);
        }
        return new AliyunConnection(builder.build(), listener);
    }

    private final class AliyunConnection implements SttConnection {
        private final TranslationRecognizerParam param;
        private final Listener events;
        private volatile TranslationRecognizerRealtime translator;
        private volatile boolean opened;
        private volatile boolean closed;

        AliyunConnection(TranslationRecognizerParam param, Listener events) {
            this.param = param;
            this.events = events;
        }

        @Override
        public void open() {
            // call() 会阻塞到握手完成，放到 IO 线程执行
            io.execute(() -> {
                try {
                    TranslationRecognizerRealtime t = new TranslationRecognizerRealtime();
                    translator = t;
                    t.call(param, new ResultCallback<TranslationRecognizerResult>() {
                        @Override
                        public void onEvent(TranslationRecognizerResult result) {
                            try {
                                if (result.getTranscriptionResult() != null) {
                                    String text = result.getTranscriptionResult().getText();
                                    if (text != null && !text.isEmpty()) {
                                        events.onTranscript(text, result.isSentenceEnd());
                                    }
                                }
                            } catch (Exception e) {
                                log.warn("Handle transcription result failed", e);
                            }
                        }

                        @Override
                        public void onComplete() {
                            log.info("Aliyun STT transcription complete");
                            opened = false;
                            events.onClose();
                        }

                        @Override
                        public void onError(Exception e) {
                            log.warn("Aliyun STT error: {}", e.getMessage());
                            opened = false;
                            events.onError(new SttException(NAME, ProviderErrorKind.SERVER_ERROR, -1,
                                    "Aliyun STT error: " + e.getMessage(), e));
                        }
                    });
                    if (closed) {
                        closeTranslator(t);
                        return;
                    }
                    opened = true;
                    events.onOpen();
                } catch (Exception e) {
                    log.warn("Start Aliyun STT session failed: {}", e.getMessage());
                    events.onError(new SttException(NAME, ProviderErrorKind.NETWORK, -1,
                            "Start Aliyun STT session failed: " + e.getMessage(), e));
                }
            });
        }

        @Override
        public boolean isOpen() {
            return opened && !closed && translator != null;
        }

        @Override
        public void sendAudio(byte[] chunk) {
            TranslationRecognizerRealtime t = translator;
            if (t == null) {
                throw new IllegalStateException("Aliyun STT not started");
            }
            try {
                t.sendAudioFrame(ByteBuffer.wrap(chunk));
            } catch (Exception e) {
                throw new SttException(NAME, ProviderErrorKind.NETWORK, -1,
                        "Aliyun STT send failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void finish() {
            TranslationRecognizerRealtime t = translator;
            if (t == null || !opened) {
                return;
            }
            try {
                t.stop();
                log.info("Aliyun STT stop sent");
            } catch (Exception e) {
                log.warn("Failed to stop Aliyun STT: {}", e.getMessage());
            }
        }

        @Override
        public void close() {
            closed = true;
            opened = false;
            TranslationRecognizerRealtime t = translator;
            translator = null;
            if (t != null) {
                closeTranslator(t);
            }
        }

        private void closeTranslator(TranslationRecognizerRealtime t) {
            try {
                if (t.getDuplexApi() != null) {
                    t.getDuplexApi().close(1000, "bye");
                }
            } catch (Exception e) {
                log.warn("Close Aliyun STT failed: {}", e.getMessage());
            }
        }
    }
}
