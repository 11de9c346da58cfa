package com.deepknow.goodface.copilot.domain.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会话管线共用的线程资源：连接超时调度、回复链路线程池、STT SDK 阻塞调用线程。
 */
public class SessionSchedulers {
    private static final Logger log = LoggerFactory.getLogger(SessionSchedulers.class);

    private final ScheduledExecutorService scheduler;
    private final Executor pipeline;
    private final Executor io;

    public SessionSchedulers(ScheduledExecutorService scheduler, Executor pipeline, Executor io) {
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.io = io;
    }

    public static SessionSchedulers create(int pipelineThreads) {
        return new SessionSchedulers(
                Executors.newScheduledThreadPool(2, daemonFactory("copilot-scheduler")),
                Executors.newFixedThreadPool(Math.max(1, pipelineThreads), daemonFactory("copilot-pipeline")),
                Executors.newCachedThreadPool(daemonFactory("copilot-stt-io")));
    }

    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    public Executor pipeline() {
        return pipeline;
    }

    public Executor io() {
        return io;
    }

    public void shutdown() {
        scheduler.shutdownNow();
        if (pipeline instanceof ExecutorService) {
            ((ExecutorService) pipeline).shutdownNow();
        }
        if (io instanceof ExecutorService) {
            ((ExecutorService) io).shutdownNow();
        }
        log.info("Session schedulers shut down");
    }

    static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, ex) ->
                    log.error("Uncaught exception in {}", thread.getName(), ex));
            return t;
        };
    }
}
