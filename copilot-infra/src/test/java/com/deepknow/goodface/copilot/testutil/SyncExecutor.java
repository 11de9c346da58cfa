package com.deepknow.goodface.copilot.testutil;

import java.util.concurrent.Executor;

/**
 * 在调用线程上直接执行任务，使测试结果确定。
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
