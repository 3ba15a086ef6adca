package com.blockhub.gameservice.clock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 对局 tick 线程池。
 *
 * 所有对局共享一个 ScheduledThreadPoolExecutor，每局各自持有一个 ScheduledFuture：
 * - 线程数取 scheduler.tick.corePoolSize；
 * - 线程名 tick-N，守护线程；
 * - 关闭后再提交的任务直接丢弃；
 * - 取消的 future 立即出队，长时间运行不会堆积已结束对局的任务。
 */
@Slf4j
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.tick.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "gameTickExecutor", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor gameTickExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                corePoolSize, new TickThreadFactory(), new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        log.info("game tick executor ready: corePoolSize={}", corePoolSize);
        return executor;
    }

    /** tick-N 守护线程；未捕获异常只记日志 */
    static final class TickThreadFactory implements ThreadFactory {

        private final AtomicInteger seq = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "tick-" + seq.getAndIncrement());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) -> log.error("tick 线程异常退出: {}", thread.getName(), e));
            return t;
        }
    }
}
