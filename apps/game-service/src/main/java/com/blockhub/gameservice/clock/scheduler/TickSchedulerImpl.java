package com.blockhub.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * TickSchedulerImpl
 * ---------------------------------------
 * 通用 tick 调度引擎的默认实现。
 *
 * 职责：
 *  - 使用共享的 ScheduledThreadPoolExecutor 为每个 key 挂一个固定周期任务；
 *  - 记录 key → 任务句柄，支持单独取消；
 *  - 任务抛出的异常在这里记录，避免 ScheduledExecutor 静默地终止后续调度。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（下落、消行、广播）。
 */
public class TickSchedulerImpl implements TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(TickSchedulerImpl.class);

    // 调度器：所有对局共享
    private final ScheduledThreadPoolExecutor scheduler;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    /**
     * 构造函数：注入调度线程池。
     * @param scheduler 周期执行 tick 的线程池
     */
    public TickSchedulerImpl(ScheduledThreadPoolExecutor scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start(String key, long periodMillis, Runnable task) {
        // 防止重复任务：先取消老任务
        stop(key);
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(
                () -> safeRun(key, task),
                periodMillis,
                periodMillis,
                TimeUnit.MILLISECONDS);
        activeTasks.put(key, fut);
        log.debug("tick started: key={}, periodMs={}", key, periodMillis);
    }

    @Override
    public void stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        // 取消调度，但不打断正在运行的一次
        if (f != null) {
            f.cancel(false);
            log.debug("tick stopped: key={}", key);
        }
    }

    @Override
    public boolean isActive(String key) {
        return activeTasks.containsKey(key);
    }

    @Override
    public int activeCount() {
        return activeTasks.size();
    }

    /**
     * 执行一次任务；异常只记录，不外抛（外抛会让该 key 的后续调度被永久取消）。
     */
    private void safeRun(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("tick task failed: key={}", key, e);
        }
    }
}
