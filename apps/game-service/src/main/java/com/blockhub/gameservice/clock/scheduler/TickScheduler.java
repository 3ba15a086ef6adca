package com.blockhub.gameservice.clock.scheduler;

/**
 * TickScheduler
 * ---------------------------------------
 * 通用的“固定周期 tick 调度器”接口，完全独立于具体游戏规则。
 *
 * 设计目标：
 *  - 以业务 key（如对局 id）为单位启动/停止周期任务；
 *  - 不同 key 的任务相互独立，一个 key 停止不影响其他 key；
 *  - 同一 key 的任务不会并发执行（由底层 scheduleAtFixedRate 保证）。
 */
public interface TickScheduler {

    /**
     * 启动（或重启）指定 key 的周期任务；已存在的同名任务会先被取消。
     * @param key          业务键
     * @param periodMillis 周期（毫秒）
     * @param task         每个周期执行一次
     */
    void start(String key, long periodMillis, Runnable task);

    /**
     * 停止指定 key 的周期任务（不打断正在执行的那一次）。
     * @param key 业务键
     */
    void stop(String key);

    /**
     * 指定 key 当前是否有活跃任务。
     */
    boolean isActive(String key);

    /**
     * 活跃任务总数。
     */
    int activeCount();
}
