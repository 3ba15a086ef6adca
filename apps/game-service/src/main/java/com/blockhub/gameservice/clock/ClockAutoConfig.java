package com.blockhub.gameservice.clock;

import com.blockhub.gameservice.clock.scheduler.TickScheduler;
import com.blockhub.gameservice.clock.scheduler.TickSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * tick 相关 Bean 的装配：把调度线程池注入通用调度引擎。
 * 这里不关心任何业务细节，只负责把基础设施拼起来。
 */
@Configuration
public class ClockAutoConfig {

    /**
     * 注册通用 tick 调度器。
     * @param gameTickExecutor 调度线程池（守护线程）
     * @return TickScheduler 实例
     */
    @Bean
    public TickScheduler tickScheduler(@Qualifier("gameTickExecutor") ScheduledThreadPoolExecutor gameTickExecutor) {
        return new TickSchedulerImpl(gameTickExecutor);
    }
}
