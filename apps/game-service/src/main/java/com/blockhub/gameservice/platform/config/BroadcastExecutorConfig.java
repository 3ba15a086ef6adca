package com.blockhub.gameservice.platform.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 出站广播线程池。
 * 每条连接的出站队列同一时刻最多占用一个线程，多线程保证一个阻塞的连接不影响其他连接。
 */
@Configuration
public class BroadcastExecutorConfig {

    @Value("${blockhub.ws.broadcast-threads:4}")
    private int broadcastThreads;

    @Bean(name = "broadcastExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor broadcastExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(broadcastThreads);
        executor.setMaxPoolSize(broadcastThreads);
        executor.setThreadNamePrefix("ws-broadcast-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
