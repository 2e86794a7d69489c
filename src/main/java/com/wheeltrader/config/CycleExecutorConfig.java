package com.wheeltrader.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that runs decision cycles. A single thread with a one-slot queue: cycles are
 * strictly serialized, and the runner itself coalesces triggers so the queue never holds
 * more than one pending cycle. A rejected submission surfaces to the runner, which clears
 * its pending flag.
 */
@Configuration
public class CycleExecutorConfig {

    @Bean(name = "cycleExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor cycleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("wheel-cycle-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
