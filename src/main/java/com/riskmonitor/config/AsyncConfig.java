package com.riskmonitor.config;

import java.util.concurrent.RejectedExecutionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool that delivers alerts to handlers, one task per handler invocation.
 *
 * <p>Handlers are short (a log line, a STOMP push, one HTTP call). When the queue is full the
 * submitting monitor thread delivers the alert itself, so a slow channel delays the next
 * refresh instead of losing the alert.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Bean("alertExecutor")
    public ThreadPoolTaskExecutor alertExecutor(
            @Value("${riskmonitor.async.core-pool-size:2}") int corePoolSize,
            @Value("${riskmonitor.async.max-pool-size:8}") int maxPoolSize,
            @Value("${riskmonitor.async.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler(deliverOnCaller());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    /** Public for testability. */
    public static RejectedExecutionHandler deliverOnCaller() {
        return (task, pool) -> {
            if (pool.isShutdown()) {
                log.warn("Alert dispatch pool is shut down, alert delivery dropped");
                return;
            }
            log.warn("Alert dispatch queue full ({} pending), delivering on {}",
                    pool.getQueue().size(), Thread.currentThread().getName());
            task.run();
        };
    }
}
