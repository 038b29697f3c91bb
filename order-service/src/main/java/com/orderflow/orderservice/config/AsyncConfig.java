package com.orderflow.orderservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;

/**
 * Thread pool for applying webhook events after the endpoint has acknowledged.
 *
 * Tasks are submitted from the request thread that stored the inbox row, so a
 * full queue must never make that thread apply the event itself. Rejected
 * tasks are logged and dropped; the row stays unprocessed in webhook_inbox and
 * WebhookInboxSweeper picks it up.
 */
@Slf4j
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig implements AsyncConfigurer {

    public static final String WEBHOOK_EXECUTOR = "webhookExecutor";

    @Bean(name = WEBHOOK_EXECUTOR)
    public Executor webhookExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("webhook-");
        executor.setRejectedExecutionHandler(dropAndLog());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Webhook executor initialized - core: {}, max: {}, queue: {}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), executor.getQueueCapacity());
        return executor;
    }

    static RejectedExecutionHandler dropAndLog() {
        return (task, pool) -> log.warn("Webhook executor saturated, leaving event to the inbox sweeper - "
                + "active: {}, queued: {}", pool.getActiveCount(), pool.getQueue().size());
    }

    @Override
    public Executor getAsyncExecutor() {
        return webhookExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (throwable, method, params) -> log.error("Async task failed - method: {}, error: {}",
                method.getName(), throwable.getMessage(), throwable);
    }
}
