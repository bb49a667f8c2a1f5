package com.company.eventrelay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration class for asynchronous task execution.
 * Configures the pools used for background tasks, per-subscriber webhook
 * delivery and the poll ticks of real-time streams.
 */
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${async.task.core-pool-size:4}")
    private int taskCorePoolSize;

    @Value("${async.task.max-pool-size:8}")
    private int taskMaxPoolSize;

    @Value("${async.task.queue-capacity:100}")
    private int taskQueueCapacity;

    @Value("${async.webhook.core-pool-size:10}")
    private int webhookCorePoolSize;

    @Value("${async.webhook.max-pool-size:20}")
    private int webhookMaxPoolSize;

    @Value("${async.webhook.queue-capacity:50}")
    private int webhookQueueCapacity;

    @Value("${async.stream.pool-size:4}")
    private int streamPoolSize;

    @Value("${async.stream-writer.core-pool-size:4}")
    private int streamWriterCorePoolSize;

    @Value("${async.stream-writer.max-pool-size:${sse.max-connections:1000}}")
    private int streamWriterMaxPoolSize;

    @Value("${async.shutdown.await-termination-seconds:30}")
    private int awaitTerminationSeconds;

    /**
     * Executor for background tasks such as event delivery jobs.
     * Saturation is reported to the submitter as a rejection.
     */
    @Override
    @Bean(name = "taskExecutor")
    public Executor getAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(taskCorePoolSize);
        executor.setMaxPoolSize(taskMaxPoolSize);
        executor.setQueueCapacity(taskQueueCapacity);
        executor.setThreadNamePrefix("background-task-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();
        return executor;
    }

    /**
     * Executor for per-subscriber webhook calls.
     * Tuned for I/O-bound work; a saturated pool runs the delivery in the caller's thread
     * instead of dropping it.
     */
    @Bean(name = "webhookExecutor")
    public Executor webhookExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(webhookCorePoolSize);
        executor.setMaxPoolSize(webhookMaxPoolSize);
        executor.setQueueCapacity(webhookQueueCapacity);
        executor.setThreadNamePrefix("webhook-task-");
        executor.setRejectedExecutionHandler(new WebhookRejectionHandler());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler driving the periodic poll of every open real-time stream.
     */
    @Bean(name = "streamScheduler")
    public ThreadPoolTaskScheduler streamScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(streamPoolSize);
        scheduler.setThreadNamePrefix("event-stream-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor writing queued stream events to clients.
     * Without a queue every busy connection gets its own thread, up to the connection cap,
     * so a client blocked in a write never holds up the others.
     */
    @Bean(name = "streamWriterExecutor")
    public Executor streamWriterExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(streamWriterCorePoolSize);
        executor.setMaxPoolSize(Math.max(streamWriterCorePoolSize, streamWriterMaxPoolSize));
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("event-stream-writer-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new CustomAsyncExceptionHandler();
    }

    /**
     * Logs exceptions escaping {@code @Async} methods.
     */
    private static class CustomAsyncExceptionHandler implements AsyncUncaughtExceptionHandler {

        @Override
        public void handleUncaughtException(Throwable ex, Method method, Object... params) {
            logger.error("Async method execution exception: Method [{}] threw exception [{}] with message [{}]",
                    method.getName(), ex.getClass().getName(), ex.getMessage());
            logger.error("Exception stacktrace:", ex);
        }
    }

    /**
     * Runs a rejected webhook task in the caller's thread, also while the pool is
     * shutting down, so every fan-out future completes.
     */
    static class WebhookRejectionHandler implements RejectedExecutionHandler {

        private final Logger rejectionLogger = LoggerFactory.getLogger("webhook.rejection");

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            rejectionLogger.warn("Webhook task rejected, running in caller thread. Queue size: {}, active threads: {}",
                    executor.getQueue().size(), executor.getActiveCount());
            r.run();
        }
    }
}
