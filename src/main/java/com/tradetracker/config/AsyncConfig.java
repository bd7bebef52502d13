package com.tradetracker.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for the service.
 *
 * <ul>
 *   <li><b>marketDataExecutor</b>: one long-lived thread per subscribed instrument
 *       (the watch loop). No queue: a loop either gets a thread or is rejected.</li>
 *   <li><b>eventExecutor</b>: short async work off the tick path, such as circuit
 *       breaker evaluation after a trade closes.</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${tradetracker.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${tradetracker.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${tradetracker.async.queue-capacity:1000}")
    private int queueCapacity;

    private final MarketDataConfig marketDataConfig;

    public AsyncConfig(MarketDataConfig marketDataConfig) {
        this.marketDataConfig = marketDataConfig;
    }

    @Bean("marketDataExecutor")
    public ThreadPoolTaskExecutor marketDataExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(marketDataConfig.getExecutorCorePoolSize());
        executor.setMaxPoolSize(marketDataConfig.getExecutorMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("watch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
