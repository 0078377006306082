package com.signaltrader.config;

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
import org.springframework.scheduling.concurrent.ThreadPoolExecutorFactoryBean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools used by the pipeline.
 *
 * <ul>
 *   <li>eventExecutor: async event listeners (notifications)</li>
 *   <li>signalExecutor: concurrent signal source calls, one task per source per cycle. Sized
 *       so every enabled source of every symbol can run at once; excess calls wait in a
 *       bounded queue and count against their own timeout</li>
 *   <li>taskScheduler: per-symbol decision cycles, position monitor and Telegram queue drain</li>
 * </ul>
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${signaltrader.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${signaltrader.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${signaltrader.async.queue-capacity:500}")
    private int queueCapacity;

    @Value("${signaltrader.async.signal-pool-size:8}")
    private int signalPoolSize;

    @Value("${signaltrader.async.signal-queue-capacity:100}")
    private int signalQueueCapacity;

    @Value("${signaltrader.async.scheduler-pool-size:4}")
    private int schedulerPoolSize;

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

    @Bean("signalExecutor")
    public ThreadPoolExecutorFactoryBean signalExecutor(TradingProperties tradingProperties) {
        int poolSize = Math.max(signalPoolSize, concurrentSourceCalls(tradingProperties));
        ThreadPoolExecutorFactoryBean executor = new ThreadPoolExecutorFactoryBean();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(signalQueueCapacity);
        executor.setThreadNamePrefix("signal-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        log.info("Signal executor: {} workers, queue capacity {}", poolSize, signalQueueCapacity);
        return executor;
    }

    /** Source calls in flight when every symbol's cycle collects at the same moment. */
    static int concurrentSourceCalls(TradingProperties tradingProperties) {
        long enabledSources = tradingProperties.getSources().stream()
                .filter(TradingProperties.Source::isEnabled)
                .count();
        return Math.max(1, tradingProperties.getSymbols().size()) * (int) Math.max(1, enabledSources);
    }

    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("cycle-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
