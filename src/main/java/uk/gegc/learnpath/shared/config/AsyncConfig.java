package uk.gegc.learnpath.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for asynchronous work:
 * - analytics fan-out queries
 * - event listeners such as certificate auto-issuance
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${learnpath.analytics.core-pool-size:4}")
    private int analyticsCorePoolSize;

    @Value("${learnpath.analytics.max-pool-size:8}")
    private int analyticsMaxPoolSize;

    @Value("${learnpath.analytics.queue-capacity:50}")
    private int analyticsQueueCapacity;

    @Value("${async.general.core-pool-size:2}")
    private int generalCorePoolSize;

    @Value("${async.general.max-pool-size:4}")
    private int generalMaxPoolSize;

    @Value("${async.general.queue-capacity:25}")
    private int generalQueueCapacity;

    /**
     * Bounded pool for analytics sub-queries. Callers run the task when the queue is full.
     */
    @Bean(name = "analyticsTaskExecutor")
    public Executor analyticsTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analyticsCorePoolSize);
        executor.setMaxPoolSize(analyticsMaxPoolSize);
        executor.setQueueCapacity(analyticsQueueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("analytics-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Analytics Task Executor configured - Core: {}, Max: {}, Queue: {}",
                analyticsCorePoolSize, analyticsMaxPoolSize, analyticsQueueCapacity);
        return executor;
    }

    @Bean(name = "generalTaskExecutor")
    public Executor generalTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generalCorePoolSize);
        executor.setMaxPoolSize(generalMaxPoolSize);
        executor.setQueueCapacity(generalQueueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("general-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("General Task Executor configured - Core: {}, Max: {}, Queue: {}",
                generalCorePoolSize, generalMaxPoolSize, generalQueueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generalTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        java.util.Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
