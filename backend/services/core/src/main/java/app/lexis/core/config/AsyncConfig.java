package app.lexis.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Background execution for remote pushes.
 * <p>
 * Pushes are best-effort: a full queue runs the push on the caller thread
 * instead of dropping it, and uncaught failures are only logged.
 */
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    public static final String SYNC_PUSH_EXECUTOR = "syncPushExecutor";

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${app.sync.push.core-pool-size:1}")
    private int corePoolSize;

    @Value("${app.sync.push.max-pool-size:2}")
    private int maxPoolSize;

    @Value("${app.sync.push.queue-capacity:200}")
    private int queueCapacity;

    @Bean(name = SYNC_PUSH_EXECUTOR)
    public Executor syncPushExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(corePoolSize, 1));
        executor.setMaxPoolSize(Math.max(maxPoolSize, Math.max(corePoolSize, 1)));
        executor.setQueueCapacity(Math.max(queueCapacity, 1));
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("sync-push-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
                log.warn("Async task {} failed: {}", method.getName(), ex.getMessage());
    }
}
