package com.phillippitts.retroauto.config;

import com.phillippitts.retroauto.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Threads owned by the engine: one executor thread running the interpreter and a scheduler
 * driving interrupt supervisor ticks.
 *
 * <p>Sizes and names come from {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-thread executor for script sessions. The interpreter is strictly sequential, so
     * core and max size are both 1; a full queue rejects ({@link ThreadPoolExecutor.AbortPolicy})
     * instead of running a script on the caller's thread.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext from the submitting thread.
     */
    @Bean(name = "engineExecutor")
    public ThreadPoolTaskExecutor engineExecutor() {
        ThreadPoolProperties.EnginePoolProperties props = threadPoolProperties.getEngine();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for interrupt supervisor ticks, separate from Spring's default scheduler
     * so a slow matcher never delays other {@code @Scheduled} work.
     */
    @Bean(name = "supervisorScheduler")
    public ThreadPoolTaskScheduler supervisorScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getSupervisor();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
