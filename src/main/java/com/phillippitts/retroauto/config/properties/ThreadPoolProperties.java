package com.phillippitts.retroauto.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the executor running scripts and the supervisor scheduler.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private EnginePoolProperties engine = new EnginePoolProperties();
    private SchedulerPoolProperties supervisor = new SchedulerPoolProperties();

    public EnginePoolProperties getEngine() {
        return engine;
    }

    public void setEngine(EnginePoolProperties engine) {
        this.engine = engine;
    }

    public SchedulerPoolProperties getSupervisor() {
        return supervisor;
    }

    public void setSupervisor(SchedulerPoolProperties supervisor) {
        this.supervisor = supervisor;
    }

    /**
     * Script executor. A single thread: the main executor is strictly sequential.
     */
    public static class EnginePoolProperties {
        private int queueCapacity = 1;
        private int awaitTerminationSeconds = 5;
        private String threadNamePrefix = "engine-";

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Scheduler driving interrupt supervisor ticks.
     */
    public static class SchedulerPoolProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "supervisor-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
