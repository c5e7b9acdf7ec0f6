package com.phillippitts.retroauto.config;

import com.phillippitts.retroauto.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateSingleThreadEngineExecutor() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

        executor = config.engineExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(1);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("engine-");
    }

    @Test
    void shouldRejectWhenEngineThreadAndQueueAreBusy() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getEngine().setQueueCapacity(0);
        executor = new ThreadPoolConfig(properties).engineExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);

        executor.execute(() -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> executor.execute(() -> { }))
                .isInstanceOf(TaskRejectedException.class);
        release.countDown();
    }

    @Test
    void shouldPropagateMdcToEngineThread() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).engineExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ThreadContext.put("requestId", "req-7");
        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-7");
    }

    @Test
    void shouldCreateSupervisorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolConfig(new ThreadPoolProperties()).supervisorScheduler();
        try {
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("supervisor-");
        } finally {
            scheduler.shutdown();
        }
    }
}
