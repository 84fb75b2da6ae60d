package com.phillippitts.selfconsistency.config;

import com.phillippitts.selfconsistency.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    private static ThreadPoolTaskExecutor executor() {
        return (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).reasoningExecutor();
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolTaskExecutor executor = executor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(16);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("reasoning-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor = executor();
        int taskCount = 15;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void shouldPropagateRequestIdToWorkerThread() throws InterruptedException {
        Executor executor = executor();
        ThreadContext.put("requestId", "req-42");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(threadName.get()).startsWith("reasoning-pool-");
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("requestId", "req-1");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("req-1"));

        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker-own");
        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker-own");
    }
}
