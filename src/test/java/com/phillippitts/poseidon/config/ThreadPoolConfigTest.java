package com.phillippitts.poseidon.config;

import com.phillippitts.poseidon.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void extractionExecutorUsesConfiguredSizes() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = config.extractionExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(6);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(12);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("extract-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void workerThreadsSeeCallerContext() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).extractionExecutor();
        ThreadContext.put("conversationId", "chat-9");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> thread = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("conversationId"));
            thread.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("chat-9");
        assertThat(thread.get()).startsWith("extract-pool-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("requestId", "caller");
        Runnable decorated = ThreadPoolConfig.mdcPropagating().decorate(
                () -> assertThat(ThreadContext.get("requestId")).isEqualTo("caller"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker");

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker");
    }

    @Test
    void sessionSchedulerUsesConfiguredPool() {
        TaskScheduler scheduler = new ThreadPoolConfig(new ThreadPoolProperties())
                .sessionScheduler(Clock.systemUTC());

        assertThat(scheduler).isInstanceOf(ThreadPoolTaskScheduler.class);
        ThreadPoolTaskScheduler pool = (ThreadPoolTaskScheduler) scheduler;
        assertThat(pool.getThreadNamePrefix()).isEqualTo("session-timer-");
        pool.shutdown();
    }
}
