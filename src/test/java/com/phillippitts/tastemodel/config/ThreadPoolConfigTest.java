package com.phillippitts.tastemodel.config;

import com.phillippitts.tastemodel.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void trainingExecutorUsesDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.trainingExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
            assertThat(executor.getMaxPoolSize()).isEqualTo(2);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("training-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void probeExecutorUsesDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.probeExecutor();
        try {
            assertThat(executor.getMaxPoolSize()).isEqualTo(2);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("probe-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void propagatesThreadContextToWorker() throws InterruptedException {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.trainingExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        try {
            ThreadContext.put("runId", "run-7");
            executor.execute(() -> {
                seen.set(ThreadContext.get("runId"));
                latch.countDown();
            });

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("run-7");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void rejectsWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setTraining(new ThreadPoolProperties.PoolProperties(1, 1, 1, "t-"));
        ThreadPoolConfig config = new ThreadPoolConfig(properties);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.trainingExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            Executor ex = executor;
            ex.execute(blocker);
            ex.execute(blocker);

            assertThatThrownBy(() -> ex.execute(blocker))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }
}
