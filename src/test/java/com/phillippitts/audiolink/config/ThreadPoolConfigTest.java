package com.phillippitts.audiolink.config;

import com.phillippitts.audiolink.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

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
    void shouldCreateExecutorWithDefaultConfiguration() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).modemExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("modem-pool-");
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
    }

    @Test
    void shouldCopyRequestContextToWorker() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).modemExecutor();
        ThreadContext.put("requestId", "req-42");
        CountDownLatch latch = new CountDownLatch(1);
        String[] seen = new String[2];

        executor.execute(() -> {
            seen[0] = ThreadContext.get("requestId");
            seen[1] = Thread.currentThread().getName();
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen[0]).isEqualTo("req-42");
        assertThat(seen[1]).startsWith("modem-pool-");
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() -> { });
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker-own");

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker-own");
    }

    @Test
    void shouldRejectWhenSaturated() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getModem().setCorePoolSize(1);
        properties.getModem().setMaxPoolSize(1);
        properties.getModem().setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).modemExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        executor.execute(blocker);
        executor.execute(blocker);

        assertThatThrownBy(() -> executor.execute(blocker)).isInstanceOf(TaskRejectedException.class);
        release.countDown();
    }
}
