package com.riskmonitor.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskmonitor.config.AsyncConfig;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class AsyncConfigTest {

    private ThreadPoolTaskExecutor executor;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        executor = new AsyncConfig().alertExecutor(1, 1, 1);
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdown();
    }

    @Test
    void saturatedPool_deliversOnCallingThread() throws Exception {
        CountDownLatch busy = new CountDownLatch(1);
        executor.execute(() -> {
            busy.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();
        executor.execute(() -> {});

        AtomicReference<String> deliveredOn = new AtomicReference<>();
        executor.execute(() -> deliveredOn.set(Thread.currentThread().getName()));

        assertThat(deliveredOn.get()).isEqualTo(Thread.currentThread().getName());
    }

    @Test
    void workerThreadsAreNamedForAlerts() throws Exception {
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("alert-");
    }
}
