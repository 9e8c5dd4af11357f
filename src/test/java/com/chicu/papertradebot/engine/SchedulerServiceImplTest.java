package com.chicu.papertradebot.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerServiceImplTest {

    private final SchedulerServiceImpl scheduler = new SchedulerServiceImpl(2);

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void failingTask_shouldKeepTicking() throws Exception {
        CountDownLatch threeRuns = new CountDownLatch(3);
        AtomicInteger runs = new AtomicInteger();

        scheduler.scheduleAtFixedRate("boom", () -> {
            runs.incrementAndGet();
            threeRuns.countDown();
            throw new IllegalStateException("tick failed");
        }, 20);

        assertTrue(threeRuns.await(5, TimeUnit.SECONDS), "после исключения таймер должен продолжать");
        assertTrue(scheduler.isActive("boom"));
        assertTrue(scheduler.getStartedAt("boom").isPresent());
    }

    @Test
    void cancel_shouldBeIdempotent() {
        scheduler.scheduleAtFixedRate("k", () -> { }, 1000);

        scheduler.cancel("k");
        scheduler.cancel("k");
        scheduler.cancel(null);

        assertFalse(scheduler.isActive("k"));
        assertTrue(scheduler.getStartedAt("k").isEmpty());
    }

    @Test
    void sameKey_shouldReplacePreviousTask() {
        scheduler.scheduleAtFixedRate("k", () -> { }, 1000);
        scheduler.scheduleAtFixedRate("k", () -> { }, 1000);

        assertTrue(scheduler.isActive("k"));
        scheduler.cancel("k");
        assertFalse(scheduler.isActive("k"));
    }

    @Test
    void badArguments_shouldFail() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAtFixedRate("k", () -> { }, 0));
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAtFixedRate(" ", () -> { }, 10));
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleAtFixedRate("k", null, 10));
    }
}
