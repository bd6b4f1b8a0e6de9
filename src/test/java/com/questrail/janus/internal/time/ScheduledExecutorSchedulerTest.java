package com.questrail.janus.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production timer used by request deadlines.
 *
 * Note: These tests use real time. Tolerances are generous to avoid false
 * failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void deadlineFiresAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = SystemMonotonicClock.INSTANCE.nowNanos();

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "deadline should fire");
        long elapsed = SystemMonotonicClock.INSTANCE.nowNanos() - start;
        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(45), "fired too early: " + elapsed + "ns");
    }

    @Test
    void pastDeadlineFiresImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "overdue deadline should fire at once");
    }

    @Test
    void cancelledDeadlineNeverFires() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);

        Cancellable timer = scheduler.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE,
                () -> fired.set(true));

        assertTrue(timer.cancel(), "first cancel should disarm the timer");
        assertFalse(timer.cancel(), "second cancel has nothing left to disarm");

        Thread.sleep(200);
        assertFalse(fired.get(), "cancelled timer must not fire");
    }

    @Test
    void cancelAfterFiringReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable timer = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        Thread.sleep(20);
        assertFalse(timer.cancel(), "cancel after firing should return false");
    }

    @Test
    void deadlinesFireInDeadlineOrder() throws InterruptedException {
        AtomicInteger counter = new AtomicInteger(0);
        CountDownLatch latch = new CountDownLatch(3);
        int[] order = new int[3];

        long now = SystemMonotonicClock.INSTANCE.nowNanos();

        // Armed in reverse order
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(60), () -> {
            order[2] = counter.incrementAndGet();
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> {
            order[1] = counter.incrementAndGet();
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> {
            order[0] = counter.incrementAndGet();
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertArrayEquals(new int[] {1, 2, 3}, order);
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
