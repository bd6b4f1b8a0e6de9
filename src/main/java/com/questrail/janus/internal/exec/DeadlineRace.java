package com.questrail.janus.internal.exec;

import com.questrail.janus.internal.time.Cancellable;
import com.questrail.janus.internal.time.MonotonicClock;
import com.questrail.janus.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DeadlineRace
 * =============================================================================
 * Runs a piece of work against a deadline and reports whichever finishes first.
 *
 * <h2>Single resolution</h2>
 * The work (on the worker executor) and the timer (on the scheduler) both try
 * to complete one {@link CompletableFuture} slot. The first writer wins; the
 * loser's write is a no-op. Exactly one {@link Outcome} is ever observed.
 *
 * <h2>Losing work</h2>
 * When the deadline wins, work that has not started yet never runs, and work
 * that is running has its thread interrupted. Its eventual value or failure is
 * discarded.
 *
 * <h2>Settlement</h2>
 * {@link Race#settled()} completes when the work has returned, thrown, or is
 * known never to run. Callers holding a resource for the duration of the work
 * (a concurrency permit) release it there, not on the outcome.
 */
public final class DeadlineRace
{
    public enum Winner {
        WORK,
        DEADLINE
    }

    /**
     * @param winner  which side resolved the slot
     * @param value   the work's result when it returned normally
     * @param failure the work's exception when it threw
     */
    public record Outcome<T>(Winner winner, T value, Throwable failure) {
        public static <T> Outcome<T> value(T value) {
            return new Outcome<>(Winner.WORK, value, null);
        }

        public static <T> Outcome<T> failure(Throwable failure) {
            return new Outcome<>(Winner.WORK, null, Objects.requireNonNull(failure, "failure"));
        }

        public static <T> Outcome<T> deadline() {
            return new Outcome<>(Winner.DEADLINE, null, null);
        }

        public boolean timedOut() {
            return winner == Winner.DEADLINE;
        }

        public boolean failed() {
            return failure != null;
        }
    }

    /**
     * Handle on one race.
     *
     * @param outcome resolved exactly once with the winner
     * @param settled completed once the work can no longer be running
     */
    public record Race<T>(CompletableFuture<Outcome<T>> outcome, CompletableFuture<Void> settled) {
    }

    private final Executor workers;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    public DeadlineRace(Executor workers, MonotonicScheduler scheduler, MonotonicClock clock) {
        this.workers = Objects.requireNonNull(workers, "workers");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <T> Race<T> run(Callable<T> work, Duration deadline) {
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(deadline, "deadline");

        CompletableFuture<Outcome<T>> slot = new CompletableFuture<>();
        CompletableFuture<Void> settled = new CompletableFuture<>();
        Contender contender = new Contender();

        Cancellable timer = scheduler.scheduleAfter(deadline, clock, () -> {
            if (slot.complete(Outcome.deadline())) {
                contender.abandon(settled);
            }
        });

        Runnable body = () -> {
            if (!contender.enter()) {
                return;
            }
            try {
                T value = work.call();
                if (slot.complete(Outcome.value(value))) {
                    timer.cancel();
                }
            } catch (Throwable t) {
                if (slot.complete(Outcome.failure(t))) {
                    timer.cancel();
                }
            } finally {
                contender.exit();
                settled.complete(null);
            }
        };

        try {
            workers.execute(body);
        } catch (RejectedExecutionException e) {
            timer.cancel();
            slot.complete(Outcome.failure(e));
            settled.complete(null);
        }
        return new Race<>(slot, settled);
    }

    /**
     * Tracks whether the work started and which thread runs it, so the
     * deadline can either pre-empt it or interrupt exactly that run.
     */
    private static final class Contender
    {
        private final AtomicBoolean claimed = new AtomicBoolean(false);
        private final Object lock = new Object();
        private Thread runner;

        boolean enter() {
            if (!claimed.compareAndSet(false, true)) {
                return false;
            }
            synchronized (lock) {
                runner = Thread.currentThread();
            }
            return true;
        }

        void exit() {
            synchronized (lock) {
                runner = null;
            }
        }

        void abandon(CompletableFuture<Void> settled) {
            if (claimed.compareAndSet(false, true)) {
                settled.complete(null);
                return;
            }
            synchronized (lock) {
                if (runner != null) {
                    runner.interrupt();
                }
            }
        }
    }
}
