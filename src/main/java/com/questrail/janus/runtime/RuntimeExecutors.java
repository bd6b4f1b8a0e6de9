package com.questrail.janus.runtime;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown sequence shared by the composition roots.
 */
final class RuntimeExecutors
{
    static final long TERMINATION_GRACE_SECONDS = 5;

    private RuntimeExecutors() {
    }

    /**
     * Orderly shutdown, then {@code shutdownNow} after the grace period.
     */
    static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_GRACE_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
