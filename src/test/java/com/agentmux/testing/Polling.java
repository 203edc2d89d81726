package com.agentmux.testing;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Waits for conditions that are reached on background threads.
 */
public final class Polling {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private Polling() {}

    public static void await(String description, BooleanSupplier condition) {
        await(description, condition, DEFAULT_TIMEOUT);
    }

    public static void await(String description, BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out after " + timeout.toMillis() + "ms waiting for: " + description);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting for: " + description, e);
            }
        }
    }
}
