package com.keystone.core.recovery;

import java.time.Duration;

/**
 * Delay schedule applied before each retry. {@code retry} is 0 for the first retry.
 */
public sealed interface BackoffStrategy permits BackoffStrategy.Fixed, BackoffStrategy.Exponential,
        BackoffStrategy.Linear {

    Duration delay(int retry);

    /** Upper bound of every delay this strategy produces. */
    Duration max();

    record Fixed(Duration delay) implements BackoffStrategy {

        public Fixed {
            requireNonNegative(delay, "delay");
        }

        @Override
        public Duration delay(int retry) {
            return delay;
        }

        @Override
        public Duration max() {
            return delay;
        }
    }

    /**
     * {@code initial * factor^retry}, capped at {@code max}.
     */
    record Exponential(Duration initial, double factor, Duration max) implements BackoffStrategy {

        public Exponential {
            requireNonNegative(initial, "initial");
            requireNonNegative(max, "max");
            if (factor < 1.0) {
                throw new IllegalArgumentException("factor must be >= 1.0 (current: " + factor + ")");
            }
        }

        @Override
        public Duration delay(int retry) {
            double millis = initial.toMillis() * Math.pow(factor, Math.max(0, retry));
            return Duration.ofMillis((long) Math.min(millis, max.toMillis()));
        }
    }

    /**
     * {@code initial + increment * retry}, capped at {@code max}.
     */
    record Linear(Duration initial, Duration increment, Duration max) implements BackoffStrategy {

        public Linear {
            requireNonNegative(initial, "initial");
            requireNonNegative(increment, "increment");
            requireNonNegative(max, "max");
        }

        @Override
        public Duration delay(int retry) {
            double millis = initial.toMillis() + (double) increment.toMillis() * Math.max(0, retry);
            return Duration.ofMillis((long) Math.min(millis, max.toMillis()));
        }
    }

    private static void requireNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a non-negative duration (current: " + value + ")");
        }
    }
}
