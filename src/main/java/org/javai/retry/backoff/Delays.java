package org.javai.retry.backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay arithmetic in nanoseconds. Values saturate at {@link Long#MAX_VALUE} nanoseconds
 * (about 292 years) instead of overflowing.
 */
final class Delays {

    private Delays() {}

    static void requireValidAttempt(int attemptIndex) {
        if (attemptIndex < 1) {
            throw new IllegalArgumentException("attemptIndex must be >= 1, was: " + attemptIndex);
        }
    }

    static Duration requireNonNegative(Duration duration, String name) {
        Objects.requireNonNull(duration, name + " must not be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, was: " + duration);
        }
        return duration;
    }

    static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    static long saturatedAdd(long a, long b) {
        return a > Long.MAX_VALUE - b ? Long.MAX_VALUE : a + b;
    }

    static long saturatedMultiply(long a, long b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        return a > Long.MAX_VALUE / b ? Long.MAX_VALUE : a * b;
    }
}
