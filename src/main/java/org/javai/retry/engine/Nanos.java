package org.javai.retry.engine;

import java.time.Duration;

final class Nanos {

    private Nanos() {}

    /**
     * Converts to nanoseconds, saturating instead of overflowing for very long durations.
     */
    static long of(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
