package org.javai.retry.engine;

import java.time.Duration;

/**
 * Waits between attempts. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
interface Sleeper {

    /**
     * @return true if the wait ended because the token was cancelled
     */
    boolean sleep(Duration duration, CancellationToken token) throws InterruptedException;

    static Sleeper cancellable() {
        return (duration, token) -> token.await(duration);
    }
}
