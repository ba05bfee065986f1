package org.javai.retry.engine;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A one-shot signal a caller uses to abort an execution.
 *
 * <p>Thread-safe. Once cancelled, a token stays cancelled. The engine observes it before every
 * attempt, during the wait between attempts, and while a timed attempt is in flight.
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * executor.submit(() -> engine.execute(policy, token));
 * // later, from any thread
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch signal = new CountDownLatch(1);
    private final List<Registration> callbacks = new CopyOnWriteArrayList<>();

    private CancellationToken() {}

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Cancels this token and runs every registered callback on the calling thread.
     * Has no effect if already cancelled.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.countDown();
            for (Registration registration : callbacks) {
                registration.fire();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Blocks until this token is cancelled or the timeout elapses.
     *
     * @param timeout how long to wait at most
     * @return true if the token was cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return signal.await(Nanos.of(timeout), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a callback to run when this token is cancelled. If the token is already
     * cancelled the callback runs immediately. Each callback runs at most once.
     *
     * @param callback the action to run on cancellation
     * @return a registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        Registration registration = new Registration(Objects.requireNonNull(callback, "callback must not be null"));
        callbacks.add(registration);
        if (cancelled.get()) {
            registration.fire();
        }
        return registration;
    }

    /**
     * Handle for a callback registered with {@link #onCancel(Runnable)}.
     *
     * <p>Once {@link #close()} returns the callback is not running and will never run.
     */
    public final class Registration implements AutoCloseable {

        private final Runnable callback;
        private boolean done;

        private Registration(Runnable callback) {
            this.callback = callback;
        }

        private synchronized void fire() {
            if (!done) {
                done = true;
                callback.run();
            }
        }

        @Override
        public synchronized void close() {
            done = true;
            callbacks.remove(this);
        }
    }
}
