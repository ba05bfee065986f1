package org.javai.retry.engine;

import org.javai.retry.AttemptFailure;
import org.javai.retry.AttemptResult;
import org.javai.retry.Operation;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one attempt and turns whatever happens into an {@link AttemptResult}.
 *
 * <p>Without a timeout the operation runs on the calling thread, which is interrupted if the token
 * is cancelled mid-attempt. With a timeout it runs on the timeout executor; on expiry or
 * cancellation the future is cancelled with interruption. Either way only operations that respond
 * to interrupts are aborted. An executor that rejects the attempt yields an invocation failure.
 * {@link Error}s are never captured.
 */
final class AttemptInvoker {

    private final ExecutorService suppliedExecutor;
    private ExecutorService ownedExecutor;

    AttemptInvoker(ExecutorService suppliedExecutor) {
        this.suppliedExecutor = suppliedExecutor;
    }

    <T> AttemptResult<T> invoke(Operation<T> operation, Duration timeout, CancellationToken token) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (timeout == null) {
            return invokeInline(operation, token);
        }
        return invokeBounded(operation, timeout, token);
    }

    private <T> AttemptResult<T> invokeInline(Operation<T> operation, CancellationToken token) {
        Thread caller = Thread.currentThread();
        AtomicBoolean interruptedByToken = new AtomicBoolean(false);
        AttemptResult<T> result;
        try (CancellationToken.Registration ignored = token.onCancel(() -> {
            interruptedByToken.set(true);
            caller.interrupt();
        })) {
            result = AttemptResult.value(operation.call());
        } catch (InterruptedException e) {
            if (!interruptedByToken.get()) {
                // the wait that follows sees the restored flag and ends the execution
                Thread.currentThread().interrupt();
            }
            result = AttemptResult.failed(AttemptFailure.invocation(e));
        } catch (Exception e) {
            result = AttemptResult.failed(AttemptFailure.invocation(e));
        }

        // the registration is closed, so no further interrupt can arrive from the token
        if (interruptedByToken.get()) {
            Thread.interrupted();
            return AttemptResult.failed(AttemptFailure.cancelled());
        }
        return result;
    }

    private <T> AttemptResult<T> invokeBounded(Operation<T> operation, Duration timeout, CancellationToken token) {
        Callable<T> task = operation::call;
        Future<T> future;
        try {
            future = executor().submit(task);
        } catch (RejectedExecutionException e) {
            return AttemptResult.failed(AttemptFailure.invocation(e));
        }
        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            return AttemptResult.value(future.get(Nanos.of(timeout), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return AttemptResult.failed(AttemptFailure.timeout(timeout));
        } catch (CancellationException e) {
            return AttemptResult.failed(AttemptFailure.cancelled());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            return AttemptResult.failed(AttemptFailure.invocation(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AttemptResult.failed(AttemptFailure.cancelled());
        }
    }

    private synchronized ExecutorService executor() {
        if (suppliedExecutor != null) {
            return suppliedExecutor;
        }
        if (ownedExecutor == null) {
            ownedExecutor = Executors.newCachedThreadPool(daemonThreads("retry-attempt"));
        }
        return ownedExecutor;
    }

    synchronized void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
            ownedExecutor = null;
        }
    }

    private static ThreadFactory daemonThreads(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
    }
}
