package org.javai.retry;

/**
 * The unit of work a policy retries. May throw any checked or unchecked exception;
 * the engine records it as a failed attempt.
 *
 * @param <T> The type of value produced by a successful invocation
 */
@FunctionalInterface
public interface Operation<T> {

    T call() throws Exception;
}
