package org.javai.retry.bailout;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides, from the value an attempt produced, whether further attempts are pointless.
 *
 * <p>Evaluators must be free of side effects: they must not invoke the operation or touch
 * engine state. The engine evaluates them after every attempt that produced a value,
 * the last one included. Attempts that failed never reach the evaluator.
 *
 * @param <T> The type of value inspected
 */
@FunctionalInterface
public interface BailoutEvaluator<T> {

    /**
     * @param value the value produced by the latest attempt (may be null)
     * @return true to stop retrying
     */
    boolean shouldBailOut(T value);

    default BailoutEvaluator<T> or(BailoutEvaluator<? super T> other) {
        Objects.requireNonNull(other, "other must not be null");
        return value -> shouldBailOut(value) || other.shouldBailOut(value);
    }

    default BailoutEvaluator<T> and(BailoutEvaluator<? super T> other) {
        Objects.requireNonNull(other, "other must not be null");
        return value -> shouldBailOut(value) && other.shouldBailOut(value);
    }

    default BailoutEvaluator<T> negate() {
        return value -> !shouldBailOut(value);
    }

    /**
     * Never bails out; only exhaustion or cancellation ends the execution.
     */
    static <T> BailoutEvaluator<T> never() {
        return value -> false;
    }

    /**
     * Bails out after the first attempt that produces a value.
     */
    static <T> BailoutEvaluator<T> always() {
        return value -> true;
    }

    static <T> BailoutEvaluator<T> when(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return predicate::test;
    }

    /**
     * Bails out once an attempt returns a value equal to {@code expected}.
     */
    static <T> BailoutEvaluator<T> equalTo(T expected) {
        return value -> Objects.equals(value, expected);
    }
}
