package org.javai.retry;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * What a single attempt produced.
 * Either {@link Value} holding the operation's return value, or {@link Failed} holding an {@link AttemptFailure}.
 *
 * @param <T> The type of the operation's value
 */
public sealed interface AttemptResult<T> permits AttemptResult.Value, AttemptResult.Failed {

    /**
     * The operation returned a value. The value itself may be null.
     *
     * @param value the returned value
     */
    record Value<T>(T value) implements AttemptResult<T> {

        @Override
        public boolean isValue() {
            return true;
        }

        @Override
        public boolean isFailed() {
            return false;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> AttemptResult<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Value<>(mapper.apply(value));
        }
    }

    /**
     * The attempt did not produce a value.
     *
     * @param failure the failure details
     */
    record Failed<T>(AttemptFailure failure) implements AttemptResult<T> {

        public Failed {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isValue() {
            return false;
        }

        @Override
        public boolean isFailed() {
            return true;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> AttemptResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failed<>(failure);
        }
    }

    boolean isValue();
    boolean isFailed();

    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    <U> AttemptResult<U> map(Function<? super T, ? extends U> mapper);

    static <T> AttemptResult<T> value(T value) {
        return new Value<>(value);
    }

    static <T> AttemptResult<T> failed(AttemptFailure failure) {
        return new Failed<>(failure);
    }
}
