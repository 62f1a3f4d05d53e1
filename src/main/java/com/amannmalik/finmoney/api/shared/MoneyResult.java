package com.amannmalik.finmoney.api.shared;

import com.amannmalik.finmoney.util.Ensure;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a fallible money operation: either a value or a {@link MoneyError}.
 *
 * @param <T> type of the successful value
 */
public sealed interface MoneyResult<T> permits MoneyResult.Ok, MoneyResult.Err {
    static <T> MoneyResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> MoneyResult<T> err(MoneyError error) {
        return new Err<>(error);
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /// Present only for {@link Ok}.
    Optional<T> value();

    /// Present only for {@link Err}.
    Optional<MoneyError> error();

    <U> MoneyResult<U> map(Function<? super T, ? extends U> mapper);

    <U> MoneyResult<U> flatMap(Function<? super T, MoneyResult<U>> mapper);

    T orElse(T fallback);

    /**
     * Unwraps the value, converting an error into a {@link MoneyErrorException}.
     */
    T orElseThrow();

    record Ok<T>(T get) implements MoneyResult<T> {
        public Ok {
            get = Ensure.notNull("result.value", get);
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<T> value() {
            return Optional.of(get);
        }

        @Override
        public Optional<MoneyError> error() {
            return Optional.empty();
        }

        @Override
        public <U> MoneyResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Ok<>(mapper.apply(get));
        }

        @Override
        public <U> MoneyResult<U> flatMap(Function<? super T, MoneyResult<U>> mapper) {
            return Ensure.notNull("result.flatMap", mapper.apply(get));
        }

        @Override
        public T orElse(T fallback) {
            return get;
        }

        @Override
        public T orElseThrow() {
            return get;
        }
    }

    record Err<T>(MoneyError get) implements MoneyResult<T> {
        public Err {
            get = Ensure.notNull("result.error", get);
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        @Override
        public Optional<MoneyError> error() {
            return Optional.of(get);
        }

        @Override
        public <U> MoneyResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(get);
        }

        @Override
        public <U> MoneyResult<U> flatMap(Function<? super T, MoneyResult<U>> mapper) {
            return new Err<>(get);
        }

        @Override
        public T orElse(T fallback) {
            return fallback;
        }

        @Override
        public T orElseThrow() {
            throw new MoneyErrorException(get);
        }
    }
}
