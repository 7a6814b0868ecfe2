package org.pragmatica.hcl;

import org.pragmatica.hcl.error.HclError;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a parse or format call - either a value or an {@link HclError}.
 *
 * <p>Errors travel as values; nothing in the library signals a failed parse by throwing.
 */
public sealed interface HclResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The success value.
     *
     * @throws IllegalStateException if this is a failure; the exception message is the rendered error
     */
    T unwrap();

    /**
     * The failure value.
     *
     * @throws IllegalStateException if this is a success
     */
    HclError error();

    <U> HclResult<U> map(Function<? super T, ? extends U> mapper);

    <U> HclResult<U> flatMap(Function<? super T, HclResult<U>> mapper);

    <U> U fold(Function<? super HclError, ? extends U> onFailure, Function<? super T, ? extends U> onSuccess);

    default HclResult<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default HclResult<T> onFailure(Consumer<? super HclError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    static <T> HclResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> HclResult<T> failure(HclError error) {
        return new Failure<>(error);
    }

    record Success<T>(T value) implements HclResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public HclError error() {
            throw new IllegalStateException("Result is a success: " + value);
        }

        @Override
        public <U> HclResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> HclResult<U> flatMap(Function<? super T, HclResult<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <U> U fold(Function<? super HclError, ? extends U> onFailure, Function<? super T, ? extends U> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(HclError error) implements HclResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException(error.message());
        }

        @Override
        public <U> HclResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <U> HclResult<U> flatMap(Function<? super T, HclResult<U>> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <U> U fold(Function<? super HclError, ? extends U> onFailure, Function<? super T, ? extends U> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
