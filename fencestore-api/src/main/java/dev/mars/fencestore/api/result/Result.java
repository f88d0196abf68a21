package dev.mars.fencestore.api.result;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a backend operation: either a value or a typed error.
 *
 * <p>Lock and event store operations report expected conditions such as contention or version
 * conflicts through this type instead of exceptions, so that callers have to decide how to react
 * to them. The returned futures only complete exceptionally for programming errors raised inside
 * caller-supplied callbacks.</p>
 *
 * @param <T> the success value type
 * @param <E> the error type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * Success without a value, used by operations such as release and extend.
     */
    static <E> Result<Void, E> ok() {
        return new Ok<>(null);
    }

    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * Returns the success value.
     *
     * @throws IllegalStateException if this is an error
     */
    T value();

    /**
     * Returns the error.
     *
     * @throws IllegalStateException if this is a success
     */
    E error();

    default Optional<T> toOptional() {
        return isOk() ? Optional.ofNullable(value()) : Optional.empty();
    }

    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return isOk() ? ok(mapper.apply(value())) : err(error());
    }

    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return isOk() ? mapper.apply(value()) : err(error());
    }

    default <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return isOk() ? ok(value()) : err(mapper.apply(error()));
    }

    default <R> R fold(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
        return isOk() ? onOk.apply(value()) : onErr.apply(error());
    }

    default Result<T, E> ifOk(Consumer<? super T> action) {
        if (isOk()) {
            action.accept(value());
        }
        return this;
    }

    default Result<T, E> ifErr(Consumer<? super E> action) {
        if (isErr()) {
            action.accept(error());
        }
        return this;
    }

    default <X extends Throwable> T orElseThrow(Function<? super E, ? extends X> exceptionFactory) throws X {
        if (isOk()) {
            return value();
        }
        throw exceptionFactory.apply(error());
    }

    record Ok<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public E error() {
            throw new IllegalStateException("Result is Ok, no error present");
        }
    }

    record Err<T, E>(E error) implements Result<T, E> {

        public Err {
            Objects.requireNonNull(error, "error cannot be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Result is Err: " + error);
        }
    }
}
