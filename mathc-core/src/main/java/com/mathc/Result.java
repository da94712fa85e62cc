package com.mathc;

import java.util.function.Function;

/**
 * Outcome of a lex or parse call that reports failure as a value.
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    record Ok<T>(T value) implements Result<T> {}

    record Err<T>(SyntaxError error) implements Result<T> {}

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(SyntaxError error) {
        return new Err<>(error);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * @throws IllegalStateException if this is an {@link Err}
     */
    default T value() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new IllegalStateException("No value: " + ((Err<T>) this).error());
    }

    /**
     * @throws IllegalStateException if this is an {@link Ok}
     */
    default SyntaxError error() {
        if (this instanceof Err<T> err) {
            return err.error();
        }
        throw new IllegalStateException("Result is Ok");
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Err<>(((Err<T>) this).error());
    }
}
