package com.hcltech.dawg.common.errorsor;

import com.hcltech.dawg.common.function.ThrowingFunction;
import com.hcltech.dawg.common.function.ThrowingSupplier;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Used wherever a failure is expected and recoverable by the caller (a rejected word, a missing
 * word file, JSON that will not parse). Programming errors are still thrown.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    /** "{prefix}: {ExceptionClass}: {message}". */
    static <T> ErrorsOr<T> error(String prefix, Exception e) {
        return new Error<>(List.of(prefix + ": " + e.getClass().getSimpleName() + ": " + e.getMessage()));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    /** Wrap a throwing supplier -> ErrorsOr. */
    static <T> ErrorsOr<T> trying(String prefix, ThrowingSupplier<T> body) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(prefix, e);
        }
    }

    /** Map + try: apply f to value (which may throw). */
    default <U> ErrorsOr<U> mapTry(String prefix, ThrowingFunction<? super T, ? extends U> f) {
        if (isError()) return ErrorsOr.errors(getErrors());
        try {
            return ErrorsOr.lift(f.apply(getValue().get()));
        } catch (Exception e) {
            return ErrorsOr.error(prefix, e);
        }
    }
}
