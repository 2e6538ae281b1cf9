package com.example.ledger_manager.dto.response;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a registry or engine call: either a value or a {@link LedgerError}
 * with a human readable message.
 */
public record OperationResult<T>(T value, LedgerError error, String message) {

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(LedgerError error, String message) {
        return new OperationResult<>(null, Objects.requireNonNull(error), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return failure(error, message);
        }
        return success(mapper.apply(value));
    }
}
