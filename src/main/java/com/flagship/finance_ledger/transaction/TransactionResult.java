package com.flagship.finance_ledger.transaction;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.NoSuchElementException;

/**
 * Outcome of a transaction operation: either data or a typed error, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionResult<T> {
    T data;
    TransactionErrorCode error;
    String message;

    public static <T> TransactionResult<T> success(T data) {
        return new TransactionResult<>(data, null, null);
    }

    public static <T> TransactionResult<T> failure(TransactionErrorCode error, String message) {
        return new TransactionResult<>(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws NoSuchElementException if this result is a failure
     */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new NoSuchElementException("Transaction operation failed: " + error + " (" + message + ")");
        }
        return data;
    }
}
