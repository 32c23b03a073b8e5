package com.flagship.finance_ledger.transaction;

import lombok.Getter;

/**
 * Raised when a request fails validation. Carries the error code reported to the caller.
 * Thrown inside a unit of work, it rolls the unit of work back before anything was written.
 */
@Getter
public class TransactionValidationException extends RuntimeException {

    private final TransactionErrorCode errorCode;

    public TransactionValidationException(TransactionErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
