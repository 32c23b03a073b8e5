package com.flagship.finance_ledger.transaction;

/**
 * Error kinds a transaction operation can report to its caller.
 */
public enum TransactionErrorCode {
    INVALID_REQUEST,
    INVALID_MONETARY_VALUE,
    ACCOUNT_NOT_FOUND,
    CREDIT_CARD_NOT_FOUND,
    CATEGORY_OR_SUBCATEGORY_REQUIRED,
    CATEGORY_NOT_FOUND_OR_INACTIVE,
    SUBCATEGORY_NOT_FOUND_OR_INACTIVE,
    TAG_NOT_FOUND,
    TRANSACTION_NOT_FOUND,
    INTERNAL_ERROR
}
