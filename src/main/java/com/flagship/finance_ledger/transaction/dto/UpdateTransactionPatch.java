package com.flagship.finance_ledger.transaction.dto;

import com.flagship.finance_ledger.transaction.TransactionSource;
import com.flagship.finance_ledger.transaction.TransactionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a transaction. A null field keeps the current value.
 *
 * Switching {@code transactionSource} clears the other holder id automatically.
 * A non-null {@code tags} list replaces the tag set; an empty list removes all tags.
 */
@Value
@Builder
public class UpdateTransactionPatch {
    String value;
    Instant date;
    TransactionType transactionType;
    TransactionSource transactionSource;
    Long accountId;
    Long creditCardId;
    Long categoryId;
    Long subcategoryId;
    Boolean installment;

    @Positive(message = "Total months must be positive")
    Integer totalMonths;

    Boolean recurring;

    @Min(value = 1, message = "Payment day must be between 1 and 31")
    @Max(value = 31, message = "Payment day must be between 1 and 31")
    Integer paymentDay;

    Boolean active;

    @Size(max = 2000, message = "Observation must be at most 2000 characters")
    String observation;

    List<Long> tags;
}
