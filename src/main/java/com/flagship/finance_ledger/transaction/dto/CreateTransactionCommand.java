package com.flagship.finance_ledger.transaction.dto;

import com.flagship.finance_ledger.transaction.TransactionSource;
import com.flagship.finance_ledger.transaction.TransactionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Input for creating a transaction.
 *
 * The holder id matching {@code transactionSource} is required; the other one is ignored.
 * A null tag list means "no tags"; duplicate ids collapse to one association.
 */
@Value
@Builder
public class CreateTransactionCommand {

    @NotBlank(message = "Value is required")
    String value;

    @NotNull(message = "Date is required")
    Instant date;

    @NotNull(message = "Transaction type is required")
    TransactionType transactionType;

    @NotNull(message = "Transaction source is required")
    TransactionSource transactionSource;

    Long accountId;
    Long creditCardId;
    Long categoryId;
    Long subcategoryId;

    boolean installment;

    @Positive(message = "Total months must be positive")
    Integer totalMonths;

    boolean recurring;

    @Min(value = 1, message = "Payment day must be between 1 and 31")
    @Max(value = 31, message = "Payment day must be between 1 and 31")
    Integer paymentDay;

    Boolean active;

    @Size(max = 2000, message = "Observation must be at most 2000 characters")
    String observation;

    List<Long> tags;
}
