package com.flagship.finance_ledger.transaction;

import com.flagship.finance_ledger.balance.BalanceHolder;
import com.flagship.finance_ledger.monetary.MonetaryDelta;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Domain model for a ledger transaction row.
 *
 * Key invariant: exactly one of accountId / creditCardId is set, matching
 * transactionSource. The value is the unsigned magnitude as a decimal string;
 * the sign applied to the holder's balance comes from {@link #signedDelta()}.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {
    Long id;
    String value;
    Instant date;
    TransactionType transactionType;
    TransactionSource transactionSource;
    Long accountId;
    Long creditCardId;
    Long categoryId;
    Long subcategoryId;
    boolean installment;
    Integer totalMonths;
    boolean recurring;
    Integer paymentDay;
    boolean active;
    String observation;
    Instant createdAt;
    Instant updatedAt;

    /**
     * The account or credit card whose balance this transaction affects.
     *
     * @throws IllegalStateException if the holder id for the source is missing
     */
    public BalanceHolder balanceHolder() {
        Long holderId = transactionSource == TransactionSource.ACCOUNT ? accountId : creditCardId;
        if (holderId == null) {
            throw new IllegalStateException(
                "Transaction " + id + " has source " + transactionSource + " but no holder id");
        }
        return BalanceHolder.of(transactionSource.holderType(), holderId);
    }

    public String signedDelta() {
        return MonetaryDelta.signed(transactionType, transactionSource, value);
    }
}
