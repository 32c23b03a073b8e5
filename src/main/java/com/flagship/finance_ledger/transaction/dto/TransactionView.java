package com.flagship.finance_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_ledger.transaction.Transaction;
import com.flagship.finance_ledger.transaction.TransactionSource;
import com.flagship.finance_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Persisted transaction as returned to callers.
 * Monetary value is a two-fraction-digit decimal string; dates are ISO-8601 strings.
 */
@Value
@Builder
public class TransactionView {

    @JsonProperty("id")
    Long id;

    @JsonProperty("value")
    String value;

    @JsonProperty("date")
    String date;

    @JsonProperty("transaction_type")
    TransactionType transactionType;

    @JsonProperty("transaction_source")
    TransactionSource transactionSource;

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("credit_card_id")
    Long creditCardId;

    @JsonProperty("category_id")
    Long categoryId;

    @JsonProperty("subcategory_id")
    Long subcategoryId;

    @JsonProperty("is_installment")
    boolean installment;

    @JsonProperty("total_months")
    Integer totalMonths;

    @JsonProperty("is_recurring")
    boolean recurring;

    @JsonProperty("payment_day")
    Integer paymentDay;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("observation")
    String observation;

    @JsonProperty("tags")
    List<Long> tags;

    @JsonProperty("created_at")
    String createdAt;

    @JsonProperty("updated_at")
    String updatedAt;

    public static TransactionView from(Transaction transaction, List<Long> tagIds) {
        return TransactionView.builder()
            .id(transaction.getId())
            .value(transaction.getValue())
            .date(isoString(transaction.getDate()))
            .transactionType(transaction.getTransactionType())
            .transactionSource(transaction.getTransactionSource())
            .accountId(transaction.getAccountId())
            .creditCardId(transaction.getCreditCardId())
            .categoryId(transaction.getCategoryId())
            .subcategoryId(transaction.getSubcategoryId())
            .installment(transaction.isInstallment())
            .totalMonths(transaction.getTotalMonths())
            .recurring(transaction.isRecurring())
            .paymentDay(transaction.getPaymentDay())
            .active(transaction.isActive())
            .observation(transaction.getObservation())
            .tags(List.copyOf(tagIds))
            .createdAt(isoString(transaction.getCreatedAt()))
            .updatedAt(isoString(transaction.getUpdatedAt()))
            .build();
    }

    private static String isoString(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
