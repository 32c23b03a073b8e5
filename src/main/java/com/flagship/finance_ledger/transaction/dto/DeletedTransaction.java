package com.flagship.finance_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class DeletedTransaction {

    @JsonProperty("id")
    long id;
}
