package com.flagship.finance_ledger.lookup;

import lombok.Value;

@Value
public class CreditCardRef {
    long id;
    long userId;
    boolean active;
}
