package com.flagship.finance_ledger.lookup;

import lombok.Value;

@Value
public class CategoryRef {
    long id;
    boolean active;
}
