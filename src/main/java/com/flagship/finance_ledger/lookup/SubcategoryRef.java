package com.flagship.finance_ledger.lookup;

import lombok.Value;

@Value
public class SubcategoryRef {
    long id;
    long categoryId;
    boolean active;
}
