package com.flagship.finance_ledger.lookup;

import lombok.Value;

@Value
public class AccountRef {
    long id;
    long userId;
    boolean active;
}
