package com.flagship.finance_ledger.lookup;

import java.util.Optional;

public interface AccountLookup {

    Optional<AccountRef> getById(long accountId);
}
