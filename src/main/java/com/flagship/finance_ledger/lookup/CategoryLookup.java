package com.flagship.finance_ledger.lookup;

import java.util.Optional;

public interface CategoryLookup {

    Optional<CategoryRef> getById(long categoryId);
}
