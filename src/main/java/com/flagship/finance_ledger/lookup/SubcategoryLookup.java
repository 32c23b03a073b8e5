package com.flagship.finance_ledger.lookup;

import java.util.Optional;

public interface SubcategoryLookup {

    Optional<SubcategoryRef> getById(long subcategoryId);
}
