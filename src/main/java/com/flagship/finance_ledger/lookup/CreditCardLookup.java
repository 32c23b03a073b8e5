package com.flagship.finance_ledger.lookup;

import java.util.Optional;

public interface CreditCardLookup {

    Optional<CreditCardRef> getById(long creditCardId);
}
