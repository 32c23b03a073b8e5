package com.flagship.finance_ledger.lookup;

import java.util.Collection;
import java.util.List;

public interface TagLookup {

    /**
     * Finds the tags among {@code tagIds} that belong to {@code userId}.
     * Ids that do not match are simply absent from the result.
     */
    List<TagRef> findByIdsForUser(Collection<Long> tagIds, long userId, boolean activeOnly);
}
