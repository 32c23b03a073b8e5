package com.flagship.finance_ledger.validation;

import com.flagship.finance_ledger.lookup.AccountLookup;
import com.flagship.finance_ledger.lookup.AccountRef;
import com.flagship.finance_ledger.lookup.CategoryLookup;
import com.flagship.finance_ledger.lookup.CreditCardLookup;
import com.flagship.finance_ledger.lookup.CreditCardRef;
import com.flagship.finance_ledger.lookup.SubcategoryLookup;
import com.flagship.finance_ledger.lookup.TagLookup;
import com.flagship.finance_ledger.lookup.TagRef;
import com.flagship.finance_ledger.transaction.TransactionErrorCode;
import com.flagship.finance_ledger.transaction.TransactionSource;
import com.flagship.finance_ledger.transaction.TransactionValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Validates the references a transaction points to.
 *
 * Enforces:
 * 1. The balance holder selected by the source exists; its owner becomes the transaction's owner
 * 2. At least one of category / subcategory is given, and each given one exists and is active
 * 3. Every tag exists, is active and belongs to the owner
 *
 * Violations raise {@link TransactionValidationException} carrying the error code.
 */
@Component
@RequiredArgsConstructor
public class TransactionReferenceValidator {

    private final AccountLookup accountLookup;
    private final CreditCardLookup creditCardLookup;
    private final CategoryLookup categoryLookup;
    private final SubcategoryLookup subcategoryLookup;
    private final TagLookup tagLookup;

    /**
     * Resolves the user owning the holder referenced by {@code source}.
     *
     * @return the owner's user id
     */
    public long resolveOwner(TransactionSource source, Long accountId, Long creditCardId) {
        if (source == TransactionSource.ACCOUNT) {
            AccountRef account = (accountId == null ? null : accountLookup.getById(accountId).orElse(null));
            if (account == null) {
                throw new TransactionValidationException(
                    TransactionErrorCode.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
            }
            return account.getUserId();
        }

        CreditCardRef card = (creditCardId == null ? null : creditCardLookup.getById(creditCardId).orElse(null));
        if (card == null) {
            throw new TransactionValidationException(
                TransactionErrorCode.CREDIT_CARD_NOT_FOUND, "Credit card not found: " + creditCardId);
        }
        return card.getUserId();
    }

    public void validateClassification(Long categoryId, Long subcategoryId) {
        if (categoryId == null && subcategoryId == null) {
            throw new TransactionValidationException(
                TransactionErrorCode.CATEGORY_OR_SUBCATEGORY_REQUIRED,
                "A category or a subcategory is required");
        }

        if (categoryId != null) {
            boolean active = categoryLookup.getById(categoryId).map(c -> c.isActive()).orElse(false);
            if (!active) {
                throw new TransactionValidationException(
                    TransactionErrorCode.CATEGORY_NOT_FOUND_OR_INACTIVE,
                    "Category not found or inactive: " + categoryId);
            }
        }

        if (subcategoryId != null) {
            boolean active = subcategoryLookup.getById(subcategoryId).map(s -> s.isActive()).orElse(false);
            if (!active) {
                throw new TransactionValidationException(
                    TransactionErrorCode.SUBCATEGORY_NOT_FOUND_OR_INACTIVE,
                    "Subcategory not found or inactive: " + subcategoryId);
            }
        }
    }

    /**
     * Checks that every id resolves to an active tag owned by {@code ownerUserId}.
     * Expects ids already de-duplicated by {@link #normalizeTagIds(List)}.
     */
    public void validateTags(long ownerUserId, List<Long> tagIds) {
        if (tagIds.isEmpty()) {
            return;
        }
        List<TagRef> found = tagLookup.findByIdsForUser(tagIds, ownerUserId, true);
        if (found.size() != tagIds.size()) {
            throw new TransactionValidationException(
                TransactionErrorCode.TAG_NOT_FOUND,
                String.format("Tags not found for user %d: requested=%s, resolved=%d",
                    ownerUserId, tagIds, found.size()));
        }
    }

    /**
     * Checks that tags already attached to a transaction belong to {@code ownerUserId}.
     * Used when an update moves the transaction to another holder without replacing its
     * tags. A retained tag may have been deactivated since it was attached, so only
     * ownership is checked.
     */
    public void validateRetainedTags(long ownerUserId, List<Long> tagIds) {
        if (tagIds.isEmpty()) {
            return;
        }
        List<TagRef> found = tagLookup.findByIdsForUser(tagIds, ownerUserId, false);
        if (found.size() != tagIds.size()) {
            throw new TransactionValidationException(
                TransactionErrorCode.TAG_NOT_FOUND,
                String.format("Attached tags do not belong to user %d: attached=%s, owned=%d",
                    ownerUserId, tagIds, found.size()));
        }
    }

    /**
     * Collapses duplicate tag ids, keeping first-occurrence order.
     *
     * @return null when no tag list was supplied
     */
    public static List<Long> normalizeTagIds(List<Long> tagIds) {
        if (tagIds == null) {
            return null;
        }
        LinkedHashSet<Long> unique = new LinkedHashSet<>();
        for (Long tagId : tagIds) {
            if (tagId == null) {
                throw new TransactionValidationException(TransactionErrorCode.TAG_NOT_FOUND, "Tag id must not be null");
            }
            unique.add(tagId);
        }
        return new ArrayList<>(unique);
    }
}
