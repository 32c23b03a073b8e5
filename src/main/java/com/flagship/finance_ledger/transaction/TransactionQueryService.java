package com.flagship.finance_ledger.transaction;

import com.flagship.finance_ledger.transaction.dto.TransactionView;
import com.flagship.finance_ledger.unitofwork.UnitOfWork;
import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side for transactions. Each call runs in its own read-only unit of work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionQueryService {

    private final TransactionStore transactionStore;
    private final TagAssociationStore tagAssociationStore;
    private final UnitOfWork unitOfWork;

    public TransactionResult<TransactionView> getById(long transactionId) {
        return unitOfWork.readOnly(ctx -> transactionStore.findById(transactionId, ctx)
            .map(tx -> TransactionResult.success(
                TransactionView.from(tx, tagAssociationStore.findTagIds(transactionId, ctx))))
            .orElseGet(() -> TransactionResult.<TransactionView>failure(
                TransactionErrorCode.TRANSACTION_NOT_FOUND, "Transaction not found: " + transactionId)));
    }

    /**
     * Transactions booked on an account, ordered by date then id.
     */
    public List<TransactionView> getByAccount(long accountId) {
        return unitOfWork.readOnly(ctx -> withTags(transactionStore.findByAccount(accountId, ctx), ctx));
    }

    /**
     * Transactions booked on a credit card, ordered by date then id.
     */
    public List<TransactionView> getByCreditCard(long creditCardId) {
        return unitOfWork.readOnly(ctx -> withTags(transactionStore.findByCreditCard(creditCardId, ctx), ctx));
    }

    /**
     * Transactions on all accounts of a user, keyed by account id in ascending order.
     * Every account of the user has an entry, empty when it has no transactions.
     * Fails with ACCOUNT_NOT_FOUND when the user owns no account.
     */
    public TransactionResult<Map<Long, List<TransactionView>>> getByUser(long userId) {
        return unitOfWork.readOnly(ctx -> {
            List<Long> accountIds = transactionStore.findAccountIdsByUser(userId, ctx);
            if (accountIds.isEmpty()) {
                return TransactionResult.<Map<Long, List<TransactionView>>>failure(
                    TransactionErrorCode.ACCOUNT_NOT_FOUND, "No accounts for user: " + userId);
            }
            Map<Long, List<TransactionView>> byAccount = new LinkedHashMap<>();
            accountIds.forEach(accountId -> byAccount.put(accountId, new ArrayList<>()));
            for (TransactionView view : withTags(transactionStore.findByUser(userId, ctx), ctx)) {
                byAccount.computeIfAbsent(view.getAccountId(), id -> new ArrayList<>()).add(view);
            }
            return TransactionResult.success(byAccount);
        });
    }

    public long countByAccount(long accountId) {
        return unitOfWork.readOnly(ctx -> transactionStore.countByAccount(accountId, ctx));
    }

    public long countByCreditCard(long creditCardId) {
        return unitOfWork.readOnly(ctx -> transactionStore.countByCreditCard(creditCardId, ctx));
    }

    public TransactionResult<Long> countByUser(long userId) {
        return unitOfWork.readOnly(ctx -> {
            if (transactionStore.findAccountIdsByUser(userId, ctx).isEmpty()) {
                return TransactionResult.<Long>failure(
                    TransactionErrorCode.ACCOUNT_NOT_FOUND, "No accounts for user: " + userId);
            }
            return TransactionResult.success(transactionStore.countByUser(userId, ctx));
        });
    }

    private List<TransactionView> withTags(List<Transaction> transactions, UnitOfWorkContext ctx) {
        Map<Long, List<Long>> tagsByTransaction = tagAssociationStore.findTagIdsByTransactions(
            transactions.stream().map(Transaction::getId).toList(), ctx);
        log.debug("Loaded {} transactions, {} with tags", transactions.size(), tagsByTransaction.size());
        return transactions.stream()
            .map(tx -> TransactionView.from(tx, tagsByTransaction.getOrDefault(tx.getId(), List.of())))
            .toList();
    }
}
