package com.flagship.finance_ledger.transaction;

import com.flagship.finance_ledger.audit.AuditLogService;
import com.flagship.finance_ledger.audit.AuditOperation;
import com.flagship.finance_ledger.balance.BalanceDeltaApplier;
import com.flagship.finance_ledger.balance.BalanceHolder;
import com.flagship.finance_ledger.balance.HolderBalance;
import com.flagship.finance_ledger.monetary.MonetaryDelta;
import com.flagship.finance_ledger.observability.TransactionMetrics;
import com.flagship.finance_ledger.transaction.dto.CreateTransactionCommand;
import com.flagship.finance_ledger.transaction.dto.DeletedTransaction;
import com.flagship.finance_ledger.transaction.dto.TransactionView;
import com.flagship.finance_ledger.transaction.dto.UpdateTransactionPatch;
import com.flagship.finance_ledger.unitofwork.UnitOfWork;
import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;
import com.flagship.finance_ledger.validation.TransactionReferenceValidator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Creates, updates and deletes transactions while keeping holder balances consistent.
 *
 * Every mutation runs in one unit of work: the transaction row, its tag associations,
 * the balance deltas and the audit entry commit together or not at all.
 *
 * Balance effects:
 * - create applies the signed delta to the holder
 * - update reverts the old delta on the old holder and applies the new delta on the new
 *   holder, or does nothing when source, holder and delta are unchanged
 * - delete reverts the delta
 *
 * Failures come back as {@link TransactionResult} error codes; nothing is thrown to callers.
 * The service is stateless and may be called from any number of threads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionMutationService {

    private static final String MDC_TRANSACTION_ID = "transactionId";

    private final TransactionStore transactionStore;
    private final TagAssociationStore tagAssociationStore;
    private final BalanceDeltaApplier balanceDeltaApplier;
    private final TransactionReferenceValidator referenceValidator;
    private final UnitOfWork unitOfWork;
    private final AuditLogService auditLogService;
    private final TransactionMetrics metrics;
    private final Validator validator;

    /**
     * Creates a transaction and applies its delta to the selected holder.
     *
     * References are validated before the unit of work opens, so a rejected command
     * never touches the ledger tables.
     */
    public TransactionResult<TransactionView> create(CreateTransactionCommand command) {
        return execute("create", null, () -> {
            requireValid(command);
            String value = normalizeValue(command.getValue());

            TransactionSource source = command.getTransactionSource();
            Long accountId = source == TransactionSource.ACCOUNT ? command.getAccountId() : null;
            Long creditCardId = source == TransactionSource.CREDIT_CARD ? command.getCreditCardId() : null;

            long ownerUserId = referenceValidator.resolveOwner(source, accountId, creditCardId);
            referenceValidator.validateClassification(command.getCategoryId(), command.getSubcategoryId());

            List<Long> tagIds = TransactionReferenceValidator.normalizeTagIds(command.getTags());
            if (tagIds != null) {
                referenceValidator.validateTags(ownerUserId, tagIds);
            }

            Transaction draft = Transaction.builder()
                .value(value)
                .date(command.getDate())
                .transactionType(command.getTransactionType())
                .transactionSource(source)
                .accountId(accountId)
                .creditCardId(creditCardId)
                .categoryId(command.getCategoryId())
                .subcategoryId(command.getSubcategoryId())
                .installment(command.isInstallment())
                .totalMonths(command.getTotalMonths())
                .recurring(command.isRecurring())
                .paymentDay(command.getPaymentDay())
                .active(command.getActive() == null || command.getActive())
                .observation(command.getObservation())
                .build();

            return unitOfWork.run(ctx -> {
                long transactionId = transactionStore.insert(draft, ctx);
                MDC.put(MDC_TRANSACTION_ID, String.valueOf(transactionId));

                Transaction created = draft.toBuilder().id(transactionId).build();
                String delta = created.signedDelta();
                balanceDeltaApplier.apply(created.balanceHolder(), delta, ctx);

                if (tagIds != null) {
                    tagAssociationStore.replace(transactionId, tagIds, ctx);
                }

                TransactionView view = readBack(transactionId, ctx);
                auditLogService.record(AuditOperation.CREATE, transactionId, ownerUserId, view);

                log.info("Transaction created: holder={}, delta={}, tags={}",
                    created.balanceHolder(), delta, view.getTags().size());
                return view;
            });
        });
    }

    /**
     * Applies a partial update under a row lock.
     *
     * The patched state is validated as a whole after the lock is taken and before the
     * first write; a rejection rolls back a unit of work that has written nothing.
     */
    public TransactionResult<TransactionView> update(long transactionId, UpdateTransactionPatch patch) {
        return execute("update", transactionId, () -> {
            requireValid(patch);
            String patchedValue = patch.getValue() != null ? normalizeValue(patch.getValue()) : null;
            List<Long> tagIds = TransactionReferenceValidator.normalizeTagIds(patch.getTags());

            return unitOfWork.run(ctx -> {
                Transaction current = lockExisting(transactionId, ctx);
                Transaction updated = overlay(current, patch, patchedValue);

                long ownerUserId = referenceValidator.resolveOwner(
                    updated.getTransactionSource(), updated.getAccountId(), updated.getCreditCardId());
                referenceValidator.validateClassification(updated.getCategoryId(), updated.getSubcategoryId());
                BalanceHolder oldHolder = current.balanceHolder();
                BalanceHolder newHolder = updated.balanceHolder();
                if (tagIds != null) {
                    referenceValidator.validateTags(ownerUserId, tagIds);
                } else if (!oldHolder.equals(newHolder)) {
                    // Kept tags must follow the holder's owner
                    referenceValidator.validateRetainedTags(ownerUserId,
                        tagAssociationStore.findTagIds(transactionId, ctx));
                }
                String oldDelta = current.signedDelta();
                String newDelta = updated.signedDelta();

                if (oldHolder.equals(newHolder) && MonetaryDelta.sameAmount(oldDelta, newDelta)) {
                    log.debug("Balance effect unchanged, skipping delta: holder={}, delta={}", oldHolder, oldDelta);
                } else {
                    // Revert and reapply stay separate statements, also on the same holder
                    balanceDeltaApplier.apply(oldHolder, MonetaryDelta.invert(oldDelta), ctx);
                    balanceDeltaApplier.apply(newHolder, newDelta, ctx);
                }

                transactionStore.update(updated, ctx);
                if (tagIds != null) {
                    tagAssociationStore.replace(transactionId, tagIds, ctx);
                }

                TransactionView view = readBack(transactionId, ctx);
                auditLogService.record(AuditOperation.UPDATE, transactionId, ownerUserId, view);

                log.info("Transaction updated: oldHolder={}, oldDelta={}, newHolder={}, newDelta={}",
                    oldHolder, oldDelta, newHolder, newDelta);
                return view;
            });
        });
    }

    /**
     * Deletes a transaction with its tag associations and reverts its balance effect.
     */
    public TransactionResult<DeletedTransaction> delete(long transactionId) {
        return execute("delete", transactionId, () -> unitOfWork.run(ctx -> {
            Transaction current = lockExisting(transactionId, ctx);
            TransactionView deletedState = TransactionView.from(
                current, tagAssociationStore.findTagIds(transactionId, ctx));

            // Join rows first: transaction_tag references ledger_transaction
            tagAssociationStore.deleteAll(transactionId, ctx);
            if (!transactionStore.delete(transactionId, ctx)) {
                throw new IllegalStateException("Locked transaction disappeared before delete: " + transactionId);
            }

            BalanceHolder holder = current.balanceHolder();
            String revert = MonetaryDelta.invert(current.signedDelta());
            HolderBalance after = balanceDeltaApplier.apply(holder, revert, ctx)
                .orElseGet(() -> balanceDeltaApplier.balanceOf(holder, ctx));

            auditLogService.record(AuditOperation.DELETE, transactionId, after.getUserId(), deletedState);

            log.info("Transaction deleted: holder={}, revertedDelta={}, balance={}",
                holder, revert, after.getBalance());
            return new DeletedTransaction(transactionId);
        }));
    }

    private <T> TransactionResult<T> execute(String operation, Long transactionId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        if (transactionId != null) {
            MDC.put(MDC_TRANSACTION_ID, transactionId.toString());
        }

        try {
            T data = action.get();
            metrics.recordMutation(operation, "success");
            return TransactionResult.success(data);

        } catch (TransactionValidationException e) {
            metrics.recordMutation(operation, e.getErrorCode().name());
            log.warn("Transaction {} rejected: code={}, reason={}", operation, e.getErrorCode(), e.getMessage());
            return TransactionResult.failure(e.getErrorCode(), e.getMessage());

        } catch (RuntimeException e) {
            // DataAccessException, TransactionException (incl. timeout) and invariant violations
            metrics.recordMutation(operation, TransactionErrorCode.INTERNAL_ERROR.name());
            log.error("Transaction {} failed, unit of work rolled back: error={}", operation, e.getMessage(), e);
            return TransactionResult.failure(TransactionErrorCode.INTERNAL_ERROR,
                "Transaction " + operation + " failed");

        } finally {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency(operation, duration);
            log.debug("Transaction {} finished in {}ms", operation, duration);
            MDC.remove(MDC_TRANSACTION_ID);
        }
    }

    private Transaction lockExisting(long transactionId, UnitOfWorkContext ctx) {
        return transactionStore.findByIdForUpdate(transactionId, ctx)
            .orElseThrow(() -> new TransactionValidationException(
                TransactionErrorCode.TRANSACTION_NOT_FOUND, "Transaction not found: " + transactionId));
    }

    private TransactionView readBack(long transactionId, UnitOfWorkContext ctx) {
        Transaction stored = transactionStore.findById(transactionId, ctx)
            .orElseThrow(() -> new IllegalStateException("Transaction missing after write: " + transactionId));
        return TransactionView.from(stored, tagAssociationStore.findTagIds(transactionId, ctx));
    }

    /**
     * Effective state after the patch. The holder id not matching the effective source
     * is always cleared.
     */
    private static Transaction overlay(Transaction current, UpdateTransactionPatch patch, String patchedValue) {
        TransactionSource source = coalesce(patch.getTransactionSource(), current.getTransactionSource());
        Long accountId = source == TransactionSource.ACCOUNT
            ? coalesce(patch.getAccountId(), current.getAccountId())
            : null;
        Long creditCardId = source == TransactionSource.CREDIT_CARD
            ? coalesce(patch.getCreditCardId(), current.getCreditCardId())
            : null;

        return current.toBuilder()
            .value(coalesce(patchedValue, current.getValue()))
            .date(coalesce(patch.getDate(), current.getDate()))
            .transactionType(coalesce(patch.getTransactionType(), current.getTransactionType()))
            .transactionSource(source)
            .accountId(accountId)
            .creditCardId(creditCardId)
            .categoryId(coalesce(patch.getCategoryId(), current.getCategoryId()))
            .subcategoryId(coalesce(patch.getSubcategoryId(), current.getSubcategoryId()))
            .installment(coalesce(patch.getInstallment(), current.isInstallment()))
            .totalMonths(coalesce(patch.getTotalMonths(), current.getTotalMonths()))
            .recurring(coalesce(patch.getRecurring(), current.isRecurring()))
            .paymentDay(coalesce(patch.getPaymentDay(), current.getPaymentDay()))
            .active(coalesce(patch.getActive(), current.isActive()))
            .observation(coalesce(patch.getObservation(), current.getObservation()))
            .build();
    }

    private static <V> V coalesce(V patched, V current) {
        return patched != null ? patched : current;
    }

    private <T> void requireValid(T request) {
        if (request == null) {
            throw new TransactionValidationException(TransactionErrorCode.INVALID_REQUEST, "Request is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            throw new TransactionValidationException(TransactionErrorCode.INVALID_REQUEST, message);
        }
    }

    private static String normalizeValue(String value) {
        try {
            return MonetaryDelta.normalize(value);
        } catch (IllegalArgumentException e) {
            throw new TransactionValidationException(TransactionErrorCode.INVALID_MONETARY_VALUE, e.getMessage());
        }
    }
}
