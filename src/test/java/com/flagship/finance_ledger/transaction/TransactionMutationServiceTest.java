package com.flagship.finance_ledger.transaction;

import com.flagship.finance_ledger.audit.AuditLogService;
import com.flagship.finance_ledger.audit.AuditOperation;
import com.flagship.finance_ledger.balance.BalanceDeltaApplier;
import com.flagship.finance_ledger.balance.BalanceHolder;
import com.flagship.finance_ledger.balance.HolderBalance;
import com.flagship.finance_ledger.observability.TransactionMetrics;
import com.flagship.finance_ledger.transaction.dto.CreateTransactionCommand;
import com.flagship.finance_ledger.transaction.dto.DeletedTransaction;
import com.flagship.finance_ledger.transaction.dto.TransactionView;
import com.flagship.finance_ledger.transaction.dto.UpdateTransactionPatch;
import com.flagship.finance_ledger.unitofwork.UnitOfWork;
import com.flagship.finance_ledger.unitofwork.UnitOfWorkContext;
import com.flagship.finance_ledger.validation.TransactionReferenceValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Orchestration rules of {@link TransactionMutationService} against mocked stores.
 * The unit of work runs the callback directly; persistence is covered by the integration tests.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TransactionMutationServiceTest {

    private static final long TX_ID = 1L;
    private static final long ACCOUNT_ID = 10L;
    private static final long CARD_ID = 5L;
    private static final long OWNER = 77L;
    private static final Instant DATE = Instant.parse("2024-03-15T12:00:00Z");

    @Mock
    private TransactionStore transactionStore;

    @Mock
    private TagAssociationStore tagAssociationStore;

    @Mock
    private BalanceDeltaApplier balanceDeltaApplier;

    @Mock
    private TransactionReferenceValidator referenceValidator;

    @Mock
    private AuditLogService auditLogService;

    private final DirectUnitOfWork unitOfWork = new DirectUnitOfWork();
    private SimpleMeterRegistry registry;
    private TransactionMutationService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new TransactionMutationService(
            transactionStore,
            tagAssociationStore,
            balanceDeltaApplier,
            referenceValidator,
            unitOfWork,
            auditLogService,
            new TransactionMetrics(registry),
            Validation.buildDefaultValidatorFactory().getValidator()
        );

        when(referenceValidator.resolveOwner(any(), any(), any())).thenReturn(OWNER);
        when(tagAssociationStore.findTagIds(anyLong(), any())).thenReturn(List.of());
    }

    @Test
    @DisplayName("Create inserts the row, applies the signed delta and writes one audit entry")
    void createAppliesSignedDelta() {
        // Given
        CreateTransactionCommand command = expenseOnAccount("150").build();
        when(transactionStore.insert(any(), same(unitOfWork.ctx))).thenReturn(TX_ID);
        when(transactionStore.findById(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(storedExpense("150.00")));

        // When
        TransactionResult<TransactionView> result = service.create(command);

        // Then
        assertTrue(result.isSuccess(), () -> "Unexpected failure: " + result.getMessage());
        assertEquals("150.00", result.getData().getValue());
        verify(balanceDeltaApplier).apply(BalanceHolder.account(ACCOUNT_ID), "-150.00", unitOfWork.ctx);
        verify(auditLogService).record(eq(AuditOperation.CREATE), eq(TX_ID), eq(OWNER), any(TransactionView.class));
        verify(tagAssociationStore, never()).replace(anyLong(), any(), any());
        assertEquals(1.0, registry.counter("ledger.transactions.mutations",
            "operation", "create", "outcome", "success").count());
    }

    @Test
    @DisplayName("Create ignores the holder id of the other source")
    void createClearsUnusedHolderId() {
        CreateTransactionCommand command = expenseOnAccount("10.00").creditCardId(CARD_ID).build();
        when(transactionStore.insert(any(), any())).thenReturn(TX_ID);
        when(transactionStore.findById(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(storedExpense("10.00")));

        service.create(command);

        ArgumentCaptor<Transaction> inserted = ArgumentCaptor.forClass(Transaction.class);
        verify(transactionStore).insert(inserted.capture(), any());
        assertEquals(ACCOUNT_ID, inserted.getValue().getAccountId());
        assertNull(inserted.getValue().getCreditCardId());
        assertTrue(inserted.getValue().isActive(), "active defaults to true");
        verify(referenceValidator).resolveOwner(TransactionSource.ACCOUNT, ACCOUNT_ID, null);
    }

    @Test
    @DisplayName("Classification failure is returned before any store access")
    void classificationFailureTouchesNothing() {
        CreateTransactionCommand command = expenseOnAccount("150").categoryId(null).build();
        doThrow(new TransactionValidationException(
            TransactionErrorCode.CATEGORY_OR_SUBCATEGORY_REQUIRED, "A category or a subcategory is required"))
            .when(referenceValidator).validateClassification(null, null);

        TransactionResult<TransactionView> result = service.create(command);

        assertFalse(result.isSuccess());
        assertEquals(TransactionErrorCode.CATEGORY_OR_SUBCATEGORY_REQUIRED, result.getError());
        verifyNoInteractions(transactionStore, balanceDeltaApplier, auditLogService);
        assertEquals(1.0, registry.counter("ledger.transactions.mutations",
            "operation", "create", "outcome", "category_or_subcategory_required").count());
    }

    @Test
    void missingRequiredFieldIsInvalidRequest() {
        CreateTransactionCommand command = expenseOnAccount("150").date(null).build();

        TransactionResult<TransactionView> result = service.create(command);

        assertEquals(TransactionErrorCode.INVALID_REQUEST, result.getError());
        assertTrue(result.getMessage().contains("date"));
        verifyNoInteractions(referenceValidator, transactionStore);
    }

    @Test
    void malformedValueIsInvalidMonetaryValue() {
        TransactionResult<TransactionView> result = service.create(expenseOnAccount("12.345").build());

        assertEquals(TransactionErrorCode.INVALID_MONETARY_VALUE, result.getError());
        verifyNoInteractions(referenceValidator, transactionStore);
    }

    @Test
    @DisplayName("Store failure inside the unit of work maps to INTERNAL_ERROR")
    void storeFailureIsInternalError() {
        when(transactionStore.insert(any(), any())).thenThrow(new DataIntegrityViolationException("boom"));

        TransactionResult<TransactionView> result = service.create(expenseOnAccount("150").build());

        assertEquals(TransactionErrorCode.INTERNAL_ERROR, result.getError());
        verifyNoInteractions(balanceDeltaApplier, auditLogService);
    }

    @Test
    @DisplayName("Update that leaves source, holder and value alone issues no balance statement")
    void updateWithUnchangedDeltaSkipsBalance() {
        Transaction current = storedExpense("150.00");
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));
        when(transactionStore.findById(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));

        UpdateTransactionPatch patch = UpdateTransactionPatch.builder()
            .observation("Groceries")
            .value("150")
            .build();

        TransactionResult<TransactionView> result = service.update(TX_ID, patch);

        assertTrue(result.isSuccess());
        verify(balanceDeltaApplier, never()).apply(any(), anyString(), any());
        verify(transactionStore).update(argThat(tx -> "Groceries".equals(tx.getObservation())), same(unitOfWork.ctx));
        verify(auditLogService).record(eq(AuditOperation.UPDATE), eq(TX_ID), eq(OWNER), any());
        verify(referenceValidator, never()).validateRetainedTags(anyLong(), any());
    }

    @Test
    @DisplayName("Value change reverts the old delta then applies the new one")
    void updateValueChangeIssuesTwoStatements() {
        Transaction current = storedExpense("150.00");
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));
        when(transactionStore.findById(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));

        service.update(TX_ID, UpdateTransactionPatch.builder().value("200").build());

        InOrder inOrder = inOrder(balanceDeltaApplier, transactionStore);
        inOrder.verify(balanceDeltaApplier).apply(BalanceHolder.account(ACCOUNT_ID), "150.00", unitOfWork.ctx);
        inOrder.verify(balanceDeltaApplier).apply(BalanceHolder.account(ACCOUNT_ID), "-200.00", unitOfWork.ctx);
        inOrder.verify(transactionStore).update(any(), any());
        verify(balanceDeltaApplier, times(2)).apply(any(), anyString(), any());
    }

    @Test
    @DisplayName("Switching the source to CREDIT_CARD clears accountId and moves the balance effect")
    void sourceSwitchToCreditCard() {
        Transaction current = storedExpense("150.00");
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));
        when(transactionStore.findById(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));

        UpdateTransactionPatch patch = UpdateTransactionPatch.builder()
            .transactionSource(TransactionSource.CREDIT_CARD)
            .creditCardId(CARD_ID)
            .build();

        TransactionResult<TransactionView> result = service.update(TX_ID, patch);

        assertTrue(result.isSuccess());
        ArgumentCaptor<Transaction> updated = ArgumentCaptor.forClass(Transaction.class);
        verify(transactionStore).update(updated.capture(), any());
        assertNull(updated.getValue().getAccountId());
        assertEquals(CARD_ID, updated.getValue().getCreditCardId());
        verify(referenceValidator).resolveOwner(TransactionSource.CREDIT_CARD, null, CARD_ID);
        verify(balanceDeltaApplier).apply(BalanceHolder.account(ACCOUNT_ID), "150.00", unitOfWork.ctx);
        verify(balanceDeltaApplier).apply(BalanceHolder.creditCard(CARD_ID), "150.00", unitOfWork.ctx);
    }

    @Test
    @DisplayName("Switching back to ACCOUNT clears creditCardId")
    void sourceSwitchToAccount() {
        Transaction current = storedExpense("40.00").toBuilder()
            .transactionSource(TransactionSource.CREDIT_CARD)
            .accountId(null)
            .creditCardId(CARD_ID)
            .build();
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));
        when(transactionStore.findById(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));

        service.update(TX_ID, UpdateTransactionPatch.builder()
            .transactionSource(TransactionSource.ACCOUNT)
            .accountId(ACCOUNT_ID)
            .build());

        ArgumentCaptor<Transaction> updated = ArgumentCaptor.forClass(Transaction.class);
        verify(transactionStore).update(updated.capture(), any());
        assertEquals(ACCOUNT_ID, updated.getValue().getAccountId());
        assertNull(updated.getValue().getCreditCardId());
        verify(balanceDeltaApplier).apply(BalanceHolder.creditCard(CARD_ID), "-40.00", unitOfWork.ctx);
        verify(balanceDeltaApplier).apply(BalanceHolder.account(ACCOUNT_ID), "-40.00", unitOfWork.ctx);
    }

    @Test
    @DisplayName("Holder change without a tag list checks the attached tags against the new owner")
    void holderChangeChecksRetainedTags() {
        Transaction current = storedExpense("150.00");
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));
        when(transactionStore.findById(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(current));
        when(tagAssociationStore.findTagIds(TX_ID, unitOfWork.ctx)).thenReturn(List.of(4L, 6L));

        service.update(TX_ID, UpdateTransactionPatch.builder().accountId(11L).build());

        verify(referenceValidator).validateRetainedTags(OWNER, List.of(4L, 6L));
        verify(referenceValidator, never()).validateTags(anyLong(), any());
    }

    @Test
    @DisplayName("Attached tags foreign to the new owner reject the move before any write")
    void foreignRetainedTagsRejectMove() {
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(storedExpense("150.00")));
        when(tagAssociationStore.findTagIds(TX_ID, unitOfWork.ctx)).thenReturn(List.of(4L));
        doThrow(new TransactionValidationException(TransactionErrorCode.TAG_NOT_FOUND, "Attached tags foreign"))
            .when(referenceValidator).validateRetainedTags(OWNER, List.of(4L));

        TransactionResult<TransactionView> result = service.update(TX_ID, UpdateTransactionPatch.builder()
            .transactionSource(TransactionSource.CREDIT_CARD)
            .creditCardId(CARD_ID)
            .build());

        assertEquals(TransactionErrorCode.TAG_NOT_FOUND, result.getError());
        verify(transactionStore, never()).update(any(), any());
        verify(tagAssociationStore, never()).replace(anyLong(), any(), any());
        verifyNoInteractions(balanceDeltaApplier, auditLogService);
    }

    @Test
    void oversizedObservationIsInvalidRequest() {
        TransactionResult<TransactionView> created = service.create(expenseOnAccount("1.00")
            .observation("o".repeat(2001))
            .build());
        TransactionResult<TransactionView> updated = service.update(TX_ID, UpdateTransactionPatch.builder()
            .observation("o".repeat(2001))
            .build());

        assertEquals(TransactionErrorCode.INVALID_REQUEST, created.getError());
        assertTrue(created.getMessage().contains("observation"));
        assertEquals(TransactionErrorCode.INVALID_REQUEST, updated.getError());
        verifyNoInteractions(referenceValidator, transactionStore);
    }

    @Test
    void updateOfMissingTransactionIsNotFound() {
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.empty());

        TransactionResult<TransactionView> result = service.update(TX_ID, UpdateTransactionPatch.builder().build());

        assertEquals(TransactionErrorCode.TRANSACTION_NOT_FOUND, result.getError());
        verify(transactionStore, never()).update(any(), any());
        verifyNoInteractions(balanceDeltaApplier, auditLogService);
    }

    @Test
    @DisplayName("Update rejected by validation writes nothing")
    void updateValidationFailureWritesNothing() {
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(storedExpense("150.00")));
        doThrow(new TransactionValidationException(TransactionErrorCode.TAG_NOT_FOUND, "Tags not found"))
            .when(referenceValidator).validateTags(OWNER, List.of(9L));

        TransactionResult<TransactionView> result = service.update(TX_ID, UpdateTransactionPatch.builder()
            .value("1.00")
            .tags(List.of(9L, 9L))
            .build());

        assertEquals(TransactionErrorCode.TAG_NOT_FOUND, result.getError());
        verify(transactionStore, never()).update(any(), any());
        verify(tagAssociationStore, never()).replace(anyLong(), any(), any());
        verifyNoInteractions(balanceDeltaApplier, auditLogService);
    }

    @Test
    @DisplayName("Delete removes tag rows before the row and reverts the delta")
    void deleteRevertsDelta() {
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.of(storedExpense("150.00")));
        when(transactionStore.delete(TX_ID, unitOfWork.ctx)).thenReturn(true);
        when(balanceDeltaApplier.apply(BalanceHolder.account(ACCOUNT_ID), "150.00", unitOfWork.ctx))
            .thenReturn(Optional.of(new HolderBalance(BalanceHolder.account(ACCOUNT_ID), OWNER, "0.00")));

        TransactionResult<DeletedTransaction> result = service.delete(TX_ID);

        assertTrue(result.isSuccess());
        assertEquals(TX_ID, result.getData().getId());
        InOrder inOrder = inOrder(tagAssociationStore, transactionStore, balanceDeltaApplier, auditLogService);
        inOrder.verify(tagAssociationStore).deleteAll(TX_ID, unitOfWork.ctx);
        inOrder.verify(transactionStore).delete(TX_ID, unitOfWork.ctx);
        inOrder.verify(balanceDeltaApplier).apply(BalanceHolder.account(ACCOUNT_ID), "150.00", unitOfWork.ctx);
        inOrder.verify(auditLogService).record(eq(AuditOperation.DELETE), eq(TX_ID), eq(OWNER), any());
    }

    @Test
    void deleteOfMissingTransactionIsNotFound() {
        when(transactionStore.findByIdForUpdate(TX_ID, unitOfWork.ctx)).thenReturn(Optional.empty());

        TransactionResult<DeletedTransaction> result = service.delete(TX_ID);

        assertEquals(TransactionErrorCode.TRANSACTION_NOT_FOUND, result.getError());
        verify(tagAssociationStore, never()).deleteAll(anyLong(), any());
        verifyNoInteractions(balanceDeltaApplier);
    }

    private static CreateTransactionCommand.CreateTransactionCommandBuilder expenseOnAccount(String value) {
        return CreateTransactionCommand.builder()
            .value(value)
            .date(DATE)
            .transactionType(TransactionType.EXPENSE)
            .transactionSource(TransactionSource.ACCOUNT)
            .accountId(ACCOUNT_ID)
            .categoryId(3L);
    }

    private static Transaction storedExpense(String value) {
        return Transaction.builder()
            .id(TX_ID)
            .value(value)
            .date(DATE)
            .transactionType(TransactionType.EXPENSE)
            .transactionSource(TransactionSource.ACCOUNT)
            .accountId(ACCOUNT_ID)
            .categoryId(3L)
            .active(true)
            .createdAt(DATE)
            .updatedAt(DATE)
            .build();
    }

    /**
     * Runs the callback on the calling thread with a context that has no database behind it.
     */
    private static final class DirectUnitOfWork implements UnitOfWork {

        private final UnitOfWorkContext ctx = new UnitOfWorkContext(null, null);

        @Override
        public <T> T run(Function<UnitOfWorkContext, T> work) {
            return work.apply(ctx);
        }

        @Override
        public <T> T readOnly(Function<UnitOfWorkContext, T> work) {
            return work.apply(ctx);
        }
    }
}
