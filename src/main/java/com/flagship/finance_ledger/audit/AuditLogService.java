package com.flagship.finance_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes one audit row per transaction mutation, inside the mutation's own unit of work,
 * so the row commits or rolls back together with the mutation.
 */
@Service
@Slf4j
public class AuditLogService {

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public AuditLogService(AuditLogRepository repository,
                           ObjectMapper objectMapper,
                           @Value("${ledger.audit.enabled:true}") boolean enabled) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    /**
     * Records a mutation. Must be called within an open unit of work (MANDATORY propagation).
     *
     * @param operation what happened to the transaction
     * @param transactionId the affected transaction
     * @param userId owner of the transaction's balance holder
     * @param state object serialized to JSON as the entry's detail
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditOperation operation, long transactionId, Long userId, Object state) {
        if (!enabled) {
            return;
        }
        AuditLogEntity saved = repository.save(
            AuditLogEntity.of(operation, transactionId, userId, serialize(state)));
        log.debug("Recorded audit entry: operation={}, transactionId={}, entryId={}",
            operation, transactionId, saved.getId());
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> findByTransaction(long transactionId) {
        return repository.findByTransactionIdOrderByIdAsc(transactionId)
            .stream()
            .map(AuditLogEntity::toDomain)
            .toList();
    }

    private String serialize(Object state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit detail", e);
        }
    }
}
