package com.flagship.finance_ledger.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the mutation audit log. Rows are append-only: no setters, no update path.
 */
@Entity
@Table(
    name = "ledger_audit_log",
    indexes = @Index(name = "idx_ledger_audit_log_transaction", columnList = "transaction_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private AuditOperation operation;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private Long transactionId;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    // Full view JSON; its length grows with escaping and the tag count
    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static AuditLogEntity of(AuditOperation operation, long transactionId, Long userId, String detail) {
        AuditLogEntity entity = new AuditLogEntity();
        entity.operation = operation;
        entity.transactionId = transactionId;
        entity.userId = userId;
        entity.detail = detail;
        return entity;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public AuditLogEntry toDomain() {
        return new AuditLogEntry(id, operation, transactionId, userId, detail, createdAt);
    }
}
