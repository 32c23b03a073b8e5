package com.flagship.finance_ledger.unitofwork;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Unit of work backed by Spring's transaction manager.
 *
 * Each call starts a new database transaction (REQUIRES_NEW) so a mutation is
 * never silently merged into a caller's outer transaction. JdbcTemplate and the
 * JPA audit repository both join it through the shared transaction manager.
 */
@Component
@Slf4j
public class TransactionTemplateUnitOfWork implements UnitOfWork {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public TransactionTemplateUnitOfWork(
            PlatformTransactionManager transactionManager,
            JdbcTemplate jdbcTemplate,
            @Value("${ledger.unit-of-work.timeout-seconds:10}") int timeoutSeconds) {
        this.jdbcTemplate = jdbcTemplate;

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.writeTemplate.setTimeout(timeoutSeconds);
        this.writeTemplate.setName("ledger-mutation");

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(timeoutSeconds);
        this.readTemplate.setName("ledger-read");

        log.info("Unit of work configured: timeout={}s", timeoutSeconds);
    }

    @Override
    public <T> T run(Function<UnitOfWorkContext, T> work) {
        return writeTemplate.execute(status -> work.apply(new UnitOfWorkContext(jdbcTemplate, status)));
    }

    @Override
    public <T> T readOnly(Function<UnitOfWorkContext, T> work) {
        return readTemplate.execute(status -> work.apply(new UnitOfWorkContext(jdbcTemplate, status)));
    }
}
