package com.verve.infrastructure.persistence;

import com.verve.domain.common.adapter.ITransactionScope;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 基于 TransactionTemplate 的事务边界，超时后整体回滚并映射为 TIMEOUT。
 *
 * @author verve
 * @since 2025-06-02
 */
@Component
@ConditionalOnProperty(name = "verve.store.type", havingValue = "postgres")
public class PostgresTransactionScope implements ITransactionScope {

    private final TransactionTemplate transactionTemplate;

    public PostgresTransactionScope(PlatformTransactionManager transactionManager,
                                    @Value("${verve.store.transaction-timeout-seconds:10}") int timeoutSeconds) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(timeoutSeconds);
    }

    @Override
    public <T> T execute(Supplier<T> action) {
        return StoreErrorTranslator.call("transaction", () -> transactionTemplate.execute(status -> action.get()));
    }
}
