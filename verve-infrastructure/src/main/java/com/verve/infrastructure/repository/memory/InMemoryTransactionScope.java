package com.verve.infrastructure.repository.memory;

import com.verve.domain.common.adapter.ITransactionScope;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 内存事务：持有存储锁执行整个回调，保证其他调用方看不到中间状态。
 * 回调抛出异常时已写入的变更不会回滚。
 */
@Component
@ConditionalOnProperty(name = "verve.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTransactionScope implements ITransactionScope {

    private final InMemoryDataStore store;

    public InMemoryTransactionScope(InMemoryDataStore store) {
        this.store = store;
    }

    @Override
    public <T> T execute(Supplier<T> action) {
        return store.locked(action);
    }
}
