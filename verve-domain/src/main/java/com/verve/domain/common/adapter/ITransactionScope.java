package com.verve.domain.common.adapter;

import java.util.function.Supplier;

/**
 * 事务边界：回调内的多次条件更新要么全部生效要么全部回滚。
 * 超时抛出 {@code AppException(TIMEOUT)}。
 */
public interface ITransactionScope {

    <T> T execute(Supplier<T> action);

    default void run(Runnable action) {
        execute(() -> {
            action.run();
            return null;
        });
    }
}
