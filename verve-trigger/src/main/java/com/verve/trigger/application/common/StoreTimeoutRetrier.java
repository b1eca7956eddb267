package com.verve.trigger.application.common;

import com.verve.types.enums.ResponseCode;
import com.verve.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 存储超时有限次重试。超时的语句已被数据库取消，重放条件更新不会重复生效。
 */
@Slf4j
@Component
public class StoreTimeoutRetrier {

    private final int maxRetries;

    public StoreTimeoutRetrier(@Value("${verve.store.timeout-retries:2}") int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public <T> T call(String operation, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (AppException ex) {
                if (!ex.is(ResponseCode.TIMEOUT) || attempt >= maxRetries) {
                    throw ex;
                }
                attempt++;
                log.warn("Store operation timed out, retrying. operation={}, attempt={}, maxRetries={}",
                        operation, attempt, maxRetries);
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
