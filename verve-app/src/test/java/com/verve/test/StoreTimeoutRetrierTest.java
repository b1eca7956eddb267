package com.verve.test;

import com.verve.trigger.application.common.StoreTimeoutRetrier;
import com.verve.types.enums.ResponseCode;
import com.verve.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

public class StoreTimeoutRetrierTest {

    @Test
    public void shouldRetryTimeoutsUpToLimit() {
        StoreTimeoutRetrier retrier = new StoreTimeoutRetrier(2);
        AtomicInteger calls = new AtomicInteger();

        String result = retrier.call("read task", () -> {
            if (calls.incrementAndGet() < 3) {
                throw AppException.timeout("statement timeout", null);
            }
            return "ok";
        });

        Assertions.assertEquals("ok", result);
        Assertions.assertEquals(3, calls.get());
    }

    @Test
    public void shouldSurfaceTimeoutAfterRetriesExhausted() {
        StoreTimeoutRetrier retrier = new StoreTimeoutRetrier(1);
        AtomicInteger calls = new AtomicInteger();

        AppException ex = Assertions.assertThrows(AppException.class, () -> retrier.run("claim task", () -> {
            calls.incrementAndGet();
            throw AppException.timeout("statement timeout", null);
        }));

        Assertions.assertEquals(ResponseCode.TIMEOUT.getCode(), ex.getCode());
        Assertions.assertEquals(2, calls.get());
    }

    @Test
    public void shouldNotRetryOtherFailures() {
        StoreTimeoutRetrier retrier = new StoreTimeoutRetrier(3);
        AtomicInteger calls = new AtomicInteger();

        Assertions.assertThrows(AppException.class, () -> retrier.run("close task", () -> {
            calls.incrementAndGet();
            throw AppException.preconditionFailed("already closed");
        }));

        Assertions.assertEquals(1, calls.get());
    }
}
