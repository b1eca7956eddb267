package com.verve.infrastructure.persistence;

import com.verve.types.exception.AppException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.function.Supplier;

/**
 * 存储异常归一：唯一约束冲突 → CONFLICT，语句或事务超时 → TIMEOUT，其余原样抛出。
 *
 * @author verve
 * @since 2025-06-02
 */
public final class StoreErrorTranslator {

    /** PostgreSQL query_canceled，statement_timeout 触发 */
    private static final String PG_QUERY_CANCELED = "57014";

    private StoreErrorTranslator() {
    }

    public static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DuplicateKeyException ex) {
            throw AppException.conflict(operation + " conflicts with an existing record");
        } catch (QueryTimeoutException | TransactionTimedOutException ex) {
            throw AppException.timeout(operation + " timed out", ex);
        } catch (DataAccessException ex) {
            if (isTimeout(ex)) {
                throw AppException.timeout(operation + " timed out", ex);
            }
            throw ex;
        }
    }

    public static int update(String operation, Supplier<Integer> action) {
        Integer affected = call(operation, action);
        return affected == null ? 0 : affected;
    }

    static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLTimeoutException || current instanceof TransactionTimedOutException) {
                return true;
            }
            if (current instanceof SQLException sqlEx && PG_QUERY_CANCELED.equals(sqlEx.getSQLState())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
