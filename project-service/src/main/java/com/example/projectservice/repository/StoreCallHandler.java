package com.example.projectservice.repository;

import com.example.projectservice.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized handler for calls into the table store.
 *
 * <p>Every repository call made by the services goes through here so that a
 * failing store call surfaces as {@link PersistenceException} (HTTP 500) with
 * the operation name logged, instead of a raw Spring DataAccessException.
 *
 * <p>Optimistic locking failures are not translated: they are handled by the
 * caller as a conflict.
 */
@Component
@Slf4j
public class StoreCallHandler {

    /**
     * Execute a store call with exception mapping.
     *
     * @param storeCall the repository call
     * @param operationName descriptive name for logging (e.g. "insertProject")
     * @return result of the call
     * @throws PersistenceException if the store call fails
     */
    public <T> T handleStoreCall(Supplier<T> storeCall, String operationName) {
        try {
            return storeCall.get();
        } catch (OptimisticLockingFailureException e) {
            throw e;
        } catch (DataAccessException e) {
            log.error("Store call failed [operation={}, error={}]", operationName, e.getMessage());
            throw new PersistenceException(operationName, e);
        }
    }

    /**
     * Variant for calls without a result.
     */
    public void runStoreCall(Runnable storeCall, String operationName) {
        handleStoreCall(() -> {
            storeCall.run();
            return null;
        }, operationName);
    }
}
