package com.ai.tutoring.service;

import com.ai.tutoring.exception.ConcurrentUpdateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.function.Supplier;

/**
 * Runs a read-validate-write unit in its own short transaction.
 *
 * <p>The unit must re-read everything it validates. If its write loses an
 * optimistic version check (or collides on a unique key with a concurrent
 * insert) the whole unit runs once more against fresh state; a second loss
 * surfaces as {@link ConcurrentUpdateException}.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OptimisticRetry {

    private final TransactionOperations transactionOperations;

    public <T> T execute(String target, Supplier<T> unit) {
        try {
            return transactionOperations.execute(status -> unit.get());
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException first) {
            log.warn("Concurrent write on {} detected, re-reading and retrying once", target);
            try {
                return transactionOperations.execute(status -> unit.get());
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException second) {
                throw new ConcurrentUpdateException(
                        "Concurrent modification of " + target + ", please retry", second);
            }
        }
    }
}
