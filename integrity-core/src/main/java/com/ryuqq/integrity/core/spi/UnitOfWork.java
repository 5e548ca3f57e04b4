package com.ryuqq.integrity.core.spi;

import com.ryuqq.integrity.core.model.EntityRef;

import java.util.function.Function;

/**
 * Atomic unit of work around one row.
 *
 * <p>Runs {@code work} while holding the row lock of {@code lockKey} and commits everything
 * it staged on its {@link Transaction} as one atomic step. If {@code work} throws, or the
 * lock cannot be acquired within the configured timeout, nothing is committed.</p>
 *
 * <p><strong>Transaction Boundary:</strong></p>
 * <pre>
 * lock(lockKey)                 (bounded wait)
 *   work(tx)                    (read, check version, stage entity + audit)
 * commit(tx) | rollback(tx)
 * unlock(lockKey)
 * </pre>
 *
 * <p>Row locks are never nested: {@code work} must not call {@code execute} again.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface UnitOfWork {

    /**
     * Executes work atomically under the row lock.
     *
     * @param lockKey row to lock
     * @param work work to run against the transaction
     * @param <T> result type
     * @return the value returned by work
     * @throws UnitOfWorkTimeoutException if the row lock could not be acquired in time
     * @throws RuntimeException whatever work throws, after rollback
     */
    <T> T execute(EntityRef lockKey, Function<Transaction, T> work);
}
