package com.ryuqq.integrity.core.spi;

import com.ryuqq.integrity.core.model.EntityRef;

/**
 * Thrown when a unit of work cannot acquire its row lock within the timeout.
 *
 * <p>Nothing was written: no partial version bump and no orphaned audit record.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class UnitOfWorkTimeoutException extends RuntimeException {

    private final EntityRef lockKey;

    public UnitOfWorkTimeoutException(EntityRef lockKey, long timeoutMs) {
        super("Timed out after " + timeoutMs + "ms waiting for row lock of " + lockKey);
        this.lockKey = lockKey;
    }

    public EntityRef getLockKey() {
        return lockKey;
    }
}
