package com.ryuqq.integrity.core.spi;

import com.ryuqq.integrity.core.audit.AuditRecord;
import com.ryuqq.integrity.core.audit.ChainHead;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;

import java.util.List;

/**
 * Read-only view of the append-only audit log.
 *
 * <p>There is no append or update method here. Records are appended only
 * through {@link Transaction#appendAudit} inside a unit of work.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface AuditLog {

    /**
     * Returns one chain in commit order.
     *
     * @param target entity type
     * @param targetId entity id
     * @return records ordered by sequence (may be empty)
     */
    List<AuditRecord> history(EntityType target, EntityId targetId);

    /**
     * Returns the records with {@code afterSequence < sequence <= throughSequence}, in commit order.
     *
     * @param afterSequence exclusive lower bound
     * @param throughSequence inclusive upper bound
     * @return records ordered by sequence (empty if the range is empty)
     */
    List<AuditRecord> records(long afterSequence, long throughSequence);

    /**
     * Returns the stored head of every chain as of {@code throughSequence}.
     *
     * @param throughSequence inclusive upper bound
     * @return one head per chain, using stored hashes
     */
    List<ChainHead> heads(long throughSequence);

    /**
     * Highest committed sequence.
     *
     * @return last sequence, or 0 if the log is empty
     */
    long lastSequence();
}
