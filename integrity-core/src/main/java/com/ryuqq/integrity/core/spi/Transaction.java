package com.ryuqq.integrity.core.spi;

import com.ryuqq.integrity.core.audit.AuditEntry;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.ScopedEntity;

import java.util.Optional;

/**
 * Write handle of one unit of work.
 *
 * <p>This is the only interface through which entities and audit records can be written.
 * A Transaction is valid only inside {@link UnitOfWork#execute}; writes are staged and
 * become visible atomically on commit, or are discarded on rollback.</p>
 *
 * <p><strong>Store-enforced rules:</strong></p>
 * <ul>
 *   <li>{@link #insert} requires version 1 and an unused key</li>
 *   <li>{@link #update} requires exactly {@code current.version + 1} and an unchanged factoryId</li>
 *   <li>{@link #appendAudit} hashes the entry onto the head of its chain at commit time</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface Transaction {

    /**
     * Reads an entity, including writes staged in this transaction.
     *
     * @param ref the (type, id) key
     * @return the entity, or empty if it does not exist
     */
    Optional<ScopedEntity> find(EntityRef ref);

    /**
     * Stages a new entity.
     *
     * @param entity version-1 entity
     * @throws IllegalStateException if the key already exists or version is not 1
     */
    void insert(ScopedEntity entity);

    /**
     * Stages the next version of an existing entity.
     *
     * @param entity entity with version {@code current + 1}
     * @throws IllegalStateException if the entity is missing, the version does not follow
     *         the current one, or the factoryId changed
     */
    void update(ScopedEntity entity);

    /**
     * Stages a hard delete.
     *
     * @param ref the (type, id) key
     * @throws IllegalStateException if the entity does not exist
     */
    void delete(EntityRef ref);

    /**
     * Stages an audit record for the entry's chain.
     *
     * @param entry audit content
     */
    void appendAudit(AuditEntry entry);
}
