package com.ryuqq.integrity.core.spi;

import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.ScopedEntity;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to committed entities.
 *
 * <p>Reads through this interface are unscoped: authorization is applied by the caller
 * (the mutation pipeline) using the {@code PolicyEngine}. Adapters must never return
 * uncommitted (staged) state.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface EntityReader {

    /**
     * Finds a committed entity.
     *
     * @param ref the (type, id) key
     * @return the entity, or empty if it does not exist
     * @throws IllegalArgumentException if ref is null
     */
    Optional<ScopedEntity> find(EntityRef ref);

    /**
     * Lists committed entities of one type in one factory.
     *
     * <p>Order is implementation-defined but stable; the in-memory adapter orders by
     * {@code updatedAt} descending so that the first page is the list head.</p>
     *
     * @param type entity type
     * @param factoryId owning factory
     * @return matching entities (may be empty)
     */
    List<ScopedEntity> list(EntityType type, FactoryId factoryId);
}
