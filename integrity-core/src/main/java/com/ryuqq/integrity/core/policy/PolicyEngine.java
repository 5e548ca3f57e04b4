package com.ryuqq.integrity.core.policy;

import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.ScopedEntity;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Factory-scoped authorization engine.
 *
 * <p>Decides ALLOW or DENY for an operation given a principal's scope. Every read and write
 * path of the mutation pipeline goes through this class; scoping logic is never duplicated
 * per entity type.</p>
 *
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>ALLOW iff the principal is global or the factory is in its assigned set</li>
 *   <li>An empty assigned set denies everything without raising an error</li>
 *   <li>DELETE additionally requires the entity type to be on the {@link DeletePolicy} allow-list</li>
 *   <li>Writes check the target factory as well as the source row (WITH CHECK semantics)</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Stateless apart from the immutable delete policy.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class PolicyEngine {

    private final DeletePolicy deletePolicy;

    /**
     * Creates an engine that denies every delete.
     */
    public PolicyEngine() {
        this(DeletePolicy.denyAll());
    }

    /**
     * Creates an engine with the given delete allow-list.
     *
     * @param deletePolicy delete allow-list
     * @throws IllegalArgumentException if deletePolicy is null
     */
    public PolicyEngine(DeletePolicy deletePolicy) {
        if (deletePolicy == null) {
            throw new IllegalArgumentException("deletePolicy cannot be null");
        }
        this.deletePolicy = deletePolicy;
    }

    /**
     * Authorizes an operation against a factory without entity-type context.
     *
     * <p>DELETE always yields DENY here because the delete allow-list is keyed by entity type;
     * use {@link #authorize(Principal, EntityType, FactoryId, Operation)} for deletes.</p>
     *
     * @param principal the caller
     * @param factoryId the factory owning the row
     * @param operation the requested operation
     * @return ALLOW or DENY
     */
    public Decision authorize(Principal principal, FactoryId factoryId, Operation operation) {
        return authorize(principal, null, factoryId, operation);
    }

    /**
     * Authorizes an operation on a row of the given type.
     *
     * @param principal the caller
     * @param type entity type (may be null for non-delete operations)
     * @param factoryId the factory owning the row
     * @param operation the requested operation
     * @return ALLOW or DENY
     * @throws IllegalArgumentException if principal or operation is null
     */
    public Decision authorize(Principal principal, EntityType type, FactoryId factoryId, Operation operation) {
        if (principal == null) {
            throw new IllegalArgumentException("principal cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (operation == Operation.DELETE && !deletePolicy.isDeletable(type)) {
            return Decision.DENY;
        }
        return inScope(principal, factoryId) ? Decision.ALLOW : Decision.DENY;
    }

    /**
     * Authorizes an operation on an existing entity.
     *
     * @param principal the caller
     * @param entity the row
     * @param operation the requested operation
     * @return ALLOW or DENY
     */
    public Decision authorize(Principal principal, ScopedEntity entity, Operation operation) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        return authorize(principal, entity.getType(), entity.getFactoryId(), operation);
    }

    /**
     * Authorizes a write with WITH CHECK semantics.
     *
     * <p>Both the row's current factory (USING) and the factory the row would carry after
     * the write (WITH CHECK) must be in scope, so a write can neither touch nor produce a
     * row outside the caller's scope.</p>
     *
     * @param principal the caller
     * @param type entity type
     * @param source current factory of the row, or null for INSERT
     * @param target factory the row will carry after the write
     * @param operation INSERT or UPDATE
     * @return ALLOW or DENY
     * @throws IllegalArgumentException if operation is not a write
     */
    public Decision authorizeWrite(Principal principal, EntityType type, FactoryId source,
                                   FactoryId target, Operation operation) {
        if (operation == null || !operation.isWrite()) {
            throw new IllegalArgumentException("operation must be a write operation (current: " + operation + ")");
        }
        if (source != null && !authorize(principal, type, source, operation).isAllowed()) {
            return Decision.DENY;
        }
        return authorize(principal, type, target, operation);
    }

    /**
     * Filters entities down to the ones the principal may read.
     *
     * @param principal the caller
     * @param entities candidate rows
     * @return readable rows, in input order
     */
    public List<ScopedEntity> filterReadable(Principal principal, Collection<ScopedEntity> entities) {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        return entities.stream()
            .filter(e -> authorize(principal, e, Operation.READ).isAllowed())
            .collect(Collectors.toList());
    }

    /**
     * Narrows candidate factories to the ones the principal may read.
     *
     * @param principal the caller
     * @param candidates candidate factories
     * @return readable factories, in input order
     */
    public Set<FactoryId> readableFactories(Principal principal, Collection<FactoryId> candidates) {
        if (candidates == null) {
            throw new IllegalArgumentException("candidates cannot be null");
        }
        Set<FactoryId> readable = new LinkedHashSet<>();
        for (FactoryId candidate : candidates) {
            if (authorize(principal, candidate, Operation.READ).isAllowed()) {
                readable.add(candidate);
            }
        }
        return readable;
    }

    public DeletePolicy getDeletePolicy() {
        return deletePolicy;
    }

    // the only place the global bypass exists
    private static boolean inScope(Principal principal, FactoryId factoryId) {
        if (principal.isGlobal()) {
            return true;
        }
        return factoryId != null && principal.assignedFactoryIds().contains(factoryId);
    }
}
