/**
 * Core domain model package containing value objects for factory-scoped data.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.core.model.FactoryId} - Factory (organizational unit) identifier</li>
 *   <li>{@link com.ryuqq.integrity.core.model.EntityType} - Audited entity type (table name)</li>
 *   <li>{@link com.ryuqq.integrity.core.model.EntityId} - Entity row identifier</li>
 *   <li>{@link com.ryuqq.integrity.core.model.Origin} - Request origin (ip, user agent)</li>
 * </ul>
 *
 * <h2>Composite Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.core.model.EntityRef} - (type, id) lock and chain key</li>
 *   <li>{@link com.ryuqq.integrity.core.model.Principal} - Caller role and factory scope</li>
 *   <li>{@link com.ryuqq.integrity.core.model.ScopedEntity} - Versioned, factory-owned entity</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable; JSON attributes are deep-copied</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Type Safety:</strong> Strong typing prevents mixing factory, entity and type identifiers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.core.model;
