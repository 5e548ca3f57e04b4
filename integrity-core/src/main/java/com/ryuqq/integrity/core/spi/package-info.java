/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to back the integrity core with a concrete store and transport.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.core.spi.UnitOfWork} / {@link com.ryuqq.integrity.core.spi.Transaction} - Atomic row-locked writes (entity + audit)</li>
 *   <li>{@link com.ryuqq.integrity.core.spi.EntityReader} - Committed entity reads</li>
 *   <li>{@link com.ryuqq.integrity.core.spi.AuditLog} - Read-only audit log</li>
 *   <li>{@link com.ryuqq.integrity.core.spi.CheckpointStore} - Daily checkpoints</li>
 *   <li>{@link com.ryuqq.integrity.core.spi.RealtimeTransport} - Channel pub/sub</li>
 *   <li>{@link com.ryuqq.integrity.core.spi.IntegrityAlertSink} - Operator alerts</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., integrity-adapter-inmemory, a JDBC adapter) provide concrete
 * implementations. A relational adapter maps {@code UnitOfWork} to a database transaction
 * with {@code SELECT ... FOR UPDATE} on the row and a BIGSERIAL audit sequence.</p>
 *
 * <h2>Write Path Guarantees</h2>
 * <ul>
 *   <li><strong>Atomicity:</strong> Entity write and audit append commit together or not at all</li>
 *   <li><strong>Append-only:</strong> No SPI method updates or deletes audit records</li>
 *   <li><strong>Serialization:</strong> Writes to one row (and its chain) are serialized by the row lock</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.core.spi;
