/**
 * In-memory store adapters.
 *
 * <p>{@link com.ryuqq.integrity.adapter.inmemory.store.InMemoryStore} implements the row-locked
 * unit of work, committed entity reads and the read-only audit log over one in-process data set.
 * {@link com.ryuqq.integrity.adapter.inmemory.store.InMemoryCheckpointStore} keeps daily checkpoints.</p>
 *
 * <p>Both are reference implementations for tests and local development; data is lost on restart.</p>
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.adapter.inmemory.store;
