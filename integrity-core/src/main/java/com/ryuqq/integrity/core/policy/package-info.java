/**
 * Factory-scoped authorization.
 *
 * <p>{@link com.ryuqq.integrity.core.policy.PolicyEngine} replaces declarative row-level
 * security with one explicit predicate that the mutation pipeline enforces at the
 * data-access boundary, independent of the underlying store.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.core.policy.Operation} - READ, INSERT, UPDATE, DELETE</li>
 *   <li>{@link com.ryuqq.integrity.core.policy.Decision} - ALLOW or DENY</li>
 *   <li>{@link com.ryuqq.integrity.core.policy.DeletePolicy} - Per-type hard delete opt-in</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.core.policy;
