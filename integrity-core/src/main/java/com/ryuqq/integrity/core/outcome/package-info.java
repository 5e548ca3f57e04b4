/**
 * Typed mutation results.
 *
 * <p>{@link com.ryuqq.integrity.core.outcome.MutationResult} is a sealed interface so that
 * callers handle every case: commit, optimistic lock conflict and authorization violation.
 * Conflicts and denials are values, not exceptions, and carry stable error codes
 * ({@code VERSION_CONFLICT}, {@code ACCESS_DENIED}).</p>
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.core.outcome;
