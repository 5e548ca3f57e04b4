/**
 * Tamper-evident audit chain.
 *
 * <p>Every committed mutation appends one {@link com.ryuqq.integrity.core.audit.AuditRecord}
 * whose hash links it to the previous record of the same {@code (target, targetId)} chain.
 * Tampering is not prevented; it becomes detectable by re-walking the chain or by comparing
 * against a daily {@link com.ryuqq.integrity.core.audit.Checkpoint}.</p>
 *
 * <h2>Hashing</h2>
 * <pre>
 * currentHash = SHA256(previousHash || utf8(canonical(after)))
 * checkpoint  = SHA256(utf8(join(",", hex(head) + ":" + target + ":" + targetId)))
 * </pre>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.core.audit.CanonicalJson} - Recursive key-sorted JSON form</li>
 *   <li>{@link com.ryuqq.integrity.core.audit.ChainHasher} - SHA-256 link computation</li>
 *   <li>{@link com.ryuqq.integrity.core.audit.CheckpointDigest} - Digest over chain heads</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Integrity Team
 */
package com.ryuqq.integrity.core.audit;
