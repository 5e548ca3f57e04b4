package com.ryuqq.integrity.core.audit;

import com.ryuqq.integrity.core.model.EntityRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checkpoint digest over all chain heads.
 *
 * <p>{@code SHA256(utf8(join(",", hex(head) + ":" + target + ":" + targetId)))} with heads
 * sorted by {@code (target, targetId)}. An empty head set digests the empty string.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class CheckpointDigest {

    private CheckpointDigest() {
    }

    /**
     * Digest of the given heads, in hex.
     *
     * @param heads chain heads in any order
     * @return hex SHA-256 digest
     */
    public static String digest(Collection<ChainHead> heads) {
        if (heads == null) {
            throw new IllegalArgumentException("heads cannot be null");
        }
        String joined = heads.stream()
            .sorted(ChainHead.DIGEST_ORDER)
            .map(ChainHead::digestToken)
            .collect(Collectors.joining(","));
        return ChainHasher.toHex(ChainHasher.sha256(joined));
    }

    /**
     * Recomputes chain heads from record content alone.
     *
     * <p>Stored hashes are ignored: every chain is re-hashed from its first record, so an
     * edited {@code after} image or a rewritten hash yields a different head than the one
     * the store reports.</p>
     *
     * @param records audit records in commit order
     * @return one recomputed head per chain
     */
    public static List<ChainHead> recomputeHeads(List<AuditRecord> records) {
        return recomputeHeads(List.of(), records);
    }

    /**
     * Rolls known heads forward over later records, re-hashing from content.
     *
     * <p>Each chain continues from its head in {@code base} (or from the empty hash if it has
     * none). Chains without records in {@code records} keep their base head.</p>
     *
     * @param base heads as of the sequence just before {@code records}
     * @param records audit records in commit order
     * @return one head per chain in base or records
     */
    public static List<ChainHead> recomputeHeads(Collection<ChainHead> base, List<AuditRecord> records) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        Map<EntityRef, ChainHead> heads = new LinkedHashMap<>();
        Map<EntityRef, byte[]> expected = new HashMap<>();
        for (ChainHead head : base) {
            EntityRef ref = EntityRef.of(head.target(), head.targetId());
            heads.put(ref, head);
            expected.put(ref, ChainHasher.fromHex(head.headHash()));
        }
        for (AuditRecord record : records) {
            EntityRef ref = record.getRef();
            byte[] current = ChainHasher.next(expected.getOrDefault(ref, ChainHasher.EMPTY), record.getAfter());
            expected.put(ref, current);
            heads.put(ref, new ChainHead(ref.type(), ref.id(), ChainHasher.toHex(current), record.getSequence()));
        }
        return new ArrayList<>(heads.values());
    }
}
