package com.ryuqq.integrity.core.audit;

import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;

import java.util.Comparator;

/**
 * 체인 헤드: 하나의 (target, targetId) 체인에서 가장 최근 레코드의 해시.
 *
 * @param target 대상 타입
 * @param targetId 대상 ID
 * @param headHash 헤드 해시 (hex)
 * @param sequence 헤드 레코드의 커밋 순번
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record ChainHead(
    EntityType target,
    EntityId targetId,
    String headHash,
    long sequence
) {

    /**
     * 체크포인트 다이제스트 정렬 순서: target, targetId 문자열 오름차순.
     */
    public static final Comparator<ChainHead> DIGEST_ORDER = Comparator
        .comparing((ChainHead h) -> h.target().getValue())
        .thenComparing(h -> h.targetId().getValue());

    public ChainHead {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (targetId == null) {
            throw new IllegalArgumentException("targetId cannot be null");
        }
        if (headHash == null || headHash.isBlank()) {
            throw new IllegalArgumentException("headHash cannot be null or blank");
        }
    }

    /**
     * 레코드로부터 헤드 생성 (저장된 currentHash 사용).
     *
     * @param record 체인의 마지막 레코드
     * @return ChainHead
     */
    public static ChainHead of(AuditRecord record) {
        return new ChainHead(record.getTarget(), record.getTargetId(), record.getCurrentHashHex(), record.getSequence());
    }

    /**
     * 다이제스트 구성 요소 {@code hex(head):target:targetId}.
     */
    public String digestToken() {
        return headHash + ":" + target.getValue() + ":" + targetId.getValue();
    }
}
