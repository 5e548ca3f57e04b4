package com.ryuqq.integrity.core.outcome;

import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.ScopedEntity;

/**
 * 커밋된 변경.
 *
 * <p>DELETE의 경우 엔티티가 더 이상 존재하지 않으므로 {@code entity}는 null이며,
 * {@code version}은 마지막 버전 + 1 (삭제 이벤트의 버전)입니다.</p>
 *
 * @param ref 대상 (type, id)
 * @param factoryId 소속 공장
 * @param version 커밋 후 버전
 * @param action 변경 종류
 * @param entity 커밋 후 엔티티 (DELETE이면 null)
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record Committed(
    EntityRef ref,
    FactoryId factoryId,
    long version,
    ChangeAction action,
    ScopedEntity entity
) implements MutationResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 누락되었거나 DELETE 외의 변경에 entity가 없는 경우
     */
    public Committed {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (factoryId == null) {
            throw new IllegalArgumentException("factoryId cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be at least 1 (current: " + version + ")");
        }
        if (entity == null && action != ChangeAction.DELETE) {
            throw new IllegalArgumentException("entity cannot be null for " + action);
        }
    }

    /**
     * 엔티티 쓰기 결과로부터 생성.
     *
     * @param entity 커밋 후 엔티티
     * @param action 변경 종류
     * @return Committed 인스턴스
     */
    public static Committed of(ScopedEntity entity, ChangeAction action) {
        return new Committed(entity.getRef(), entity.getFactoryId(), entity.getVersion(), action, entity);
    }

    /**
     * 삭제 결과 생성.
     *
     * @param ref 삭제 대상
     * @param factoryId 삭제 전 소속 공장
     * @param tombstoneVersion 삭제 이벤트 버전
     * @return Committed 인스턴스
     */
    public static Committed deleted(EntityRef ref, FactoryId factoryId, long tombstoneVersion) {
        return new Committed(ref, factoryId, tombstoneVersion, ChangeAction.DELETE, null);
    }

    public boolean isTombstone() {
        return action == ChangeAction.DELETE;
    }
}
