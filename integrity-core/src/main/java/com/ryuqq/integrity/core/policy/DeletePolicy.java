package com.ryuqq.integrity.core.policy;

import com.ryuqq.integrity.core.model.EntityType;

import java.util.Set;

/**
 * 엔티티 타입별 물리 삭제 허용 목록.
 *
 * <p>기본값은 모든 타입의 삭제 거부입니다. 목록에 포함된 타입이라도
 * 일반 공장 범위 규칙은 그대로 적용됩니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class DeletePolicy {

    private static final DeletePolicy DENY_ALL = new DeletePolicy(Set.of());

    private final Set<EntityType> deletableTypes;

    private DeletePolicy(Set<EntityType> deletableTypes) {
        if (deletableTypes == null) {
            throw new IllegalArgumentException("deletableTypes cannot be null");
        }
        this.deletableTypes = Set.copyOf(deletableTypes);
    }

    /**
     * 모든 삭제를 거부하는 정책.
     *
     * @return 빈 허용 목록 정책
     */
    public static DeletePolicy denyAll() {
        return DENY_ALL;
    }

    /**
     * 지정한 타입만 삭제를 허용하는 정책.
     *
     * @param types 삭제 허용 타입
     * @return DeletePolicy 인스턴스
     */
    public static DeletePolicy allowing(EntityType... types) {
        return new DeletePolicy(Set.of(types));
    }

    public static DeletePolicy allowing(Set<EntityType> types) {
        return new DeletePolicy(types);
    }

    /**
     * 해당 타입이 삭제 허용 목록에 있는지 확인.
     *
     * @param type 엔티티 타입
     * @return 허용 여부
     */
    public boolean isDeletable(EntityType type) {
        return type != null && deletableTypes.contains(type);
    }

    public Set<EntityType> getDeletableTypes() {
        return deletableTypes;
    }
}
