package com.ryuqq.integrity.core.model;

/**
 * (type, id) 복합 키.
 *
 * <p>행 잠금 단위이자 감사 체인 하나의 식별자 {@code (target, targetId)}입니다.</p>
 *
 * @param type 엔티티 타입
 * @param id 엔티티 ID
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record EntityRef(EntityType type, EntityId id) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type 또는 id가 null인 경우
     */
    public EntityRef {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    public static EntityRef of(EntityType type, EntityId id) {
        return new EntityRef(type, id);
    }

    public static EntityRef of(String type, String id) {
        return new EntityRef(EntityType.of(type), EntityId.of(id));
    }
}
