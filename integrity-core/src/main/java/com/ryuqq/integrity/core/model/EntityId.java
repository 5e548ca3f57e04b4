package com.ryuqq.integrity.core.model;

/**
 * ScopedEntity 행(row) 식별자.
 *
 * <p>감사 체인에서는 {@code targetId}로, 실시간 채널에서는 {@code doc:<type>:<id>}의
 * id 부분으로 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class EntityId {

    private final String value;

    private EntityId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("EntityId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("EntityId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * EntityId 생성.
     *
     * @param value EntityId 값
     * @return EntityId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityId of(String value) {
        return new EntityId(value);
    }

    /**
     * UUID 기반 EntityId 생성.
     *
     * @return 새 EntityId
     */
    public static EntityId random() {
        return new EntityId(java.util.UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityId entityId = (EntityId) o;
        return value.equals(entityId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityId{" + value + '}';
    }
}
