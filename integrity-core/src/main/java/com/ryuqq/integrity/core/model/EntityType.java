package com.ryuqq.integrity.core.model;

/**
 * 감사 대상 엔티티 타입 (테이블 이름에 해당).
 *
 * <p>감사 레코드의 {@code target}, 실시간 이벤트의 {@code type}으로 사용됩니다.</p>
 *
 * <p><strong>예시:</strong> factories, users, work_orders, skus</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 소문자로 시작, 소문자/숫자/언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class EntityType {

    private final String value;

    private EntityType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityType cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("EntityType length cannot exceed 100 characters");
        }
        if (!value.matches("^[a-z][a-z0-9_]*$")) {
            throw new IllegalArgumentException("EntityType must be lower snake case: " + value);
        }
        this.value = value;
    }

    /**
     * EntityType 생성.
     *
     * @param value 타입 이름
     * @return EntityType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityType of(String value) {
        return new EntityType(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityType that = (EntityType) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityType{" + value + '}';
    }
}
