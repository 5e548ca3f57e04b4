package com.ryuqq.integrity.core.model;

/**
 * 공장(Factory) 식별자.
 *
 * <p>모든 ScopedEntity는 정확히 하나의 공장에 속하며, 비전역 Principal의 접근 범위는
 * FactoryId 집합으로 표현됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용 (채널 이름 구분자 ':' 금지)</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class FactoryId {

    private final String value;

    private FactoryId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FactoryId cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("FactoryId length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("FactoryId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * FactoryId 생성.
     *
     * @param value FactoryId 값
     * @return FactoryId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static FactoryId of(String value) {
        return new FactoryId(value);
    }

    /**
     * FactoryId 값 조회.
     *
     * @return FactoryId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FactoryId factoryId = (FactoryId) o;
        return value.equals(factoryId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "FactoryId{" + value + '}';
    }
}
