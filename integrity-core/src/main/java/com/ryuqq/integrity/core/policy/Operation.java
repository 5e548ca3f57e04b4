package com.ryuqq.integrity.core.policy;

/**
 * 권한 검사 대상 연산.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public enum Operation {
    READ,
    INSERT,
    UPDATE,
    DELETE;

    /**
     * 쓰기 연산 여부.
     *
     * @return INSERT, UPDATE, DELETE이면 true
     */
    public boolean isWrite() {
        return this != READ;
    }
}
