package com.ryuqq.integrity.core.model;

/**
 * Principal 역할.
 *
 * <p>CEO와 DIRECTOR는 기본적으로 전역(global) 역할이며, 공장 관리자/작업자는 공장 범위로 제한됩니다.
 * OFFICE의 전역 여부는 인증 계층이 {@link Principal#isGlobal()}로 결정합니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public enum Role {

    CEO(true),
    DIRECTOR(true),
    FACTORY_MANAGER(false),
    FACTORY_WORKER(false),
    OFFICE(false);

    private final boolean globalByDefault;

    Role(boolean globalByDefault) {
        this.globalByDefault = globalByDefault;
    }

    /**
     * 이 역할의 기본 전역 여부.
     *
     * @return 기본적으로 모든 공장에 접근 가능하면 true
     */
    public boolean isGlobalByDefault() {
        return globalByDefault;
    }
}
