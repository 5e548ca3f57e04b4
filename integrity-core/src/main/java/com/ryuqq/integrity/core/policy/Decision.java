package com.ryuqq.integrity.core.policy;

/**
 * 권한 판정 결과.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public enum Decision {
    ALLOW,
    DENY;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
