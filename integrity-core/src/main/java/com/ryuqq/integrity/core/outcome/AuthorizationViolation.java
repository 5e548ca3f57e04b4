package com.ryuqq.integrity.core.outcome;

import com.ryuqq.integrity.core.policy.Operation;

/**
 * 권한 거부.
 *
 * <p>대상 행이 존재하지 않는 경우와 범위 밖인 경우를 구분하지 않습니다. 따라서 메시지와
 * 필드에는 행의 존재 여부를 추론할 수 있는 정보가 들어가지 않습니다.</p>
 *
 * @param operation 거부된 연산
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record AuthorizationViolation(Operation operation) implements MutationResult {

    /**
     * 안정적인 오류 코드.
     */
    public static final String ERROR_CODE = "ACCESS_DENIED";

    public AuthorizationViolation {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }

    public static AuthorizationViolation of(Operation operation) {
        return new AuthorizationViolation(operation);
    }

    public String errorCode() {
        return ERROR_CODE;
    }

    public String message() {
        return "Access denied for " + operation;
    }
}
