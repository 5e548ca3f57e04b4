package com.ryuqq.integrity.core.outcome;

/**
 * 변경(mutation) 실행 결과.
 *
 * <p>MutationResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Committed}: 커밋됨 (버전 증가 + 감사 레코드 추가)</li>
 *   <li>{@link OptimisticLockConflict}: 버전 충돌, 최신 버전으로 재시도 가능</li>
 *   <li>{@link AuthorizationViolation}: 권한 없음 또는 대상 없음 (구분하지 않음)</li>
 * </ul>
 *
 * <p>충돌과 거부는 예외로 던지지 않고 타입으로 반환합니다. 두 경우 모두 상태 변경과
 * 감사 레코드가 발생하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MutationResult result = api.mutate(type, id, 3, patch, principal);
 * if (result instanceof OptimisticLockConflict conflict) {
 *     // conflict.currentVersion()으로 다시 읽고 재시도
 * }
 * </pre>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public sealed interface MutationResult permits Committed, OptimisticLockConflict, AuthorizationViolation {

    /**
     * 커밋 여부.
     *
     * @return 커밋되었으면 true
     */
    default boolean isCommitted() {
        return this instanceof Committed;
    }

    /**
     * 버전 충돌 여부.
     *
     * @return 충돌이면 true
     */
    default boolean isConflict() {
        return this instanceof OptimisticLockConflict;
    }

    /**
     * 권한 거부 여부.
     *
     * @return 거부되었으면 true
     */
    default boolean isDenied() {
        return this instanceof AuthorizationViolation;
    }
}
