package com.ryuqq.integrity.core.outcome;

/**
 * 낙관적 잠금 충돌.
 *
 * <p>호출자가 읽은 버전(attemptedVersion)이 현재 버전과 다릅니다. 호출자는
 * currentVersion으로 다시 읽은 뒤 재시도해야 합니다 ("다시 시도해 주세요").</p>
 *
 * @param currentVersion 저장소의 현재 버전
 * @param attemptedVersion 호출자가 기대한 버전
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record OptimisticLockConflict(
    long currentVersion,
    long attemptedVersion
) implements MutationResult {

    /**
     * 안정적인 오류 코드.
     */
    public static final String ERROR_CODE = "VERSION_CONFLICT";

    public OptimisticLockConflict {
        if (currentVersion < 1) {
            throw new IllegalArgumentException("currentVersion must be at least 1 (current: " + currentVersion + ")");
        }
        if (currentVersion == attemptedVersion) {
            throw new IllegalArgumentException("attemptedVersion must differ from currentVersion (current: " + currentVersion + ")");
        }
    }

    public static OptimisticLockConflict of(long currentVersion, long attemptedVersion) {
        return new OptimisticLockConflict(currentVersion, attemptedVersion);
    }

    public String errorCode() {
        return ERROR_CODE;
    }

    public String message() {
        return "Version conflict: expected " + attemptedVersion + " but current is " + currentVersion;
    }
}
