package com.ryuqq.integrity.adapter.inmemory.store;

/**
 * 작업 단위(UnitOfWork) 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>lockTimeoutMs: 행 잠금 획득 최대 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * <p>잠금은 버전 검사, 패치 적용, 감사 추가 동안만 유지되므로 짧은 시간이면 충분합니다.
 * 시간 초과 시 UnitOfWorkTimeoutException이 발생하고 아무것도 기록되지 않습니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 * @param lockTimeoutMs 행 잠금 대기 시간 (밀리초, 양수여야 함)
 */
public record UnitOfWorkConfig(long lockTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: lockTimeoutMs=5000ms</p>
     */
    public UnitOfWorkConfig() {
        this(5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public UnitOfWorkConfig {
        if (lockTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "lockTimeoutMs must be positive (current: " + lockTimeoutMs + ")"
            );
        }
    }

    /**
     * lockTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public UnitOfWorkConfig withLockTimeoutMs(long lockTimeoutMs) {
        return new UnitOfWorkConfig(lockTimeoutMs);
    }
}
