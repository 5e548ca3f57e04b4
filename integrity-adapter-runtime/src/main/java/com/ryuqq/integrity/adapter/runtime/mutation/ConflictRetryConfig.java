package com.ryuqq.integrity.adapter.runtime.mutation;

/**
 * 충돌 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 3, 총 시도 = maxRetries + 1)</li>
 *   <li>backoffMs: 선형 백오프 단위 (기본 100ms, n번째 재시도 전 backoffMs * n 대기)</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param backoffMs 백오프 단위 (밀리초, 0 이상)
 */
public record ConflictRetryConfig(int maxRetries, long backoffMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, backoffMs=100ms</p>
     */
    public ConflictRetryConfig() {
        this(3, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConflictRetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
        if (backoffMs < 0) {
            throw new IllegalArgumentException(
                "backoffMs cannot be negative (current: " + backoffMs + ")"
            );
        }
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withMaxRetries(int maxRetries) {
        return new ConflictRetryConfig(maxRetries, backoffMs);
    }

    /**
     * backoffMs만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withBackoffMs(long backoffMs) {
        return new ConflictRetryConfig(maxRetries, backoffMs);
    }
}
