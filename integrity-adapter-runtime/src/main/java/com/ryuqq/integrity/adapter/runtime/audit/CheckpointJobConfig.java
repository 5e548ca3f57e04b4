package com.ryuqq.integrity.adapter.runtime.audit;

import java.time.ZoneId;

/**
 * CheckpointJob 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>intervalMs: 실행 주기 (기본 86400000ms = 24시간)</li>
 *   <li>initialDelayMs: 첫 실행 지연 (기본 60000ms = 1분)</li>
 *   <li>zone: 체크포인트 날짜 계산 기준 시간대 (기본 UTC)</li>
 * </ul>
 *
 * <p>하루에 체크포인트는 하나만 기록되므로 주기를 하루보다 짧게 잡아도 같은 날의 재실행은
 * 비교만 수행하고 기록은 건너뜁니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 * @param intervalMs 실행 주기 (밀리초, 양수여야 함)
 * @param initialDelayMs 첫 실행 지연 (밀리초, 0 이상)
 * @param zone 날짜 기준 시간대 (null이 아니어야 함)
 */
public record CheckpointJobConfig(
    long intervalMs,
    long initialDelayMs,
    ZoneId zone
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: intervalMs=86400000ms (24시간), initialDelayMs=60000ms (1분), zone=UTC</p>
     */
    public CheckpointJobConfig() {
        this(86_400_000L, 60_000L, ZoneId.of("UTC"));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CheckpointJobConfig {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs cannot be negative (current: " + initialDelayMs + ")"
            );
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
    }

    /**
     * intervalMs만 변경한 새 인스턴스 생성.
     */
    public CheckpointJobConfig withIntervalMs(long intervalMs) {
        return new CheckpointJobConfig(intervalMs, initialDelayMs, zone);
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public CheckpointJobConfig withInitialDelayMs(long initialDelayMs) {
        return new CheckpointJobConfig(intervalMs, initialDelayMs, zone);
    }

    /**
     * zone만 변경한 새 인스턴스 생성.
     */
    public CheckpointJobConfig withZone(ZoneId zone) {
        return new CheckpointJobConfig(intervalMs, initialDelayMs, zone);
    }
}
