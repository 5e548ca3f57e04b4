package com.ryuqq.integrity.adapter.runtime.realtime;

/**
 * ChangeCoalescer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>windowMs: 디바운스 창 (기본 350ms, 250~500ms). 이벤트가 올 때마다 다시 시작됩니다</li>
 *   <li>maxDelayMs: 첫 대기 이벤트부터 flush까지 최대 지연 (기본 1000ms, windowMs 이상)</li>
 * </ul>
 *
 * <p>maxDelayMs는 이벤트가 끊이지 않는 동안 flush가 무한히 밀리는 것을 막습니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 * @param windowMs 디바운스 창 (밀리초, 250~500)
 * @param maxDelayMs 최대 지연 (밀리초, windowMs 이상)
 */
public record CoalescerConfig(long windowMs, long maxDelayMs) {

    public static final long MIN_WINDOW_MS = 250;
    public static final long MAX_WINDOW_MS = 500;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: windowMs=350ms, maxDelayMs=1000ms</p>
     */
    public CoalescerConfig() {
        this(350, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoalescerConfig {
        if (windowMs < MIN_WINDOW_MS || windowMs > MAX_WINDOW_MS) {
            throw new IllegalArgumentException(
                "windowMs must be between " + MIN_WINDOW_MS + " and " + MAX_WINDOW_MS + " (current: " + windowMs + ")"
            );
        }
        if (maxDelayMs < windowMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be at least windowMs (current: " + maxDelayMs + ", windowMs: " + windowMs + ")"
            );
        }
    }

    /**
     * windowMs만 변경한 새 인스턴스 생성.
     */
    public CoalescerConfig withWindowMs(long windowMs) {
        return new CoalescerConfig(windowMs, Math.max(maxDelayMs, windowMs));
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public CoalescerConfig withMaxDelayMs(long maxDelayMs) {
        return new CoalescerConfig(windowMs, maxDelayMs);
    }
}
