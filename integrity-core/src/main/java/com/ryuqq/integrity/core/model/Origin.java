package com.ryuqq.integrity.core.model;

/**
 * 요청 출처 정보.
 *
 * <p>감사 레코드의 {@code ip}, {@code ua} 컬럼으로 기록됩니다. 두 값 모두 null 허용입니다.</p>
 *
 * @param ip 클라이언트 IP (null 가능)
 * @param userAgent User-Agent 헤더 (null 가능)
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record Origin(String ip, String userAgent) {

    private static final Origin UNKNOWN = new Origin(null, null);

    /**
     * 출처 정보가 없는 경우 (배치 작업, 테스트 등).
     *
     * @return 빈 Origin
     */
    public static Origin unknown() {
        return UNKNOWN;
    }

    public static Origin of(String ip, String userAgent) {
        return new Origin(ip, userAgent);
    }
}
