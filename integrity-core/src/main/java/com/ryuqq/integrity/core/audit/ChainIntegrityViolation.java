package com.ryuqq.integrity.core.audit;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 체크포인트 불일치 보고.
 *
 * <p>운영자 채널로 전달되며 자동 복구하지 않습니다. 저장소도 롤백하지 않습니다.</p>
 *
 * @param checkpointDay 비교 대상 체크포인트 날짜
 * @param expectedHeadHash 체크포인트에 기록된 다이제스트, 또는 체크포인트 이후 구간이면 저장된 헤드의 다이제스트
 * @param actualHeadHash 현재 다시 만든 다이제스트
 * @param throughSequence 비교 범위 (최대 감사 순번)
 * @param detectedAt 감지 시각
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record ChainIntegrityViolation(
    LocalDate checkpointDay,
    String expectedHeadHash,
    String actualHeadHash,
    long throughSequence,
    Instant detectedAt
) {

    public ChainIntegrityViolation {
        if (checkpointDay == null) {
            throw new IllegalArgumentException("checkpointDay cannot be null");
        }
        if (expectedHeadHash == null || actualHeadHash == null) {
            throw new IllegalArgumentException("head hashes cannot be null");
        }
        if (detectedAt == null) {
            throw new IllegalArgumentException("detectedAt cannot be null");
        }
    }
}
