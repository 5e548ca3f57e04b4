package com.ryuqq.integrity.core.audit;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 일일 체크포인트.
 *
 * <p>하루에 하나만 존재하며, 이미 존재하는 날짜에는 기록되지 않습니다 (insert-if-absent).</p>
 *
 * @param day 체크포인트 날짜
 * @param headHash 모든 체인 헤드의 다이제스트 (hex)
 * @param meta 체인 수와 포함 범위
 * @param createdAt 생성 시각
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record Checkpoint(
    LocalDate day,
    String headHash,
    CheckpointMeta meta,
    Instant createdAt
) {

    public Checkpoint {
        if (day == null) {
            throw new IllegalArgumentException("day cannot be null");
        }
        if (headHash == null || headHash.isBlank()) {
            throw new IllegalArgumentException("headHash cannot be null or blank");
        }
        if (meta == null) {
            throw new IllegalArgumentException("meta cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }
}
