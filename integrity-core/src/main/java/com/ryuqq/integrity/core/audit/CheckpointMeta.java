package com.ryuqq.integrity.core.audit;

/**
 * 체크포인트 메타데이터.
 *
 * @param count 다이제스트에 포함된 체인 수
 * @param throughSequence 다이제스트가 포함하는 최대 감사 순번 (감사 레코드가 없으면 0)
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record CheckpointMeta(long count, long throughSequence) {

    public CheckpointMeta {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative (current: " + count + ")");
        }
        if (throughSequence < 0) {
            throw new IllegalArgumentException("throughSequence cannot be negative (current: " + throughSequence + ")");
        }
    }
}
