package com.ryuqq.integrity.core.audit;

/**
 * 체인 검증 실패 유형.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public enum VerificationFailure {

    /** 정상 */
    NONE,

    /** 저장된 previousHash가 재계산한 직전 해시와 다름 */
    PREVIOUS_HASH_MISMATCH,

    /** previousHash는 일치하지만 저장된 currentHash가 내용으로 재계산한 해시와 다름 */
    CONTENT_HASH_MISMATCH
}
