package com.ryuqq.integrity.core.audit;

/**
 * 체인 내 한 위치의 검증 결과.
 *
 * <p>재계산은 내용만으로 진행되므로, 한 위치에서 변조가 발견되면 그 이후의 모든 위치도
 * ok = false가 됩니다.</p>
 *
 * @param position 체인 내 위치 (1부터 시작)
 * @param sequence 레코드의 커밋 순번
 * @param ok 일치 여부
 * @param expectedPrevHash 재계산한 직전 해시 (hex, 첫 위치는 빈 문자열)
 * @param actualPrevHash 저장된 previousHash (hex)
 * @param failure 실패 유형
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record VerificationResult(
    int position,
    long sequence,
    boolean ok,
    String expectedPrevHash,
    String actualPrevHash,
    VerificationFailure failure
) {

    public VerificationResult {
        if (position < 1) {
            throw new IllegalArgumentException("position must be positive (current: " + position + ")");
        }
        if (expectedPrevHash == null) {
            throw new IllegalArgumentException("expectedPrevHash cannot be null");
        }
        if (actualPrevHash == null) {
            throw new IllegalArgumentException("actualPrevHash cannot be null");
        }
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (ok != (failure == VerificationFailure.NONE)) {
            throw new IllegalArgumentException("ok must be true exactly when failure is NONE");
        }
    }
}
