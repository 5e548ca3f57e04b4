package com.ryuqq.integrity.adapter.runtime.audit;

import com.ryuqq.integrity.application.audit.AuditQuery;
import com.ryuqq.integrity.core.audit.AuditRecord;
import com.ryuqq.integrity.core.audit.ChainHasher;
import com.ryuqq.integrity.core.audit.VerificationFailure;
import com.ryuqq.integrity.core.audit.VerificationResult;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.spi.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 감사 체인 검증기 (AuditQuery 구현체).
 *
 * <p>체인을 커밋 순서대로 걸으며 내용만으로 기대 해시를 재계산합니다:</p>
 * <pre>
 * expected[0] = (empty)
 * expected[i] = SHA256(expected[i-1] || canonical(after[i]))
 *
 * ok[i] = stored.previousHash[i] == expected[i-1]
 *      &amp;&amp; stored.currentHash[i]  == expected[i]
 * </pre>
 *
 * <p>기대 체인은 저장된 해시를 이어받지 않으므로, 한 위치의 변조는 그 위치와 이후 모든 위치를
 * 실패로 표시합니다. 변조 증거는 ERROR로 기록만 하고 복구하지 않습니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class ChainVerifier implements AuditQuery {

    private static final Logger log = LoggerFactory.getLogger(ChainVerifier.class);

    private final AuditLog auditLog;

    /**
     * 생성자.
     *
     * @param auditLog 감사 로그
     * @throws IllegalArgumentException auditLog가 null인 경우
     */
    public ChainVerifier(AuditLog auditLog) {
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        this.auditLog = auditLog;
    }

    @Override
    public List<AuditRecord> getHistory(EntityType target, EntityId targetId) {
        requireTarget(target, targetId);
        return auditLog.history(target, targetId);
    }

    @Override
    public List<VerificationResult> verifyChain(EntityType target, EntityId targetId) {
        requireTarget(target, targetId);
        List<AuditRecord> chain = auditLog.history(target, targetId);
        List<VerificationResult> results = new ArrayList<>(chain.size());

        byte[] expectedPrevious = ChainHasher.EMPTY;
        int position = 0;
        for (AuditRecord record : chain) {
            position++;
            byte[] expectedCurrent = ChainHasher.next(expectedPrevious, record.getAfter());

            VerificationFailure failure;
            if (!Arrays.equals(record.getPreviousHash(), expectedPrevious)) {
                failure = VerificationFailure.PREVIOUS_HASH_MISMATCH;
            } else if (!Arrays.equals(record.getCurrentHash(), expectedCurrent)) {
                failure = VerificationFailure.CONTENT_HASH_MISMATCH;
            } else {
                failure = VerificationFailure.NONE;
            }

            results.add(new VerificationResult(
                position,
                record.getSequence(),
                failure == VerificationFailure.NONE,
                ChainHasher.toHex(expectedPrevious),
                record.getPreviousHashHex(),
                failure
            ));
            expectedPrevious = expectedCurrent;
        }

        results.stream()
            .filter(r -> !r.ok())
            .findFirst()
            .ifPresent(first -> log.error("Audit chain {}/{} broken from position {} of {} ({})",
                target.getValue(), targetId.getValue(), first.position(), results.size(), first.failure()));
        return results;
    }

    private static void requireTarget(EntityType target, EntityId targetId) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (targetId == null) {
            throw new IllegalArgumentException("targetId cannot be null");
        }
    }
}
