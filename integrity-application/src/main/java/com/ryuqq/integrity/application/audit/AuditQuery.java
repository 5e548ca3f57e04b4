package com.ryuqq.integrity.application.audit;

import com.ryuqq.integrity.core.audit.AuditRecord;
import com.ryuqq.integrity.core.audit.VerificationResult;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;

import java.util.List;

/**
 * 감사 이력 조회 및 체인 검증.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;VerificationResult&gt; results = auditQuery.verifyChain(type, id);
 * boolean intact = results.stream().allMatch(VerificationResult::ok);
 * </pre>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface AuditQuery {

    /**
     * 체인의 감사 레코드를 커밋 순서로 조회.
     *
     * @param target 대상 타입
     * @param targetId 대상 ID
     * @return 감사 레코드 목록 (없으면 빈 목록)
     */
    List<AuditRecord> getHistory(EntityType target, EntityId targetId);

    /**
     * 체인 검증.
     *
     * <p>커밋 순서대로 해시를 재계산하여 위치별 결과를 반환합니다. 변조 증거는 보고만 하며
     * 복구하지 않습니다.</p>
     *
     * @param target 대상 타입
     * @param targetId 대상 ID
     * @return 위치별 검증 결과 (레코드가 없으면 빈 목록)
     */
    List<VerificationResult> verifyChain(EntityType target, EntityId targetId);
}
