package com.ryuqq.integrity.application.mutation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.outcome.MutationResult;

import java.util.List;
import java.util.Optional;

/**
 * 공장 범위 엔티티 변경 API.
 *
 * <p>비즈니스 모듈이 엔티티를 만들고 바꾸는 유일한 경로입니다. 모든 쓰기는 권한 검사,
 * 버전 검사, 패치 적용, 버전 증가, 감사 레코드 추가를 하나의 원자적 작업으로 수행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MutationResult result = api.mutate(type, id, 3, patch, principal);
 *
 * if (result.isCommitted()) {
 *     // 200 OK
 * } else if (result.isConflict()) {
 *     // 409 "다시 시도해 주세요"
 * } else {
 *     // 403 "접근 권한이 없습니다" (대상 없음과 구분하지 않음)
 * }
 * </pre>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface MutationApi {

    /**
     * 엔티티 생성 (version = 1).
     *
     * <p>첫 감사 레코드(CREATE)와 같은 작업 단위에서 커밋됩니다.</p>
     *
     * @param type 엔티티 타입
     * @param factoryId 소속 공장 (INSERT 대상 공장 검사)
     * @param payload 초기 속성 (예약 키 포함 불가)
     * @param principal 호출자
     * @return Committed 또는 AuthorizationViolation
     * @throws IllegalArgumentException 인자가 null이거나 payload에 예약 키가 있는 경우
     */
    MutationResult create(EntityType type, FactoryId factoryId, ObjectNode payload, Principal principal);

    /**
     * 엔티티 변경 (UPDATE).
     *
     * <p>{@code expectedVersion}이 현재 버전과 다르면 상태 변경 없이
     * {@code OptimisticLockConflict(currentVersion, expectedVersion)}을 반환합니다.</p>
     *
     * @param type 엔티티 타입
     * @param id 엔티티 ID
     * @param expectedVersion 호출자가 읽은 버전
     * @param patch 변경할 속성
     * @param principal 호출자
     * @return Committed, OptimisticLockConflict 또는 AuthorizationViolation
     * @throws IllegalArgumentException patch에 예약 키가 있는 경우
     */
    MutationResult mutate(EntityType type, EntityId id, long expectedVersion, ObjectNode patch, Principal principal);

    /**
     * 승인 (APPROVE). 감사/실시간 action이 APPROVE인 것 외에는 {@link #mutate}와 같습니다.
     */
    MutationResult approve(EntityType type, EntityId id, long expectedVersion, ObjectNode patch, Principal principal);

    /**
     * 반려 (REJECT). 감사/실시간 action이 REJECT인 것 외에는 {@link #mutate}와 같습니다.
     */
    MutationResult reject(EntityType type, EntityId id, long expectedVersion, ObjectNode patch, Principal principal);

    /**
     * 물리 삭제.
     *
     * <p>타입이 삭제 허용 목록에 없으면 항상 AuthorizationViolation입니다. 허용된 경우
     * tombstone after 이미지로 감사 레코드를 남깁니다.</p>
     *
     * @param type 엔티티 타입
     * @param id 엔티티 ID
     * @param principal 호출자
     * @return Committed 또는 AuthorizationViolation
     */
    MutationResult delete(EntityType type, EntityId id, Principal principal);

    /**
     * 단건 조회.
     *
     * @return 엔티티 (권한이 없거나 없으면 empty)
     */
    Optional<ScopedEntity> find(EntityType type, EntityId id, Principal principal);

    /**
     * 공장별 목록 조회.
     *
     * @return 엔티티 목록 (권한이 없으면 빈 목록)
     */
    List<ScopedEntity> list(EntityType type, FactoryId factoryId, Principal principal);
}
