package com.ryuqq.integrity.core.model;

import java.util.Set;

/**
 * 인증된 호출자의 역할 및 범위 컨텍스트.
 *
 * <p>외부 인증 계층이 요청마다 제공하며, 요청 내에서 불변입니다.</p>
 *
 * <p><strong>범위 규칙:</strong></p>
 * <ul>
 *   <li>isGlobal = true: 모든 공장 접근 가능</li>
 *   <li>isGlobal = false: assignedFactoryIds에 포함된 공장만 접근 가능</li>
 *   <li>assignedFactoryIds가 비어 있으면 아무것도 접근 불가 (오류 아님)</li>
 * </ul>
 *
 * @param actorId 호출자 ID (감사 레코드의 actor)
 * @param role 역할
 * @param assignedFactoryIds 할당된 공장 집합 (불변 복사본)
 * @param isGlobal 전역 여부
 * @param origin 요청 출처
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record Principal(
    String actorId,
    Role role,
    Set<FactoryId> assignedFactoryIds,
    boolean isGlobal,
    Origin origin
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException actorId, role, assignedFactoryIds가 null인 경우
     */
    public Principal {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (assignedFactoryIds == null) {
            throw new IllegalArgumentException("assignedFactoryIds cannot be null");
        }
        assignedFactoryIds = Set.copyOf(assignedFactoryIds);
        if (origin == null) {
            origin = Origin.unknown();
        }
    }

    /**
     * 역할의 기본 전역 여부를 사용하여 Principal 생성.
     *
     * @param actorId 호출자 ID
     * @param role 역할
     * @param assignedFactoryIds 할당된 공장 집합
     * @return Principal 인스턴스
     */
    public static Principal of(String actorId, Role role, Set<FactoryId> assignedFactoryIds) {
        return new Principal(actorId, role, assignedFactoryIds, role.isGlobalByDefault(), Origin.unknown());
    }

    /**
     * 전역 Principal 생성.
     *
     * @param actorId 호출자 ID
     * @param role 역할
     * @return 전역 Principal
     */
    public static Principal global(String actorId, Role role) {
        return new Principal(actorId, role, Set.of(), true, Origin.unknown());
    }

    /**
     * 공장 범위 Principal 생성.
     *
     * @param actorId 호출자 ID
     * @param role 역할
     * @param factoryIds 할당된 공장
     * @return 범위 제한 Principal
     */
    public static Principal scoped(String actorId, Role role, FactoryId... factoryIds) {
        return new Principal(actorId, role, Set.of(factoryIds), false, Origin.unknown());
    }

    /**
     * origin만 변경한 새 인스턴스 생성.
     */
    public Principal withOrigin(Origin origin) {
        return new Principal(actorId, role, assignedFactoryIds, isGlobal, origin);
    }
}
