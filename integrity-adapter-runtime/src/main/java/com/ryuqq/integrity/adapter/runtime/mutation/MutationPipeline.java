package com.ryuqq.integrity.adapter.runtime.mutation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.adapter.runtime.realtime.ChangeNotifier;
import com.ryuqq.integrity.application.mutation.MutationApi;
import com.ryuqq.integrity.core.audit.AuditEntry;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.outcome.AuthorizationViolation;
import com.ryuqq.integrity.core.outcome.Committed;
import com.ryuqq.integrity.core.outcome.MutationResult;
import com.ryuqq.integrity.core.outcome.OptimisticLockConflict;
import com.ryuqq.integrity.core.policy.Operation;
import com.ryuqq.integrity.core.policy.PolicyEngine;
import com.ryuqq.integrity.core.realtime.ChangeEvent;
import com.ryuqq.integrity.core.spi.EntityReader;
import com.ryuqq.integrity.core.spi.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MutationApi 구현체 (변경 파이프라인).
 *
 * <p>모든 쓰기는 하나의 {@link UnitOfWork} 안에서 다음 순서로 실행됩니다:</p>
 * <pre>
 * 1. 행 잠금 + 현재 상태 조회
 * 2. 권한 검사 (없는 행과 범위 밖 행은 동일한 AuthorizationViolation)
 * 3. 버전 검사 (불일치 → OptimisticLockConflict)
 * 4. 패치 적용 + 버전 증가
 * 5. 감사 레코드 추가
 * 6. 커밋 → 실시간 이벤트 게시 (커밋 이후, 실패해도 결과에 영향 없음)
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>충돌과 거부는 상태 변경도, 감사 레코드도 만들지 않음</li>
 *   <li>같은 버전 N을 읽은 두 호출자 중 하나만 성공</li>
 *   <li>factoryId는 변경 불가: 권한 없는 공장으로의 이동은 거부, 권한 있는 공장이라도 IllegalArgumentException</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> 상태가 없으며, 동시성 제어는 UnitOfWork의 행 잠금에 위임합니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class MutationPipeline implements MutationApi {

    private static final Logger log = LoggerFactory.getLogger(MutationPipeline.class);

    private final PolicyEngine policyEngine;
    private final EntityReader entityReader;
    private final UnitOfWork unitOfWork;
    private final ChangeNotifier changeNotifier;
    private final Clock clock;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     */
    public MutationPipeline(PolicyEngine policyEngine, EntityReader entityReader,
                            UnitOfWork unitOfWork, ChangeNotifier changeNotifier) {
        this(policyEngine, entityReader, unitOfWork, changeNotifier, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param policyEngine 권한 엔진
     * @param entityReader 커밋된 엔티티 조회
     * @param unitOfWork 원자적 작업 단위
     * @param changeNotifier 실시간 이벤트 게시자
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MutationPipeline(PolicyEngine policyEngine, EntityReader entityReader, UnitOfWork unitOfWork,
                            ChangeNotifier changeNotifier, Clock clock) {
        if (policyEngine == null) {
            throw new IllegalArgumentException("policyEngine cannot be null");
        }
        if (entityReader == null) {
            throw new IllegalArgumentException("entityReader cannot be null");
        }
        if (unitOfWork == null) {
            throw new IllegalArgumentException("unitOfWork cannot be null");
        }
        if (changeNotifier == null) {
            throw new IllegalArgumentException("changeNotifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.policyEngine = policyEngine;
        this.entityReader = entityReader;
        this.unitOfWork = unitOfWork;
        this.changeNotifier = changeNotifier;
        this.clock = clock;
    }

    @Override
    public MutationResult create(EntityType type, FactoryId factoryId, ObjectNode payload, Principal principal) {
        requireNonNull(type, "type");
        requireNonNull(factoryId, "factoryId");
        requireNonNull(payload, "payload");
        requireNonNull(principal, "principal");

        if (!policyEngine.authorizeWrite(principal, type, null, factoryId, Operation.INSERT).isAllowed()) {
            log.debug("Create denied: actor={}, type={}, factory={}", principal.actorId(), type.getValue(), factoryId.getValue());
            return AuthorizationViolation.of(Operation.INSERT);
        }

        Instant now = clock.instant();
        ScopedEntity entity = ScopedEntity.create(type, EntityId.random(), factoryId, payload, now);
        EntityRef ref = entity.getRef();

        MutationResult result = unitOfWork.execute(ref, tx -> {
            tx.insert(entity);
            tx.appendAudit(AuditEntry.of(ref, ChangeAction.CREATE, null, entity.toImage(), principal, now));
            return Committed.of(entity, ChangeAction.CREATE);
        });

        publishIfCommitted(result, List.of(), now);
        return result;
    }

    @Override
    public MutationResult mutate(EntityType type, EntityId id, long expectedVersion, ObjectNode patch, Principal principal) {
        return update(type, id, expectedVersion, patch, principal, ChangeAction.UPDATE);
    }

    @Override
    public MutationResult approve(EntityType type, EntityId id, long expectedVersion, ObjectNode patch, Principal principal) {
        return update(type, id, expectedVersion, patch, principal, ChangeAction.APPROVE);
    }

    @Override
    public MutationResult reject(EntityType type, EntityId id, long expectedVersion, ObjectNode patch, Principal principal) {
        return update(type, id, expectedVersion, patch, principal, ChangeAction.REJECT);
    }

    @Override
    public MutationResult delete(EntityType type, EntityId id, Principal principal) {
        requireNonNull(type, "type");
        requireNonNull(id, "id");
        requireNonNull(principal, "principal");

        if (!policyEngine.getDeletePolicy().isDeletable(type)) {
            log.debug("Delete denied by policy: actor={}, type={}", principal.actorId(), type.getValue());
            return AuthorizationViolation.of(Operation.DELETE);
        }

        EntityRef ref = EntityRef.of(type, id);
        Instant now = clock.instant();

        MutationResult result = unitOfWork.execute(ref, tx -> {
            Optional<ScopedEntity> found = tx.find(ref);
            if (found.isEmpty() || !policyEngine.authorize(principal, found.get(), Operation.DELETE).isAllowed()) {
                return AuthorizationViolation.of(Operation.DELETE);
            }
            ScopedEntity current = found.get();
            tx.delete(ref);
            tx.appendAudit(AuditEntry.of(ref, ChangeAction.DELETE, current.toImage(), AuditEntry.tombstone(), principal, now));
            return Committed.deleted(ref, current.getFactoryId(), current.getVersion() + 1);
        });

        logOutcome(ref, principal, result);
        publishIfCommitted(result, List.of(), now);
        return result;
    }

    @Override
    public Optional<ScopedEntity> find(EntityType type, EntityId id, Principal principal) {
        requireNonNull(principal, "principal");
        return entityReader.find(EntityRef.of(type, id))
            .filter(entity -> policyEngine.authorize(principal, entity, Operation.READ).isAllowed());
    }

    @Override
    public List<ScopedEntity> list(EntityType type, FactoryId factoryId, Principal principal) {
        requireNonNull(type, "type");
        requireNonNull(factoryId, "factoryId");
        requireNonNull(principal, "principal");
        if (!policyEngine.authorize(principal, type, factoryId, Operation.READ).isAllowed()) {
            return List.of();
        }
        return policyEngine.filterReadable(principal, entityReader.list(type, factoryId));
    }

    private MutationResult update(EntityType type, EntityId id, long expectedVersion, ObjectNode patch,
                                  Principal principal, ChangeAction action) {
        requireNonNull(type, "type");
        requireNonNull(id, "id");
        requireNonNull(patch, "patch");
        requireNonNull(principal, "principal");

        if (patch.has("factoryId")) {
            return rejectFactoryMove(type, patch.get("factoryId"), principal);
        }
        ScopedEntity.requireNoReservedKeys(patch);

        EntityRef ref = EntityRef.of(type, id);
        Instant now = clock.instant();

        MutationResult result = unitOfWork.execute(ref, tx -> {
            Optional<ScopedEntity> found = tx.find(ref);
            if (found.isEmpty() || !policyEngine.authorize(principal, found.get(), Operation.UPDATE).isAllowed()) {
                return AuthorizationViolation.of(Operation.UPDATE);
            }
            ScopedEntity current = found.get();
            if (current.getVersion() != expectedVersion) {
                return OptimisticLockConflict.of(current.getVersion(), expectedVersion);
            }
            ScopedEntity next = current.applyPatch(patch, now);
            tx.update(next);
            tx.appendAudit(AuditEntry.of(ref, action, current.toImage(), next.toImage(), principal, now));
            return Committed.of(next, action);
        });

        logOutcome(ref, principal, result);
        publishIfCommitted(result, ScopedEntity.changedKeys(patch), now);
        return result;
    }

    /**
     * factoryId 변경 시도 처리.
     *
     * <p>대상 공장에 권한이 없으면 거부(WITH CHECK), 권한이 있어도 factoryId는 불변이므로
     * IllegalArgumentException입니다. 행 조회 전에 판정하므로 행의 존재 여부가 드러나지 않습니다.</p>
     */
    private MutationResult rejectFactoryMove(EntityType type, JsonNode requested, Principal principal) {
        FactoryId target;
        try {
            target = FactoryId.of(requested.isTextual() ? requested.asText() : null);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("factoryId is immutable and cannot be written", e);
        }
        if (!policyEngine.authorize(principal, type, target, Operation.UPDATE).isAllowed()) {
            log.debug("Factory move denied: actor={}, type={}, target={}", principal.actorId(), type.getValue(), target.getValue());
            return AuthorizationViolation.of(Operation.UPDATE);
        }
        throw new IllegalArgumentException("factoryId is immutable and cannot be written");
    }

    private void logOutcome(EntityRef ref, Principal principal, MutationResult result) {
        if (result instanceof OptimisticLockConflict conflict) {
            log.debug("Version conflict on {}: current={}, attempted={}", ref, conflict.currentVersion(), conflict.attemptedVersion());
        } else if (result instanceof AuthorizationViolation violation) {
            log.debug("{} denied on {} for actor={}", violation.operation(), ref, principal.actorId());
        }
    }

    private void publishIfCommitted(MutationResult result, List<String> changedKeys, Instant now) {
        if (!(result instanceof Committed committed)) {
            return;
        }
        log.debug("Committed {} {} at version {}", committed.action(), committed.ref(), committed.version());
        try {
            changeNotifier.publish(ChangeEvent.from(committed, changedKeys, now));
        } catch (RuntimeException e) {
            // mutation is already durable; clients catch up on their next refetch
            log.error("Change notification failed for committed {} {}", committed.action(), committed.ref(), e);
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
