package com.ryuqq.integrity.adapter.runtime.mutation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.adapter.runtime.realtime.ChangeNotifier;
import com.ryuqq.integrity.core.audit.AuditEntry;
import com.ryuqq.integrity.core.json.JsonMappers;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.Role;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.outcome.AuthorizationViolation;
import com.ryuqq.integrity.core.outcome.Committed;
import com.ryuqq.integrity.core.outcome.MutationResult;
import com.ryuqq.integrity.core.outcome.OptimisticLockConflict;
import com.ryuqq.integrity.core.policy.DeletePolicy;
import com.ryuqq.integrity.core.policy.Operation;
import com.ryuqq.integrity.core.policy.PolicyEngine;
import com.ryuqq.integrity.core.realtime.ChangeEvent;
import com.ryuqq.integrity.core.spi.EntityReader;
import com.ryuqq.integrity.core.spi.Transaction;
import com.ryuqq.integrity.core.spi.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * MutationPipeline 유닛 테스트.
 *
 * <p>쓰기 경로의 판정 순서와 부수 효과를 검증합니다:</p>
 * <ul>
 *   <li>권한 거부 시 트랜잭션/감사/이벤트 없음</li>
 *   <li>권한 판정이 버전 비교보다 먼저</li>
 *   <li>버전 충돌 시 쓰기 없음</li>
 *   <li>커밋 후에만 이벤트 게시</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MutationPipelineTest {

    private static final EntityType WORK_ORDERS = EntityType.of("work_orders");
    private static final FactoryId A = FactoryId.of("A");
    private static final FactoryId B = FactoryId.of("B");
    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    @Mock
    private EntityReader entityReader;

    @Mock
    private UnitOfWork unitOfWork;

    @Mock
    private Transaction tx;

    @Mock
    private ChangeNotifier changeNotifier;

    private MutationPipeline pipeline;

    private final Principal managerOfA = Principal.scoped("fm-a", Role.FACTORY_MANAGER, A);

    @BeforeEach
    void setUp() {
        PolicyEngine policyEngine = new PolicyEngine(DeletePolicy.allowing(EntityType.of("lots")));
        pipeline = new MutationPipeline(policyEngine, entityReader, unitOfWork, changeNotifier,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenTransaction() {
        when(unitOfWork.execute(any(EntityRef.class), ArgumentMatchers.<Function<Transaction, Object>>any()))
            .thenAnswer(invocation -> {
                Function<Transaction, Object> work = invocation.getArgument(1);
                return work.apply(tx);
            });
    }

    private ScopedEntity order(FactoryId factoryId, long version) {
        return ScopedEntity.restore(WORK_ORDERS, EntityId.of("wo-1"), factoryId, version,
            NOW.minusSeconds(60), JsonMappers.readObject("{\"status\":\"open\"}"));
    }

    private ObjectNode patch(String json) {
        return JsonMappers.readObject(json);
    }

    // ============================================================
    // 1. create
    // ============================================================

    @Test
    void create_권한이_있으면_버전1로_커밋되고_감사와_이벤트() {
        // given
        givenTransaction();

        // when
        MutationResult result = pipeline.create(WORK_ORDERS, A, patch("{\"status\":\"open\"}"), managerOfA);

        // then
        assertThat(result.isCommitted()).isTrue();
        Committed committed = (Committed) result;
        assertThat(committed.version()).isEqualTo(1);
        assertThat(committed.entity().getUpdatedAt()).isEqualTo(NOW);

        ArgumentCaptor<AuditEntry> audit = ArgumentCaptor.forClass(AuditEntry.class);
        verify(tx).insert(committed.entity());
        verify(tx).appendAudit(audit.capture());
        assertThat(audit.getValue().action()).isEqualTo(ChangeAction.CREATE);
        assertThat(audit.getValue().before()).isNull();
        assertThat(audit.getValue().actor()).isEqualTo("fm-a");

        ArgumentCaptor<ChangeEvent> event = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(changeNotifier).publish(event.capture());
        assertThat(event.getValue().action()).isEqualTo(ChangeAction.CREATE);
        assertThat(event.getValue().version()).isEqualTo(1);
    }

    @Test
    void create_범위_밖_공장이면_거부되고_트랜잭션_없음() {
        // when
        MutationResult result = pipeline.create(WORK_ORDERS, B, patch("{}"), managerOfA);

        // then
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.INSERT));
        verifyNoInteractions(unitOfWork, changeNotifier);
    }

    // ============================================================
    // 2. update 계열
    // ============================================================

    @Test
    void mutate_버전이_다르면_충돌이고_쓰기_없음() {
        // given
        givenTransaction();
        when(tx.find(any())).thenReturn(Optional.of(order(A, 5)));

        // when
        MutationResult result = pipeline.mutate(WORK_ORDERS, EntityId.of("wo-1"), 4, patch("{\"status\":\"x\"}"), managerOfA);

        // then
        assertThat(result).isEqualTo(OptimisticLockConflict.of(5, 4));
        verify(tx, never()).update(any());
        verify(tx, never()).appendAudit(any());
        verifyNoInteractions(changeNotifier);
    }

    @Test
    void mutate_범위_밖_행은_버전_비교보다_먼저_거부() {
        // given
        givenTransaction();
        when(tx.find(any())).thenReturn(Optional.of(order(B, 5)));

        // when
        MutationResult result = pipeline.mutate(WORK_ORDERS, EntityId.of("wo-1"), 4, patch("{\"status\":\"x\"}"), managerOfA);

        // then
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.UPDATE));
        verify(tx, never()).appendAudit(any());
    }

    @Test
    void mutate_없는_행도_같은_거부_결과() {
        // given
        givenTransaction();
        when(tx.find(any())).thenReturn(Optional.empty());

        // when
        MutationResult result = pipeline.mutate(WORK_ORDERS, EntityId.of("wo-404"), 1, patch("{}"), managerOfA);

        // then
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.UPDATE));
        verifyNoInteractions(changeNotifier);
    }

    @Test
    void approve_성공시_버전이_증가하고_변경_키가_이벤트에_포함() {
        // given
        givenTransaction();
        ScopedEntity current = order(A, 3);
        when(tx.find(any())).thenReturn(Optional.of(current));

        // when
        MutationResult result = pipeline.approve(WORK_ORDERS, EntityId.of("wo-1"), 3,
            patch("{\"status\":\"approved\"}"), managerOfA);

        // then
        Committed committed = (Committed) result;
        assertThat(committed.version()).isEqualTo(4);
        assertThat(committed.action()).isEqualTo(ChangeAction.APPROVE);

        ArgumentCaptor<AuditEntry> audit = ArgumentCaptor.forClass(AuditEntry.class);
        verify(tx).update(committed.entity());
        verify(tx).appendAudit(audit.capture());
        assertThat(audit.getValue().before().get("version").asLong()).isEqualTo(3);
        assertThat(audit.getValue().after().get("version").asLong()).isEqualTo(4);

        ArgumentCaptor<ChangeEvent> event = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(changeNotifier).publish(event.capture());
        assertThat(event.getValue().changedKeys()).containsExactly("status");
        assertThat(event.getValue().data().get("status").asText()).isEqualTo("approved");
    }

    @Test
    void mutate_권한_없는_공장으로_이동하면_거부() {
        // when
        MutationResult result = pipeline.mutate(WORK_ORDERS, EntityId.of("wo-1"), 1, patch("{\"factoryId\":\"B\"}"), managerOfA);

        // then
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.UPDATE));
        verifyNoInteractions(unitOfWork);
    }

    @Test
    void mutate_권한_있는_공장이어도_factoryId는_불변() {
        assertThatThrownBy(() -> pipeline.mutate(WORK_ORDERS, EntityId.of("wo-1"), 1, patch("{\"factoryId\":\"A\"}"), managerOfA))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("immutable");
        verifyNoInteractions(unitOfWork);
    }

    @Test
    void mutate_예약_키는_잠금_전에_거부() {
        assertThatThrownBy(() -> pipeline.mutate(WORK_ORDERS, EntityId.of("wo-1"), 1, patch("{\"version\":9}"), managerOfA))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Reserved key");
        verifyNoInteractions(unitOfWork);
    }

    @Test
    void 알림이_실패해도_커밋_결과를_반환() {
        // given
        givenTransaction();
        when(tx.find(any())).thenReturn(Optional.of(order(A, 1)));
        doThrow(new IllegalStateException("transport down")).when(changeNotifier).publish(any());

        // when
        MutationResult result = pipeline.mutate(WORK_ORDERS, EntityId.of("wo-1"), 1, patch("{\"status\":\"x\"}"), managerOfA);

        // then
        assertThat(result.isCommitted()).isTrue();
    }

    // ============================================================
    // 3. delete
    // ============================================================

    @Test
    void delete_허용되지_않은_타입은_전역_역할도_거부() {
        // when
        MutationResult result = pipeline.delete(WORK_ORDERS, EntityId.of("wo-1"), Principal.global("ceo", Role.CEO));

        // then
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.DELETE));
        verifyNoInteractions(unitOfWork);
    }

    @Test
    void delete_허용된_타입은_tombstone_감사와_다음_버전_이벤트() {
        // given
        givenTransaction();
        EntityType lots = EntityType.of("lots");
        ScopedEntity lot = ScopedEntity.restore(lots, EntityId.of("lot-1"), A, 2, NOW, JsonMappers.objectNode());
        when(tx.find(any())).thenReturn(Optional.of(lot));

        // when
        MutationResult result = pipeline.delete(lots, EntityId.of("lot-1"), managerOfA);

        // then
        Committed committed = (Committed) result;
        assertThat(committed.isTombstone()).isTrue();
        assertThat(committed.version()).isEqualTo(3);
        verify(tx).delete(lot.getRef());

        ArgumentCaptor<AuditEntry> audit = ArgumentCaptor.forClass(AuditEntry.class);
        verify(tx).appendAudit(audit.capture());
        assertThat(audit.getValue().after().get(AuditEntry.TOMBSTONE_KEY).asBoolean()).isTrue();
        verify(changeNotifier).publish(any(ChangeEvent.class));
    }

    // ============================================================
    // 4. 읽기
    // ============================================================

    @Test
    void find_범위_밖_행은_보이지_않음() {
        // given
        when(entityReader.find(any())).thenReturn(Optional.of(order(B, 1)));

        // when & then
        assertThat(pipeline.find(WORK_ORDERS, EntityId.of("wo-1"), managerOfA)).isEmpty();
    }

    @Test
    void list_범위_밖_공장은_조회하지_않고_빈_목록() {
        // when
        List<ScopedEntity> listed = pipeline.list(WORK_ORDERS, B, managerOfA);

        // then
        assertThat(listed).isEmpty();
        verifyNoInteractions(entityReader);
    }
}
