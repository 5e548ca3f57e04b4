package com.ryuqq.integrity.testkit.contract;

import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.outcome.AuthorizationViolation;
import com.ryuqq.integrity.core.outcome.Committed;
import com.ryuqq.integrity.core.outcome.MutationResult;
import com.ryuqq.integrity.core.policy.Operation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test: factory-scoped authorization on every read and write.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Scoped roles never see or change rows of other factories</li>
 *   <li>Denied writes leave no row change and no audit record</li>
 *   <li>Missing rows and out-of-scope rows are indistinguishable</li>
 *   <li>Hard delete only for opted-in types</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
class AuthorizationContractTest extends AbstractContractTest {

    @Test
    void 다른_공장의_목록은_비어있고_수정은_거부() {
        // Given: an order in factory B
        Committed orderInB = createAs(ceo(), WORK_ORDERS, "B", "{\"status\":\"open\"}");
        Principal managerOfA = managerOf("A");

        // When
        MutationResult result = pipeline.mutate(WORK_ORDERS, orderInB.ref().id(), 1,
            payload("{\"status\":\"hijacked\"}"), managerOfA);

        // Then
        assertThat(pipeline.list(WORK_ORDERS, FactoryId.of("B"), managerOfA)).isEmpty();
        assertThat(pipeline.find(WORK_ORDERS, orderInB.ref().id(), managerOfA)).isEmpty();
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.UPDATE));
        assertThat(((AuthorizationViolation) result).errorCode()).isEqualTo("ACCESS_DENIED");
        assertThat(pipeline.find(WORK_ORDERS, orderInB.ref().id(), ceo()).orElseThrow().get("status").asText())
            .isEqualTo("open");
        assertThat(auditCount(WORK_ORDERS, orderInB.ref().id())).isEqualTo(1);
    }

    @Test
    void 없는_행과_범위_밖_행은_같은_결과() {
        // Given
        Committed orderInB = createAs(ceo(), WORK_ORDERS, "B", "{}");
        Principal managerOfA = managerOf("A");

        // When
        MutationResult outOfScope = pipeline.mutate(WORK_ORDERS, orderInB.ref().id(), 1, payload("{}"), managerOfA);
        MutationResult missing = pipeline.mutate(WORK_ORDERS, EntityId.of("wo-missing"), 1, payload("{}"), managerOfA);

        // Then
        assertThat(outOfScope).isEqualTo(missing);
    }

    @Test
    void 범위_밖_행은_버전이_틀려도_충돌이_아닌_거부() {
        // Given
        Committed orderInB = createAs(ceo(), WORK_ORDERS, "B", "{}");

        // When
        MutationResult result = pipeline.mutate(WORK_ORDERS, orderInB.ref().id(), 99, payload("{}"), managerOf("A"));

        // Then
        assertThat(result.isDenied()).isTrue();
    }

    @Test
    void 전역_역할은_모든_공장을_읽고_쓴다() {
        // Given
        createAs(ceo(), WORK_ORDERS, "A", "{}");
        Committed inB = createAs(ceo(), WORK_ORDERS, "B", "{}");

        // When
        MutationResult result = pipeline.approve(WORK_ORDERS, inB.ref().id(), 1, payload("{\"status\":\"ok\"}"), ceo());

        // Then
        assertCommitted(result, 2);
        assertThat(pipeline.list(WORK_ORDERS, FactoryId.of("A"), ceo())).hasSize(1);
        assertThat(pipeline.list(WORK_ORDERS, FactoryId.of("B"), ceo())).hasSize(1);
    }

    @Test
    void 범위_밖_공장에는_생성할_수_없음() {
        // When
        MutationResult result = pipeline.create(WORK_ORDERS, FactoryId.of("B"), payload("{}"), workerOf("A"));

        // Then
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.INSERT));
        assertThat(store.entityCount()).isZero();
        assertThat(store.auditSize()).isZero();
        assertThat(transport.publishedTo("factory:B")).isEmpty();
    }

    @Test
    void 다른_공장으로_옮기는_패치는_거부() {
        // Given
        Principal managerOfA = managerOf("A");
        Committed order = createAs(managerOfA, WORK_ORDERS, "A", "{}");

        // When
        MutationResult moved = pipeline.mutate(WORK_ORDERS, order.ref().id(), 1, payload("{\"factoryId\":\"B\"}"), managerOfA);

        // Then
        assertThat(moved.isDenied()).isTrue();
        assertThatThrownBy(() -> pipeline.mutate(WORK_ORDERS, order.ref().id(), 1, payload("{\"factoryId\":\"A\"}"), managerOfA))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(auditCount(WORK_ORDERS, order.ref().id())).isEqualTo(1);
    }

    @Test
    void 삭제는_허용된_타입만_가능하고_감사에_tombstone() {
        // Given
        Principal managerOfA = managerOf("A");
        Committed lot = createAs(managerOfA, LOTS, "A", "{\"qty\":1}");
        Committed order = createAs(managerOfA, WORK_ORDERS, "A", "{}");

        // When
        MutationResult lotDeleted = pipeline.delete(LOTS, lot.ref().id(), managerOfA);
        MutationResult orderDeleted = pipeline.delete(WORK_ORDERS, order.ref().id(), ceo());

        // Then
        assertCommitted(lotDeleted, 2);
        assertThat(orderDeleted.isDenied()).isTrue();
        assertThat(pipeline.find(LOTS, lot.ref().id(), managerOfA)).isEmpty();
        assertThat(store.history(LOTS, lot.ref().id()).get(1).getAfter().get("_deleted").asBoolean()).isTrue();
        assertChainIntact(LOTS, lot.ref().id());
    }

    @Test
    void 범위_밖_행은_삭제할_수_없음() {
        // Given
        Committed lotInB = createAs(ceo(), LOTS, "B", "{}");

        // When
        MutationResult result = pipeline.delete(LOTS, lotInB.ref().id(), managerOf("A"));

        // Then
        assertThat(result).isEqualTo(AuthorizationViolation.of(Operation.DELETE));
        assertThat(pipeline.find(LOTS, lotInB.ref().id(), ceo())).isPresent();
    }
}
