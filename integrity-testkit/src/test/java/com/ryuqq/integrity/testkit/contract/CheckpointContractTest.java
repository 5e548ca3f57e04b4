package com.ryuqq.integrity.testkit.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.integrity.core.audit.AuditRecord;
import com.ryuqq.integrity.core.audit.ChainHasher;
import com.ryuqq.integrity.core.audit.ChainIntegrityViolation;
import com.ryuqq.integrity.core.audit.Checkpoint;
import com.ryuqq.integrity.core.outcome.Committed;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: daily checkpoints over chain heads.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Untouched history verifies against yesterday's checkpoint</li>
 *   <li>Rewriting old content is reported even when the forger rewrites hashes too</li>
 *   <li>Records appended after the checkpoint are re-hashed from content</li>
 *   <li>One checkpoint per day</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
class CheckpointContractTest extends AbstractContractTest {

    @Test
    void 변조가_없으면_다음날_비교는_통과() {
        // Given: day 1 activity and checkpoint
        Committed lot = createAs(ceo(), LOTS, "A", "{\"qty\":1}");
        updateTimes(ceo(), lot, 2);
        checkpointJob.run();

        // When: day 2 activity, then the job runs again
        clock.advance(Duration.ofDays(1));
        updateTimes(ceo(), createAs(ceo(), BOMS, "B", "{\"rev\":\"A\"}"), 1);
        Optional<ChainIntegrityViolation> violation = checkpointJob.run();

        // Then
        assertThat(violation).isEmpty();
        assertThat(alertSink.getViolations()).isEmpty();
        assertThat(checkpointStore.all()).hasSize(2);
        Checkpoint dayTwo = checkpointStore.find(LocalDate.parse("2024-05-02")).orElseThrow();
        assertThat(dayTwo.meta().count()).isEqualTo(2);
        assertThat(dayTwo.meta().throughSequence()).isEqualTo(store.lastSequence());
    }

    @Test
    void 과거_레코드와_해시를_함께_위조해도_체크포인트가_탐지() {
        // Given
        Committed lot = createAs(ceo(), LOTS, "A", "{\"qty\":1}");
        checkpointJob.run();
        Checkpoint dayOne = checkpointStore.latest().orElseThrow();

        // When: content rewritten and the hash recomputed so the chain walk still passes
        AuditRecord original = store.history(LOTS, lot.ref().id()).get(0);
        JsonNode forged = payload("{\"id\":\"" + lot.ref().id().getValue() + "\",\"qty\":500}");
        store.tamperAfter(original.getSequence(), forged);
        store.tamperCurrentHash(original.getSequence(), ChainHasher.next(ChainHasher.EMPTY, forged));
        assertChainIntact(LOTS, lot.ref().id());

        clock.advance(Duration.ofDays(1));
        Optional<ChainIntegrityViolation> violation = checkpointJob.run();

        // Then
        assertThat(violation).isPresent();
        assertThat(violation.get().expectedHeadHash()).isEqualTo(dayOne.headHash());
        assertThat(violation.get().checkpointDay()).isEqualTo(LocalDate.parse("2024-05-01"));
        assertThat(alertSink.getViolations()).containsExactly(violation.get());
    }

    @Test
    void 체크포인트_이후_추가된_레코드의_내용_변조를_탐지() {
        // Given: checkpoint covers the create, the update comes after it
        Committed lot = createAs(ceo(), LOTS, "A", "{\"qty\":1}");
        checkpointJob.run();
        assertCommitted(pipeline.mutate(LOTS, lot.ref().id(), 1, payload("{\"qty\":2}"), ceo()), 2);
        long updateSequence = store.lastSequence();

        // When: only the after-image is edited, stored hashes stay
        store.tamperAfter(updateSequence, payload("{\"id\":\"" + lot.ref().id().getValue() + "\",\"qty\":-7}"));
        clock.advance(Duration.ofDays(1));
        Optional<ChainIntegrityViolation> violation = checkpointJob.run();

        // Then
        assertThat(violation).isPresent();
        assertThat(violation.get().throughSequence()).isEqualTo(updateSequence);
        assertThat(violation.get().checkpointDay()).isEqualTo(LocalDate.parse("2024-05-01"));
        assertThat(alertSink.getViolations()).containsExactly(violation.get());
    }

    @Test
    void 같은_날_두_번_실행해도_체크포인트는_하나() {
        // Given
        createAs(ceo(), LOTS, "A", "{}");
        checkpointJob.run();
        String first = checkpointStore.latest().orElseThrow().headHash();

        // When
        createAs(ceo(), LOTS, "A", "{}");
        checkpointJob.run();

        // Then
        assertThat(checkpointStore.all()).hasSize(1);
        assertThat(checkpointStore.latest().orElseThrow().headHash()).isEqualTo(first);
    }

    @Test
    void 비어있는_로그도_체크포인트를_남김() {
        // When
        Optional<ChainIntegrityViolation> violation = checkpointJob.run();

        // Then
        assertThat(violation).isEmpty();
        assertThat(checkpointStore.latest().orElseThrow().meta().count()).isZero();
    }
}
