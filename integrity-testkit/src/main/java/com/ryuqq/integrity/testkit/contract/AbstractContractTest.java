package com.ryuqq.integrity.testkit.contract;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.adapter.inmemory.alert.InMemoryAlertSink;
import com.ryuqq.integrity.adapter.inmemory.store.InMemoryCheckpointStore;
import com.ryuqq.integrity.adapter.inmemory.store.InMemoryStore;
import com.ryuqq.integrity.adapter.inmemory.transport.InMemoryRealtimeTransport;
import com.ryuqq.integrity.adapter.runtime.audit.ChainVerifier;
import com.ryuqq.integrity.adapter.runtime.audit.CheckpointJob;
import com.ryuqq.integrity.adapter.runtime.audit.CheckpointJobConfig;
import com.ryuqq.integrity.adapter.runtime.mutation.MutationPipeline;
import com.ryuqq.integrity.adapter.runtime.realtime.ChangeNotifier;
import com.ryuqq.integrity.adapter.runtime.realtime.ScopedRealtimeTransport;
import com.ryuqq.integrity.core.audit.VerificationResult;
import com.ryuqq.integrity.core.json.JsonMappers;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.Role;
import com.ryuqq.integrity.core.outcome.Committed;
import com.ryuqq.integrity.core.outcome.MutationResult;
import com.ryuqq.integrity.core.policy.DeletePolicy;
import com.ryuqq.integrity.core.policy.PolicyEngine;
import com.ryuqq.integrity.core.realtime.ChangeEventCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires the whole write, audit and realtime path over in-memory adapters so each
 * scenario runs against the same components an application would assemble.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryStore: rows, audit log and row locks</li>
 *   <li>InMemoryCheckpointStore: daily checkpoints</li>
 *   <li>InMemoryRealtimeTransport: synchronous pub/sub</li>
 *   <li>InMemoryAlertSink: operator channel</li>
 *   <li>TestClock: settable time for mutations and checkpoints</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         Committed order = createAs(managerOf("A"), WORK_ORDERS, "A", "{\"status\":\"open\"}");
 *         MutationResult result = pipeline.approve(WORK_ORDERS, order.ref().id(), 1,
 *             payload("{\"status\":\"approved\"}"), managerOf("A"));
 *         assertCommitted(result, 2);
 *         assertChainIntact(WORK_ORDERS, order.ref().id());
 *     }
 * }
 * </pre>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final EntityType WORK_ORDERS = EntityType.of("work_orders");
    protected static final EntityType LOTS = EntityType.of("lots");
    protected static final EntityType BOMS = EntityType.of("boms");

    protected static final Instant START = Instant.parse("2024-05-01T09:00:00Z");

    protected TestClock clock;
    protected InMemoryStore store;
    protected InMemoryCheckpointStore checkpointStore;
    protected InMemoryRealtimeTransport transport;
    protected InMemoryAlertSink alertSink;
    protected ChangeEventCodec codec;
    protected PolicyEngine policyEngine;
    protected MutationPipeline pipeline;
    protected ChainVerifier verifier;
    protected CheckpointJob checkpointJob;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Only {@code lots} may be hard-deleted.</p>
     */
    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        store = new InMemoryStore();
        checkpointStore = new InMemoryCheckpointStore();
        transport = new InMemoryRealtimeTransport();
        alertSink = new InMemoryAlertSink();
        codec = new ChangeEventCodec();
        policyEngine = new PolicyEngine(DeletePolicy.allowing(LOTS));
        pipeline = new MutationPipeline(policyEngine, store, store, new ChangeNotifier(transport, codec), clock);
        verifier = new ChainVerifier(store);
        checkpointJob = new CheckpointJob(store, checkpointStore, alertSink, new CheckpointJobConfig(), clock);
    }

    /**
     * Clears all in-memory state to prevent test interference.
     */
    @AfterEach
    void tearDown() {
        store.clear();
        checkpointStore.clear();
        transport.clear();
        alertSink.clear();
    }

    // ============================================================
    // Principals
    // ============================================================

    protected Principal ceo() {
        return Principal.global("ceo-1", Role.CEO);
    }

    protected Principal managerOf(String... factories) {
        return Principal.scoped("manager-" + String.join("-", factories), Role.FACTORY_MANAGER, factoryIds(factories));
    }

    protected Principal workerOf(String... factories) {
        return Principal.scoped("worker-" + String.join("-", factories), Role.FACTORY_WORKER, factoryIds(factories));
    }

    /**
     * Client-side transport for a principal, as a realtime gateway would hand it out.
     */
    protected ScopedRealtimeTransport scopedTransport(Principal principal) {
        return new ScopedRealtimeTransport(transport, principal, policyEngine, store, codec);
    }

    private static FactoryId[] factoryIds(String... factories) {
        return Arrays.stream(factories).map(FactoryId::of).toArray(FactoryId[]::new);
    }

    // ============================================================
    // Helpers
    // ============================================================

    protected ObjectNode payload(String json) {
        return JsonMappers.readObject(json);
    }

    /**
     * Creates an entity and asserts the create committed.
     */
    protected Committed createAs(Principal principal, EntityType type, String factory, String json) {
        MutationResult result = pipeline.create(type, FactoryId.of(factory), payload(json), principal);
        return assertCommitted(result, 1);
    }

    /**
     * Applies {@code count} sequential updates and returns the last commit.
     */
    protected Committed updateTimes(Principal principal, Committed start, int count) {
        Committed current = start;
        for (int i = 0; i < count; i++) {
            clock.advance(Duration.ofSeconds(1));
            MutationResult result = pipeline.mutate(current.ref().type(), current.ref().id(), current.version(),
                payload("{\"step\":" + (i + 1) + "}"), principal);
            current = assertCommitted(result, current.version() + 1);
        }
        return current;
    }

    protected Committed assertCommitted(MutationResult result, long expectedVersion) {
        assertThat(result.isCommitted())
            .as("Expected a commit but was %s", result)
            .isTrue();
        Committed committed = (Committed) result;
        assertThat(committed.version()).isEqualTo(expectedVersion);
        return committed;
    }

    protected void assertChainIntact(EntityType type, EntityId id) {
        List<VerificationResult> results = verifier.verifyChain(type, id);
        assertThat(results).isNotEmpty();
        assertThat(results)
            .as("Chain %s/%s should verify at every position", type.getValue(), id.getValue())
            .allMatch(VerificationResult::ok);
    }

    protected int auditCount(EntityType type, EntityId id) {
        return store.history(type, id).size();
    }

    /**
     * Sleeps for the given duration. Used for timing-sensitive tests.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Sleep interrupted", e);
        }
    }
}
