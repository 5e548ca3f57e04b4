package com.ryuqq.integrity.adapter.inmemory.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.integrity.core.audit.AuditEntry;
import com.ryuqq.integrity.core.audit.AuditRecord;
import com.ryuqq.integrity.core.audit.ChainHasher;
import com.ryuqq.integrity.core.audit.ChainHead;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.spi.AuditLog;
import com.ryuqq.integrity.core.spi.EntityReader;
import com.ryuqq.integrity.core.spi.Transaction;
import com.ryuqq.integrity.core.spi.UnitOfWork;
import com.ryuqq.integrity.core.spi.UnitOfWorkTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory implementation of the {@link UnitOfWork}, {@link EntityReader} and
 * {@link AuditLog} SPIs for testing and reference purposes.
 *
 * <p>Each unit of work holds a per-row {@link ReentrantLock} (acquired with a bounded
 * wait), stages its writes on a private {@link Transaction} and publishes them in one
 * synchronized commit step. Audit hashing happens inside that commit step, the same
 * way a database trigger would compute it inside the writer's transaction.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entities:</strong> HashMap&lt;EntityRef, ScopedEntity&gt; - Committed rows</li>
 *   <li><strong>auditLog:</strong> ArrayList&lt;AuditRecord&gt; - Records in commit (sequence) order</li>
 *   <li><strong>chainHeads:</strong> HashMap&lt;EntityRef, byte[]&gt; - Stored head hash per chain</li>
 *   <li><strong>rowLocks:</strong> ConcurrentHashMap&lt;EntityRef, ReentrantLock&gt; - Per-row write locks</li>
 * </ul>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>Entity writes and audit appends of one unit of work become visible together</li>
 *   <li>An exception in the work function discards every staged write</li>
 *   <li>A transaction may only touch the row it locked, so each chain has a single writer</li>
 *   <li>Row locks cannot be nested on one thread</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryStore store = new InMemoryStore();
 * MutationResult result = store.execute(ref, tx -&gt; {
 *     // 1. 현재 상태 조회 (잠금 보유 중)
 *     ScopedEntity current = tx.find(ref).orElseThrow();
 *     // 2. 다음 버전 기록 + 감사 추가
 *     tx.update(next);
 *     tx.appendAudit(entry);
 *     return Committed.of(next, ChangeAction.UPDATE);
 * });
 * </pre>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class InMemoryStore implements UnitOfWork, EntityReader, AuditLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStore.class);

    private static final ThreadLocal<EntityRef> HELD_LOCK = new ThreadLocal<>();

    private final UnitOfWorkConfig config;

    /**
     * Committed rows. Guarded by {@code this}.
     */
    private final Map<EntityRef, ScopedEntity> entities = new HashMap<>();

    /**
     * Audit records in commit order. Guarded by {@code this}.
     */
    private final List<AuditRecord> auditLog = new ArrayList<>();

    /**
     * Stored head hash of each chain. Guarded by {@code this}.
     */
    private final Map<EntityRef, byte[]> chainHeads = new HashMap<>();

    /**
     * Row locks in use (held or awaited). An entry is removed when its last user leaves.
     */
    private final ConcurrentHashMap<EntityRef, RowLock> rowLocks = new ConcurrentHashMap<>();

    private long lastSequence;

    /**
     * Creates a new InMemoryStore with the default lock timeout.
     */
    public InMemoryStore() {
        this(new UnitOfWorkConfig());
    }

    /**
     * Creates a new InMemoryStore.
     *
     * @param config unit of work configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryStore(UnitOfWorkConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    // ============================================================
    // UnitOfWork
    // ============================================================

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Lock wait bounded by {@link UnitOfWorkConfig#lockTimeoutMs()}</li>
     *   <li>Commit is a single synchronized step over entities and audit log</li>
     *   <li>Any RuntimeException from work triggers rollback and is rethrown unchanged</li>
     *   <li>Idle row locks are discarded, so lookups of unknown ids leave nothing behind</li>
     * </ul>
     */
    @Override
    public <T> T execute(EntityRef lockKey, Function<Transaction, T> work) {
        if (lockKey == null) {
            throw new IllegalArgumentException("lockKey cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        EntityRef held = HELD_LOCK.get();
        if (held != null) {
            throw new IllegalStateException("Row locks cannot be nested: holding " + held + ", requested " + lockKey);
        }

        RowLock rowLock = enter(lockKey);
        try {
            acquire(rowLock.lock, lockKey);
        } catch (RuntimeException e) {
            leave(lockKey);
            throw e;
        }
        HELD_LOCK.set(lockKey);
        StagedTransaction tx = new StagedTransaction(lockKey);
        try {
            T result = work.apply(tx);
            commit(tx);
            return result;
        } catch (RuntimeException e) {
            log.debug("Rolled back unit of work on {}: {}", lockKey, e.toString());
            throw e;
        } finally {
            tx.active = false;
            HELD_LOCK.remove();
            rowLock.lock.unlock();
            leave(lockKey);
        }
    }

    private RowLock enter(EntityRef lockKey) {
        return rowLocks.compute(lockKey, (key, existing) -> {
            RowLock rowLock = existing == null ? new RowLock() : existing;
            rowLock.users++;
            return rowLock;
        });
    }

    private void leave(EntityRef lockKey) {
        rowLocks.computeIfPresent(lockKey, (key, rowLock) -> --rowLock.users == 0 ? null : rowLock);
    }

    private void acquire(ReentrantLock lock, EntityRef lockKey) {
        boolean acquired;
        try {
            acquired = lock.tryLock(config.lockTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for row lock of " + lockKey, e);
        }
        if (!acquired) {
            throw new UnitOfWorkTimeoutException(lockKey, config.lockTimeoutMs());
        }
    }

    /**
     * Publishes staged writes and hashes staged audit entries onto their chains.
     *
     * <p>Records are built before anything is applied, so a failure leaves no partial state.</p>
     */
    private synchronized void commit(StagedTransaction tx) {
        List<AuditRecord> records = new ArrayList<>(tx.auditEntries.size());
        Map<EntityRef, byte[]> heads = new HashMap<>();
        long sequence = lastSequence;
        for (AuditEntry entry : tx.auditEntries) {
            EntityRef ref = entry.ref();
            byte[] previous = heads.containsKey(ref)
                ? heads.get(ref)
                : chainHeads.getOrDefault(ref, ChainHasher.EMPTY);
            byte[] current = ChainHasher.next(previous, entry.after());
            records.add(AuditRecord.of(++sequence, entry, previous, current));
            heads.put(ref, current);
        }

        for (Map.Entry<EntityRef, Optional<ScopedEntity>> staged : tx.staged.entrySet()) {
            if (staged.getValue().isPresent()) {
                entities.put(staged.getKey(), staged.getValue().get());
            } else {
                entities.remove(staged.getKey());
            }
        }
        auditLog.addAll(records);
        chainHeads.putAll(heads);
        lastSequence = sequence;
    }

    // ============================================================
    // EntityReader
    // ============================================================

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized Optional<ScopedEntity> find(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        return Optional.ofNullable(entities.get(ref));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> ordered by updatedAt descending, then id.</p>
     */
    @Override
    public synchronized List<ScopedEntity> list(EntityType type, FactoryId factoryId) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (factoryId == null) {
            throw new IllegalArgumentException("factoryId cannot be null");
        }
        return entities.values().stream()
            .filter(e -> e.getType().equals(type) && e.getFactoryId().equals(factoryId))
            .sorted(Comparator.comparing(ScopedEntity::getUpdatedAt).reversed()
                .thenComparing(e -> e.getId().getValue()))
            .collect(Collectors.toList());
    }

    // ============================================================
    // AuditLog
    // ============================================================

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized List<AuditRecord> history(EntityType target, EntityId targetId) {
        EntityRef ref = EntityRef.of(target, targetId);
        return auditLog.stream()
            .filter(r -> r.getRef().equals(ref))
            .collect(Collectors.toList());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized List<AuditRecord> records(long afterSequence, long throughSequence) {
        return auditLog.stream()
            .filter(r -> r.getSequence() > afterSequence && r.getSequence() <= throughSequence)
            .collect(Collectors.toList());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> equivalent of
     * {@code SELECT DISTINCT ON (target, target_id) current_hash ... ORDER BY sequence DESC}.</p>
     */
    @Override
    public synchronized List<ChainHead> heads(long throughSequence) {
        Map<EntityRef, AuditRecord> last = new LinkedHashMap<>();
        for (AuditRecord record : auditLog) {
            if (record.getSequence() <= throughSequence) {
                last.put(record.getRef(), record);
            }
        }
        return last.values().stream()
            .map(ChainHead::of)
            .sorted(ChainHead.DIGEST_ORDER)
            .collect(Collectors.toList());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized long lastSequence() {
        return lastSequence;
    }

    // ============================================================
    // Test helpers
    // ============================================================

    /**
     * Overwrites the stored {@code after} image of a record, keeping its hashes.
     *
     * <p>Simulates direct storage-layer tampering. Used for test assertions only.</p>
     *
     * @param sequence sequence of the record to alter
     * @param forgedAfter replacement after-image
     * @throws IllegalArgumentException if no record has the sequence
     */
    public synchronized void tamperAfter(long sequence, JsonNode forgedAfter) {
        int index = indexOf(sequence);
        AuditRecord original = auditLog.get(index);
        auditLog.set(index, AuditRecord.of(
            original.getSequence(),
            original.getEntry().withAfter(forgedAfter),
            original.getPreviousHash(),
            original.getCurrentHash()
        ));
    }

    /**
     * Overwrites the stored {@code currentHash} of a record.
     *
     * <p>Simulates a forger who also rewrites hashes. Used for test assertions only.</p>
     *
     * @param sequence sequence of the record to alter
     * @param forgedHash replacement hash
     */
    public synchronized void tamperCurrentHash(long sequence, byte[] forgedHash) {
        int index = indexOf(sequence);
        AuditRecord original = auditLog.get(index);
        auditLog.set(index, AuditRecord.of(
            original.getSequence(), original.getEntry(), original.getPreviousHash(), forgedHash
        ));
        chainHeads.put(original.getRef(), forgedHash.clone());
    }

    private int indexOf(long sequence) {
        for (int i = 0; i < auditLog.size(); i++) {
            if (auditLog.get(i).getSequence() == sequence) {
                return i;
            }
        }
        throw new IllegalArgumentException("No audit record with sequence " + sequence);
    }

    /**
     * Returns the number of committed audit records.
     * Used for test assertions.
     */
    public synchronized int auditSize() {
        return auditLog.size();
    }

    /**
     * Returns the number of row locks currently held or awaited.
     * Used for test assertions.
     */
    public int rowLockCount() {
        return rowLocks.size();
    }

    /**
     * Returns the number of committed entities.
     * Used for test assertions.
     */
    public synchronized int entityCount() {
        return entities.size();
    }

    /**
     * Clears all stored data.
     * Used for test cleanup.
     */
    public synchronized void clear() {
        entities.clear();
        auditLog.clear();
        chainHeads.clear();
        rowLocks.clear();
        lastSequence = 0;
    }

    /**
     * Row lock with its user count. {@code users} is only changed inside
     * {@link ConcurrentHashMap#compute} for its key.
     */
    private static final class RowLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    /**
     * Staged writes of one unit of work, bound to the locked row.
     */
    private final class StagedTransaction implements Transaction {

        private final EntityRef lockKey;
        private final Map<EntityRef, Optional<ScopedEntity>> staged = new LinkedHashMap<>();
        private final List<AuditEntry> auditEntries = new ArrayList<>();
        private volatile boolean active = true;

        private StagedTransaction(EntityRef lockKey) {
            this.lockKey = lockKey;
        }

        @Override
        public Optional<ScopedEntity> find(EntityRef ref) {
            ensureActive();
            if (staged.containsKey(ref)) {
                return staged.get(ref);
            }
            return InMemoryStore.this.find(ref);
        }

        @Override
        public void insert(ScopedEntity entity) {
            ensureBound(entity.getRef());
            if (find(entity.getRef()).isPresent()) {
                throw new IllegalStateException("Entity already exists: " + entity.getRef());
            }
            if (entity.getVersion() != 1) {
                throw new IllegalStateException("New entity must start at version 1 (current: " + entity.getVersion() + ")");
            }
            staged.put(entity.getRef(), Optional.of(entity));
        }

        @Override
        public void update(ScopedEntity entity) {
            ensureBound(entity.getRef());
            ScopedEntity current = find(entity.getRef())
                .orElseThrow(() -> new IllegalStateException("Entity not found: " + entity.getRef()));
            if (entity.getVersion() != current.getVersion() + 1) {
                throw new IllegalStateException("Version must advance by exactly one (current: "
                    + current.getVersion() + ", new: " + entity.getVersion() + ")");
            }
            if (!entity.getFactoryId().equals(current.getFactoryId())) {
                throw new IllegalStateException("factoryId is immutable: " + entity.getRef());
            }
            staged.put(entity.getRef(), Optional.of(entity));
        }

        @Override
        public void delete(EntityRef ref) {
            ensureBound(ref);
            if (find(ref).isEmpty()) {
                throw new IllegalStateException("Entity not found: " + ref);
            }
            staged.put(ref, Optional.empty());
        }

        @Override
        public void appendAudit(AuditEntry entry) {
            if (entry == null) {
                throw new IllegalArgumentException("entry cannot be null");
            }
            ensureBound(entry.ref());
            auditEntries.add(entry);
        }

        private void ensureBound(EntityRef ref) {
            ensureActive();
            if (!lockKey.equals(ref)) {
                throw new IllegalStateException("Transaction locked " + lockKey + " cannot write " + ref);
            }
        }

        private void ensureActive() {
            if (!active) {
                throw new IllegalStateException("Transaction is no longer active");
            }
        }
    }
}
