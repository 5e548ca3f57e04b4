package com.ryuqq.integrity.adapter.inmemory.store;

import com.ryuqq.integrity.core.audit.Checkpoint;
import com.ryuqq.integrity.core.spi.CheckpointStore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link CheckpointStore}.
 *
 * <p>Checkpoints are kept in a {@link ConcurrentSkipListMap} ordered by day;
 * {@link #insertIfAbsent} maps to {@code putIfAbsent}, the equivalent of
 * {@code INSERT ... ON CONFLICT (day) DO NOTHING}.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentSkipListMap<LocalDate, Checkpoint> checkpoints = new ConcurrentSkipListMap<>();

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean insertIfAbsent(Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        return checkpoints.putIfAbsent(checkpoint.day(), checkpoint) == null;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<Checkpoint> find(LocalDate day) {
        if (day == null) {
            throw new IllegalArgumentException("day cannot be null");
        }
        return Optional.ofNullable(checkpoints.get(day));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<Checkpoint> latest() {
        Map.Entry<LocalDate, Checkpoint> last = checkpoints.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    /**
     * Returns all checkpoints ordered by day.
     * Used for test assertions.
     */
    public List<Checkpoint> all() {
        return new ArrayList<>(checkpoints.values());
    }

    /**
     * Clears all stored data.
     * Used for test cleanup.
     */
    public void clear() {
        checkpoints.clear();
    }
}
