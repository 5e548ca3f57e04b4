package com.ryuqq.integrity.core.spi;

import com.ryuqq.integrity.core.audit.Checkpoint;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Checkpoint persistence (one checkpoint per day).
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface CheckpointStore {

    /**
     * Inserts a checkpoint unless one already exists for its day.
     *
     * @param checkpoint the checkpoint
     * @return true if inserted, false if the day already had one
     */
    boolean insertIfAbsent(Checkpoint checkpoint);

    Optional<Checkpoint> find(LocalDate day);

    /**
     * Returns the checkpoint with the latest day.
     *
     * @return latest checkpoint, or empty if none exists
     */
    Optional<Checkpoint> latest();
}
