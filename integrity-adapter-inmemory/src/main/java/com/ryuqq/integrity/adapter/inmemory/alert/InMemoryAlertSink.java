package com.ryuqq.integrity.adapter.inmemory.alert;

import com.ryuqq.integrity.core.audit.ChainIntegrityViolation;
import com.ryuqq.integrity.core.spi.IntegrityAlertSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link IntegrityAlertSink} that records every report.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class InMemoryAlertSink implements IntegrityAlertSink {

    private final CopyOnWriteArrayList<ChainIntegrityViolation> violations = new CopyOnWriteArrayList<>();

    @Override
    public void report(ChainIntegrityViolation violation) {
        if (violation == null) {
            throw new IllegalArgumentException("violation cannot be null");
        }
        violations.add(violation);
    }

    /**
     * Returns reported violations in report order.
     * Used for test assertions.
     */
    public List<ChainIntegrityViolation> getViolations() {
        return List.copyOf(violations);
    }

    /**
     * Clears all reports.
     * Used for test cleanup.
     */
    public void clear() {
        violations.clear();
    }
}
