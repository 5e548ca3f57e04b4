package com.ryuqq.integrity.core.spi;

import com.ryuqq.integrity.core.audit.ChainIntegrityViolation;

/**
 * Operator channel for integrity violations (paging, chat, ticketing).
 *
 * @author Integrity Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface IntegrityAlertSink {

    /**
     * Reports a violation. Implementations must not attempt to repair the log.
     *
     * @param violation the detected violation
     */
    void report(ChainIntegrityViolation violation);
}
