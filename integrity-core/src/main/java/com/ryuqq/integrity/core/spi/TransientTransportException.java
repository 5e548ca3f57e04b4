package com.ryuqq.integrity.core.spi;

/**
 * Realtime transport temporarily unavailable.
 *
 * <p>Never fails an already committed mutation. Clients recover through a single
 * catch-up refetch after reconnecting.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class TransientTransportException extends RuntimeException {

    public TransientTransportException(String message) {
        super(message);
    }

    public TransientTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
