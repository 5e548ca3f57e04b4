package com.ryuqq.integrity.core.spi;

import java.util.function.Consumer;

/**
 * Pub/sub transport for realtime change events.
 *
 * <p>Payloads are opaque strings (the JSON produced by {@code ChangeEventCodec}). Delivery
 * is best effort: a disconnected transport fails {@link #publish} with
 * {@link TransientTransportException} and clients catch up after reconnect.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface RealtimeTransport {

    /**
     * Publishes a payload to a channel.
     *
     * @param channel channel name
     * @param payload JSON payload
     * @throws TransientTransportException if the transport is currently unavailable
     */
    void publish(String channel, String payload);

    /**
     * Subscribes to a channel.
     *
     * @param channel channel name
     * @param listener payload consumer
     * @return handle that cancels the subscription
     */
    Subscription subscribe(String channel, Consumer<String> listener);

    /**
     * Registers a connection state listener.
     *
     * @param listener the listener
     */
    void addConnectionListener(ConnectionListener listener);

    /**
     * Cancellable subscription handle. Cancelling twice has no effect.
     */
    interface Subscription {

        void unsubscribe();

        boolean isActive();
    }

    /**
     * Connection state callbacks.
     */
    interface ConnectionListener {

        void onReconnect();

        default void onDisconnect() {
        }
    }
}
