package com.ryuqq.integrity.adapter.inmemory.transport;

import com.ryuqq.integrity.core.spi.RealtimeTransport;
import com.ryuqq.integrity.core.spi.TransientTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link RealtimeTransport} for testing and reference purposes.
 *
 * <p>Delivery is synchronous on the publishing thread. The connection can be toggled with
 * {@link #disconnect()} and {@link #reconnect()} to exercise catch-up behavior; while
 * disconnected, {@link #publish} throws {@link TransientTransportException} and nothing
 * is buffered, matching a websocket transport without replay.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>subscribers:</strong> ConcurrentHashMap&lt;String, CopyOnWriteArrayList&gt; - Channel listeners</li>
 *   <li><strong>published:</strong> CopyOnWriteArrayList&lt;Message&gt; - Delivered messages, for assertions</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class InMemoryRealtimeTransport implements RealtimeTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRealtimeTransport.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ChannelSubscription>> subscribers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<ConnectionListener> connectionListeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Message> published = new CopyOnWriteArrayList<>();
    private volatile boolean connected = true;

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong> a listener that throws is logged and does not
     * prevent delivery to the remaining listeners.</p>
     */
    @Override
    public void publish(String channel, String payload) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (!connected) {
            throw new TransientTransportException("Transport disconnected, cannot publish to " + channel);
        }
        published.add(new Message(channel, payload));
        List<ChannelSubscription> listeners = subscribers.get(channel);
        if (listeners == null) {
            return;
        }
        for (ChannelSubscription subscription : listeners) {
            if (!subscription.isActive()) {
                continue;
            }
            try {
                subscription.listener.accept(payload);
            } catch (RuntimeException e) {
                log.warn("Listener on {} failed", channel, e);
            }
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Subscription subscribe(String channel, Consumer<String> listener) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        ChannelSubscription subscription = new ChannelSubscription(channel, listener);
        subscribers.computeIfAbsent(channel, key -> new CopyOnWriteArrayList<>()).add(subscription);
        return subscription;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void addConnectionListener(ConnectionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        connectionListeners.add(listener);
    }

    /**
     * Simulates a dropped connection.
     */
    public void disconnect() {
        connected = false;
        for (ConnectionListener listener : connectionListeners) {
            listener.onDisconnect();
        }
    }

    /**
     * Restores the connection and notifies listeners.
     */
    public void reconnect() {
        connected = true;
        for (ConnectionListener listener : connectionListeners) {
            listener.onReconnect();
        }
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Returns the number of active subscriptions on a channel.
     * Used for test assertions.
     */
    public int subscriberCount(String channel) {
        List<ChannelSubscription> listeners = subscribers.get(channel);
        if (listeners == null) {
            return 0;
        }
        return (int) listeners.stream().filter(ChannelSubscription::isActive).count();
    }

    /**
     * Returns payloads published to a channel, in publish order.
     * Used for test assertions.
     */
    public List<String> publishedTo(String channel) {
        List<String> payloads = new ArrayList<>();
        for (Message message : published) {
            if (message.channel().equals(channel)) {
                payloads.add(message.payload());
            }
        }
        return payloads;
    }

    /**
     * Clears subscriptions and published messages.
     * Used for test cleanup.
     */
    public void clear() {
        subscribers.clear();
        published.clear();
        connectionListeners.clear();
        connected = true;
    }

    /**
     * Published message.
     *
     * @param channel channel name
     * @param payload JSON payload
     */
    public record Message(String channel, String payload) {
    }

    private final class ChannelSubscription implements Subscription {

        private final String channel;
        private final Consumer<String> listener;
        private volatile boolean active = true;

        private ChannelSubscription(String channel, Consumer<String> listener) {
            this.channel = channel;
            this.listener = listener;
        }

        @Override
        public void unsubscribe() {
            if (!active) {
                return;
            }
            active = false;
            List<ChannelSubscription> listeners = subscribers.get(channel);
            if (listeners != null) {
                listeners.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
