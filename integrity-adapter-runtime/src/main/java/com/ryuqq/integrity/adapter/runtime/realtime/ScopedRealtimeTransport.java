package com.ryuqq.integrity.adapter.runtime.realtime;

import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.policy.Operation;
import com.ryuqq.integrity.core.policy.PolicyEngine;
import com.ryuqq.integrity.core.realtime.ChangeEvent;
import com.ryuqq.integrity.core.realtime.ChangeEventCodec;
import com.ryuqq.integrity.core.realtime.MalformedChangeEventException;
import com.ryuqq.integrity.core.spi.EntityReader;
import com.ryuqq.integrity.core.spi.RealtimeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Client-facing view of a {@link RealtimeTransport} bound to one principal.
 *
 * <p>Realtime reads are authorized the same way as row reads:</p>
 * <ul>
 *   <li><strong>Subscribe:</strong> the channel's factory must be readable. For
 *       {@code factory:<f>} and {@code list:<type>:<f>} it is taken from the name; for
 *       {@code doc:<type>:<id>} it is the committed row's factory. A denied, missing or
 *       unparseable channel yields an inert subscription that never delivers, so a denial
 *       looks the same as a quiet channel.</li>
 *   <li><strong>Deliver:</strong> every payload is decoded and its {@code factoryId} is
 *       authorized again before it reaches the listener. Rows moved out of scope stop
 *       delivering at once.</li>
 * </ul>
 *
 * <p>Publishing is a server-side concern and is not available through this view.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class ScopedRealtimeTransport implements RealtimeTransport {

    private static final Logger log = LoggerFactory.getLogger(ScopedRealtimeTransport.class);

    private final RealtimeTransport delegate;
    private final Principal principal;
    private final PolicyEngine policyEngine;
    private final EntityReader reader;
    private final ChangeEventCodec codec;

    /**
     * 생성자.
     *
     * @param delegate 서버 측 전송
     * @param principal 구독 주체
     * @param policyEngine 권한 엔진
     * @param reader doc 채널의 소속 공장 조회용
     * @param codec 전달 시 이벤트 해석용 코덱
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ScopedRealtimeTransport(RealtimeTransport delegate, Principal principal, PolicyEngine policyEngine,
                                   EntityReader reader, ChangeEventCodec codec) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (principal == null) {
            throw new IllegalArgumentException("principal cannot be null");
        }
        if (policyEngine == null) {
            throw new IllegalArgumentException("policyEngine cannot be null");
        }
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.delegate = delegate;
        this.principal = principal;
        this.policyEngine = policyEngine;
        this.reader = reader;
        this.codec = codec;
    }

    /**
     * Not supported: clients only subscribe.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public void publish(String channel, String payload) {
        throw new UnsupportedOperationException("Scoped transport is subscribe-only");
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns an inert subscription when the channel is not readable by the principal.</p>
     */
    @Override
    public Subscription subscribe(String channel, Consumer<String> listener) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Optional<FactoryId> factory = resolveFactory(channel);
        if (factory.isEmpty() || !isReadable(factory.get())) {
            log.debug("Subscription to {} denied for {}", channel, principal.actorId());
            return new InertSubscription();
        }
        return delegate.subscribe(channel, payload -> deliver(channel, payload, listener));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void addConnectionListener(ConnectionListener listener) {
        delegate.addConnectionListener(listener);
    }

    public Principal getPrincipal() {
        return principal;
    }

    // ============================================================
    // Authorization
    // ============================================================

    private void deliver(String channel, String payload, Consumer<String> listener) {
        ChangeEvent event;
        try {
            event = codec.decode(payload);
        } catch (MalformedChangeEventException e) {
            log.debug("Dropped unverifiable payload on {}: {}", channel, e.getMessage());
            return;
        }
        if (!isReadable(event.factoryId())) {
            log.debug("Dropped out-of-scope {} {} on {}", event.action(), event.ref(), channel);
            return;
        }
        listener.accept(payload);
    }

    private boolean isReadable(FactoryId factoryId) {
        return policyEngine.authorize(principal, factoryId, Operation.READ).isAllowed();
    }

    /**
     * Resolves the factory a channel belongs to.
     *
     * @param channel channel name
     * @return owning factory, or empty if the channel is unknown or its row does not exist
     */
    Optional<FactoryId> resolveFactory(String channel) {
        String[] parts = channel.split(":", -1);
        try {
            if (parts.length == 2 && "factory".equals(parts[0])) {
                return Optional.of(FactoryId.of(parts[1]));
            }
            if (parts.length == 3 && "list".equals(parts[0])) {
                return Optional.of(FactoryId.of(parts[2]));
            }
            if (parts.length == 3 && "doc".equals(parts[0])) {
                return reader.find(EntityRef.of(parts[1], parts[2])).map(ScopedEntity::getFactoryId);
            }
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable channel {}: {}", channel, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Subscription that never delivers. Indistinguishable from a quiet channel.
     */
    private static final class InertSubscription implements Subscription {

        private volatile boolean active = true;

        @Override
        public void unsubscribe() {
            active = false;
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
