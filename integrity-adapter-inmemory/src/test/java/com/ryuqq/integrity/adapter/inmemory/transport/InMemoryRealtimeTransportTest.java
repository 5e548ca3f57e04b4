package com.ryuqq.integrity.adapter.inmemory.transport;

import com.ryuqq.integrity.core.spi.RealtimeTransport;
import com.ryuqq.integrity.core.spi.TransientTransportException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRealtimeTransport 테스트.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
class InMemoryRealtimeTransportTest {

    private final InMemoryRealtimeTransport transport = new InMemoryRealtimeTransport();

    @Test
    void publish_구독자에게_동기_전달() {
        // given
        List<String> received = new ArrayList<>();
        transport.subscribe("doc:lots:lot-1", received::add);

        // when
        transport.publish("doc:lots:lot-1", "{\"v\":1}");
        transport.publish("doc:lots:lot-2", "{\"v\":2}");

        // then
        assertThat(received).containsExactly("{\"v\":1}");
        assertThat(transport.publishedTo("doc:lots:lot-2")).containsExactly("{\"v\":2}");
    }

    @Test
    void unsubscribe_이후에는_전달되지_않음() {
        // given
        List<String> received = new ArrayList<>();
        RealtimeTransport.Subscription subscription = transport.subscribe("factory:A", received::add);

        // when
        subscription.unsubscribe();
        transport.publish("factory:A", "{}");

        // then
        assertThat(received).isEmpty();
        assertThat(subscription.isActive()).isFalse();
        assertThat(transport.subscriberCount("factory:A")).isZero();
    }

    @Test
    void 실패한_리스너가_다른_리스너를_막지_않음() {
        // given
        List<String> received = new ArrayList<>();
        transport.subscribe("factory:A", payload -> {
            throw new IllegalStateException("listener failure");
        });
        transport.subscribe("factory:A", received::add);

        // when
        transport.publish("factory:A", "{}");

        // then
        assertThat(received).containsExactly("{}");
    }

    @Test
    void 연결이_끊기면_publish는_일시적_예외() {
        // given
        transport.disconnect();

        // when & then
        assertThatThrownBy(() -> transport.publish("factory:A", "{}"))
            .isInstanceOf(TransientTransportException.class);
        assertThat(transport.publishedTo("factory:A")).isEmpty();
    }

    @Test
    void reconnect_연결_리스너에_통지() {
        // given
        AtomicInteger reconnects = new AtomicInteger();
        transport.addConnectionListener(reconnects::incrementAndGet);
        transport.disconnect();

        // when
        transport.reconnect();

        // then
        assertThat(reconnects.get()).isEqualTo(1);
        assertThat(transport.isConnected()).isTrue();
    }
}
