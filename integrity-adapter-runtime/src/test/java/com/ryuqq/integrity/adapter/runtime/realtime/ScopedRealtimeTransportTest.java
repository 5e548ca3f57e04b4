package com.ryuqq.integrity.adapter.runtime.realtime;

import com.ryuqq.integrity.core.json.JsonMappers;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.Role;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.policy.PolicyEngine;
import com.ryuqq.integrity.core.realtime.ChangeEvent;
import com.ryuqq.integrity.core.realtime.ChangeEventCodec;
import com.ryuqq.integrity.core.spi.EntityReader;
import com.ryuqq.integrity.core.spi.RealtimeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * ScopedRealtimeTransport 유닛 테스트.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ScopedRealtimeTransportTest {

    private static final EntityType LOTS = EntityType.of("lots");
    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");

    @Mock
    private RealtimeTransport delegate;

    @Mock
    private EntityReader reader;

    @Mock
    private RealtimeTransport.Subscription delegateSubscription;

    @Captor
    private ArgumentCaptor<Consumer<String>> listenerCaptor;

    private final ChangeEventCodec codec = new ChangeEventCodec();
    private final List<String> received = new ArrayList<>();

    private ScopedRealtimeTransport scoped;

    @BeforeEach
    void setUp() {
        Principal managerOfA = Principal.scoped("manager-a", Role.FACTORY_MANAGER, FactoryId.of("A"));
        scoped = new ScopedRealtimeTransport(delegate, managerOfA, new PolicyEngine(), reader, codec);
    }

    private String payloadIn(String factory) {
        return codec.encode(new ChangeEvent(LOTS, EntityId.of("lot-1"), FactoryId.of(factory),
            ChangeAction.UPDATE, List.of("qty"), 2, NOW, JsonMappers.readObject("{\"qty\":2}")));
    }

    private ScopedEntity lotIn(String factory) {
        return ScopedEntity.restore(LOTS, EntityId.of("lot-1"), FactoryId.of(factory), 1, NOW,
            JsonMappers.readObject("{\"qty\":1}"));
    }

    @Test
    void subscribe_범위_안_공장_채널은_위임() {
        // given
        when(delegate.subscribe(eq("factory:A"), any())).thenReturn(delegateSubscription);

        // when
        RealtimeTransport.Subscription subscription = scoped.subscribe("factory:A", received::add);

        // then
        assertThat(subscription).isSameAs(delegateSubscription);
    }

    @Test
    void subscribe_범위_밖_공장_채널은_비활성_구독() {
        // when
        RealtimeTransport.Subscription subscription = scoped.subscribe("factory:B", received::add);
        RealtimeTransport.Subscription list = scoped.subscribe("list:lots:B", received::add);

        // then
        verify(delegate, never()).subscribe(anyString(), any());
        assertThat(subscription.isActive()).isTrue();
        subscription.unsubscribe();
        assertThat(subscription.isActive()).isFalse();
        assertThat(list.isActive()).isTrue();
    }

    @Test
    void subscribe_문서_채널은_행의_공장으로_판정() {
        // given
        when(reader.find(EntityRef.of("lots", "lot-1"))).thenReturn(Optional.of(lotIn("B")));
        when(reader.find(EntityRef.of("lots", "lot-2"))).thenReturn(Optional.empty());

        // when
        scoped.subscribe("doc:lots:lot-1", received::add);
        scoped.subscribe("doc:lots:lot-2", received::add);

        // then
        verify(delegate, never()).subscribe(anyString(), any());
    }

    @Test
    void subscribe_해석할_수_없는_채널은_거부() {
        // when
        scoped.subscribe("presence:A", received::add);
        scoped.subscribe("doc:Bad Type:x", received::add);

        // then
        verifyNoInteractions(delegate);
    }

    @Test
    void 전달시_범위_밖_이벤트는_걸러냄() {
        // given: a doc that was in A when subscribed
        when(reader.find(EntityRef.of("lots", "lot-1"))).thenReturn(Optional.of(lotIn("A")));
        when(delegate.subscribe(eq("doc:lots:lot-1"), listenerCaptor.capture())).thenReturn(delegateSubscription);
        scoped.subscribe("doc:lots:lot-1", received::add);
        Consumer<String> delivery = listenerCaptor.getValue();

        // when
        delivery.accept(payloadIn("A"));
        delivery.accept(payloadIn("B"));
        delivery.accept("{\"type\":\"lots\"}");

        // then
        assertThat(received).containsExactly(payloadIn("A"));
    }

    @Test
    void publish_클라이언트_측에서는_지원하지_않음() {
        assertThatThrownBy(() -> scoped.publish("factory:A", "{}"))
            .isInstanceOf(UnsupportedOperationException.class);
        verifyNoInteractions(delegate);
    }

    @Test
    void 연결_리스너는_위임() {
        // given
        RealtimeTransport.ConnectionListener listener = () -> { };

        // when
        scoped.addConnectionListener(listener);

        // then
        verify(delegate).addConnectionListener(listener);
    }
}
