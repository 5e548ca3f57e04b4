package com.ryuqq.integrity.adapter.runtime.realtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.ScopedEntity;
import com.ryuqq.integrity.core.realtime.ChangeEvent;
import com.ryuqq.integrity.core.realtime.ChangeEventCodec;
import com.ryuqq.integrity.core.realtime.Channels;
import com.ryuqq.integrity.core.realtime.MalformedChangeEventException;
import com.ryuqq.integrity.core.spi.RealtimeTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Client-side cache kept fresh by realtime change events.
 *
 * <p>Events arrive on the subscriptions of open views, pass through a {@link ChangeCoalescer}
 * and are applied in batches:</p>
 *
 * <ul>
 *   <li><strong>Stale guard:</strong> an event whose version is at or below the cached version
 *       of its entity is dropped</li>
 *   <li><strong>Patch:</strong> an UPDATE/APPROVE/REJECT event that directly follows the cached
 *       version and carries the values of all its {@code changedKeys} is applied as a field
 *       patch without a round trip</li>
 *   <li><strong>Invalidate:</strong> any other event marks the cached document stale; it is
 *       refetched lazily on the next read</li>
 *   <li><strong>List head:</strong> CREATE/DELETE events invalidate only the first page of
 *       {@code (type, factoryId)}, at most once per batch</li>
 *   <li><strong>Reconnect:</strong> exactly one refetch per open view, no event replay</li>
 * </ul>
 *
 * <p>Subscriptions exist only while a view is open; closing a view unsubscribes immediately.
 * Clients build the cache on a {@link ScopedRealtimeTransport} for their principal so that
 * channels and events outside their factories never arrive.</p>
 *
 * <p><strong>Thread Safety:</strong> cache state is guarded by {@code this}; batches may be
 * applied from the coalescer's timer thread.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class RealtimeCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RealtimeCache.class);

    private final RealtimeTransport transport;
    private final ChangeEventCodec codec;
    private final ViewLoader loader;
    private final ChangeCoalescer coalescer;

    private final Map<EntityRef, CachedDoc> docs = new HashMap<>();
    private final Map<ListKey, CachedList> lists = new HashMap<>();
    private final CopyOnWriteArrayList<View> openViews = new CopyOnWriteArrayList<>();

    private long patches;
    private long invalidations;
    private long listHeadInvalidations;
    private long droppedStale;
    private long refetches;

    /**
     * 생성자 (기본 코얼레서 설정).
     */
    public RealtimeCache(RealtimeTransport transport, ChangeEventCodec codec, ViewLoader loader) {
        this(transport, codec, loader, new CoalescerConfig());
    }

    /**
     * 생성자.
     *
     * @param transport 실시간 전송
     * @param codec 와이어 코덱
     * @param loader 화면 조회 포트
     * @param config 디바운스 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RealtimeCache(RealtimeTransport transport, ChangeEventCodec codec, ViewLoader loader, CoalescerConfig config) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.transport = transport;
        this.codec = codec;
        this.loader = loader;
        this.coalescer = new ChangeCoalescer(config, this::applyBatch);
        transport.addConnectionListener(this::onReconnect);
    }

    // ============================================================
    // Views
    // ============================================================

    /**
     * Opens a document view: loads it and subscribes to {@code doc:<type>:<id>}.
     *
     * @param type entity type
     * @param id entity id
     * @return open view
     */
    public DocView openDoc(EntityType type, EntityId id) {
        EntityRef ref = EntityRef.of(type, id);
        refetchDoc(ref);
        DocView view = new DocView(ref);
        view.subscription = transport.subscribe(Channels.doc(type, id), this::onPayload);
        openViews.add(view);
        return view;
    }

    /**
     * Opens a list view: loads its first page and subscribes to {@code list:<type>:<factoryId>}.
     *
     * @param type entity type
     * @param factoryId factory
     * @return open view
     */
    public ListView openList(EntityType type, FactoryId factoryId) {
        ListKey key = new ListKey(type, factoryId);
        refetchList(key);
        ListView view = new ListView(key);
        view.subscription = transport.subscribe(Channels.list(type, factoryId), this::onPayload);
        openViews.add(view);
        return view;
    }

    /**
     * Visibility regained: flushes pending events immediately.
     */
    public void onVisible() {
        coalescer.onVisible();
    }

    /**
     * Closes every open view and the coalescer.
     */
    @Override
    public void close() {
        for (View view : openViews) {
            view.close();
        }
        coalescer.close();
    }

    // ============================================================
    // Event handling
    // ============================================================

    private void onPayload(String payload) {
        ChangeEvent event;
        try {
            event = codec.decode(payload);
        } catch (MalformedChangeEventException e) {
            log.debug("Dropped malformed change event: {}", e.getMessage());
            return;
        }
        coalescer.offer(event);
    }

    /**
     * Applies one coalesced batch.
     *
     * @param batch events, deduplicated by (type, id, action)
     */
    synchronized void applyBatch(List<ChangeEvent> batch) {
        List<ChangeEvent> ordered = new ArrayList<>(batch);
        ordered.sort(Comparator.comparingLong(ChangeEvent::version));
        Set<ListKey> listHeads = new LinkedHashSet<>();

        for (ChangeEvent event : ordered) {
            CachedDoc doc = docs.get(event.ref());
            if (doc != null && event.version() <= doc.version) {
                droppedStale++;
                log.debug("Stale {} {} v{} dropped (cached v{})", event.action(), event.ref(), event.version(), doc.version);
                continue;
            }
            if (event.action().isListShaping()) {
                listHeads.add(new ListKey(event.type(), event.factoryId()));
            }
            if (doc == null) {
                continue;
            }
            if (isPatchable(event, doc)) {
                doc.entity = patched(doc.entity, event);
                doc.version = event.version();
                patches++;
            } else {
                doc.stale = true;
                doc.version = event.version();
                invalidations++;
            }
        }

        for (ListKey key : listHeads) {
            CachedList list = lists.get(key);
            if (list != null && !list.stale) {
                list.stale = true;
                listHeadInvalidations++;
            }
        }
    }

    private static boolean isPatchable(ChangeEvent event, CachedDoc doc) {
        return event.action().isUpdateClass()
            && !doc.stale
            && doc.entity != null
            && event.version() == doc.version + 1
            && event.carriesAllChangedValues();
    }

    private static ScopedEntity patched(ScopedEntity entity, ChangeEvent event) {
        ObjectNode attributes = entity.getAttributes();
        for (String key : event.changedKeys()) {
            attributes.set(key, event.data().get(key));
        }
        return ScopedEntity.restore(entity.getType(), entity.getId(), entity.getFactoryId(),
            event.version(), event.ts(), attributes);
    }

    private void onReconnect() {
        Set<Object> refreshed = new LinkedHashSet<>();
        for (View view : openViews) {
            if (refreshed.add(view.key())) {
                view.refetch();
            }
        }
        log.info("Realtime reconnected, refetched {} open views", refreshed.size());
    }

    // ============================================================
    // Reads
    // ============================================================

    /**
     * Reads a cached document, refetching it first if it was invalidated.
     *
     * @param ref the document
     * @return the entity, or empty if it is unknown, deleted or not visible
     */
    public synchronized Optional<ScopedEntity> getDoc(EntityRef ref) {
        CachedDoc doc = docs.get(ref);
        if (doc == null) {
            return Optional.empty();
        }
        if (doc.stale) {
            refetchDoc(ref);
            doc = docs.get(ref);
        }
        return Optional.ofNullable(doc.entity);
    }

    /**
     * Reads a cached list head, refetching it first if it was invalidated.
     *
     * @param type entity type
     * @param factoryId factory
     * @return first page (empty if never opened)
     */
    public synchronized List<ScopedEntity> getListHead(EntityType type, FactoryId factoryId) {
        ListKey key = new ListKey(type, factoryId);
        CachedList list = lists.get(key);
        if (list == null) {
            return List.of();
        }
        if (list.stale) {
            refetchList(key);
            list = lists.get(key);
        }
        return list.head;
    }

    private synchronized void refetchDoc(EntityRef ref) {
        refetches++;
        Optional<ScopedEntity> loaded = loader.loadDoc(ref);
        CachedDoc doc = docs.computeIfAbsent(ref, key -> new CachedDoc());
        doc.entity = loaded.orElse(null);
        doc.version = loaded.map(ScopedEntity::getVersion).orElse(doc.version);
        doc.stale = false;
    }

    private synchronized void refetchList(ListKey key) {
        refetches++;
        List<ScopedEntity> head = List.copyOf(loader.loadListHead(key.type(), key.factoryId()));
        CachedList list = lists.computeIfAbsent(key, k -> new CachedList());
        list.head = head;
        list.stale = false;
    }

    /**
     * Counters since construction.
     * Used for test assertions and diagnostics.
     */
    public synchronized Stats getStats() {
        return new Stats(patches, invalidations, listHeadInvalidations, droppedStale, refetches);
    }

    /**
     * Number of open views.
     */
    public int openViewCount() {
        return openViews.size();
    }

    // ============================================================
    // Types
    // ============================================================

    /**
     * Cache counters.
     *
     * @param patches field patches applied
     * @param invalidations documents marked stale
     * @param listHeadInvalidations list heads marked stale
     * @param droppedStale events dropped by the stale guard
     * @param refetches loads through the ViewLoader (including initial loads)
     */
    public record Stats(long patches, long invalidations, long listHeadInvalidations, long droppedStale, long refetches) {
    }

    private record ListKey(EntityType type, FactoryId factoryId) {
    }

    private static final class CachedDoc {
        private ScopedEntity entity;
        private long version;
        private boolean stale;
    }

    private static final class CachedList {
        private List<ScopedEntity> head = List.of();
        private boolean stale;
    }

    /**
     * An open view. Closing it unsubscribes immediately; cached data is kept.
     */
    public abstract class View implements AutoCloseable {

        RealtimeTransport.Subscription subscription;
        private volatile boolean open = true;

        abstract Object key();

        abstract void refetch();

        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            if (!open) {
                return;
            }
            open = false;
            subscription.unsubscribe();
            openViews.remove(this);
        }
    }

    /**
     * Document view.
     */
    public final class DocView extends View {

        private final EntityRef ref;

        private DocView(EntityRef ref) {
            this.ref = ref;
        }

        @Override
        Object key() {
            return ref;
        }

        @Override
        void refetch() {
            refetchDoc(ref);
        }

        public Optional<ScopedEntity> get() {
            return getDoc(ref);
        }

        public EntityRef getRef() {
            return ref;
        }
    }

    /**
     * List head view.
     */
    public final class ListView extends View {

        private final ListKey key;

        private ListView(ListKey key) {
            this.key = key;
        }

        @Override
        Object key() {
            return key;
        }

        @Override
        void refetch() {
            refetchList(key);
        }

        public List<ScopedEntity> get() {
            return getListHead(key.type(), key.factoryId());
        }
    }
}
