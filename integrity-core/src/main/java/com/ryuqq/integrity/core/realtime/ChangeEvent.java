package com.ryuqq.integrity.core.realtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.outcome.Committed;

import java.time.Instant;
import java.util.List;

/**
 * 커밋된 변경으로부터 파생된 실시간 이벤트 (휘발성).
 *
 * <p>version은 필수입니다. 클라이언트 캐시는 이 값으로 오래된 이벤트를 걸러냅니다.</p>
 *
 * @param type 엔티티 타입
 * @param id 엔티티 ID
 * @param factoryId 소속 공장
 * @param action 변경 종류
 * @param changedKeys 변경된 속성 키 (없으면 빈 목록)
 * @param version 커밋 후 버전
 * @param ts 이벤트 시각
 * @param data changedKeys의 새 값 (null 가능)
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record ChangeEvent(
    EntityType type,
    EntityId id,
    FactoryId factoryId,
    ChangeAction action,
    List<String> changedKeys,
    long version,
    Instant ts,
    ObjectNode data
) {

    public ChangeEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (factoryId == null) {
            throw new IllegalArgumentException("factoryId cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be at least 1 (current: " + version + ")");
        }
        if (ts == null) {
            throw new IllegalArgumentException("ts cannot be null");
        }
        changedKeys = changedKeys == null ? List.of() : List.copyOf(changedKeys);
        data = data == null ? null : data.deepCopy();
    }

    /**
     * 커밋 결과로부터 이벤트 생성.
     *
     * <p>update 계열이면 changedKeys의 새 값을 data로 포함합니다.</p>
     *
     * @param committed 커밋 결과
     * @param changedKeys 변경 키 (CREATE/DELETE는 빈 목록)
     * @param ts 이벤트 시각
     * @return ChangeEvent
     */
    public static ChangeEvent from(Committed committed, List<String> changedKeys, Instant ts) {
        ObjectNode data = null;
        if (committed.action().isUpdateClass() && committed.entity() != null && !changedKeys.isEmpty()) {
            ObjectNode attributes = committed.entity().getAttributes();
            data = attributes.objectNode();
            for (String key : changedKeys) {
                if (attributes.has(key)) {
                    data.set(key, attributes.get(key));
                }
            }
        }
        return new ChangeEvent(
            committed.ref().type(), committed.ref().id(), committed.factoryId(), committed.action(),
            changedKeys, committed.version(), ts, data
        );
    }

    public EntityRef ref() {
        return EntityRef.of(type, id);
    }

    /**
     * 중복 제거 키 (type, id, action).
     */
    public DedupKey dedupKey() {
        return new DedupKey(type, id, action);
    }

    /**
     * data가 모든 changedKeys의 값을 포함하는지 여부.
     *
     * @return 필드 패치가 가능하면 true
     */
    public boolean carriesAllChangedValues() {
        if (changedKeys.isEmpty() || data == null) {
            return false;
        }
        for (String key : changedKeys) {
            if (!data.has(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 이벤트가 게시될 세 채널.
     *
     * @return factory, doc, list 채널 이름
     */
    public List<String> channels() {
        return List.of(
            Channels.factory(factoryId),
            Channels.doc(type, id),
            Channels.list(type, factoryId)
        );
    }

    /**
     * 코얼레서의 중복 제거 키.
     *
     * @param type 엔티티 타입
     * @param id 엔티티 ID
     * @param action 변경 종류
     */
    public record DedupKey(EntityType type, EntityId id, ChangeAction action) {
    }
}
