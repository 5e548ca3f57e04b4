package com.ryuqq.integrity.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 공장 범위에 속하는 버전 관리 엔티티.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>factoryId는 생성 후 변경 불가</li>
 *   <li>version은 1부터 시작하며, 성공한 쓰기마다 정확히 1 증가 (감소/초기화 없음)</li>
 *   <li>{@code id}, {@code factoryId}, {@code version}, {@code updatedAt}은 예약 키이며 패치로 설정 불가</li>
 * </ul>
 *
 * <p>attributes는 생성 시와 조회 시 모두 깊은 복사되므로 외부에서 내부 상태를 변경할 수 없습니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class ScopedEntity {

    /**
     * 패치 및 생성 페이로드에 포함될 수 없는 키.
     */
    public static final Set<String> RESERVED_KEYS = Set.of("id", "factoryId", "version", "updatedAt");

    private final EntityType type;
    private final EntityId id;
    private final FactoryId factoryId;
    private final long version;
    private final Instant updatedAt;
    private final ObjectNode attributes;

    private ScopedEntity(EntityType type, EntityId id, FactoryId factoryId, long version,
                         Instant updatedAt, ObjectNode attributes) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (factoryId == null) {
            throw new IllegalArgumentException("factoryId cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be at least 1 (current: " + version + ")");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        this.type = type;
        this.id = id;
        this.factoryId = factoryId;
        this.version = version;
        this.updatedAt = updatedAt;
        this.attributes = attributes.deepCopy();
    }

    /**
     * 새 엔티티 생성 (version = 1).
     *
     * @param type 엔티티 타입
     * @param id 엔티티 ID
     * @param factoryId 소속 공장
     * @param payload 초기 속성 (예약 키 포함 불가)
     * @param now 생성 시각
     * @return version 1 엔티티
     * @throws IllegalArgumentException payload에 예약 키가 포함된 경우
     */
    public static ScopedEntity create(EntityType type, EntityId id, FactoryId factoryId,
                                      ObjectNode payload, Instant now) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        requireNoReservedKeys(payload);
        return new ScopedEntity(type, id, factoryId, 1, now, payload);
    }

    /**
     * 저장소 복원용 생성.
     *
     * <p>어댑터가 이미 저장된 상태를 재구성할 때 사용합니다.</p>
     */
    public static ScopedEntity restore(EntityType type, EntityId id, FactoryId factoryId, long version,
                                       Instant updatedAt, ObjectNode attributes) {
        return new ScopedEntity(type, id, factoryId, version, updatedAt, attributes);
    }

    /**
     * 패치를 적용한 다음 버전 생성.
     *
     * <p>최상위 키 단위로 덮어씁니다. 패치의 null 값은 해당 속성을 null로 설정합니다.</p>
     *
     * @param patch 변경할 속성 (예약 키 포함 불가)
     * @param now 변경 시각
     * @return version + 1 엔티티
     * @throws IllegalArgumentException patch가 null이거나 예약 키가 포함된 경우
     */
    public ScopedEntity applyPatch(ObjectNode patch, Instant now) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        requireNoReservedKeys(patch);
        ObjectNode merged = attributes.deepCopy();
        merged.setAll(patch.deepCopy());
        return new ScopedEntity(type, id, factoryId, version + 1, now, merged);
    }

    /**
     * 패치가 변경하는 키 목록 (패치 순서 유지).
     *
     * @param patch 패치
     * @return 변경 키 목록
     */
    public static List<String> changedKeys(ObjectNode patch) {
        List<String> keys = new ArrayList<>();
        Iterator<String> names = patch.fieldNames();
        while (names.hasNext()) {
            keys.add(names.next());
        }
        return List.copyOf(keys);
    }

    /**
     * 예약 키 포함 여부 검사.
     *
     * @param node 생성 페이로드 또는 패치
     * @throws IllegalArgumentException 예약 키가 포함된 경우
     */
    public static void requireNoReservedKeys(ObjectNode node) {
        for (String key : RESERVED_KEYS) {
            if (node.has(key)) {
                throw new IllegalArgumentException("Reserved key cannot be written: " + key);
            }
        }
    }

    /**
     * 감사 레코드의 before/after 이미지.
     *
     * <p>속성과 함께 id, factoryId, version, updatedAt을 포함합니다.</p>
     *
     * @return 새 ObjectNode
     */
    public ObjectNode toImage() {
        ObjectNode image = JsonNodeFactory.instance.objectNode();
        image.put("id", id.getValue());
        image.put("factoryId", factoryId.getValue());
        image.put("version", version);
        image.put("updatedAt", updatedAt.toString());
        image.setAll(attributes.deepCopy());
        return image;
    }

    public EntityRef getRef() {
        return EntityRef.of(type, id);
    }

    public EntityType getType() {
        return type;
    }

    public EntityId getId() {
        return id;
    }

    public FactoryId getFactoryId() {
        return factoryId;
    }

    public long getVersion() {
        return version;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * 속성 조회 (깊은 복사본).
     *
     * @return 속성 사본
     */
    public ObjectNode getAttributes() {
        return attributes.deepCopy();
    }

    /**
     * 단일 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값 (없으면 null)
     */
    public JsonNode get(String key) {
        JsonNode value = attributes.get(key);
        return value == null ? null : value.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScopedEntity that = (ScopedEntity) o;
        return version == that.version
            && type.equals(that.type)
            && id.equals(that.id)
            && factoryId.equals(that.factoryId)
            && updatedAt.equals(that.updatedAt)
            && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id, factoryId, version, updatedAt, attributes);
    }

    @Override
    public String toString() {
        return "ScopedEntity{" +
            "type=" + type.getValue() +
            ", id=" + id.getValue() +
            ", factoryId=" + factoryId.getValue() +
            ", version=" + version +
            '}';
    }
}
