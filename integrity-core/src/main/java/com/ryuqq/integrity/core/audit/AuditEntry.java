package com.ryuqq.integrity.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.core.json.JsonMappers;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.Principal;

import java.time.Instant;

/**
 * 해시 체인에 추가되기 전의 감사 내용.
 *
 * <p>저장소가 커밋 시점에 sequence, previousHash, currentHash를 부여하여
 * {@link AuditRecord}로 확정합니다.</p>
 *
 * @param target 대상 타입
 * @param targetId 대상 ID
 * @param action 변경 종류
 * @param before 변경 전 이미지 (CREATE이면 null)
 * @param after 변경 후 이미지 (DELETE이면 tombstone)
 * @param actor 호출자 ID
 * @param ip 클라이언트 IP (null 가능)
 * @param ua User-Agent (null 가능)
 * @param ts 변경 시각
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public record AuditEntry(
    EntityType target,
    EntityId targetId,
    ChangeAction action,
    JsonNode before,
    JsonNode after,
    String actor,
    String ip,
    String ua,
    Instant ts
) {

    /**
     * 삭제 시 after에 기록되는 tombstone 키.
     */
    public static final String TOMBSTONE_KEY = "_deleted";

    public AuditEntry {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (targetId == null) {
            throw new IllegalArgumentException("targetId cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor cannot be null or blank");
        }
        if (ts == null) {
            throw new IllegalArgumentException("ts cannot be null");
        }
        before = before == null ? null : before.deepCopy();
        after = after.deepCopy();
    }

    /**
     * Principal 정보로 감사 내용 생성.
     *
     * @param ref 대상
     * @param action 변경 종류
     * @param before 변경 전 이미지
     * @param after 변경 후 이미지
     * @param principal 호출자
     * @param ts 변경 시각
     * @return AuditEntry
     */
    public static AuditEntry of(EntityRef ref, ChangeAction action, JsonNode before, JsonNode after,
                                Principal principal, Instant ts) {
        return new AuditEntry(
            ref.type(), ref.id(), action, before, after,
            principal.actorId(), principal.origin().ip(), principal.origin().userAgent(), ts
        );
    }

    /**
     * 삭제 tombstone 이미지 {@code {"_deleted":true}}.
     *
     * @return 새 ObjectNode
     */
    public static ObjectNode tombstone() {
        ObjectNode node = JsonMappers.objectNode();
        node.put(TOMBSTONE_KEY, true);
        return node;
    }

    public EntityRef ref() {
        return EntityRef.of(target, targetId);
    }

    /**
     * after만 변경한 새 인스턴스 생성.
     */
    public AuditEntry withAfter(JsonNode after) {
        return new AuditEntry(target, targetId, action, before, after, actor, ip, ua, ts);
    }
}
