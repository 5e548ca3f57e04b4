package com.ryuqq.integrity.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.integrity.core.model.ChangeAction;
import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * 해시 체인에 연결된 감사 레코드 (추가 전용).
 *
 * <p>{@code currentHash = SHA256(previousHash || utf8(canonical(after)))}이며,
 * 체인의 첫 레코드는 빈 previousHash를 가집니다.</p>
 *
 * <p>sequence는 저장소가 커밋 순서대로 부여하는 단조 증가 값입니다.
 * 해시 배열은 생성 시와 조회 시 모두 복사됩니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class AuditRecord {

    private final long sequence;
    private final AuditEntry entry;
    private final byte[] previousHash;
    private final byte[] currentHash;

    private AuditRecord(long sequence, AuditEntry entry, byte[] previousHash, byte[] currentHash) {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (previousHash == null) {
            throw new IllegalArgumentException("previousHash cannot be null");
        }
        if (currentHash == null || currentHash.length == 0) {
            throw new IllegalArgumentException("currentHash cannot be null or empty");
        }
        this.sequence = sequence;
        this.entry = entry;
        this.previousHash = previousHash.clone();
        this.currentHash = currentHash.clone();
    }

    /**
     * AuditRecord 생성.
     *
     * @param sequence 커밋 순번
     * @param entry 감사 내용
     * @param previousHash 직전 레코드의 currentHash (첫 레코드는 빈 배열)
     * @param currentHash 이 레코드의 해시
     * @return AuditRecord 인스턴스
     */
    public static AuditRecord of(long sequence, AuditEntry entry, byte[] previousHash, byte[] currentHash) {
        return new AuditRecord(sequence, entry, previousHash, currentHash);
    }

    public long getSequence() {
        return sequence;
    }

    public AuditEntry getEntry() {
        return entry;
    }

    public EntityRef getRef() {
        return entry.ref();
    }

    public EntityType getTarget() {
        return entry.target();
    }

    public EntityId getTargetId() {
        return entry.targetId();
    }

    public ChangeAction getAction() {
        return entry.action();
    }

    public JsonNode getBefore() {
        return entry.before() == null ? null : entry.before().deepCopy();
    }

    public JsonNode getAfter() {
        return entry.after().deepCopy();
    }

    public String getActor() {
        return entry.actor();
    }

    public String getIp() {
        return entry.ip();
    }

    public String getUa() {
        return entry.ua();
    }

    public Instant getTs() {
        return entry.ts();
    }

    public byte[] getPreviousHash() {
        return previousHash.clone();
    }

    public byte[] getCurrentHash() {
        return currentHash.clone();
    }

    public String getPreviousHashHex() {
        return ChainHasher.toHex(previousHash);
    }

    public String getCurrentHashHex() {
        return ChainHasher.toHex(currentHash);
    }

    public boolean isFirstInChain() {
        return previousHash.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AuditRecord that = (AuditRecord) o;
        return sequence == that.sequence
            && entry.equals(that.entry)
            && Arrays.equals(previousHash, that.previousHash)
            && Arrays.equals(currentHash, that.currentHash);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sequence, entry);
        result = 31 * result + Arrays.hashCode(previousHash);
        result = 31 * result + Arrays.hashCode(currentHash);
        return result;
    }

    @Override
    public String toString() {
        return "AuditRecord{" +
            "sequence=" + sequence +
            ", target=" + entry.target().getValue() +
            ", targetId=" + entry.targetId().getValue() +
            ", action=" + entry.action() +
            ", currentHash=" + getCurrentHashHex() +
            '}';
    }
}
