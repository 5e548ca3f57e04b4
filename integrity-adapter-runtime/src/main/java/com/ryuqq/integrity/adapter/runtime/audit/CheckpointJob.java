package com.ryuqq.integrity.adapter.runtime.audit;

import com.ryuqq.integrity.core.audit.AuditRecord;
import com.ryuqq.integrity.core.audit.ChainHead;
import com.ryuqq.integrity.core.audit.ChainIntegrityViolation;
import com.ryuqq.integrity.core.audit.Checkpoint;
import com.ryuqq.integrity.core.audit.CheckpointDigest;
import com.ryuqq.integrity.core.audit.CheckpointMeta;
import com.ryuqq.integrity.core.spi.AuditLog;
import com.ryuqq.integrity.core.spi.CheckpointStore;
import com.ryuqq.integrity.core.spi.IntegrityAlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 일일 체크포인트 작업.
 *
 * <p>주기적으로 호출되어 (1) 최신 체크포인트를 저장된 체인 헤드와 비교하고 (2) 그 이후에
 * 추가된 레코드만 내용으로 재검증한 뒤 (3) 오늘의 체크포인트를 기록합니다. 전체 이력을 다시
 * 해시하지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. latest() → 최신 체크포인트 (없으면 비교 생략)
 * 2. heads(cp.throughSequence) → 다이제스트 → cp.headHash와 비교
 * 3. records(cp.throughSequence, lastSequence) → cp 시점 헤드에서 이어 재계산 → heads(lastSequence)와 비교
 * 4. 불일치 → ChainIntegrityViolation 보고 (ERROR 로그, 자동 복구 없음)
 * 5. heads(lastSequence) → 오늘 날짜로 insertIfAbsent
 * </pre>
 *
 * <p><strong>감지 범위:</strong></p>
 * <ul>
 *   <li>체크포인트 이전 레코드의 해시 재작성, 삭제, 재배열: 저장된 헤드 다이제스트가 달라짐</li>
 *   <li>체크포인트 이후 레코드의 after 이미지 수정: 재계산 헤드가 저장된 헤드와 달라짐</li>
 *   <li>체크포인트 이전 레코드의 내용만 수정: 감지하지 않음, {@code ChainVerifier}가 담당</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class CheckpointJob {

    private static final Logger log = LoggerFactory.getLogger(CheckpointJob.class);

    private final AuditLog auditLog;
    private final CheckpointStore checkpointStore;
    private final IntegrityAlertSink alertSink;
    private final CheckpointJobConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param auditLog 감사 로그
     * @param checkpointStore 체크포인트 저장소
     * @param alertSink 운영자 알림 채널
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CheckpointJob(AuditLog auditLog, CheckpointStore checkpointStore, IntegrityAlertSink alertSink,
                         CheckpointJobConfig config, Clock clock) {
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        if (checkpointStore == null) {
            throw new IllegalArgumentException("checkpointStore cannot be null");
        }
        if (alertSink == null) {
            throw new IllegalArgumentException("alertSink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.auditLog = auditLog;
        this.checkpointStore = checkpointStore;
        this.alertSink = alertSink;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 비교 후 오늘의 체크포인트 기록.
     *
     * <p>주기적으로 호출되어야 합니다 (CheckpointScheduler 또는 외부 스케줄러).</p>
     *
     * @return 비교에서 발견한 위반 (없으면 empty)
     */
    public Optional<ChainIntegrityViolation> run() {
        log.info("Checkpoint job started");
        long lastSequence = auditLog.lastSequence();
        List<ChainHead> heads = auditLog.heads(lastSequence);

        // 1. 최신 체크포인트와 비교, 이후 추가분 재검증
        Optional<Checkpoint> latest = checkpointStore.latest();
        Optional<ChainIntegrityViolation> violation = latest.flatMap(this::compare);
        violation.ifPresent(this::report);
        Optional<ChainIntegrityViolation> appended = latest.flatMap(cp -> verifySince(cp, lastSequence, heads));
        appended.ifPresent(this::report);

        // 2. 오늘의 체크포인트 기록
        Checkpoint checkpoint = snapshot(lastSequence, heads);
        boolean inserted = checkpointStore.insertIfAbsent(checkpoint);

        // 3. 결과 로깅
        log.info("Checkpoint job completed: day={}, chains={}, throughSequence={}, inserted={}",
            checkpoint.day(), checkpoint.meta().count(), checkpoint.meta().throughSequence(), inserted);
        return violation.isPresent() ? violation : appended;
    }

    /**
     * 체크포인트 시점의 저장된 체인 헤드로 다이제스트를 다시 만들어 비교.
     *
     * @param checkpoint 비교 대상
     * @return 불일치 시 위반
     */
    Optional<ChainIntegrityViolation> compare(Checkpoint checkpoint) {
        long through = checkpoint.meta().throughSequence();
        List<ChainHead> stored = auditLog.heads(through);
        String actual = CheckpointDigest.digest(stored);

        if (actual.equals(checkpoint.headHash()) && stored.size() == checkpoint.meta().count()) {
            log.info("Checkpoint {} verified: {} chains through sequence {}", checkpoint.day(), stored.size(), through);
            return Optional.empty();
        }
        return Optional.of(new ChainIntegrityViolation(
            checkpoint.day(), checkpoint.headHash(), actual, through, clock.instant()
        ));
    }

    /**
     * 체크포인트 이후 추가된 레코드만 내용으로 재해시해 저장된 헤드와 비교.
     *
     * @param checkpoint 기준 체크포인트
     * @param lastSequence 현재 마지막 순번
     * @param storedHeads {@code lastSequence} 시점의 저장된 헤드
     * @return 불일치 시 위반
     */
    Optional<ChainIntegrityViolation> verifySince(Checkpoint checkpoint, long lastSequence, List<ChainHead> storedHeads) {
        long from = checkpoint.meta().throughSequence();
        if (lastSequence <= from) {
            return Optional.empty();
        }
        List<AuditRecord> appended = auditLog.records(from, lastSequence);
        List<ChainHead> recomputed = CheckpointDigest.recomputeHeads(auditLog.heads(from), appended);
        String expected = CheckpointDigest.digest(storedHeads);
        String actual = CheckpointDigest.digest(recomputed);

        if (actual.equals(expected)) {
            log.debug("Verified {} records appended after checkpoint {}", appended.size(), checkpoint.day());
            return Optional.empty();
        }
        return Optional.of(new ChainIntegrityViolation(
            checkpoint.day(), expected, actual, lastSequence, clock.instant()
        ));
    }

    private void report(ChainIntegrityViolation violation) {
        log.error("Audit chain integrity violation against checkpoint {}: expected={}, actual={}, throughSequence={}",
            violation.checkpointDay(), violation.expectedHeadHash(), violation.actualHeadHash(), violation.throughSequence());
        try {
            alertSink.report(violation);
        } catch (RuntimeException e) {
            log.error("Failed to deliver integrity violation for checkpoint {} to operator channel",
                violation.checkpointDay(), e);
        }
    }

    private Checkpoint snapshot(long lastSequence, List<ChainHead> heads) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, config.zone());
        return new Checkpoint(
            today,
            CheckpointDigest.digest(heads),
            new CheckpointMeta(heads.size(), lastSequence),
            now
        );
    }
}
