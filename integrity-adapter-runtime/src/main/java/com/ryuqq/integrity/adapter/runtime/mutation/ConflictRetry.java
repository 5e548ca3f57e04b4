package com.ryuqq.integrity.adapter.runtime.mutation;

import com.ryuqq.integrity.core.outcome.MutationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 낙관적 잠금 충돌 시 재시도 헬퍼.
 *
 * <p>attempt는 매번 최신 엔티티를 다시 읽고 변경을 다시 적용해야 합니다. 충돌이 아닌 결과
 * (커밋, 거부)는 즉시 반환하며, 예외는 재시도 없이 전파합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MutationResult result = retry.execute(() -&gt; {
 *     ScopedEntity current = api.find(type, id, principal).orElseThrow();
 *     return api.mutate(type, id, current.getVersion(), patch, principal);
 * });
 * </pre>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class ConflictRetry {

    private static final Logger log = LoggerFactory.getLogger(ConflictRetry.class);

    private final ConflictRetryConfig config;

    public ConflictRetry() {
        this(new ConflictRetryConfig());
    }

    /**
     * 생성자.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ConflictRetry(ConflictRetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 충돌이 해소되거나 재시도 횟수를 다 쓸 때까지 실행.
     *
     * @param attempt 읽기-변경 시도
     * @return 마지막 시도의 결과 (재시도 소진 시 마지막 충돌)
     */
    public MutationResult execute(Supplier<MutationResult> attempt) {
        if (attempt == null) {
            throw new IllegalArgumentException("attempt cannot be null");
        }
        MutationResult result = attempt.get();
        for (int retry = 1; retry <= config.maxRetries() && result.isConflict(); retry++) {
            log.debug("Version conflict, retry {} of {}", retry, config.maxRetries());
            if (!pause(config.backoffMs() * retry)) {
                return result;
            }
            result = attempt.get();
        }
        return result;
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Conflict retry interrupted while backing off");
            return false;
        }
    }
}
