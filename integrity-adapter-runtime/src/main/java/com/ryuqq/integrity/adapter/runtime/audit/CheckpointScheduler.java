package com.ryuqq.integrity.adapter.runtime.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * CheckpointJob을 고정 주기로 실행하는 스케줄러.
 *
 * <p>한 번의 실행이 실패해도 예외를 기록하고 다음 주기에 다시 실행합니다
 * ({@code scheduleAtFixedRate}는 예외가 전파되면 이후 실행을 중단하기 때문입니다).</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * CheckpointScheduler scheduler = new CheckpointScheduler(job, config);
 * scheduler.start();
 * ...
 * scheduler.close();   // 진행 중인 실행은 완료까지 대기
 * </pre>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class CheckpointScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CheckpointScheduler.class);

    private final CheckpointJob job;
    private final CheckpointJobConfig config;
    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> future;

    /**
     * 생성자 (전용 데몬 스레드 사용).
     */
    public CheckpointScheduler(CheckpointJob job, CheckpointJobConfig config) {
        this(job, config, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "checkpoint-scheduler");
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * 생성자.
     *
     * @param job 체크포인트 작업
     * @param config 설정 (주기, 첫 지연)
     * @param executor 스케줄 실행기 (close() 시 종료됨)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CheckpointScheduler(CheckpointJob job, CheckpointJobConfig config, ScheduledExecutorService executor) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.job = job;
        this.config = config;
        this.executor = executor;
    }

    /**
     * 스케줄 시작.
     *
     * @throws IllegalStateException 이미 시작되었거나 종료된 경우
     */
    public synchronized void start() {
        if (future != null) {
            throw new IllegalStateException("CheckpointScheduler already started");
        }
        if (executor.isShutdown()) {
            throw new IllegalStateException("CheckpointScheduler already closed");
        }
        future = executor.scheduleAtFixedRate(this::runOnce, config.initialDelayMs(), config.intervalMs(), TimeUnit.MILLISECONDS);
        log.info("CheckpointScheduler started: interval={}ms, initialDelay={}ms", config.intervalMs(), config.initialDelayMs());
    }

    public synchronized boolean isRunning() {
        return future != null && !future.isCancelled() && !executor.isShutdown();
    }

    /**
     * 스케줄 중지 및 실행기 종료.
     */
    @Override
    public synchronized void close() {
        if (future != null) {
            future.cancel(false);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("CheckpointScheduler did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping CheckpointScheduler");
        }
        log.info("CheckpointScheduler stopped");
    }

    private void runOnce() {
        try {
            job.run();
        } catch (RuntimeException e) {
            log.error("Checkpoint job run failed, will retry at next interval", e);
        }
    }
}
