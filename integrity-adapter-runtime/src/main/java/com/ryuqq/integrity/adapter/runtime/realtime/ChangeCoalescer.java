package com.ryuqq.integrity.adapter.runtime.realtime;

import com.ryuqq.integrity.core.realtime.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 클라이언트 측 변경 이벤트 디바운서 (타이머 + 중복 제거 맵).
 *
 * <p>짧은 시간에 몰리는 이벤트를 하나의 배치로 모아 sink에 전달합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>중복 제거 키 (type, id, action): 같은 키는 가장 높은 version만 유지</li>
 *   <li>Rolling window: 이벤트마다 windowMs 타이머를 다시 시작</li>
 *   <li>maxDelayMs: 첫 대기 이벤트로부터 이 시간이 지나면 창과 관계없이 flush</li>
 * </ul>
 *
 * <p><strong>flush 트리거:</strong></p>
 * <ul>
 *   <li>타이머 만료</li>
 *   <li>{@link #onVisible()}: 화면이 다시 보이게 된 경우</li>
 *   <li>{@link #close()}: 화면 해제 (마지막 flush 후 이후 이벤트는 무시)</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> 대기 맵은 this로 보호되며, sink는 잠금 밖에서 호출됩니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class ChangeCoalescer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChangeCoalescer.class);

    private final CoalescerConfig config;
    private final Consumer<List<ChangeEvent>> sink;
    private final ScheduledExecutorService timer;
    private final boolean ownsTimer;

    private final Map<ChangeEvent.DedupKey, ChangeEvent> pending = new LinkedHashMap<>();
    private ScheduledFuture<?> scheduledFlush;
    private long firstPendingAtNanos;
    private boolean closed;

    /**
     * 생성자 (전용 데몬 타이머 스레드 사용).
     *
     * @param config 설정
     * @param sink flush된 배치 소비자
     */
    public ChangeCoalescer(CoalescerConfig config, Consumer<List<ChangeEvent>> sink) {
        this(config, sink, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "change-coalescer");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    /**
     * 생성자 (외부 타이머 사용, close() 시 종료하지 않음).
     *
     * @param config 설정
     * @param sink flush된 배치 소비자
     * @param timer 스케줄 실행기
     */
    public ChangeCoalescer(CoalescerConfig config, Consumer<List<ChangeEvent>> sink, ScheduledExecutorService timer) {
        this(config, sink, timer, false);
    }

    private ChangeCoalescer(CoalescerConfig config, Consumer<List<ChangeEvent>> sink,
                            ScheduledExecutorService timer, boolean ownsTimer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        this.config = config;
        this.sink = sink;
        this.timer = timer;
        this.ownsTimer = ownsTimer;
    }

    /**
     * 이벤트 추가.
     *
     * <p>같은 (type, id, action)에 이미 같거나 높은 version이 대기 중이면 무시합니다.</p>
     *
     * @param event 수신 이벤트
     */
    public synchronized void offer(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (closed) {
            log.debug("Coalescer closed, dropped {} v{}", event.ref(), event.version());
            return;
        }
        ChangeEvent.DedupKey key = event.dedupKey();
        ChangeEvent existing = pending.get(key);
        if (existing != null && existing.version() >= event.version()) {
            log.debug("Duplicate {} {} v{} dropped", event.action(), event.ref(), event.version());
            return;
        }
        if (pending.isEmpty()) {
            firstPendingAtNanos = System.nanoTime();
        }
        pending.put(key, event);
        rearm();
    }

    /**
     * 화면 가시성 회복 시 즉시 flush.
     */
    public void onVisible() {
        flush();
    }

    /**
     * 대기 중인 이벤트를 즉시 sink로 전달.
     *
     * @return 전달한 이벤트 수
     */
    public int flush() {
        List<ChangeEvent> batch;
        synchronized (this) {
            if (scheduledFlush != null) {
                scheduledFlush.cancel(false);
                scheduledFlush = null;
            }
            if (pending.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(pending.values());
            pending.clear();
        }
        try {
            sink.accept(batch);
        } catch (RuntimeException e) {
            log.error("Failed to apply coalesced batch of {} events", batch.size(), e);
        }
        return batch.size();
    }

    /**
     * 마지막 flush 후 종료.
     */
    @Override
    public void close() {
        flush();
        synchronized (this) {
            closed = true;
        }
        if (ownsTimer) {
            timer.shutdownNow();
        }
    }

    /**
     * 대기 중인 이벤트 수.
     * Used for test assertions.
     */
    public synchronized int pendingCount() {
        return pending.size();
    }

    private void rearm() {
        if (scheduledFlush != null) {
            scheduledFlush.cancel(false);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - firstPendingAtNanos);
        long delay = Math.min(config.windowMs(), Math.max(0, config.maxDelayMs() - elapsedMs));
        scheduledFlush = timer.schedule(this::flush, delay, TimeUnit.MILLISECONDS);
    }
}
