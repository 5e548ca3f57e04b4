package com.ryuqq.integrity.adapter.runtime.realtime;

import com.ryuqq.integrity.core.realtime.ChangeEvent;
import com.ryuqq.integrity.core.realtime.ChangeEventCodec;
import com.ryuqq.integrity.core.spi.RealtimeTransport;
import com.ryuqq.integrity.core.spi.TransientTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 서버 측 변경 알림 게시자.
 *
 * <p>커밋된 변경마다 하나의 이벤트를 세 채널에 게시합니다:</p>
 * <ul>
 *   <li>{@code factory:<factoryId>}</li>
 *   <li>{@code doc:<type>:<id>}</li>
 *   <li>{@code list:<type>:<factoryId>}</li>
 * </ul>
 *
 * <p>전송 실패({@link TransientTransportException})는 WARN으로 기록하고 나머지 채널 게시를
 * 계속합니다. 이미 커밋된 변경은 실패로 바뀌지 않으며, 클라이언트는 재연결 시 한 번의
 * 재조회로 따라잡습니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private final RealtimeTransport transport;
    private final ChangeEventCodec codec;

    /**
     * 생성자.
     *
     * @param transport 실시간 전송
     * @param codec 와이어 코덱
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ChangeNotifier(RealtimeTransport transport, ChangeEventCodec codec) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.transport = transport;
        this.codec = codec;
    }

    /**
     * 이벤트를 세 채널에 게시.
     *
     * @param event 커밋된 변경 이벤트
     * @return 게시에 성공한 채널 수
     */
    public int publish(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        String payload = codec.encode(event);
        int delivered = 0;
        for (String channel : event.channels()) {
            try {
                transport.publish(channel, payload);
                delivered++;
            } catch (TransientTransportException e) {
                log.warn("Realtime publish to {} failed for {} v{}: {}",
                    channel, event.ref(), event.version(), e.getMessage());
            }
        }
        return delivered;
    }
}
