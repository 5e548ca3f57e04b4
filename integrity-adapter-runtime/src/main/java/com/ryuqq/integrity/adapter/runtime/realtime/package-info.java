/**
 * 실시간 캐시 무효화 프로토콜.
 *
 * <h2>서버 측</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.realtime.ChangeNotifier} - 커밋된 변경을 세 채널에 게시</li>
 * </ul>
 *
 * <h2>클라이언트 측</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.realtime.ScopedRealtimeTransport} - 주체별 구독 및 전달 권한 검사</li>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.realtime.ChangeCoalescer} - 디바운스 + 중복 제거</li>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.realtime.RealtimeCache} - 오래된 이벤트 차단, 필드 패치, 무효화, 재연결 재조회</li>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.realtime.ViewLoader} - 재조회 포트</li>
 * </ul>
 *
 * <h2>전달 보장</h2>
 * <p>디바운스 창마다 최대 한 번 전달됩니다. 순서는 엔티티별 version으로만 보장되며,
 * 유실된 이벤트는 재연결 시 한 번의 재조회로 복구됩니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
package com.ryuqq.integrity.adapter.runtime.realtime;
