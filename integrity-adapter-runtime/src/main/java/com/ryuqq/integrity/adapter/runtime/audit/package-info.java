/**
 * 감사 체인 검증과 체크포인트.
 *
 * <h2>핵심 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.audit.ChainVerifier} - 위치별 체인 검증 (AuditQuery 구현)</li>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.audit.CheckpointJob} - 최신 체크포인트 비교 + 일일 기록</li>
 *   <li>{@link com.ryuqq.integrity.adapter.runtime.audit.CheckpointScheduler} - 고정 주기 실행</li>
 * </ul>
 *
 * <h2>오류 처리</h2>
 * <ul>
 *   <li>변조 증거는 ERROR 로그와 운영자 채널로 보고하며 복구하지 않습니다</li>
 *   <li>저장소는 롤백하지 않습니다</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
package com.ryuqq.integrity.adapter.runtime.audit;
