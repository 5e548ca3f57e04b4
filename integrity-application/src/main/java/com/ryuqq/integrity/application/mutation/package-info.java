/**
 * Integrity Application Layer - 엔티티 변경 API.
 *
 * <p>비즈니스 모듈(주문, 작업지시, 재고 등)이 소비하는 포트입니다. 구현체는
 * integrity-adapter-runtime 모듈의 MutationPipeline입니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.application.mutation.MutationApi} - 생성/변경/승인/반려/삭제/조회</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>타입 결과:</strong> 충돌과 거부는 예외가 아닌 MutationResult로 반환</li>
 *   <li><strong>우회 불가:</strong> 쓰기 핸들(Transaction)은 구현체 내부에만 존재</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
package com.ryuqq.integrity.application.mutation;
