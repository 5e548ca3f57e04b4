/**
 * Integrity Application Layer - 감사 조회 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.integrity.application.audit.AuditQuery} - 이력 조회와 체인 검증</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
package com.ryuqq.integrity.application.audit;
