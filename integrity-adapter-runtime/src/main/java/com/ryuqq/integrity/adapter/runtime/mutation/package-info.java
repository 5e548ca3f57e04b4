/**
 * 변경 파이프라인.
 *
 * <p>{@link com.ryuqq.integrity.adapter.runtime.mutation.MutationPipeline}은 권한 검사, 버전 검사,
 * 패치 적용, 버전 증가, 감사 추가를 하나의 작업 단위로 묶는 MutationApi 구현체입니다.
 * {@link com.ryuqq.integrity.adapter.runtime.mutation.ConflictRetry}는 충돌 시 선형 백오프로
 * 재시도합니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
package com.ryuqq.integrity.adapter.runtime.mutation;
