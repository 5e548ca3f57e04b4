package com.ryuqq.integrity.adapter.runtime.realtime;

import com.ryuqq.integrity.application.mutation.MutationApi;
import com.ryuqq.integrity.core.model.EntityRef;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;
import com.ryuqq.integrity.core.model.Principal;
import com.ryuqq.integrity.core.model.ScopedEntity;

import java.util.List;
import java.util.Optional;

/**
 * RealtimeCache가 무효화된 화면을 다시 읽을 때 사용하는 조회 포트.
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public interface ViewLoader {

    /**
     * 단일 문서 조회.
     *
     * @param ref 대상
     * @return 엔티티 (삭제되었거나 권한이 없으면 empty)
     */
    Optional<ScopedEntity> loadDoc(EntityRef ref);

    /**
     * 목록 첫 페이지 조회.
     *
     * @param type 엔티티 타입
     * @param factoryId 공장
     * @return 첫 페이지
     */
    List<ScopedEntity> loadListHead(EntityType type, FactoryId factoryId);

    /**
     * MutationApi 조회를 사용하는 ViewLoader.
     *
     * @param api 변경 API
     * @param principal 화면 사용자
     * @param pageSize 목록 첫 페이지 크기
     * @return ViewLoader
     */
    static ViewLoader from(MutationApi api, Principal principal, int pageSize) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (principal == null) {
            throw new IllegalArgumentException("principal cannot be null");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
        }
        return new ViewLoader() {
            @Override
            public Optional<ScopedEntity> loadDoc(EntityRef ref) {
                return api.find(ref.type(), ref.id(), principal);
            }

            @Override
            public List<ScopedEntity> loadListHead(EntityType type, FactoryId factoryId) {
                List<ScopedEntity> all = api.list(type, factoryId, principal);
                return List.copyOf(all.subList(0, Math.min(pageSize, all.size())));
            }
        };
    }
}
