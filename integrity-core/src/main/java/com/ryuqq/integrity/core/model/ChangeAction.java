package com.ryuqq.integrity.core.model;

import java.util.Locale;

/**
 * 커밋된 변경의 종류.
 *
 * <p>감사 레코드의 {@code action}과 실시간 이벤트의 {@code action}에 공통으로 사용됩니다.
 * 와이어 포맷에서는 소문자 이름(create, update, delete, approve, reject)을 사용합니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>Update 계열 (UPDATE, APPROVE, REJECT): 캐시된 엔티티에 필드 패치 가능</li>
 *   <li>목록 형태 변경 (CREATE, DELETE): 목록 첫 페이지 무효화 대상</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public enum ChangeAction {

    CREATE,
    UPDATE,
    DELETE,
    APPROVE,
    REJECT;

    /**
     * Update 계열 여부.
     *
     * @return UPDATE, APPROVE, REJECT이면 true
     */
    public boolean isUpdateClass() {
        return this == UPDATE || this == APPROVE || this == REJECT;
    }

    /**
     * 목록의 구성(행 추가/제거)을 바꾸는 변경인지 여부.
     *
     * @return CREATE, DELETE이면 true
     */
    public boolean isListShaping() {
        return this == CREATE || this == DELETE;
    }

    /**
     * 와이어 포맷 이름.
     *
     * @return 소문자 이름
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 와이어 포맷 이름으로부터 변환.
     *
     * @param wireName 소문자 또는 대문자 이름
     * @return ChangeAction
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static ChangeAction fromWire(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        try {
            return ChangeAction.valueOf(wireName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + wireName, e);
        }
    }
}
