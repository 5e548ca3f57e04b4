package com.ryuqq.integrity.core.realtime;

import com.ryuqq.integrity.core.model.EntityId;
import com.ryuqq.integrity.core.model.EntityType;
import com.ryuqq.integrity.core.model.FactoryId;

/**
 * 실시간 채널 이름.
 *
 * <ul>
 *   <li>{@code factory:<factoryId>} - 공장 단위 대시보드</li>
 *   <li>{@code doc:<type>:<id>} - 단일 문서 화면</li>
 *   <li>{@code list:<type>:<factoryId>} - 공장별 목록 화면</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class Channels {

    private Channels() {
    }

    public static String factory(FactoryId factoryId) {
        return "factory:" + factoryId.getValue();
    }

    public static String doc(EntityType type, EntityId id) {
        return "doc:" + type.getValue() + ":" + id.getValue();
    }

    public static String list(EntityType type, FactoryId factoryId) {
        return "list:" + type.getValue() + ":" + factoryId.getValue();
    }
}
