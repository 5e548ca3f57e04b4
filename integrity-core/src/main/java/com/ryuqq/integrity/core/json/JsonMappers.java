package com.ryuqq.integrity.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 공용 Jackson ObjectMapper 구성.
 *
 * <p>Java time 타입은 ISO-8601 문자열로 직렬화합니다 (타임스탬프 숫자 사용 안 함).
 * ObjectMapper는 구성 후 스레드 안전하므로 공유 인스턴스를 사용합니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class JsonMappers {

    private static final ObjectMapper SHARED = standard();

    private JsonMappers() {
    }

    /**
     * 새 ObjectMapper 생성.
     *
     * @return JavaTimeModule이 등록된 ObjectMapper
     */
    public static ObjectMapper standard() {
        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    /**
     * 공유 ObjectMapper.
     *
     * @return 공유 인스턴스 (설정 변경 금지)
     */
    public static ObjectMapper shared() {
        return SHARED;
    }

    /**
     * 빈 ObjectNode 생성.
     *
     * @return 새 ObjectNode
     */
    public static ObjectNode objectNode() {
        return SHARED.createObjectNode();
    }

    /**
     * JSON 객체 문자열 파싱.
     *
     * @param json JSON 객체 문자열
     * @return ObjectNode
     * @throws IllegalArgumentException JSON이 잘못되었거나 객체가 아닌 경우
     */
    public static ObjectNode readObject(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        JsonNode node;
        try {
            node = SHARED.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("JSON value is not an object");
        }
        return (ObjectNode) node;
    }
}
