package com.ryuqq.integrity.core.realtime;

/**
 * 와이어 페이로드를 ChangeEvent로 해석할 수 없는 경우.
 *
 * <p>version이 누락된 이벤트도 여기에 해당합니다.</p>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public class MalformedChangeEventException extends RuntimeException {

    public MalformedChangeEventException(String message) {
        super(message);
    }

    public MalformedChangeEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
