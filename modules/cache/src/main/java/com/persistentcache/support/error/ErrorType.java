package com.persistentcache.support.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 캐시 계층에서 발생하는 오류 유형.
 * <p>
 * 모든 저장소 구현체는 실패를 이 유형 중 하나로 분류하여 {@link CoreException}으로 전달합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Getter
@RequiredArgsConstructor
public enum ErrorType {
    /** 저장소에 연결할 수 없거나 저장소를 읽을 수 없음 */
    CONNECTION_ERROR("Connection Error", "캐시 저장소에 연결할 수 없습니다."),
    /** 연결은 되었으나 값을 저장하지 못함 */
    WRITE_ERROR("Write Error", "캐시 값을 저장하지 못했습니다."),
    /** 제한 시간 안에 파일 잠금을 획득하지 못함 */
    LOCK_TIMEOUT("Lock Timeout", "제한 시간 안에 캐시 잠금을 획득하지 못했습니다."),
    /** 인자 또는 반환 값을 직렬화하지 못함 */
    SERIALIZATION_ERROR("Serialization Error", "캐시 직렬화에 실패했습니다."),
    /** 저장된 값을 역직렬화하지 못함 */
    DESERIALIZATION_ERROR("Deserialization Error", "캐시 역직렬화에 실패했습니다.");

    private final String code;
    private final String message;
}
