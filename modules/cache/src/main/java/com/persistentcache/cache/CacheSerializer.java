package com.persistentcache.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.persistentcache.support.error.CoreException;
import com.persistentcache.support.error.ErrorType;

import java.io.IOException;

/**
 * 캐시 값 직렬화기.
 * <p>
 * 함수의 반환 값과 인자를 CBOR 바이너리로 변환합니다.
 * 같은 값은 항상 같은 바이트로 직렬화되도록 맵 엔트리는 키 순서로 기록합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public class CacheSerializer {

    private final ObjectMapper objectMapper;

    public CacheSerializer() {
        this(CBORMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build());
    }

    public CacheSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 값을 바이트 배열로 직렬화합니다.
     *
     * @param value 직렬화할 값 (null 허용)
     * @return 직렬화된 바이트 배열
     */
    public byte[] serialize(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new CoreException(ErrorType.SERIALIZATION_ERROR,
                String.format("캐시 직렬화 실패. (type: %s)", value.getClass().getName()), e);
        }
    }

    /**
     * 바이트 배열을 값으로 역직렬화합니다.
     *
     * @param bytes 직렬화된 바이트 배열
     * @param type 값의 타입
     * @param <T> 값의 타입
     * @return 역직렬화된 값 (null 가능)
     */
    public <T> T deserialize(byte[] bytes, JavaType type) {
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CoreException(ErrorType.DESERIALIZATION_ERROR,
                String.format("캐시 역직렬화 실패. (type: %s)", type), e);
        }
    }
}
