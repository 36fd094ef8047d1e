package com.persistentcache.cache;

import com.persistentcache.support.error.CoreException;
import com.persistentcache.support.error.ErrorType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 함수 인자 인코더.
 * <p>
 * 인자 목록을 결정적인 바이트 배열로 변환합니다. 각 인자는 {@code [위치, 타입 이름, 값]} 형태로 기록되어
 * 인자의 순서나 타입이 다르면 항상 다른 바이트가 만들어집니다.
 * </p>
 * <p>
 * 파일 핸들, 커넥션, 스레드처럼 결정적으로 인코딩할 수 없는 값은 {@link ErrorType#SERIALIZATION_ERROR}로 거부합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public class ArgumentEncoder {

    private static final String NULL_TYPE = "null";

    private final CacheSerializer cacheSerializer;

    public ArgumentEncoder(CacheSerializer cacheSerializer) {
        this.cacheSerializer = cacheSerializer;
    }

    /**
     * 인자 목록을 인코딩합니다.
     *
     * @param arguments 함수 인자
     * @return 인코딩된 바이트 배열
     */
    public byte[] encode(Object... arguments) {
        List<List<Object>> slots = new ArrayList<>(arguments.length);
        for (int position = 0; position < arguments.length; position++) {
            Object argument = arguments[position];
            rejectLiveHandle(position, argument);
            String type = argument != null ? argument.getClass().getName() : NULL_TYPE;
            slots.add(Arrays.asList(position, type, argument));
        }
        return cacheSerializer.serialize(slots);
    }

    private void rejectLiveHandle(int position, Object argument) {
        if (argument instanceof AutoCloseable || argument instanceof Thread) {
            throw new CoreException(ErrorType.SERIALIZATION_ERROR,
                String.format("캐시 키로 인코딩할 수 없는 인자입니다. (position: %d, type: %s)",
                    position, argument.getClass().getName()));
        }
    }
}
