package com.persistentcache.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;

/**
 * 간단한 캐시 키 구현체.
 * <p>
 * 이미 만들어진 키 문자열로 캐시 키를 생성할 때 사용합니다.
 * 함수 호출로부터 키를 만들 때는 {@link CacheKeyGenerator}를 사용합니다.
 * </p>
 *
 * @param <T> 캐시 값의 타입
 * @author PersistentCache
 * @version 1.0
 */
public record SimpleCacheKey<T>(
    String key,
    JavaType type
) implements CacheKey<T> {

    /**
     * 캐시 키를 생성합니다.
     *
     * @param key 캐시 키 문자열
     * @param type 캐시 값의 타입
     * @param <T> 캐시 값의 타입
     * @return 캐시 키
     */
    public static <T> SimpleCacheKey<T> of(String key, Class<T> type) {
        return new SimpleCacheKey<>(key, TypeFactory.defaultInstance().constructType(type));
    }

    /**
     * 제네릭 타입의 캐시 키를 생성합니다.
     * <p>
     * 예: {@code SimpleCacheKey.of(key, new TypeReference<List<Long>>() {})}
     * </p>
     *
     * @param key 캐시 키 문자열
     * @param type 캐시 값의 타입
     * @param <T> 캐시 값의 타입
     * @return 캐시 키
     */
    public static <T> SimpleCacheKey<T> of(String key, TypeReference<T> type) {
        return new SimpleCacheKey<>(key, TypeFactory.defaultInstance().constructType(type));
    }
}
