package com.persistentcache.cache;

import com.fasterxml.jackson.databind.JavaType;

/**
 * 캐시 키 인터페이스.
 * <p>
 * 캐시 키는 해당 인터페이스를 기반으로 구현되어야 합니다.
 * 키 문자열은 {@code prefix::functionIdentity::argumentDigest} 형태를 가집니다.
 * </p>
 *
 * @param <T> 캐시 값의 타입
 * @author PersistentCache
 * @version 1.0
 */
public interface CacheKey<T> {

    /**
     * 캐시 키를 반환합니다.
     *
     * @return 캐시 키 문자열
     */
    String key();

    /**
     * 캐시 값의 타입을 반환합니다.
     * <p>
     * 역직렬화 시 사용됩니다. 제네릭 컬렉션도 표현할 수 있도록 {@link JavaType}을 사용합니다.
     * </p>
     *
     * @return 타입
     */
    JavaType type();
}
