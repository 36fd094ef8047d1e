package com.persistentcache.cache;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 캐시 템플릿 인터페이스.
 * <p>
 * 캐시 조회, 저장, 삭제 등의 기능을 제공합니다.
 * 저장소 오류는 삼키지 않고 {@link com.persistentcache.support.error.CoreException}으로 전달합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public interface CacheTemplate {

    /**
     * 캐시에서 값을 조회합니다.
     *
     * @param cacheKey 캐시 키
     * @param <T> 캐시 값의 타입
     * @return 캐시 값 (Optional)
     */
    <T> Optional<T> get(CacheKey<T> cacheKey);

    /**
     * 캐시에 값을 저장합니다. 같은 키의 기존 값은 대체됩니다.
     *
     * @param cacheKey 캐시 키
     * @param value 저장할 값
     * @param <T> 캐시 값의 타입
     */
    <T> void put(CacheKey<T> cacheKey, T value);

    /**
     * 캐시에 키가 존재하는지 확인합니다.
     *
     * @param cacheKey 캐시 키
     * @return 존재 여부
     */
    boolean contains(CacheKey<?> cacheKey);

    /**
     * 캐시를 무효화합니다. 키가 없으면 아무 것도 하지 않습니다.
     *
     * @param cacheKey 캐시 키
     */
    void evict(CacheKey<?> cacheKey);

    /**
     * 이 캐시의 프리픽스를 가진 모든 값을 무효화합니다.
     */
    void evictAll();

    /**
     * 캐시에서 값을 조회하고, 없으면 로더를 실행하여 값을 가져온 후 캐시에 저장합니다.
     * <p>
     * 로더가 예외를 던지면 아무 것도 저장하지 않고 예외를 그대로 전달합니다.
     * </p>
     *
     * @param cacheKey 캐시 키
     * @param loader 캐시에 값이 없을 때 실행할 로더
     * @param <T> 캐시 값의 타입
     * @return 캐시 값 또는 로더로부터 가져온 값
     */
    <T> T getOrLoad(CacheKey<T> cacheKey, Supplier<T> loader);
}
