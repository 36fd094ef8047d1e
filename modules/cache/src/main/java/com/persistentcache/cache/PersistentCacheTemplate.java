package com.persistentcache.cache;

import com.persistentcache.storage.CacheStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 영속 캐시 템플릿 구현체.
 * <p>
 * {@link CacheStorage}에 직렬화된 값을 저장하여 프로세스 간에 함수 결과를 공유합니다.
 * 엔진 자체는 재시도하지 않으며, 저장소 오류를 "항상 다시 계산"으로 대체하지 않습니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
public class PersistentCacheTemplate implements CacheTemplate {

    private final CacheStorage cacheStorage;
    private final CacheSerializer cacheSerializer;

    @Override
    public <T> Optional<T> get(CacheKey<T> cacheKey) {
        return cacheStorage.get(cacheKey.key())
            .map(bytes -> cacheSerializer.deserialize(bytes, cacheKey.type()));
    }

    @Override
    public <T> void put(CacheKey<T> cacheKey, T value) {
        cacheStorage.set(cacheKey.key(), cacheSerializer.serialize(value));
    }

    @Override
    public boolean contains(CacheKey<?> cacheKey) {
        return cacheStorage.contains(cacheKey.key());
    }

    @Override
    public void evict(CacheKey<?> cacheKey) {
        cacheStorage.flush(cacheKey.key());
    }

    @Override
    public void evictAll() {
        cacheStorage.flushAll();
    }

    @Override
    public <T> T getOrLoad(CacheKey<T> cacheKey, Supplier<T> loader) {
        Optional<byte[]> cached = cacheStorage.get(cacheKey.key());
        if (cached.isPresent()) {
            log.debug("캐시 히트. (key: {})", cacheKey.key());
            return cacheSerializer.deserialize(cached.get(), cacheKey.type());
        }

        log.debug("캐시 미스. (key: {})", cacheKey.key());
        // 로더가 정상적으로 반환한 값만 저장
        T value = loader.get();
        put(cacheKey, value);
        return value;
    }
}
