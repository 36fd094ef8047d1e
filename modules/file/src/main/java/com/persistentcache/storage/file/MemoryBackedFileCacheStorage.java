package com.persistentcache.storage.file;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.persistentcache.lock.AdvisoryLock;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * 메모리 캐시를 앞에 둔 파일 캐시 저장소.
 * <p>
 * 디스크에서 읽은 값을 Caffeine 로컬 캐시에 보관하여 같은 프로세스 안에서 자주 조회되는 키의
 * 디스크 읽기를 줄입니다. 메모리 캐시는 최적화일 뿐이며 기준 데이터는 항상 디스크에 있습니다.
 * </p>
 * <p>
 * <b>무효화:</b>
 * <ul>
 *   <li>저장/삭제는 디스크에 먼저 반영한 뒤 해당 키의 메모리 값을 무효화합니다.</li>
 *   <li>전체 삭제는 디스크 삭제 후 메모리 캐시 전체를 무효화합니다.</li>
 *   <li>다른 프로세스의 저장은 이미 메모리에 올라온 값에 반영되지 않습니다.</li>
 * </ul>
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public class MemoryBackedFileCacheStorage extends FileCacheStorage {

    private final Cache<String, byte[]> memory;

    public MemoryBackedFileCacheStorage(
        Path rootDirectory,
        String prefix,
        AdvisoryLock advisoryLock,
        Duration lockTimeout,
        long memoryMaximumSize
    ) {
        super(rootDirectory, prefix, advisoryLock, lockTimeout);
        this.memory = Caffeine.newBuilder()
            .maximumSize(memoryMaximumSize)
            .build();
    }

    @Override
    public boolean contains(String key) {
        if (memory.getIfPresent(key) != null) {
            return true;
        }
        return super.contains(key);
    }

    @Override
    public Optional<byte[]> get(String key) {
        // 같은 키의 적재가 끝나기 전에는 무효화가 진행되지 않으므로 오래된 값이 남지 않는다
        byte[] value = memory.get(key, k -> super.get(k).orElse(null));
        return Optional.ofNullable(value).map(byte[]::clone);
    }

    @Override
    public void set(String key, byte[] value) {
        super.set(key, value);
        memory.invalidate(key);
    }

    @Override
    public void flush(String key) {
        super.flush(key);
        memory.invalidate(key);
    }

    @Override
    public void flushAll() {
        super.flushAll();
        memory.invalidateAll();
    }

    long memorySize() {
        memory.cleanUp();
        return memory.estimatedSize();
    }
}
