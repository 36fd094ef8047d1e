package com.persistentcache.config.file;

import com.persistentcache.config.cache.PersistentCacheProperties;
import com.persistentcache.lock.AdvisoryLock;
import com.persistentcache.lock.FileChannelAdvisoryLock;
import com.persistentcache.storage.CacheStorage;
import com.persistentcache.storage.file.FileCacheStorage;
import com.persistentcache.storage.file.MemoryBackedFileCacheStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 파일 캐시 저장소 설정.
 * <p>
 * {@code persistent-cache.storage.kind=file}(기본값)일 때 활성화됩니다.
 * {@code memory-backed=true}이면 메모리 캐시를 앞에 둔 저장소를 등록합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "persistent-cache.storage", name = "kind", havingValue = "file", matchIfMissing = true)
public class FileStorageConfig {

    @Bean
    public AdvisoryLock advisoryLock(PersistentCacheProperties properties) {
        return new FileChannelAdvisoryLock(properties.storage().rootDirectory());
    }

    @Bean
    public CacheStorage fileCacheStorage(PersistentCacheProperties properties, AdvisoryLock advisoryLock) {
        PersistentCacheProperties.Storage storage = properties.storage();
        log.info("파일 캐시 저장소 생성. (directory: {}, memoryBacked: {})",
            storage.rootDirectory().toAbsolutePath(), storage.memoryBacked());
        if (storage.memoryBacked()) {
            return new MemoryBackedFileCacheStorage(
                storage.rootDirectory(),
                properties.prefix(),
                advisoryLock,
                storage.lockTimeout(),
                storage.memoryMaximumSize()
            );
        }
        return new FileCacheStorage(storage.rootDirectory(), properties.prefix(), advisoryLock, storage.lockTimeout());
    }
}
