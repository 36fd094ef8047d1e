package com.persistentcache.config.cache;

import com.persistentcache.cache.ArgumentEncoder;
import com.persistentcache.cache.CacheKeyGenerator;
import com.persistentcache.cache.CacheSerializer;
import com.persistentcache.cache.CacheTemplate;
import com.persistentcache.cache.PersistentCacheTemplate;
import com.persistentcache.storage.CacheStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 캐시 엔진 설정.
 * <p>
 * 저장소 모듈이 등록한 {@link CacheStorage} 위에 직렬화기, 키 생성기, 캐시 템플릿을 구성합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PersistentCacheProperties.class)
public class PersistentCacheConfig {

    @Bean
    public CacheSerializer cacheSerializer() {
        return new CacheSerializer();
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator(PersistentCacheProperties properties, CacheSerializer cacheSerializer) {
        return new CacheKeyGenerator(properties.prefix(), new ArgumentEncoder(cacheSerializer));
    }

    @Bean
    public CacheTemplate cacheTemplate(CacheStorage cacheStorage, CacheSerializer cacheSerializer) {
        log.info("영속 캐시 구성 완료. (storage: {}, prefix: {})",
            cacheStorage.getClass().getSimpleName(), cacheStorage.prefix());
        return new PersistentCacheTemplate(cacheStorage, cacheSerializer);
    }
}
