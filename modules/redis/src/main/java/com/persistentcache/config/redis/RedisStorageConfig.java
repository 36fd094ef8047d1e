package com.persistentcache.config.redis;

import com.persistentcache.config.cache.PersistentCacheProperties;
import com.persistentcache.storage.CacheStorage;
import com.persistentcache.storage.redis.RedisCacheStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis 캐시 저장소 설정.
 * <p>
 * {@code persistent-cache.storage.kind=redis}일 때 활성화됩니다.
 * 연결 문자열({@code redis://host:port/db})로 Lettuce 연결을 만들고,
 * 키는 문자열, 값은 바이트 배열 그대로 저장하는 RedisTemplate을 등록합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "persistent-cache.storage", name = "kind", havingValue = "redis")
public class RedisStorageConfig {

    public static final String CACHE_REDIS_TEMPLATE = "cacheRedisTemplate";

    @Bean
    public LettuceConnectionFactory cacheRedisConnectionFactory(PersistentCacheProperties properties) {
        PersistentCacheProperties.Storage storage = properties.storage();
        RedisConfiguration redisConfiguration = LettuceConnectionFactory.createRedisConfiguration(storage.connectionString());
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
            .commandTimeout(storage.commandTimeout())
            .build();
        return new LettuceConnectionFactory(redisConfiguration, clientConfig);
    }

    @Bean(CACHE_REDIS_TEMPLATE)
    public RedisTemplate<String, byte[]> cacheRedisTemplate(LettuceConnectionFactory cacheRedisConnectionFactory) {
        RedisTemplate<String, byte[]> redisTemplate = new RedisTemplate<>();
        redisTemplate.setKeySerializer(new StringRedisSerializer());
        redisTemplate.setValueSerializer(RedisSerializer.byteArray());
        redisTemplate.setConnectionFactory(cacheRedisConnectionFactory);
        return redisTemplate;
    }

    @Bean
    public CacheStorage redisCacheStorage(
        PersistentCacheProperties properties,
        RedisTemplate<String, byte[]> cacheRedisTemplate
    ) {
        log.info("Redis 캐시 저장소 생성. (prefix: {}, scanBatchSize: {})",
            properties.prefix(), properties.storage().scanBatchSize());
        return new RedisCacheStorage(cacheRedisTemplate, properties.prefix(), properties.storage().scanBatchSize());
    }
}
