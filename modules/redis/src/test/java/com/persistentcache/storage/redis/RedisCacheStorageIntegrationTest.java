package com.persistentcache.storage.redis;

import com.persistentcache.cache.CacheKey;
import com.persistentcache.cache.CacheSerializer;
import com.persistentcache.cache.PersistentCacheTemplate;
import com.persistentcache.cache.SimpleCacheKey;
import com.persistentcache.config.cache.PersistentCacheProperties;
import com.persistentcache.config.cache.StorageKind;
import com.persistentcache.config.redis.RedisStorageConfig;
import com.persistentcache.storage.CacheStorage;
import com.persistentcache.support.error.CoreException;
import com.persistentcache.support.error.ErrorType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

/**
 * 실제 Redis 서버에 대한 RedisCacheStorage 통합 테스트.
 * <p>
 * Testcontainers로 Redis 컨테이너를 띄우며, Docker를 사용할 수 없는 환경에서는 건너뜁니다.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("RedisCacheStorage 통합 테스트")
class RedisCacheStorageIntegrationTest {

    private static final int REDIS_PORT = 6379;

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
        .withExposedPorts(REDIS_PORT);

    private static final RedisStorageConfig CONFIG = new RedisStorageConfig();

    private static LettuceConnectionFactory connectionFactory;
    private static RedisTemplate<String, byte[]> redisTemplate;

    private CacheStorage storage;
    private CacheStorage otherStorage;

    @BeforeAll
    static void connect() {
        connectionFactory = CONFIG.cacheRedisConnectionFactory(propertiesOf("p"));
        connectionFactory.afterPropertiesSet();
        redisTemplate = CONFIG.cacheRedisTemplate(connectionFactory);
        redisTemplate.afterPropertiesSet();
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redisTemplate.execute(connection -> {
            connection.serverCommands().flushDb();
            return null;
        }, true);
        storage = CONFIG.redisCacheStorage(propertiesOf("p"), redisTemplate);
        otherStorage = CONFIG.redisCacheStorage(propertiesOf("pp"), redisTemplate);
    }

    @DisplayName("저장한 값을 조회하고 삭제한다.")
    @Test
    void setsGetsAndFlushes() {
        // act
        storage.set("p::add::2", new byte[]{4});

        // assert
        assertAll(
            () -> assertThat(storage.contains("p::add::2")).isTrue(),
            () -> assertThat(storage.get("p::add::2")).hasValueSatisfying(value -> assertThat(value).containsExactly(4))
        );
        storage.flush("p::add::2");
        storage.flush("p::add::2");
        assertThat(storage.contains("p::add::2")).isFalse();
    }

    @DisplayName("전체 삭제는 같은 프리픽스의 키만 배치 단위로 모두 삭제한다.")
    @Test
    void flushAllRemovesOnlyOwnPrefix() {
        // arrange
        IntStream.range(0, 25).forEach(i -> storage.set("p::add::" + i, new byte[]{(byte) i}));
        otherStorage.set("pp::add::1", new byte[]{1});
        redisTemplate.opsForValue().set("unrelated", new byte[]{1});

        // act
        storage.flushAll();

        // assert
        assertAll(
            () -> assertThat(redisTemplate.keys("p::*")).isEmpty(),
            () -> assertThat(otherStorage.contains("pp::add::1")).isTrue(),
            () -> assertThat(redisTemplate.hasKey("unrelated")).isTrue()
        );
    }

    @DisplayName("엔진과 함께 사용하면 첫 번째 로더의 결과만 저장된다.")
    @Test
    void storesFirstLoaderResult() {
        // arrange
        PersistentCacheTemplate cacheTemplate = new PersistentCacheTemplate(storage, new CacheSerializer());
        CacheKey<Long> key = SimpleCacheKey.of("p::add::3", Long.class);

        // act
        Long first = cacheTemplate.getOrLoad(key, () -> 5L);
        Long second = cacheTemplate.getOrLoad(key, () -> 999L);

        // assert
        assertAll(
            () -> assertThat(first).isEqualTo(5L),
            () -> assertThat(second).isEqualTo(5L)
        );
    }

    @DisplayName("접속할 수 없는 서버이면 CONNECTION_ERROR 예외가 발생한다.")
    @Test
    void throwsConnectionError_whenServerIsUnreachable() {
        // arrange
        PersistentCacheProperties unreachable = propertiesOf("p", "redis://127.0.0.1:1");
        LettuceConnectionFactory factory = CONFIG.cacheRedisConnectionFactory(unreachable);
        factory.afterPropertiesSet();
        RedisTemplate<String, byte[]> template = CONFIG.cacheRedisTemplate(factory);
        template.afterPropertiesSet();
        CacheStorage unreachableStorage = CONFIG.redisCacheStorage(unreachable, template);

        // act & assert
        try {
            assertThatThrownBy(() -> unreachableStorage.get("p::add::2"))
                .isInstanceOf(CoreException.class)
                .hasFieldOrPropertyWithValue("errorType", ErrorType.CONNECTION_ERROR);
        } finally {
            factory.destroy();
        }
    }

    private static PersistentCacheProperties propertiesOf(String prefix) {
        return propertiesOf(prefix, "redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(REDIS_PORT));
    }

    private static PersistentCacheProperties propertiesOf(String prefix, String connectionString) {
        return new PersistentCacheProperties(prefix, new PersistentCacheProperties.Storage(
            StorageKind.REDIS,
            Path.of(".persistent-cache"),
            Duration.ofSeconds(10),
            false,
            10_000,
            connectionString,
            Duration.ofSeconds(2),
            10
        ));
    }
}
