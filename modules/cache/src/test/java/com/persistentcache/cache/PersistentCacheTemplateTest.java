package com.persistentcache.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.persistentcache.storage.InMemoryCacheStorage;
import com.persistentcache.support.error.CoreException;
import com.persistentcache.support.error.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("PersistentCacheTemplate 테스트")
class PersistentCacheTemplateTest {

    private InMemoryCacheStorage storage;
    private CacheSerializer serializer;
    private PersistentCacheTemplate cacheTemplate;

    @BeforeEach
    void setUp() {
        storage = new InMemoryCacheStorage("p");
        serializer = new CacheSerializer();
        cacheTemplate = new PersistentCacheTemplate(storage, serializer);
    }

    @DisplayName("getOrLoad에 관한 테스트")
    @Nested
    class GetOrLoad {

        @DisplayName("캐시 미스이면 로더를 실행하고 결과를 저장한다.")
        @Test
        void loadsAndStores_whenMiss() {
            // arrange
            CacheKey<Long> key = SimpleCacheKey.of("p::add::3", Long.class);
            AtomicInteger calls = new AtomicInteger();

            // act
            Long result = cacheTemplate.getOrLoad(key, () -> {
                calls.incrementAndGet();
                return 5L;
            });

            // assert
            assertAll(
                () -> assertThat(result).isEqualTo(5L),
                () -> assertThat(calls.get()).isEqualTo(1),
                () -> assertThat(storage.contains("p::add::3")).isTrue()
            );
        }

        @DisplayName("캐시 히트이면 다른 로더를 주어도 처음 저장된 값을 반환한다.")
        @Test
        void returnsCachedValue_whenHit() {
            // arrange
            CacheKey<Long> key = SimpleCacheKey.of("p::add::3", Long.class);
            cacheTemplate.getOrLoad(key, () -> 5L);
            AtomicInteger calls = new AtomicInteger();

            // act
            Long result = cacheTemplate.getOrLoad(key, () -> {
                calls.incrementAndGet();
                return 999L;
            });

            // assert
            assertAll(
                () -> assertThat(result).isEqualTo(5L),
                () -> assertThat(calls.get()).isZero(),
                () -> assertThat(storage.setCount()).isEqualTo(1)
            );
        }

        @DisplayName("로더가 예외를 던지면 아무 것도 저장하지 않고 예외를 전달한다.")
        @Test
        void storesNothing_whenLoaderFails() {
            // arrange
            CacheKey<Long> key = SimpleCacheKey.of("p::fail::1", Long.class);

            // act & assert
            assertThatThrownBy(() -> cacheTemplate.getOrLoad(key, () -> {
                throw new IllegalStateException("계산 실패");
            }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("계산 실패");
            assertThat(storage.contains("p::fail::1")).isFalse();
        }

        @DisplayName("로더가 null을 반환하면 null도 저장되어 이후 조회는 히트가 된다.")
        @Test
        void cachesNull() {
            // arrange
            CacheKey<String> key = SimpleCacheKey.of("p::nothing::1", String.class);
            cacheTemplate.getOrLoad(key, () -> null);
            AtomicInteger calls = new AtomicInteger();

            // act
            String result = cacheTemplate.getOrLoad(key, () -> {
                calls.incrementAndGet();
                return "computed";
            });

            // assert
            assertAll(
                () -> assertThat(result).isNull(),
                () -> assertThat(calls.get()).isZero(),
                () -> assertThat(cacheTemplate.contains(key)).isTrue()
            );
        }

        @DisplayName("제네릭 타입의 값도 저장하고 복원한다.")
        @Test
        void restoresGenericType() {
            // arrange
            CacheKey<List<Long>> key = SimpleCacheKey.of("p::range::3",
                new TypeReference<List<Long>>() {});
            cacheTemplate.getOrLoad(key, () -> List.of(1L, 2L, 3L));

            // act
            List<Long> result = cacheTemplate.getOrLoad(key, List::of);

            // assert
            assertThat(result).containsExactly(1L, 2L, 3L);
        }

        @DisplayName("저장된 값을 역직렬화할 수 없으면 DESERIALIZATION_ERROR 예외가 발생한다.")
        @Test
        void throwsDeserializationError_whenPayloadIsCorrupted() {
            // arrange
            storage.set("p::broken::1", new byte[]{(byte) 0xFF, (byte) 0xFF});
            CacheKey<Long> key = SimpleCacheKey.of("p::broken::1", Long.class);

            // act & assert
            assertThatThrownBy(() -> cacheTemplate.getOrLoad(key, () -> 1L))
                .isInstanceOf(CoreException.class)
                .hasFieldOrPropertyWithValue("errorType", ErrorType.DESERIALIZATION_ERROR);
        }
    }

    @DisplayName("조회, 저장, 삭제에 관한 테스트")
    @Nested
    class GetPutEvict {

        @DisplayName("저장한 값을 그대로 조회한다.")
        @Test
        void returnsStoredValue() {
            // arrange
            CacheKey<Long> key = SimpleCacheKey.of("p::add::2", Long.class);

            // act
            cacheTemplate.put(key, 4L);

            // assert
            assertThat(cacheTemplate.get(key)).contains(4L);
        }

        @DisplayName("저장된 값이 없으면 빈 Optional을 반환한다.")
        @Test
        void returnsEmpty_whenAbsent() {
            // act & assert
            assertThat(cacheTemplate.get(SimpleCacheKey.of("p::add::9", Long.class))).isEmpty();
        }

        @DisplayName("무효화한 키는 더 이상 존재하지 않는다.")
        @Test
        void removesEntry_whenEvicted() {
            // arrange
            CacheKey<Long> key = SimpleCacheKey.of("p::add::2", Long.class);
            cacheTemplate.put(key, 4L);

            // act
            cacheTemplate.evict(key);

            // assert
            assertAll(
                () -> assertThat(cacheTemplate.contains(key)).isFalse(),
                () -> assertThat(cacheTemplate.get(key)).isEmpty()
            );
        }

        @DisplayName("존재하지 않는 키를 무효화해도 예외가 발생하지 않는다.")
        @Test
        void doesNothing_whenEvictingAbsentKey() {
            // act
            cacheTemplate.evict(SimpleCacheKey.of("p::absent::1", Long.class));

            // assert
            assertThat(storage.size()).isZero();
        }

        @DisplayName("전체 무효화는 같은 프리픽스의 값만 삭제한다.")
        @Test
        void evictsOnlyOwnPrefix() {
            // arrange
            cacheTemplate.put(SimpleCacheKey.of("p::add::1", Long.class), 3L);
            cacheTemplate.put(SimpleCacheKey.of("p::add::2", Long.class), 4L);
            storage.set("q::add::1", serializer.serialize(3L));

            // act
            cacheTemplate.evictAll();

            // assert
            assertAll(
                () -> assertThat(storage.contains("p::add::1")).isFalse(),
                () -> assertThat(storage.contains("p::add::2")).isFalse(),
                () -> assertThat(storage.contains("q::add::1")).isTrue()
            );
        }
    }
}
