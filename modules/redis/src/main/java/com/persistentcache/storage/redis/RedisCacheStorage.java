package com.persistentcache.storage.redis;

import com.persistentcache.storage.CacheStorage;
import com.persistentcache.support.error.CoreException;
import com.persistentcache.support.error.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis 캐시 저장소.
 * <p>
 * Redis의 GET/SET/EXISTS/DEL 명령으로 직렬화 값을 저장합니다.
 * 전체 삭제는 {@code SCAN MATCH <prefix>::*}로 서버에서 키를 찾아 삭제하며, 전체 키를 내려받지 않습니다.
 * </p>
 * <p>
 * 단일 키 단위의 원자성은 Redis 서버에 맡깁니다. 네트워크 오류는 재시도하지 않고
 * {@link ErrorType#CONNECTION_ERROR}로 전달합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
public class RedisCacheStorage implements CacheStorage {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final String prefix;
    private final String matchPattern;
    private final int scanBatchSize;

    public RedisCacheStorage(RedisTemplate<String, byte[]> redisTemplate, String prefix, int scanBatchSize) {
        this.redisTemplate = redisTemplate;
        this.prefix = prefix;
        this.matchPattern = escapeGlob(CacheStorage.namespaceOf(prefix)) + "*";
        this.scanBatchSize = scanBatchSize;
    }

    @Override
    public boolean contains(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (DataAccessException e) {
            throw connectionError(key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw connectionError(key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        try {
            redisTemplate.opsForValue().set(key, value);
        } catch (RedisConnectionFailureException | QueryTimeoutException e) {
            throw connectionError(key, e);
        } catch (DataAccessException e) {
            throw new CoreException(ErrorType.WRITE_ERROR,
                String.format("Redis에 캐시를 저장하지 못했습니다. (key: %s)", key), e);
        }
        log.debug("캐시 저장. (key: {}, bytes: {})", key, value.length);
    }

    @Override
    public void flush(String key) {
        try {
            redisTemplate.delete(key);
        } catch (RedisConnectionFailureException | QueryTimeoutException e) {
            throw connectionError(key, e);
        } catch (DataAccessException e) {
            throw new CoreException(ErrorType.WRITE_ERROR,
                String.format("Redis에서 캐시를 삭제하지 못했습니다. (key: %s)", key), e);
        }
    }

    /**
     * 프리픽스를 가진 모든 키를 삭제합니다.
     * <p>
     * SCAN으로 찾은 키를 {@code scanBatchSize}개씩 모아 DEL로 삭제합니다.
     * 스캔 도중 저장된 키는 삭제될 수도, 남을 수도 있습니다.
     * </p>
     */
    @Override
    public void flushAll() {
        ScanOptions options = ScanOptions.scanOptions()
            .match(matchPattern)
            .count(scanBatchSize)
            .build();

        long flushed = 0;
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            List<String> batch = new ArrayList<>(scanBatchSize);
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= scanBatchSize) {
                    flushed += deleteBatch(batch);
                    batch = new ArrayList<>(scanBatchSize);
                }
            }
            flushed += deleteBatch(batch);
        } catch (RedisConnectionFailureException | QueryTimeoutException e) {
            throw connectionError(matchPattern, e);
        } catch (DataAccessException e) {
            throw new CoreException(ErrorType.WRITE_ERROR,
                String.format("Redis에서 캐시를 삭제하지 못했습니다. (pattern: %s)", matchPattern), e);
        }
        log.info("캐시 전체 삭제 완료. (prefix: {}, count: {})", prefix, flushed);
    }

    @Override
    public String prefix() {
        return prefix;
    }

    private long deleteBatch(List<String> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(batch);
        return deleted != null ? deleted : 0;
    }

    private CoreException connectionError(String key, DataAccessException e) {
        return new CoreException(ErrorType.CONNECTION_ERROR,
            String.format("Redis에 연결할 수 없습니다. (key: %s)", key), e);
    }

    /**
     * SCAN MATCH 패턴에서 특수한 의미를 가지는 문자를 이스케이프합니다.
     *
     * @param literal 문자열
     * @return 이스케이프된 패턴
     */
    static String escapeGlob(String literal) {
        StringBuilder pattern = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                pattern.append('\\');
            }
            pattern.append(c);
        }
        return pattern.toString();
    }
}
