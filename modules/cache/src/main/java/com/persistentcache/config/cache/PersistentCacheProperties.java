package com.persistentcache.config.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 영속 캐시 설정.
 *
 * <pre>
 * persistent-cache:
 *   prefix: pc
 *   storage:
 *     kind: file            # file | redis
 *     root-directory: .persistent-cache
 *     connection-string: redis://localhost:6379
 * </pre>
 *
 * @param prefix 모든 캐시 키 앞에 붙는 네임스페이스
 * @param storage 저장소 설정
 * @author PersistentCache
 * @version 1.0
 */
@ConfigurationProperties(prefix = "persistent-cache")
public record PersistentCacheProperties(
    @DefaultValue("pc") String prefix,
    @DefaultValue Storage storage
) {

    /**
     * 저장소 설정.
     *
     * @param kind 저장소 종류
     * @param rootDirectory 파일 저장소의 루트 디렉터리
     * @param lockTimeout 파일 잠금 최대 대기 시간
     * @param memoryBacked 파일 저장소 앞에 메모리 캐시를 둘지 여부
     * @param memoryMaximumSize 메모리 캐시의 최대 엔트리 수
     * @param connectionString Redis 접속 문자열
     * @param commandTimeout Redis 명령 타임아웃
     * @param scanBatchSize 전체 삭제 시 SCAN/DEL 한 번에 처리할 키 수
     */
    public record Storage(
        @DefaultValue("file") StorageKind kind,
        @DefaultValue(".persistent-cache") Path rootDirectory,
        @DefaultValue("10s") Duration lockTimeout,
        @DefaultValue("false") boolean memoryBacked,
        @DefaultValue("10000") long memoryMaximumSize,
        @DefaultValue("redis://localhost:6379") String connectionString,
        @DefaultValue("5s") Duration commandTimeout,
        @DefaultValue("500") int scanBatchSize
    ) {
    }
}
