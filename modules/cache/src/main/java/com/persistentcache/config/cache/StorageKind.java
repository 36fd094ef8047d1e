package com.persistentcache.config.cache;

/**
 * 캐시 저장소 종류.
 */
public enum StorageKind {
    FILE,
    REDIS
}
