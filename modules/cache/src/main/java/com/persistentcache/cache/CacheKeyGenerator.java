package com.persistentcache.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.persistentcache.storage.CacheStorage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 캐시 키 생성기.
 * <p>
 * 함수 식별자와 인자로부터 캐시 키를 생성합니다.
 * </p>
 * <p>
 * 예: {@code pc::com.example.Calculator#add(int,int)::9f86d0...}
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public class CacheKeyGenerator {

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final String namespace;
    private final ArgumentEncoder argumentEncoder;

    public CacheKeyGenerator(String prefix, ArgumentEncoder argumentEncoder) {
        this.namespace = CacheStorage.namespaceOf(prefix);
        this.argumentEncoder = argumentEncoder;
    }

    /**
     * 캐시 키 문자열을 생성합니다.
     *
     * @param identity 함수 식별자
     * @param arguments 함수 인자
     * @return 캐시 키 문자열
     */
    public String generateKey(FunctionIdentity identity, Object... arguments) {
        byte[] encoded = argumentEncoder.encode(arguments);
        return namespace + identity.token() + CacheStorage.KEY_SEPARATOR + digest(encoded);
    }

    /**
     * 타입이 지정된 캐시 키를 생성합니다.
     *
     * @param identity 함수 식별자
     * @param type 반환 값의 타입
     * @param arguments 함수 인자
     * @param <T> 반환 값의 타입
     * @return 캐시 키
     */
    public <T> CacheKey<T> generate(FunctionIdentity identity, Class<T> type, Object... arguments) {
        return new SimpleCacheKey<>(generateKey(identity, arguments), TypeFactory.defaultInstance().constructType(type));
    }

    /**
     * 제네릭 반환 타입의 캐시 키를 생성합니다.
     *
     * @param identity 함수 식별자
     * @param type 반환 값의 타입
     * @param arguments 함수 인자
     * @param <T> 반환 값의 타입
     * @return 캐시 키
     */
    public <T> CacheKey<T> generate(FunctionIdentity identity, TypeReference<T> type, Object... arguments) {
        return new SimpleCacheKey<>(generateKey(identity, arguments), TypeFactory.defaultInstance().constructType(type));
    }

    private String digest(byte[] encoded) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(DIGEST_ALGORITHM).digest(encoded));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " 알고리즘을 사용할 수 없습니다.", e);
        }
    }
}
