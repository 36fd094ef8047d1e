package com.persistentcache.cache;

import java.util.function.Function;

/**
 * 캐시가 적용된 함수 래퍼.
 * <p>
 * 인자 하나를 받는 함수를 감싸서, 같은 인자에 대한 호출은 저장소에서 결과를 가져오도록 합니다.
 * 재귀 함수는 재귀 호출도 이 래퍼를 거치도록 작성해야 모든 단계가 캐시됩니다.
 * </p>
 *
 * <pre>{@code
 * Function<Long, Long> addTwo = CachedFunction.of(cacheTemplate, keyGenerator,
 *     FunctionIdentity.of("addTwo"), Long.class, a -> a + 2);
 * }</pre>
 *
 * @param <A> 인자 타입
 * @param <R> 반환 타입
 * @author PersistentCache
 * @version 1.0
 */
public final class CachedFunction<A, R> implements Function<A, R> {

    private final CacheTemplate cacheTemplate;
    private final CacheKeyGenerator keyGenerator;
    private final FunctionIdentity identity;
    private final Class<R> resultType;
    private final Function<A, R> delegate;

    private CachedFunction(
        CacheTemplate cacheTemplate,
        CacheKeyGenerator keyGenerator,
        FunctionIdentity identity,
        Class<R> resultType,
        Function<A, R> delegate
    ) {
        this.cacheTemplate = cacheTemplate;
        this.keyGenerator = keyGenerator;
        this.identity = identity;
        this.resultType = resultType;
        this.delegate = delegate;
    }

    public static <A, R> CachedFunction<A, R> of(
        CacheTemplate cacheTemplate,
        CacheKeyGenerator keyGenerator,
        FunctionIdentity identity,
        Class<R> resultType,
        Function<A, R> delegate
    ) {
        return new CachedFunction<>(cacheTemplate, keyGenerator, identity, resultType, delegate);
    }

    @Override
    public R apply(A argument) {
        CacheKey<R> cacheKey = keyGenerator.generate(identity, resultType, argument);
        return cacheTemplate.getOrLoad(cacheKey, () -> delegate.apply(argument));
    }

    public FunctionIdentity identity() {
        return identity;
    }
}
