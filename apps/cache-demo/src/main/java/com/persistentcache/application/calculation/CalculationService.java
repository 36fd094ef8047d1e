package com.persistentcache.application.calculation;

import com.persistentcache.cache.CacheKey;
import com.persistentcache.cache.CacheKeyGenerator;
import com.persistentcache.cache.CacheTemplate;
import com.persistentcache.cache.CachedFunction;
import com.persistentcache.cache.FunctionIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Function;

/**
 * 계산 결과를 영속 캐시에 저장하는 서비스.
 * <p>
 * 한 번 계산한 결과는 프로세스가 재시작되어도 저장소에서 바로 반환됩니다.
 * </p>
 * <p>
 * <b>캐시 적용 방식:</b>
 * <ul>
 *   <li><b>addTwo:</b> {@link CachedFunction}으로 감싼 함수</li>
 *   <li><b>fibonacci:</b> 재귀 호출마다 {@link CacheTemplate#getOrLoad}를 거치므로 모든 단계가 캐시됩니다.</li>
 * </ul>
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
@Service
public class CalculationService {

    static final FunctionIdentity ADD_TWO = FunctionIdentity.of(CalculationService.class, "addTwo", long.class);
    static final FunctionIdentity FIBONACCI = FunctionIdentity.of(CalculationService.class, "fibonacci", long.class);

    private final CacheTemplate cacheTemplate;
    private final CacheKeyGenerator keyGenerator;
    private final Function<Long, Long> addTwo;

    public CalculationService(CacheTemplate cacheTemplate, CacheKeyGenerator keyGenerator) {
        this.cacheTemplate = cacheTemplate;
        this.keyGenerator = keyGenerator;
        this.addTwo = CachedFunction.of(cacheTemplate, keyGenerator, ADD_TWO, Long.class, value -> {
            log.debug("addTwo 계산. (value: {})", value);
            return value + 2;
        });
    }

    public long addTwo(long value) {
        return addTwo.apply(value);
    }

    /**
     * n번째 피보나치 수를 반환합니다.
     *
     * @param n 0 이상의 순번
     * @return 피보나치 수
     * @throws IllegalArgumentException n이 음수인 경우
     */
    public long fibonacci(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("n은 0 이상이어야 합니다. (n: " + n + ")");
        }
        CacheKey<Long> cacheKey = fibonacciKey(n);
        return cacheTemplate.getOrLoad(cacheKey, () -> {
            log.debug("fibonacci 계산. (n: {})", n);
            if (n < 2) {
                return n;
            }
            return fibonacci(n - 1) + fibonacci(n - 2);
        });
    }

    CacheKey<Long> fibonacciKey(long n) {
        return keyGenerator.generate(FIBONACCI, Long.class, n);
    }

    CacheKey<Long> addTwoKey(long value) {
        return keyGenerator.generate(ADD_TWO, Long.class, value);
    }
}
