package com.persistentcache.cache;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 캐시 대상 함수의 식별자.
 * <p>
 * 함수의 이름과 시그니처가 바뀌지 않는 한 재컴파일 후에도 같은 토큰을 유지해야 합니다.
 * 예: {@code com.example.Calculator#add(int,int)}
 * </p>
 *
 * @param token 식별 토큰
 * @author PersistentCache
 * @version 1.0
 */
public record FunctionIdentity(String token) {

    public FunctionIdentity {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("함수 식별자는 비어 있을 수 없습니다.");
        }
    }

    public static FunctionIdentity of(String token) {
        return new FunctionIdentity(token);
    }

    /**
     * 메서드 시그니처로부터 식별자를 생성합니다.
     *
     * @param method 대상 메서드
     * @return 함수 식별자
     */
    public static FunctionIdentity of(Method method) {
        return of(method.getDeclaringClass(), method.getName(), method.getParameterTypes());
    }

    /**
     * 소유 클래스, 이름, 파라미터 타입으로부터 식별자를 생성합니다.
     *
     * @param owner 함수를 소유한 클래스
     * @param name 함수 이름
     * @param parameterTypes 파라미터 타입
     * @return 함수 식별자
     */
    public static FunctionIdentity of(Class<?> owner, String name, Class<?>... parameterTypes) {
        String parameters = Arrays.stream(parameterTypes)
            .map(Class::getTypeName)
            .collect(Collectors.joining(","));
        return new FunctionIdentity(owner.getName() + "#" + name + "(" + parameters + ")");
    }

    @Override
    public String toString() {
        return token;
    }
}
