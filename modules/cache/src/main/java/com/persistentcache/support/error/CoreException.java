package com.persistentcache.support.error;

import lombok.Getter;

/**
 * 캐시 계층의 모든 실패를 표현하는 예외.
 * <p>
 * 엔진은 저장소 오류를 삼키지 않고 이 예외로 호출자에게 그대로 전달합니다.
 * 재시도 여부는 호출자가 결정합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Getter
public class CoreException extends RuntimeException {

    private final ErrorType errorType;
    private final String customMessage;

    public CoreException(ErrorType errorType) {
        this(errorType, null);
    }

    public CoreException(ErrorType errorType, String customMessage) {
        super(customMessage != null ? customMessage : errorType.getMessage());
        this.errorType = errorType;
        this.customMessage = customMessage;
    }

    public CoreException(ErrorType errorType, String customMessage, Throwable cause) {
        super(customMessage != null ? customMessage : errorType.getMessage(), cause);
        this.errorType = errorType;
        this.customMessage = customMessage;
    }
}
