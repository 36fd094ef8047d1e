package com.persistentcache.lock;

/**
 * 획득한 잠금에 대한 핸들.
 * <p>
 * {@link #close()}를 호출하면 잠금이 해제됩니다. 여러 번 호출해도 한 번만 해제됩니다.
 * try-with-resources로 사용하여 모든 종료 경로에서 잠금이 해제되도록 합니다.
 * </p>
 */
public interface LockHandle extends AutoCloseable {

    @Override
    void close();
}
