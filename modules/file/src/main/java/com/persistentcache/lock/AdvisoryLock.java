package com.persistentcache.lock;

import java.time.Duration;

/**
 * 권고 잠금(advisory lock) 인터페이스.
 * <p>
 * 이름 단위로 공유 잠금과 배타 잠금을 제공합니다. 운영체제마다 다른 파일 잠금 방식을
 * 파일 저장소로부터 숨기기 위한 추상화입니다.
 * </p>
 * <p>
 * <b>규칙:</b>
 * <ul>
 *   <li>공유 잠금끼리는 서로 막지 않습니다.</li>
 *   <li>배타 잠금은 같은 이름의 다른 모든 잠금을 막습니다.</li>
 *   <li>이름이 다르면 서로 막지 않습니다.</li>
 *   <li>제한 시간 안에 획득하지 못하면 {@code LOCK_TIMEOUT}으로 실패합니다.</li>
 * </ul>
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public interface AdvisoryLock {

    /**
     * 공유(읽기) 잠금을 획득합니다.
     *
     * @param name 잠금 이름 (파일 이름으로 사용할 수 있어야 함)
     * @param timeout 최대 대기 시간
     * @return 잠금 핸들
     */
    LockHandle acquireShared(String name, Duration timeout);

    /**
     * 배타(쓰기) 잠금을 획득합니다.
     *
     * @param name 잠금 이름 (파일 이름으로 사용할 수 있어야 함)
     * @param timeout 최대 대기 시간
     * @return 잠금 핸들
     */
    LockHandle acquireExclusive(String name, Duration timeout);
}
