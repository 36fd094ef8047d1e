package com.persistentcache.storage;

import java.util.Optional;

/**
 * 캐시 저장소 인터페이스.
 * <p>
 * 직렬화된 캐시 값을 키 단위로 조회, 저장, 삭제하는 기능을 제공합니다.
 * 값은 바이트 배열 그대로 다루며, 역직렬화는 호출자의 책임입니다.
 * </p>
 * <p>
 * <b>프리픽스:</b>
 * 모든 키는 {@code prefix + "::"}로 시작합니다. {@link #flushAll()}은 이 프리픽스만을 기준으로
 * 삭제 대상을 찾습니다. 다른 프로세스가 저장한 값도 지워야 하므로 프로세스 내부에 키 목록을 두지 않습니다.
 * </p>
 * <p>
 * 구현체는 여러 스레드에서 동시에 사용할 수 있어야 하며,
 * 저장된 데이터는 독립된 여러 프로세스가 동시에 공유할 수 있어야 합니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public interface CacheStorage {

    /**
     * 키를 구성하는 요소 사이의 구분자.
     */
    String KEY_SEPARATOR = "::";

    /**
     * 구분자를 이루는 문자. 프리픽스에는 사용할 수 없습니다.
     */
    char SEPARATOR_CHAR = ':';

    /**
     * 키가 존재하는지 확인합니다. 저장소의 상태를 바꾸지 않습니다.
     *
     * @param key 캐시 키
     * @return 존재 여부
     */
    boolean contains(String key);

    /**
     * 저장된 직렬화 값을 조회합니다.
     *
     * @param key 캐시 키
     * @return 직렬화 값 (없으면 empty)
     */
    Optional<byte[]> get(String key);

    /**
     * 직렬화 값을 저장합니다. 같은 키의 기존 값은 대체됩니다.
     *
     * @param key 캐시 키
     * @param value 직렬화 값
     */
    void set(String key, byte[] value);

    /**
     * 단일 키를 삭제합니다. 키가 없으면 아무 것도 하지 않습니다.
     *
     * @param key 캐시 키
     */
    void flush(String key);

    /**
     * 이 저장소의 프리픽스를 가진 모든 키를 삭제합니다.
     * <p>
     * 같은 저장 매체에 있는 다른 데이터는 삭제하지 않습니다.
     * 삭제 도중 다른 프로세스가 저장한 값은 남을 수도, 지워질 수도 있습니다.
     * </p>
     */
    void flushAll();

    /**
     * 이 저장소 인스턴스의 프리픽스를 반환합니다.
     *
     * @return 프리픽스
     */
    String prefix();

    /**
     * 프리픽스를 검증하고 키의 네임스페이스 부분({@code prefix + "::"})을 반환합니다.
     * <p>
     * 프리픽스에는 {@code :}를 쓸 수 없습니다. {@code pc:}처럼 콜론으로 끝나는 프리픽스를 허용하면
     * 그 키({@code pc:::...})가 {@code pc::}로도 시작하게 되어 다른 프리픽스의 전체 삭제 대상이 됩니다.
     * </p>
     *
     * @param prefix 프리픽스
     * @return 네임스페이스
     * @throws IllegalArgumentException 프리픽스가 비어 있거나 {@code :}를 포함하는 경우
     */
    static String namespaceOf(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("캐시 프리픽스는 비어 있을 수 없습니다.");
        }
        if (prefix.indexOf(SEPARATOR_CHAR) >= 0) {
            throw new IllegalArgumentException(
                String.format("캐시 프리픽스에 '%c'를 포함할 수 없습니다. (prefix: %s)", SEPARATOR_CHAR, prefix));
        }
        return prefix + KEY_SEPARATOR;
    }
}
