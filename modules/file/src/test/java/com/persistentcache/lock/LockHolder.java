package com.persistentcache.lock;

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 별도 JVM에서 실행되어 잠금 파일에 배타 잠금을 걸고 종료될 때까지 보유하는 프로그램.
 * <p>
 * 사용법: {@code LockHolder <lock-file>}. 잠금을 획득하면 표준 출력에 {@value #LOCKED}를 출력합니다.
 * </p>
 */
public final class LockHolder {

    static final String LOCKED = "LOCKED";

    private LockHolder() {
    }

    public static void main(String[] args) throws Exception {
        Path lockFile = Path.of(args[0]);
        Files.createDirectories(lockFile.getParent());
        try (FileChannel channel = FileChannel.open(lockFile,
            StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock(0L, Long.MAX_VALUE, false)) {
            System.out.println(LOCKED);
            System.out.flush();
            // 부모가 종료시킬 때까지 대기
            while (System.in.read() != -1) {
                Thread.onSpinWait();
            }
        }
    }
}
