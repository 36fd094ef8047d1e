package com.persistentcache.lock;

import com.persistentcache.support.error.CoreException;
import com.persistentcache.support.error.ErrorType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link FileChannel#tryLock(long, long, boolean)} 기반 권고 잠금 구현체.
 * <p>
 * 이름마다 {@code <root>/.locks/<name>.lock} 잠금 파일을 두고 OS 파일 잠금을 겁니다.
 * 잠금은 파일 디스크립터에 묶여 있으므로 잠금을 보유한 프로세스가 비정상 종료되어도
 * OS가 잠금을 해제합니다. 잠금 파일은 삭제하지 않습니다.
 * </p>
 * <p>
 * <b>같은 JVM 안에서의 조율:</b>
 * OS 파일 잠금은 프로세스 단위로 걸리기 때문에 같은 JVM의 스레드끼리는 서로 막지 못합니다.
 * 그래서 잠금 파일별 {@link ReentrantReadWriteLock}으로 먼저 조율하고,
 * 공유 잠금을 보유한 스레드들은 OS 공유 잠금 하나를 함께 사용합니다.
 * 모든 대기는 호출자가 지정한 제한 시간 안에서만 이루어집니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
public class FileChannelAdvisoryLock implements AdvisoryLock {

    private static final String LOCK_DIRECTORY = ".locks";
    private static final String LOCK_SUFFIX = ".lock";
    private static final long POLL_INTERVAL_MILLIS = 10L;

    /**
     * JVM 전체에서 공유하는 잠금 파일별 엔트리.
     * <p>
     * 같은 디렉터리를 사용하는 저장소 인스턴스가 여러 개여도 잠금 파일 하나에는 엔트리 하나만 존재합니다.
     * 참조가 모두 해제되면 제거됩니다.
     * </p>
     */
    private static final ConcurrentHashMap<Path, LockEntry> ENTRIES = new ConcurrentHashMap<>();

    private final Path lockDirectory;

    public FileChannelAdvisoryLock(Path rootDirectory) {
        this.lockDirectory = rootDirectory.resolve(LOCK_DIRECTORY).toAbsolutePath().normalize();
    }

    @Override
    public LockHandle acquireShared(String name, Duration timeout) {
        long deadline = deadlineOf(timeout);
        Path lockFile = lockFileOf(name);
        LockEntry entry = retain(lockFile);
        Lock threadLock = entry.threadLock.readLock();
        try {
            lockWithin(threadLock, lockFile, timeout, deadline);
        } catch (RuntimeException e) {
            release(lockFile, entry);
            throw e;
        }

        try {
            // 첫 번째 공유 잠금 보유자가 OS 잠금을 기다리는 동안 다른 스레드도 각자의 제한 시간 안에서만 기다린다
            lockWithin(entry.sharedGate, lockFile, timeout, deadline);
            try {
                if (entry.sharedHolders == 0) {
                    entry.sharedLock = acquireFileLock(openChannel(lockFile), true, lockFile, timeout, deadline);
                }
                entry.sharedHolders++;
            } finally {
                entry.sharedGate.unlock();
            }
        } catch (RuntimeException e) {
            threadLock.unlock();
            release(lockFile, entry);
            throw e;
        }

        return new ReleaseOnce(() -> {
            try {
                releaseShared(entry, lockFile);
            } finally {
                threadLock.unlock();
                release(lockFile, entry);
            }
        });
    }

    @Override
    public LockHandle acquireExclusive(String name, Duration timeout) {
        long deadline = deadlineOf(timeout);
        Path lockFile = lockFileOf(name);
        LockEntry entry = retain(lockFile);
        Lock threadLock = entry.threadLock.writeLock();
        try {
            lockWithin(threadLock, lockFile, timeout, deadline);
        } catch (RuntimeException e) {
            release(lockFile, entry);
            throw e;
        }

        FileLock fileLock;
        try {
            fileLock = acquireFileLock(openChannel(lockFile), false, lockFile, timeout, deadline);
        } catch (RuntimeException e) {
            threadLock.unlock();
            release(lockFile, entry);
            throw e;
        }

        return new ReleaseOnce(() -> {
            try {
                closeChannel(fileLock, lockFile);
            } finally {
                threadLock.unlock();
                release(lockFile, entry);
            }
        });
    }

    /**
     * 이름에 해당하는 잠금 파일 경로를 반환합니다.
     *
     * @param name 잠금 이름
     * @return 잠금 파일 경로
     */
    Path lockFileOf(String name) {
        return lockDirectory.resolve(name + LOCK_SUFFIX);
    }

    private void lockWithin(Lock lock, Path lockFile, Duration timeout, long deadline) {
        try {
            if (!lock.tryLock(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
                throw lockTimeout(lockFile, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoreException(ErrorType.LOCK_TIMEOUT,
                String.format("잠금 대기 중 인터럽트되었습니다. (lock: %s)", lockFile), e);
        }
    }

    private FileChannel openChannel(Path lockFile) {
        try {
            Files.createDirectories(lockFile.getParent());
            return FileChannel.open(lockFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new CoreException(ErrorType.CONNECTION_ERROR,
                String.format("잠금 파일을 열 수 없습니다. (lock: %s)", lockFile), e);
        }
    }

    private FileLock acquireFileLock(FileChannel channel, boolean shared, Path lockFile, Duration timeout, long deadline) {
        CoreException failure;
        try {
            while (true) {
                FileLock fileLock = channel.tryLock(0L, Long.MAX_VALUE, shared);
                if (fileLock != null) {
                    return fileLock;
                }
                if (remainingNanos(deadline) <= 0) {
                    throw lockTimeout(lockFile, timeout);
                }
                Thread.sleep(POLL_INTERVAL_MILLIS);
            }
        } catch (CoreException e) {
            failure = e;
        } catch (IOException e) {
            failure = new CoreException(ErrorType.CONNECTION_ERROR,
                String.format("파일 잠금을 획득할 수 없습니다. (lock: %s)", lockFile), e);
        } catch (OverlappingFileLockException e) {
            failure = new CoreException(ErrorType.LOCK_TIMEOUT,
                String.format("같은 프로세스가 이미 파일 잠금을 보유하고 있습니다. (lock: %s)", lockFile), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new CoreException(ErrorType.LOCK_TIMEOUT,
                String.format("잠금 대기 중 인터럽트되었습니다. (lock: %s)", lockFile), e);
        }

        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        throw failure;
    }

    private void releaseShared(LockEntry entry, Path lockFile) {
        // 보유자가 있는 동안에는 OS 잠금을 기다리는 스레드가 없으므로 오래 막히지 않는다
        entry.sharedGate.lock();
        try {
            entry.sharedHolders--;
            if (entry.sharedHolders == 0) {
                FileLock fileLock = entry.sharedLock;
                entry.sharedLock = null;
                closeChannel(fileLock, lockFile);
            }
        } finally {
            entry.sharedGate.unlock();
        }
    }

    private void closeChannel(FileLock fileLock, Path lockFile) {
        try {
            // 채널을 닫으면 OS 잠금도 함께 해제된다
            fileLock.channel().close();
        } catch (IOException e) {
            log.warn("잠금 파일 닫기 실패. (lock: {})", lockFile, e);
        }
    }

    private CoreException lockTimeout(Path lockFile, Duration timeout) {
        log.warn("캐시 잠금 획득 시간 초과. (lock: {}, timeout: {})", lockFile, timeout);
        return new CoreException(ErrorType.LOCK_TIMEOUT,
            String.format("제한 시간 안에 캐시 잠금을 획득하지 못했습니다. (lock: %s, timeout: %s)", lockFile, timeout));
    }

    private static long deadlineOf(Duration timeout) {
        return System.nanoTime() + timeout.toNanos();
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    private static LockEntry retain(Path lockFile) {
        return ENTRIES.compute(lockFile, (path, entry) -> {
            LockEntry retained = entry != null ? entry : new LockEntry();
            retained.references++;
            return retained;
        });
    }

    private static void release(Path lockFile, LockEntry entry) {
        ENTRIES.computeIfPresent(lockFile, (path, current) -> {
            if (current != entry) {
                return current;
            }
            current.references--;
            return current.references == 0 ? null : current;
        });
    }

    /**
     * 잠금 파일 하나에 대한 JVM 내부 상태.
     */
    private static final class LockEntry {
        private final ReentrantReadWriteLock threadLock = new ReentrantReadWriteLock();
        // sharedHolders, sharedLock 보호
        private final ReentrantLock sharedGate = new ReentrantLock();
        private int references;
        private int sharedHolders;
        private FileLock sharedLock;
    }

    private static final class ReleaseOnce implements LockHandle {
        private final AtomicBoolean released = new AtomicBoolean(false);
        private final Runnable releaseAction;

        private ReleaseOnce(Runnable releaseAction) {
            this.releaseAction = releaseAction;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                releaseAction.run();
            }
        }
    }
}
