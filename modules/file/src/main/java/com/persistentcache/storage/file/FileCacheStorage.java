package com.persistentcache.storage.file;

import com.persistentcache.lock.AdvisoryLock;
import com.persistentcache.lock.LockHandle;
import com.persistentcache.storage.CacheStorage;
import com.persistentcache.support.error.CoreException;
import com.persistentcache.support.error.ErrorType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 파일 캐시 저장소.
 * <p>
 * 캐시 키 하나를 루트 디렉터리 안의 파일 하나로 저장합니다.
 * 파일 이름은 {@link KeyFileNames#fileNameOf(String)}로 만들고, 파일 내용은 직렬화된 바이트 그대로입니다.
 * 같은 이름이 키의 잠금 이름으로도 쓰입니다.
 * </p>
 * <p>
 * <b>잠금:</b>
 * <ul>
 *   <li>조회는 공유 잠금을 획득한 뒤 읽으므로 기록 중인 파일을 읽지 않습니다.</li>
 *   <li>저장은 배타 잠금을 획득한 뒤 임시 파일에 기록하고 원자적으로 교체합니다.
 *       기록 도중 프로세스가 종료되어도 불완전한 파일이 남지 않습니다.</li>
 *   <li>키가 다르면 서로 막지 않습니다.</li>
 * </ul>
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
@Slf4j
public class FileCacheStorage implements CacheStorage {

    private static final String PENDING_FILE_PREFIX = ".pending-";
    private static final String PENDING_FILE_SUFFIX = ".tmp";
    // 다이제스트 이름("~" + SHA-256 16진수 64자)을 붙여도 파일 이름 길이 제한 안에 들어가야 한다
    private static final int MAX_NAMESPACE_LENGTH = KeyFileNames.MAX_FILE_NAME_LENGTH - 65;

    private final Path rootDirectory;
    private final String prefix;
    private final String encodedNamespace;
    private final AdvisoryLock advisoryLock;
    private final Duration lockTimeout;

    public FileCacheStorage(Path rootDirectory, String prefix, AdvisoryLock advisoryLock, Duration lockTimeout) {
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        this.prefix = prefix;
        this.encodedNamespace = KeyFileNames.encode(CacheStorage.namespaceOf(prefix));
        if (encodedNamespace.length() > MAX_NAMESPACE_LENGTH) {
            throw new IllegalArgumentException(
                String.format("파일 저장소의 프리픽스가 너무 깁니다. (prefix: %s)", prefix));
        }
        this.advisoryLock = advisoryLock;
        this.lockTimeout = lockTimeout;
        createRootDirectory();
    }

    @Override
    public boolean contains(String key) {
        String fileName = KeyFileNames.fileNameOf(key);
        Path file = rootDirectory.resolve(fileName);
        if (!Files.exists(file)) {
            return false;
        }
        try (LockHandle ignored = advisoryLock.acquireShared(fileName, lockTimeout)) {
            return Files.isRegularFile(file);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        String fileName = KeyFileNames.fileNameOf(key);
        Path file = rootDirectory.resolve(fileName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (LockHandle ignored = advisoryLock.acquireShared(fileName, lockTimeout)) {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            // 잠금을 기다리는 동안 삭제됨
            return Optional.empty();
        } catch (IOException e) {
            throw new CoreException(ErrorType.CONNECTION_ERROR,
                String.format("캐시 파일을 읽을 수 없습니다. (key: %s)", key), e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        String fileName = KeyFileNames.fileNameOf(key);
        createRootDirectory();
        try (LockHandle ignored = advisoryLock.acquireExclusive(fileName, lockTimeout)) {
            writeAtomically(rootDirectory.resolve(fileName), value, key);
        }
        log.debug("캐시 저장. (key: {}, bytes: {})", key, value.length);
    }

    @Override
    public void flush(String key) {
        flushFile(KeyFileNames.fileNameOf(key));
    }

    /**
     * 프리픽스를 가진 모든 캐시 파일을 삭제합니다.
     * <p>
     * 키로 되돌리지 않고 파일 이름의 네임스페이스 부분으로 대상을 찾으므로, 다이제스트 이름으로 저장된 긴 키도 삭제됩니다.
     * 디렉터리를 조회하는 도중 생기거나 사라지는 파일은 포함될 수도, 빠질 수도 있습니다.
     * 이 저장소가 만든 이름이 아닌 파일은 건드리지 않습니다.
     * </p>
     */
    @Override
    public void flushAll() {
        if (!Files.isDirectory(rootDirectory)) {
            return;
        }

        List<String> fileNames;
        try (Stream<Path> files = Files.list(rootDirectory)) {
            fileNames = files
                .filter(Files::isRegularFile)
                .map(file -> file.getFileName().toString())
                .filter(fileName -> fileName.startsWith(encodedNamespace))
                .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new CoreException(ErrorType.CONNECTION_ERROR,
                String.format("캐시 디렉터리를 조회할 수 없습니다. (directory: %s)", rootDirectory), e);
        }

        int flushed = 0;
        for (String fileName : fileNames) {
            if (!KeyFileNames.isFileName(fileName)) {
                log.warn("캐시 파일이 아니므로 건너뜁니다. (fileName: {})", fileName);
                continue;
            }
            flushFile(fileName);
            flushed++;
        }
        log.info("캐시 전체 삭제 완료. (prefix: {}, count: {})", prefix, flushed);
    }

    @Override
    public String prefix() {
        return prefix;
    }

    public Path rootDirectory() {
        return rootDirectory;
    }

    private void flushFile(String fileName) {
        Path file = rootDirectory.resolve(fileName);
        if (!Files.exists(file)) {
            return;
        }
        try (LockHandle ignored = advisoryLock.acquireExclusive(fileName, lockTimeout)) {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new CoreException(ErrorType.WRITE_ERROR,
                String.format("캐시 파일을 삭제할 수 없습니다. (fileName: %s)", fileName), e);
        }
    }

    private void writeAtomically(Path target, byte[] value, String key) {
        Path pending = null;
        try {
            pending = Files.createTempFile(rootDirectory, PENDING_FILE_PREFIX, PENDING_FILE_SUFFIX);
            try (FileChannel channel = FileChannel.open(pending, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(value);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(pending, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            CoreException failure = new CoreException(ErrorType.WRITE_ERROR,
                String.format("캐시 파일을 저장할 수 없습니다. (key: %s)", key), e);
            deletePending(pending, failure);
            throw failure;
        }
    }

    private void deletePending(Path pending, CoreException failure) {
        if (pending == null) {
            return;
        }
        try {
            Files.deleteIfExists(pending);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private void createRootDirectory() {
        try {
            Files.createDirectories(rootDirectory);
        } catch (IOException e) {
            throw new CoreException(ErrorType.CONNECTION_ERROR,
                String.format("캐시 디렉터리를 생성할 수 없습니다. (directory: %s)", rootDirectory), e);
        }
    }
}
