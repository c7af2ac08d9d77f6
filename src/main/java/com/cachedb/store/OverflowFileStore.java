package com.cachedb.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Content-addressed payload files: {@code <directory>/<md5>} plus a
 * {@code <md5>.ref} reference count shared by every store in the directory.
 */
public class OverflowFileStore {
    private static final Logger logger = LoggerFactory.getLogger(OverflowFileStore.class);

    static final String LOCK_FILE = ".overflow.lock";
    static final String REF_SUFFIX = ".ref";

    private static final int LOCK_ATTEMPTS = 64;
    private static final long MAX_BACKOFF_MILLIS = 100;

    // FileChannel locks are held per JVM, so threads of one process queue here first
    private static final ConcurrentMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path directory;
    private final ReentrantLock processLock;

    public OverflowFileStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
        this.processLock = PROCESS_LOCKS.computeIfAbsent(this.directory, p -> new ReentrantLock());
    }

    public static String signature(byte[] data) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(data);
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16));
                hex.append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * Stores {@code data} and returns its hash. Identical content is written once;
     * later writers only take another reference.
     */
    public String write(byte[] data) throws IOException {
        String hash = signature(data);
        Path file = directory.resolve(hash);
        withLock(() -> {
            try {
                Files.write(file, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                writeRefCount(hash, 1);
            } catch (FileAlreadyExistsException e) {
                writeRefCount(hash, readRefCount(hash) + 1);
            }
            return null;
        });
        return hash;
    }

    /**
     * Lock-free read; empty when the file has disappeared.
     */
    public Optional<byte[]> read(String hash) {
        try {
            return Optional.of(Files.readAllBytes(directory.resolve(hash)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Failed to read overflow file {}: {}", hash, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean exists(String hash) {
        return Files.exists(directory.resolve(hash));
    }

    /**
     * Drops one reference and removes the file once nothing points at it.
     *
     * @return true if the file was removed
     */
    public boolean release(String hash) throws IOException {
        return withLock(() -> {
            if (!Files.exists(directory.resolve(hash))) {
                Files.deleteIfExists(refFile(hash));
                return false;
            }
            long count = readRefCount(hash) - 1;
            if (count > 0) {
                writeRefCount(hash, count);
                return false;
            }
            return delete(hash);
        });
    }

    /**
     * Best-effort removal of a payload file and its reference count.
     */
    public boolean delete(String hash) {
        try {
            Files.deleteIfExists(refFile(hash));
            return Files.deleteIfExists(directory.resolve(hash));
        } catch (IOException e) {
            logger.warn("Failed to delete overflow file {}: {}", hash, e.getMessage());
            return false;
        }
    }

    public long referenceCount(String hash) throws IOException {
        return withLock(() -> Files.exists(directory.resolve(hash)) ? readRefCount(hash) : 0L);
    }

    public Path getDirectory() {
        return directory;
    }

    private Path refFile(String hash) {
        return directory.resolve(hash + REF_SUFFIX);
    }

    // a missing sidecar means a single reference
    private long readRefCount(String hash) throws IOException {
        try {
            String text = new String(Files.readAllBytes(refFile(hash)), StandardCharsets.US_ASCII).trim();
            return text.isEmpty() ? 1L : Long.parseLong(text);
        } catch (NoSuchFileException e) {
            return 1L;
        } catch (NumberFormatException e) {
            throw new IOException("Corrupt reference count for overflow file " + hash, e);
        }
    }

    private void writeRefCount(String hash, long count) throws IOException {
        Files.write(refFile(hash), Long.toString(count).getBytes(StandardCharsets.US_ASCII));
    }

    private <T> T withLock(LockedAction<T> action) throws IOException {
        processLock.lock();
        try (FileChannel channel = FileChannel.open(directory.resolve(LOCK_FILE),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            FileLock lock = acquire(channel);
            try {
                return action.run();
            } finally {
                lock.release();
            }
        } finally {
            processLock.unlock();
        }
    }

    private FileLock acquire(FileChannel channel) throws IOException {
        long backoff = 1;
        for (int attempt = 0; attempt < LOCK_ATTEMPTS; attempt++) {
            FileLock lock = channel.tryLock();
            if (lock != null) {
                return lock;
            }
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while locking " + directory, e);
            }
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MILLIS);
        }
        throw new IOException("Could not lock overflow directory " + directory
                + " after " + LOCK_ATTEMPTS + " attempts");
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run() throws IOException;
    }
}
