package io.resumable.store;

import io.resumable.checkpoint.CheckpointStoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HexFormat;

/**
 * One file per key under a directory. Writes go to a temp file first and are moved into place so a crash
 * never leaves a half-written record behind.
 */
public class FileKeyValueStore implements KeyValueStore {
    private static final String SUFFIX = ".kv";

    private final Path dir;
    private final int maxValueBytes;

    public FileKeyValueStore(Path dir) throws IOException {
        this(dir, 0);
    }

    public FileKeyValueStore(Path dir, int maxValueBytes) throws IOException {
        this.dir = dir;
        this.maxValueBytes = Math.max(0, maxValueBytes);
        Files.createDirectories(dir);
    }

    @Override
    public byte[] get(String key) {
        try {
            return Files.readAllBytes(fileFor(key));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new CheckpointStoreException("cannot read " + key + " from " + dir, e);
        }
    }

    @Override
    public synchronized void set(String key, byte[] value) {
        if (maxValueBytes > 0 && value.length > maxValueBytes) {
            throw new CheckpointStoreException("value for " + key + " exceeds " + maxValueBytes + " bytes");
        }
        Path target = fileFor(key);
        try {
            Path tmp = Files.createTempFile(dir, "write-", ".tmp");
            try {
                Files.write(tmp, value);
                try {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("cannot write " + key + " to " + dir, e);
        }
    }

    @Override
    public synchronized void delete(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new CheckpointStoreException("cannot delete " + key + " from " + dir, e);
        }
    }

    @Override
    public int maxValueBytes() {
        return maxValueBytes;
    }

    // keys carry ':' and job ids are caller-chosen, so hex-encode them into safe file names
    private Path fileFor(String key) {
        return dir.resolve(HexFormat.of().formatHex(key.getBytes(StandardCharsets.UTF_8)) + SUFFIX);
    }
}
