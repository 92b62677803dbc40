package com.kiln.worker.engine;

import com.kiln.worker.failure.ProjectBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive, non-blocking lock on {@code <projectRoot>/.lock}. Contention fails immediately with
 * {@link ProjectBusyException}; there is no waiting or queueing.
 */
public final class ProjectLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProjectLock.class);

    public static final String LOCK_FILE = ".lock";

    private final String projectId;
    private final FileChannel channel;
    private final FileLock lock;

    private ProjectLock(String projectId, FileChannel channel, FileLock lock) {
        this.projectId = projectId;
        this.channel = channel;
        this.lock = lock;
    }

    public static ProjectLock acquire(Path projectRoot, String projectId) {
        Path lockFile = projectRoot.resolve(LOCK_FILE);
        FileChannel channel;
        try {
            Files.createDirectories(projectRoot);
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open project lock " + lockFile, e);
        }
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // held by this JVM
            lock = null;
        } catch (IOException e) {
            closeQuietly(channel, projectId);
            throw new UncheckedIOException("Failed to lock project " + projectId, e);
        }
        if (lock == null) {
            closeQuietly(channel, projectId);
            throw new ProjectBusyException(projectId);
        }
        log.debug("Project lock acquired | projectId={} | file={}", projectId, lockFile);
        return new ProjectLock(projectId, channel, lock);
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } catch (IOException e) {
            log.warn("Failed to release project lock | projectId={} | error={}", projectId, e.getMessage());
        } finally {
            closeQuietly(channel, projectId);
        }
        log.debug("Project lock released | projectId={}", projectId);
    }

    private static void closeQuietly(FileChannel channel, String projectId) {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close project lock channel | projectId={} | error={}", projectId, e.getMessage());
        }
    }
}
