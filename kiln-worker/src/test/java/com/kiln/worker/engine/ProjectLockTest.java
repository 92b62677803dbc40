package com.kiln.worker.engine;

import com.kiln.worker.failure.ProjectBusyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectLockTest {

    @TempDir
    Path tempDir;

    @Test
    void acquire_createsTheProjectAndRejectsASecondHolder() {
        Path root = tempDir.resolve("demo");

        try (ProjectLock lock = ProjectLock.acquire(root, "demo")) {
            assertTrue(Files.isRegularFile(root.resolve(ProjectLock.LOCK_FILE)));
            assertThrows(ProjectBusyException.class, () -> ProjectLock.acquire(root, "demo"));
        }

        try (ProjectLock again = ProjectLock.acquire(root, "demo")) {
            assertTrue(Files.exists(root.resolve(ProjectLock.LOCK_FILE)));
        }
    }

    @Test
    void acquire_locksProjectsIndependently() {
        try (ProjectLock a = ProjectLock.acquire(tempDir.resolve("a"), "a");
             ProjectLock b = ProjectLock.acquire(tempDir.resolve("b"), "b")) {
            assertTrue(Files.exists(tempDir.resolve("b").resolve(ProjectLock.LOCK_FILE)));
        }
    }
}
