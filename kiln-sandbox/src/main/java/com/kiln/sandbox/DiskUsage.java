package com.kiln.sandbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/** Byte totals for budget checks. */
public final class DiskUsage {

    private DiskUsage() {
    }

    /** Sum of regular file sizes under {@code dir}; 0 when it does not exist. */
    public static long totalBytes(Path dir) {
        if (!Files.exists(dir)) {
            return 0L;
        }
        long[] total = {0L};
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        total[0] += attrs.size();
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    // deleted mid-walk: contributes nothing
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to measure " + dir, e);
        }
        return total[0];
    }
}
