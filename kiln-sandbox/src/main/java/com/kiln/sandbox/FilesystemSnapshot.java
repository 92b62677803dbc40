package com.kiln.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Relative path to last-modified time for every regular file under a root. Paths always use {@code /}.
 * Files that vanish while the tree is walked are left out.
 */
public final class FilesystemSnapshot {

    private static final Logger log = LoggerFactory.getLogger(FilesystemSnapshot.class);

    private final Map<String, FileTime> modifiedTimes;

    private FilesystemSnapshot(Map<String, FileTime> modifiedTimes) {
        this.modifiedTimes = Collections.unmodifiableMap(modifiedTimes);
    }

    public static FilesystemSnapshot capture(Path root) {
        Map<String, FileTime> times = new HashMap<>();
        if (!Files.isDirectory(root)) {
            return new FilesystemSnapshot(times);
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        times.put(relative(root, file), attrs.lastModifiedTime());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Snapshot skipped unreadable path | path={} | error={}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to snapshot " + root, e);
        }
        return new FilesystemSnapshot(times);
    }

    static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    public Map<String, FileTime> asMap() {
        return modifiedTimes;
    }

    /** Paths present in {@code after} that are new or whose modification time differs from this snapshot. */
    public List<String> changedIn(FilesystemSnapshot after) {
        List<String> changed = new ArrayList<>();
        for (Map.Entry<String, FileTime> e : after.modifiedTimes.entrySet()) {
            FileTime before = modifiedTimes.get(e.getKey());
            if (before == null || !before.equals(e.getValue())) {
                changed.add(e.getKey());
            }
        }
        Collections.sort(changed);
        return changed;
    }

    public int size() {
        return modifiedTimes.size();
    }
}
