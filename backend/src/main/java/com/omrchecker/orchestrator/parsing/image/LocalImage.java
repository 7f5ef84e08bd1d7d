package com.omrchecker.orchestrator.parsing.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A readable image file. Temporary copies are deleted on {@link #close()}; caller-owned local files are
 * left in place.
 */
public final class LocalImage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LocalImage.class);

    private final Path path;
    private final boolean temporary;

    private LocalImage(Path path, boolean temporary) {
        this.path = path;
        this.temporary = temporary;
    }

    public static LocalImage temporary(Path path) {
        return new LocalImage(path, true);
    }

    public static LocalImage existing(Path path) {
        return new LocalImage(path, false);
    }

    public Path path() {
        return path;
    }

    public boolean isTemporary() {
        return temporary;
    }

    @Override
    public void close() {
        if (!temporary) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary image {}", path, e);
        }
    }
}
