package com.wavesmith.core.persistence;

import java.nio.file.Path;

/**
 * A saved execution could not be read back faithfully. Callers must not fall
 * back to running from scratch.
 */
public class PersistenceCorruptionException extends RuntimeException {

    private final Path path;

    public PersistenceCorruptionException(Path path, String message) {
        super("Corrupt execution snapshot %s: %s".formatted(path, message));
        this.path = path;
    }

    public PersistenceCorruptionException(Path path, String message, Throwable cause) {
        super("Corrupt execution snapshot %s: %s".formatted(path, message), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
