package com.adlanda.repoindexer.exception;

import java.nio.file.Path;

/**
 * Thrown when the repository root handed to a scan does not exist.
 */
public class PathNotFoundException extends RuntimeException {

    private final Path path;

    public PathNotFoundException(Path path) {
        super("Path not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
