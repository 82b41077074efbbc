package com.adlanda.repoindexer.service;

import java.nio.file.Path;

/**
 * A file found by the walk, with the filesystem stats sampling needs.
 *
 * @param path         Absolute path
 * @param relativePath Path relative to the repository root, '/'-separated
 * @param mtime        Modification time in seconds
 * @param size         Size in bytes
 */
public record ScanCandidate(
        Path path,
        String relativePath,
        double mtime,
        long size
) {}
