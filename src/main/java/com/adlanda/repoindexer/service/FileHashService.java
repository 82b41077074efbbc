package com.adlanda.repoindexer.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Service for computing content hashes and cache fingerprints.
 *
 * Record hashes are taken over the decoded text, not the raw bytes, so a file
 * whose mtime changed but whose content did not keeps the same hash.
 */
@Service
public class FileHashService {

    /**
     * Sentinel used in place of a HEAD commit id when the root is not under git.
     */
    public static final String NO_VCS_HEAD = "nogit";

    /**
     * Computes the SHA-256 hash of decoded text.
     *
     * @param content The text to hash
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(String content) {
        return sha256Hex(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Cache key for a repository state: the absolute root plus the HEAD commit,
     * so moving the repository or switching branches selects a different entry.
     *
     * @param root Absolute repository root
     * @param head HEAD commit id, or {@link #NO_VCS_HEAD}
     */
    public String fingerprint(Path root, String head) {
        return sha256Hex((root.toString() + head).getBytes(StandardCharsets.UTF_8));
    }

    private String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
