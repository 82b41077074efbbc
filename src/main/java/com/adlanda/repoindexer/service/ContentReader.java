package com.adlanda.repoindexer.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads file contents safely: capped, binary-sniffing, and never throwing.
 *
 * Decoding replaces malformed UTF-8 sequences, so no file content can make the
 * ingestion pipeline fail.
 */
@Component
public class ContentReader {

    private static final Logger log = LoggerFactory.getLogger(ContentReader.class);

    public static final int SAMPLE_BYTES = 4096;

    public static final int DEFAULT_MAX_BYTES = 1_000_000;

    private static final int FIRST_LINE_BYTES = 256;

    private static final double MAX_NON_TEXT_RATIO = 0.30;

    private static final boolean[] TEXT_BYTES = new boolean[256];

    static {
        for (int b = 32; b < 127; b++) {
            TEXT_BYTES[b] = true;
        }
        for (int b : new int[]{7, 8, 9, 10, 12, 13, 27}) {
            TEXT_BYTES[b] = true;
        }
    }

    /**
     * Reads a file as text.
     *
     * @param path     File to read
     * @param maxBytes Byte cap; longer files are truncated, not rejected
     * @return The decoded text, or an empty string when the file is binary or unreadable
     */
    public String readText(Path path, int maxBytes) {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] sample = in.readNBytes(Math.min(SAMPLE_BYTES, maxBytes));
            if (looksBinary(sample, sample.length)) {
                log.debug("Skipping binary file {}", path);
                return "";
            }
            ByteArrayOutputStream data = new ByteArrayOutputStream(sample.length);
            data.write(sample);
            if (sample.length < maxBytes) {
                data.write(in.readNBytes(maxBytes - sample.length));
            }
            return data.toString(StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to read {}: {}", path, e.getMessage());
            return "";
        }
    }

    /**
     * Reads the first line of a file for shebang sniffing, looking at no more
     * than 256 bytes.
     *
     * @return The first line without its terminator, or an empty string on failure
     */
    public String readFirstLine(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] head = in.readNBytes(FIRST_LINE_BYTES);
            int end = 0;
            while (end < head.length && head[end] != '\n' && head[end] != '\r') {
                end++;
            }
            return new String(head, 0, end, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to read first line of {}: {}", path, e.getMessage());
            return "";
        }
    }

    /**
     * Binary heuristic: a NUL byte, or more than 30% of bytes outside printable
     * ASCII and common control whitespace.
     */
    static boolean looksBinary(byte[] sample, int length) {
        int nonText = 0;
        for (int i = 0; i < length; i++) {
            int b = sample[i] & 0xFF;
            if (b == 0) {
                return true;
            }
            if (!TEXT_BYTES[b]) {
                nonText++;
            }
        }
        return (double) nonText / Math.max(1, length) > MAX_NON_TEXT_RATIO;
    }
}
