package com.adlanda.repoindexer.model;

import java.util.List;

/**
 * A contiguous line window of a single file, the unit indexed for search.
 *
 * @param path      Repository-relative path of the source file
 * @param startLine First line of the window (1-based, inclusive)
 * @param endLine   Last line of the window (1-based, inclusive)
 * @param text      The lines of the window joined with '\n'
 * @param functions Lowercase definition names found in the window, in order
 */
public record Chunk(
        String path,
        int startLine,
        int endLine,
        String text,
        List<String> functions
) {
    public Chunk {
        functions = List.copyOf(functions);
    }
}
