package com.repocheck.core.audit;

import java.io.IOException;
import java.util.Set;

/**
 * A set of text files that claim coverage (test files or documentation pages).
 *
 * <p>Content is read as raw text; the corpus never interprets it.
 *
 * @see DirectoryCorpus
 */
public interface CoverageCorpus {

    /**
     * Returns the names of the files in the corpus.
     *
     * @return file names (e.g., "test_modeling_bert.py")
     */
    Set<String> fileNames();

    /**
     * Checks if the corpus contains a file.
     *
     * @param fileName file name
     * @return true if present
     */
    default boolean contains(String fileName) {
        return fileNames().contains(fileName);
    }

    /**
     * Reads the raw text of a file.
     *
     * @param fileName file name from {@link #fileNames()}
     * @return file content
     * @throws IOException if the file cannot be read
     */
    String read(String fileName) throws IOException;

    /**
     * Describes where a file lives, for use in report lines.
     *
     * @param fileName file name
     * @return display location (e.g., "tests/test_modeling_bert.py")
     */
    String location(String fileName);
}
