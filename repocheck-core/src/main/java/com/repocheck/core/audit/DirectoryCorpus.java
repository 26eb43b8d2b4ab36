package com.repocheck.core.audit;

import com.repocheck.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Corpus of the files directly inside one directory.
 *
 * <p>The listing is taken once, when the corpus is opened. Files are kept when their name
 * starts with the prefix and ends with the suffix, and their stem (name without extension)
 * is not ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CoverageCorpus tests = DirectoryCorpus.open(Paths.get("tests"), "test_modeling", ".py",
 *     List.of("test_modeling_common"));
 * boolean hasBertTests = tests.contains("test_modeling_bert.py");
 * }</pre>
 */
public final class DirectoryCorpus implements CoverageCorpus {

    private static final Logger log = LoggerFactory.getLogger(DirectoryCorpus.class);

    private final Path directory;
    private final Path displayRoot;
    private final Set<String> fileNames;

    private DirectoryCorpus(Path directory, Path displayRoot, Set<String> fileNames) {
        this.directory = directory;
        this.displayRoot = displayRoot;
        this.fileNames = Collections.unmodifiableSet(fileNames);
    }

    /**
     * Lists a directory into a corpus.
     *
     * @param directory directory to list
     * @param prefix required file name prefix (may be empty)
     * @param suffix required file name suffix (may be empty)
     * @param ignoredStems file stems to leave out
     * @return corpus
     * @throws IOException if the directory cannot be listed
     */
    public static DirectoryCorpus open(Path directory, String prefix, String suffix, Collection<String> ignoredStems)
            throws IOException {
        return open(directory, null, prefix, suffix, ignoredStems);
    }

    /**
     * Lists a directory into a corpus whose locations are shown relative to a root.
     *
     * @param directory directory to list
     * @param displayRoot root that report locations are relativized against (may be null)
     * @param prefix required file name prefix (may be empty)
     * @param suffix required file name suffix (may be empty)
     * @param ignoredStems file stems to leave out
     * @return corpus
     * @throws IOException if the directory cannot be listed
     */
    public static DirectoryCorpus open(Path directory, Path displayRoot, String prefix, String suffix,
                                       Collection<String> ignoredStems) throws IOException {
        Set<String> names = new TreeSet<>();
        for (Path file : FileUtils.listFiles(directory, suffix)) {
            String fileName = file.getFileName().toString();
            if (fileName.startsWith(prefix) && !ignoredStems.contains(FileUtils.stem(fileName))) {
                names.add(fileName);
            }
        }
        log.debug("Corpus {}: {} files", directory, names.size());
        return new DirectoryCorpus(directory, displayRoot, names);
    }

    @Override
    public Set<String> fileNames() {
        return fileNames;
    }

    @Override
    public String read(String fileName) throws IOException {
        return FileUtils.readString(directory.resolve(fileName));
    }

    @Override
    public String location(String fileName) {
        Path file = directory.resolve(fileName);
        if (displayRoot != null && file.startsWith(displayRoot)) {
            return displayRoot.relativize(file).toString();
        }
        return file.toString();
    }
}
