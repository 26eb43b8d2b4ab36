package com.repocheck.core.audit;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Corpus backed by a map of file name to content, for engine tests.
 */
class InMemoryCorpus implements CoverageCorpus {

    private final String directory;
    private final Map<String, String> files = new LinkedHashMap<>();

    InMemoryCorpus(String directory) {
        this.directory = directory;
    }

    InMemoryCorpus with(String fileName, String content) {
        files.put(fileName, content);
        return this;
    }

    @Override
    public Set<String> fileNames() {
        return files.keySet();
    }

    @Override
    public String read(String fileName) throws IOException {
        String content = files.get(fileName);
        if (content == null) {
            throw new NoSuchFileException(location(fileName));
        }
        return content;
    }

    @Override
    public String location(String fileName) {
        return directory + "/" + fileName;
    }
}
