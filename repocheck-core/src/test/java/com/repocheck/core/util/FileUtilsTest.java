package com.repocheck.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void listFiles_withSuffix_returnsSortedDirectChildren() throws IOException {
        Files.writeString(tempDir.resolve("modeling_gpt2.py"), "");
        Files.writeString(tempDir.resolve("modeling_bert.py"), "");
        Files.writeString(tempDir.resolve("README.md"), "");
        Path nested = Files.createDirectories(tempDir.resolve("models"));
        Files.writeString(nested.resolve("modeling_t5.py"), "");

        List<Path> files = FileUtils.listFiles(tempDir, ".py");

        assertThat(files).extracting(path -> path.getFileName().toString())
            .containsExactly("modeling_bert.py", "modeling_gpt2.py");
    }

    @Test
    void listFiles_emptySuffix_returnsAllFiles() throws IOException {
        Files.writeString(tempDir.resolve("a.rst"), "");
        Files.writeString(tempDir.resolve("b.txt"), "");

        assertThat(FileUtils.listFiles(tempDir, "")).hasSize(2);
    }

    @Test
    void listFiles_missingDirectory_throws() {
        assertThatThrownBy(() -> FileUtils.listFiles(tempDir.resolve("missing"), ".py"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void readString_returnsContent() throws IOException {
        Path file = tempDir.resolve("bert.rst");
        Files.writeString(file, "BERT\n----\n");

        assertThat(FileUtils.readString(file)).isEqualTo("BERT\n----\n");
    }

    @Test
    void isDirectory_distinguishesFilesAndDirectories() throws IOException {
        Path file = Files.writeString(tempDir.resolve("file.txt"), "");

        assertThat(FileUtils.isDirectory(tempDir)).isTrue();
        assertThat(FileUtils.isDirectory(file)).isFalse();
        assertThat(FileUtils.isDirectory(tempDir.resolve("missing"))).isFalse();
    }

    @Test
    void stem_stripsLastExtension() {
        assertThat(FileUtils.stem("test_modeling_bert.py")).isEqualTo("test_modeling_bert");
        assertThat(FileUtils.stem("archive.tar.gz")).isEqualTo("archive.tar");
        assertThat(FileUtils.stem("Makefile")).isEqualTo("Makefile");
        assertThat(FileUtils.stem(".gitignore")).isEqualTo(".gitignore");
        assertThat(FileUtils.stem(Path.of("docs", "bert.rst"))).isEqualTo("bert");
    }
}
