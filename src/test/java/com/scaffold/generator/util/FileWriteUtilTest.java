package com.scaffold.generator.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileWriteUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesCreateParents() throws Exception {
        Path text = tempDir.resolve("a/b/c.txt");
        Path bytes = tempDir.resolve("d/e.bin");

        FileWriteUtil.safeWriteString(text, "café", StandardCharsets.UTF_8);
        FileWriteUtil.safeWriteBytes(bytes, new byte[] {1, 2, 3});

        assertThat(text).usingCharset(StandardCharsets.UTF_8).hasContent("café");
        assertThat(bytes).hasBinaryContent(new byte[] {1, 2, 3});
    }

    @Test
    void testIsNonEmptyDirectory() throws Exception {
        assertThat(FileWriteUtil.isNonEmptyDirectory(tempDir)).isFalse();
        assertThat(FileWriteUtil.isNonEmptyDirectory(tempDir.resolve("missing"))).isFalse();

        Files.writeString(tempDir.resolve("x.txt"), "x");
        assertThat(FileWriteUtil.isNonEmptyDirectory(tempDir)).isTrue();
        assertThat(FileWriteUtil.isNonEmptyDirectory(tempDir.resolve("x.txt"))).isFalse();
    }

    @Test
    void testToSymbolic() {
        assertThat(FileWriteUtil.toSymbolic("754")).isEqualTo("rwxr-xr--");
        assertThat(FileWriteUtil.toSymbolic("600")).isEqualTo("rw-------");
        assertThat(FileWriteUtil.toSymbolic("777")).isEqualTo("rwxrwxrwx");
    }
}
