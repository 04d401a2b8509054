package com.scaffold.generator.util;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;

/**
 * File operations used while materializing a template, with automatic
 * parent-directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes text to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content, Charset charset) throws IOException {
        createParentDirectories(filePath);
        Files.writeString(filePath, content, charset);
    }

    /**
     * Writes bytes to a file, creating parent directories if needed.
     */
    public static void safeWriteBytes(Path filePath, byte[] content) throws IOException {
        createParentDirectories(filePath);
        Files.write(filePath, content);
    }

    public static boolean isNonEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isPresent();
        }
    }

    /**
     * Applies a 3-digit octal permission string such as {@code "755"}.
     *
     * @throws UnsupportedOperationException when the filesystem has no POSIX permissions
     */
    public static void setPermissions(Path path, String octal) throws IOException {
        Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(toSymbolic(octal)));
    }

    /**
     * Converts {@code "754"} to {@code "rwxr-xr--"}.
     */
    public static String toSymbolic(String octal) {
        StringBuilder sb = new StringBuilder(9);
        for (char digit : octal.toCharArray()) {
            int bits = digit - '0';
            sb.append((bits & 4) != 0 ? 'r' : '-');
            sb.append((bits & 2) != 0 ? 'w' : '-');
            sb.append((bits & 1) != 0 ? 'x' : '-');
        }
        return sb.toString();
    }

    private static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }
}
