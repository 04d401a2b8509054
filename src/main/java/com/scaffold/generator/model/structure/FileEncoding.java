package com.scaffold.generator.model.structure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

import com.scaffold.generator.exception.TemplateSchemaException;

/**
 * Encodings a generated file may be written in. {@link #BINARY} files are
 * written byte-for-byte.
 */
public enum FileEncoding {
    UTF8("utf-8", StandardCharsets.UTF_8),
    ASCII("ascii", StandardCharsets.US_ASCII),
    LATIN1("latin-1", StandardCharsets.ISO_8859_1),
    BINARY("binary", null);

    private final String value;
    private final Charset charset;

    FileEncoding(String value, Charset charset) {
        this.value = value;
        this.charset = charset;
    }

    public String getValue() {
        return value;
    }

    /**
     * Charset for text encodings; {@code null} for {@link #BINARY}.
     */
    public Charset getCharset() {
        return charset;
    }

    public static FileEncoding fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(e -> e.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new TemplateSchemaException("encoding",
                        "unsupported encoding '" + value + "', must be one of: utf-8, ascii, latin-1, binary"));
    }
}
