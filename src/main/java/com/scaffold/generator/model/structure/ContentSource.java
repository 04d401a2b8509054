package com.scaffold.generator.model.structure;

/**
 * Where a file's content comes from. A file has exactly one.
 */
public enum ContentSource {
    /** Inline text with placeholders. */
    INLINE,
    /** Entry of the template's template-file collection, rendered by FreeMarker. */
    TEMPLATE_FILE,
    /** File next to the template definition, copied byte-for-byte. */
    SOURCE_FILE,
    /** Base64-encoded bytes embedded in the definition. */
    BINARY
}
