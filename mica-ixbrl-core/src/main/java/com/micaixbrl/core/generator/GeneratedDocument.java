package com.micaixbrl.core.generator;

import java.util.Objects;

/**
 * Represents a generated document.
 *
 * @param name document base name, without extension
 * @param content document content
 * @param fileExtension file extension for this content
 * @param factCount number of facts the document reports
 */
public record GeneratedDocument(
    String name,
    String content,
    String fileExtension,
    int factCount
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDocument {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * File name of the document.
     *
     * @return name plus extension
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
