package com.micaixbrl.core.renderer;

import com.micaixbrl.core.generator.GeneratedDocument;

import java.nio.file.Path;
import java.util.List;

/**
 * Sends generated documents to a destination.
 */
public interface OutputRenderer {

    /**
     * Unique renderer identifier.
     *
     * @return renderer id (e.g. "filesystem", "console")
     */
    String getId();

    /**
     * Renders documents.
     *
     * @param documents documents in generation order
     * @param context render settings
     * @return files written, empty for renderers that do not write files
     * @throws IllegalStateException if a document cannot be written
     */
    List<Path> render(List<GeneratedDocument> documents, RenderContext context);
}
