package com.micaixbrl.core.generator;

import com.micaixbrl.core.model.WhitepaperData;

/**
 * Interface for generators that turn a white paper record into an output document.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). Register
 * implementations in
 * {@code META-INF/services/com.micaixbrl.core.generator.DocumentGenerator}.</p>
 *
 * <p>Implementations hold no per-call state: ids and hidden facts live in a
 * {@link GenerationContext} created by each {@link #generate} call, so one instance may
 * serve concurrent callers.</p>
 *
 * @see GeneratorConfig
 * @see GeneratedDocument
 */
public interface DocumentGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration and on the command line
     * (e.g., "xhtml", "facts-json").</p>
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated documents.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates a document from the record.
     *
     * @param data white paper record
     * @param config configuration settings for generation
     * @return generated document
     * @throws MissingEntityIdentifierException if the primary entity has no usable LEI
     */
    GeneratedDocument generate(WhitepaperData data, GeneratorConfig config);
}
