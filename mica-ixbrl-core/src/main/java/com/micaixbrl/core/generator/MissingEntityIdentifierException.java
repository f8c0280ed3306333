package com.micaixbrl.core.generator;

/**
 * Thrown when the primary entity has no usable legal entity identifier.
 *
 * <p>Every context carries the primary LEI, so no document can be produced without it.</p>
 */
public class MissingEntityIdentifierException extends IllegalStateException {

    public MissingEntityIdentifierException(String message) {
        super(message);
    }
}
