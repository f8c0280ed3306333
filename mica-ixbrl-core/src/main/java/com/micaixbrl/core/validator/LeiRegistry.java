package com.micaixbrl.core.validator;

/**
 * Lookup of legal entity identifiers in an external registry.
 *
 * <p>Implementations never throw for registry failures; they return
 * {@link RegistryLookupResult#notPerformed(String)} instead.</p>
 */
public interface LeiRegistry {

    /**
     * Looks an identifier up.
     *
     * @param lei normalized identifier
     * @return lookup result, never null
     */
    RegistryLookupResult lookup(String lei);
}
