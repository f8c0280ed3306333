package com.micaixbrl.core.validator;

/**
 * Result of a registry lookup.
 *
 * @param lookupPerformed false when the registry could not be queried
 * @param found true when the registry holds a record for the identifier
 * @param legalName registered legal name, may be null
 * @param entityStatus entity status (e.g. {@code ACTIVE}), may be null
 * @param registrationStatus registration status (e.g. {@code ISSUED}), may be null
 * @param country legal address country, may be null
 * @param error failure description when the lookup was not performed
 */
public record RegistryLookupResult(
    boolean lookupPerformed,
    boolean found,
    String legalName,
    String entityStatus,
    String registrationStatus,
    String country,
    String error
) {
    public static RegistryLookupResult found(
            String legalName, String entityStatus, String registrationStatus, String country) {
        return new RegistryLookupResult(true, true, legalName, entityStatus, registrationStatus, country, null);
    }

    public static RegistryLookupResult notFound() {
        return new RegistryLookupResult(true, false, null, null, null, null, null);
    }

    public static RegistryLookupResult notPerformed(String error) {
        return new RegistryLookupResult(false, false, null, null, null, null, error);
    }
}
