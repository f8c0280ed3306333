package com.micaixbrl.core.model;

/**
 * Identity of a legal entity named in the white paper (offeror, issuer or operator).
 *
 * <p>Issuer and operator records usually carry only name, identifier, address and country;
 * contact fields are populated for the offeror.</p>
 *
 * @param legalName registered legal name
 * @param lei ISO 17442 legal entity identifier
 * @param registeredAddress registered address, free text
 * @param country ISO 3166-1 alpha-2 country code, or free text as extracted
 * @param website optional website URL
 * @param contactEmail optional contact email
 * @param contactPhone optional contact telephone number
 */
public record EntityInfo(
    String legalName,
    String lei,
    String registeredAddress,
    String country,
    String website,
    String contactEmail,
    String contactPhone
) {
    /**
     * Creates an entity without contact details.
     *
     * @param legalName registered legal name
     * @param lei legal entity identifier
     * @param registeredAddress registered address
     * @param country country code
     * @return entity record
     */
    public static EntityInfo of(String legalName, String lei, String registeredAddress, String country) {
        return new EntityInfo(legalName, lei, registeredAddress, country, null, null, null);
    }
}
