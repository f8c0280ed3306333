package com.micaixbrl.core.validator;

import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.util.LeiCodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Legal entity identifier checks: presence, format, check digits and registry status.
 *
 * <p>The offeror's identifier is always checked. Issuer and operator identifiers are
 * checked only when present, not a "not applicable" placeholder and different from the
 * offeror's; their findings carry {@code -ISSUER} / {@code -OPERATOR} rule suffixes.</p>
 */
public class LeiValidator {

    /** Element name carried by every identifier finding. */
    public static final String ELEMENT = "lei";

    /** Number of identifier assertions counted in a validation summary. */
    public static final int ASSERTION_COUNT = 6;

    public static final String MISSING = "LEI-000";
    public static final String FORMAT = "LEI-001";
    public static final String CHECKSUM = "LEI-002";
    public static final String NOT_FOUND = "LEI-003";
    public static final String NOT_ISSUED = "LEI-004";
    public static final String NOT_ACTIVE = "LEI-005";

    static final String OFFEROR_PATH = "partA.lei";
    static final String ISSUER_PATH = "partB.lei";
    static final String OPERATOR_PATH = "partC.lei";

    /**
     * Checks a single identifier.
     *
     * @param lei identifier, may be null
     * @return findings, empty when the identifier is valid
     */
    public List<ValidationError> validate(String lei) {
        return validate(lei, "", "", OFFEROR_PATH);
    }

    /**
     * Checks the offeror's identifier and any distinct issuer or operator identifiers.
     *
     * @param data record
     * @return findings in offeror, issuer, operator order
     */
    public List<ValidationError> validateAll(WhitepaperData data) {
        Objects.requireNonNull(data, "data must not be null");
        String offerorLei = data.partA() != null ? data.partA().lei() : null;

        List<ValidationError> findings = new ArrayList<>(validate(offerorLei));
        findings.addAll(validateSecondary(data.partB(), offerorLei, "-ISSUER", "Issuer ", ISSUER_PATH));
        findings.addAll(validateSecondary(data.partC(), offerorLei, "-OPERATOR", "Operator ", OPERATOR_PATH));
        return findings;
    }

    /**
     * Turns a registry lookup into findings.
     *
     * @param result lookup result
     * @return LEI-003 when not found; LEI-004 and LEI-005 for inactive records; empty otherwise
     */
    public List<ValidationError> registryFindings(RegistryLookupResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (!result.lookupPerformed()) {
            return List.of();
        }
        if (!result.found()) {
            return List.of(ValidationError.warning(NOT_FOUND,
                "LEI not found in GLEIF database - verify the identifier is correct", ELEMENT, OFFEROR_PATH));
        }
        List<ValidationError> findings = new ArrayList<>();
        if (result.registrationStatus() != null && !"ISSUED".equals(result.registrationStatus())) {
            findings.add(ValidationError.warning(NOT_ISSUED,
                "LEI status is " + result.registrationStatus() + " - should be ISSUED", ELEMENT, OFFEROR_PATH));
        }
        if (result.entityStatus() != null && !"ACTIVE".equals(result.entityStatus())) {
            findings.add(ValidationError.warning(NOT_ACTIVE,
                "LEI entity status is " + result.entityStatus() + " - should be ACTIVE", ELEMENT, OFFEROR_PATH));
        }
        return findings;
    }

    private List<ValidationError> validateSecondary(
            EntityInfo entity, String offerorLei, String suffix, String prefix, String fieldPath) {
        if (entity == null || isBlank(entity.lei()) || LeiCodes.isNotApplicable(entity.lei())) {
            return List.of();
        }
        if (LeiCodes.normalize(entity.lei()).equals(LeiCodes.normalize(offerorLei))) {
            return List.of();
        }
        return validate(entity.lei(), suffix, prefix, fieldPath);
    }

    private List<ValidationError> validate(String lei, String suffix, String prefix, String fieldPath) {
        if (isBlank(lei)) {
            return List.of(ValidationError.error(MISSING + suffix,
                prefix + "Legal Entity Identifier (LEI) is required", ELEMENT, fieldPath));
        }
        String normalized = LeiCodes.normalize(lei);
        if (!LeiCodes.isWellFormed(normalized)) {
            return List.of(ValidationError.error(FORMAT + suffix,
                prefix + "Invalid LEI format: \"" + lei
                    + "\". LEI must be 20 characters (18 alphanumeric + 2 check digits)",
                ELEMENT, fieldPath));
        }
        if (!LeiCodes.hasValidChecksum(normalized)) {
            return List.of(ValidationError.error(CHECKSUM + suffix,
                prefix + "LEI checksum validation failed - please verify the identifier", ELEMENT, fieldPath));
        }
        return List.of();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
