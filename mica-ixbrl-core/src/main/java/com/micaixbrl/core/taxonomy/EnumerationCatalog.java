package com.micaixbrl.core.taxonomy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Enumeration tables of the MiCA taxonomy, indexed by the element they apply to.
 *
 * <p>Enumeration facts report a member URI rather than text. Records may hold either the
 * value key ({@code "MT"}) or the label ({@code "Malta"}); both resolve to the same member.</p>
 */
public final class EnumerationCatalog {

    private EnumerationCatalog() {
        // Utility class
    }

    /** Offer to the public or admission to trading. */
    public static final Map<String, EnumerationMapping> PUBLIC_OFFERING = table(
        entry("publicOffering", "Public offering", "OfferToThePublic"),
        entry("admissionToTrading", "Admission to trading", "AdmissionToTrading"),
        entry("both", "Both public offering and admission to trading", "OfferToThePublicAndAdmissionToTrading")
    );

    /** Official currency determining the issue price. */
    public static final Map<String, EnumerationMapping> CURRENCY = table(
        entry("EUR", "Euro (EUR)", "EUR"),
        entry("USD", "US Dollar (USD)", "USD"),
        entry("GBP", "British Pound (GBP)", "GBP"),
        entry("CHF", "Swiss Franc (CHF)", "CHF")
    );

    public static final Map<String, EnumerationMapping> TARGETED_HOLDERS = table(
        entry("allInvestors", "All types of investors", "AllTypesOfInvestors"),
        entry("retailInvestors", "Retail investors", "RetailInvestors"),
        entry("qualifiedInvestors", "Qualified investors", "QualifiedInvestors")
    );

    public static final Map<String, EnumerationMapping> PLACEMENT_FORM = table(
        entry("direct", "Direct placement", "DirectPlacement"),
        entry("throughCASP", "Through CASP", "ThroughCASP")
    );

    public static final Map<String, EnumerationMapping> WHITE_PAPER_TYPE = table(
        entry("initial", "Initial white paper", "InitialWhitePaper"),
        entry("modified", "Modified white paper", "ModifiedWhitePaper")
    );

    public static final Map<String, EnumerationMapping> SUBMISSION_TYPE = table(
        entry("notification", "Notification", "Notification"),
        entry("application", "Application for admission to trading", "ApplicationForAdmissionToTrading")
    );

    /** EU member states, keyed by ISO 3166-1 alpha-2 code. */
    public static final Map<String, EnumerationMapping> MEMBER_STATE = table(
        entry("AT", "Austria", "AT"), entry("BE", "Belgium", "BE"), entry("BG", "Bulgaria", "BG"),
        entry("HR", "Croatia", "HR"), entry("CY", "Cyprus", "CY"), entry("CZ", "Czechia", "CZ"),
        entry("DK", "Denmark", "DK"), entry("EE", "Estonia", "EE"), entry("FI", "Finland", "FI"),
        entry("FR", "France", "FR"), entry("DE", "Germany", "DE"), entry("GR", "Greece", "GR"),
        entry("HU", "Hungary", "HU"), entry("IE", "Ireland", "IE"), entry("IT", "Italy", "IT"),
        entry("LV", "Latvia", "LV"), entry("LT", "Lithuania", "LT"), entry("LU", "Luxembourg", "LU"),
        entry("MT", "Malta", "MT"), entry("NL", "Netherlands", "NL"), entry("PL", "Poland", "PL"),
        entry("PT", "Portugal", "PT"), entry("RO", "Romania", "RO"), entry("SK", "Slovakia", "SK"),
        entry("SI", "Slovenia", "SI"), entry("ES", "Spain", "ES"), entry("SE", "Sweden", "SE")
    );

    public static final Map<String, EnumerationMapping> PERSON_TYPE = table(
        entry("advisor", "Advisor", "Advisor"),
        entry("auditor", "Auditor", "Auditor"),
        entry("otherPerson", "Other person", "OtherPerson")
    );

    public static final Map<String, EnumerationMapping> COMPETENT_AUTHORITY = table(
        entry("ecb", "European Central Bank", "ECB"),
        entry("nca", "National Competent Authority", "NCA")
    );

    private static final Map<String, Map<String, EnumerationMapping>> BY_ELEMENT = Map.ofEntries(
        Map.entry(MicaTaxonomy.element("PublicOfferingOrAdmissionToTrading"), PUBLIC_OFFERING),
        Map.entry(MicaTaxonomy.element("OfficialCurrencyDeterminingIssuePrice"), CURRENCY),
        Map.entry(MicaTaxonomy.element("RedemptionCurrency"), CURRENCY),
        Map.entry(MicaTaxonomy.element("TargetedHoldersForOtherToken"), TARGETED_HOLDERS),
        Map.entry(MicaTaxonomy.element("PlacementFormForOtherToken"), PLACEMENT_FORM),
        Map.entry(MicaTaxonomy.element("OtherTokenTypeOfWhitePaper"), WHITE_PAPER_TYPE),
        Map.entry(MicaTaxonomy.element("OtherTokenTypeOfSubmission"), SUBMISSION_TYPE),
        Map.entry(MicaTaxonomy.element("OtherTokenHomeMemberState"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("OtherTokenHostMemberStates"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("OfferorsRegisteredCountry"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("OfferorsHeadOfficeCountry"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("IssuersRegisteredCountry"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("IssuersHeadOfficeCountry"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("OperatorsRegisteredCountry"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("OperatorsHeadOfficeCountry"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("TypeOfPersonInvolvedInImplementationOfOtherToken"), PERSON_TYPE),
        Map.entry(MicaTaxonomy.element("DomicileOfCompanyOfPersonInvolvedInImplementationOfOtherToken"), MEMBER_STATE),
        Map.entry(MicaTaxonomy.element("CompetentAuthorityForCreditInstitutions"), COMPETENT_AUTHORITY)
    );

    /**
     * Returns the enumeration table of an element.
     *
     * @param element qualified element name
     * @return table keyed by value key, or empty when the element is not enumerated
     */
    public static Optional<Map<String, EnumerationMapping>> tableFor(String element) {
        return Optional.ofNullable(BY_ELEMENT.get(element));
    }

    /**
     * Returns all enumerated element names.
     *
     * @return element names
     */
    public static Set<String> elements() {
        return BY_ELEMENT.keySet();
    }

    /**
     * Whether an element's members are EU member states.
     *
     * @param element qualified element name
     * @return true for country-like enumerations
     */
    public static boolean isCountryEnumeration(String element) {
        return BY_ELEMENT.get(element) == MEMBER_STATE;
    }

    public static Optional<EnumerationMapping> lookup(String element, String key) {
        if (key == null) {
            return Optional.empty();
        }
        return tableFor(element).map(table -> table.get(key));
    }

    public static Optional<String> uriOf(String element, String key) {
        return lookup(element, key).map(EnumerationMapping::taxonomyUri);
    }

    public static Optional<String> labelOf(String element, String key) {
        return lookup(element, key).map(EnumerationMapping::label);
    }

    /**
     * Finds the value key whose label matches, ignoring case.
     *
     * @param element qualified element name
     * @param label human-readable label
     * @return value key, or empty
     */
    public static Optional<String> findKey(String element, String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        return tableFor(element).flatMap(table -> table.values().stream()
            .filter(mapping -> mapping.label().toLowerCase(Locale.ROOT).equals(wanted))
            .map(EnumerationMapping::key)
            .findFirst());
    }

    /**
     * Resolves a record value to an enumeration member by exact key, key ignoring case,
     * or label ignoring case.
     *
     * @param element qualified element name
     * @param value record value
     * @return resolved member, or empty
     */
    public static Optional<EnumerationMapping> resolve(String element, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Map<String, EnumerationMapping> table = BY_ELEMENT.get(element);
        if (table == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        EnumerationMapping exact = table.get(trimmed);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (EnumerationMapping mapping : table.values()) {
            if (mapping.key().equalsIgnoreCase(trimmed) || mapping.label().equalsIgnoreCase(trimmed)) {
                return Optional.of(mapping);
            }
        }
        return Optional.empty();
    }

    @SafeVarargs
    private static Map<String, EnumerationMapping> table(Map.Entry<String, EnumerationMapping>... entries) {
        Map<String, EnumerationMapping> table = new LinkedHashMap<>();
        for (Map.Entry<String, EnumerationMapping> entry : entries) {
            table.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(table);
    }

    private static Map.Entry<String, EnumerationMapping> entry(String key, String label, String member) {
        return Map.entry(key, new EnumerationMapping(key, label, MicaTaxonomy.NAMESPACE + "#" + member));
    }
}
