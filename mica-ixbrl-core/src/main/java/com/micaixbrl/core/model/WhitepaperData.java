package com.micaixbrl.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete crypto-asset white paper record, the single input of generation and validation.
 *
 * <p>Produced upstream (document extraction or manual editing) and never mutated here.
 * Every part may be absent; absence is reported by the existence assertions. Content
 * not captured by the typed parts travels in {@code rawFields}, keyed by taxonomy field
 * number (e.g. {@code "E.10"}).</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * WhitepaperData data = new WhitepaperData(
 *     TokenType.OTHR, "2025-01-15", "en",
 *     EntityInfo.of("Example Labs Ltd", "529900T8BM49AURSDO55", "Valletta, Malta", "MT"),
 *     null, null, project, offering, null, null, null, null, null, null,
 *     ManagementBodies.none(), List.of(), Map.of("E.10", "Not applicable"));
 * }</pre>
 *
 * @param tokenType crypto-asset category
 * @param documentDate document date, ISO {@code yyyy-MM-dd}
 * @param language ISO 639-1 language code of the document
 * @param partA offeror or person seeking admission to trading
 * @param partB issuer, when different from the offeror
 * @param partC trading platform operator, when applicable
 * @param partD project information
 * @param partE offering terms
 * @param partF crypto-asset characteristics
 * @param partG rights and obligations
 * @param partH underlying technology
 * @param partI risks
 * @param partJ sustainability indicators
 * @param managementBodyMembers management body members per entity
 * @param projectPersons persons involved in the project
 * @param rawFields free-text content keyed by taxonomy field number
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhitepaperData(
    TokenType tokenType,
    String documentDate,
    String language,
    EntityInfo partA,
    EntityInfo partB,
    EntityInfo partC,
    ProjectInfo partD,
    OfferingInfo partE,
    CharacteristicsInfo partF,
    RightsInfo partG,
    TechnologyInfo partH,
    RiskInfo partI,
    SustainabilityInfo partJ,
    ManagementBodies managementBodyMembers,
    List<ProjectPerson> projectPersons,
    Map<String, String> rawFields
) {
    /**
     * Compact constructor normalizing collections.
     */
    public WhitepaperData {
        if (managementBodyMembers == null) {
            managementBodyMembers = ManagementBodies.none();
        }
        projectPersons = projectPersons == null ? List.of() : List.copyOf(projectPersons);
        rawFields = rawFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(rawFields));
    }

    /**
     * Returns the effective token type, {@link TokenType#OTHR} when unset.
     *
     * @return token type
     */
    public TokenType effectiveTokenType() {
        return tokenType != null ? tokenType : TokenType.OTHR;
    }

    /**
     * Returns the raw field content for a field number, or null.
     *
     * @param fieldNumber taxonomy field number
     * @return raw content or null
     */
    public String rawField(String fieldNumber) {
        return rawFields.get(fieldNumber);
    }
}
