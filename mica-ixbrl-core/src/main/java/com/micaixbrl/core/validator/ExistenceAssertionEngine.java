package com.micaixbrl.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.FieldCatalog;
import com.micaixbrl.core.taxonomy.FieldDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks required and recommended fields per token type.
 *
 * <p>Rules run in catalog order: common rules, sustainability rules, then rules specific
 * to the token type.</p>
 */
public class ExistenceAssertionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExistenceAssertionEngine.class);

    private static final Set<TokenType> ALL = EnumSet.allOf(TokenType.class);
    private static final Set<TokenType> OTHR = EnumSet.of(TokenType.OTHR);
    private static final Set<TokenType> ART = EnumSet.of(TokenType.ART);
    private static final Set<TokenType> EMT = EnumSet.of(TokenType.EMT);

    private static final List<ExistenceAssertion> ASSERTIONS = List.of(
        required("EXS-A-001", "Offeror legal name is required", "partA.legalName", "A.1", ALL),
        required("EXS-A-002", "Offeror LEI is required", "partA.lei", "A.6", ALL),
        required("EXS-A-003", "Offeror registered address is required", "partA.registeredAddress", "A.3", ALL),
        required("EXS-A-004", "Offeror country is required", "partA.country", "A.18", ALL),
        recommended("EXS-A-005", "Offeror website is recommended", "partA.website", "A.20", ALL),
        recommended("EXS-A-006", "Offeror contact email is recommended", "partA.contactEmail", "A.9", ALL),
        required("EXS-D-001", "Crypto-asset name is required", "partD.cryptoAssetName", "D.2", ALL),
        required("EXS-D-002", "Crypto-asset symbol is required", "partD.cryptoAssetSymbol", "D.3", ALL),
        recommended("EXS-D-003", "Total supply should be provided", "partD.totalSupply", "E.12", ALL),
        required("EXS-D-004", "Project description is required", "partD.projectDescription", "D.4", ALL),
        required("EXS-E-001", "Public offering status must be specified", "partE.isPublicOffering", "E.1", ALL),
        new ExistenceAssertion("EXS-E-002", "Public offering start date required if public offering",
            "partE.publicOfferingStartDate", "E.20", ALL, ValidationSeverity.ERROR,
            "partE.isPublicOffering", Boolean.TRUE),
        required("EXS-H-001", "Blockchain description is required", "partH.blockchainDescription", "H.1", ALL),
        recommended("EXS-J-001", "Energy consumption should be disclosed", "partJ.energyConsumption", "S.8", ALL),
        recommended("EXS-J-002", "Consensus mechanism type should be specified for sustainability",
            "partJ.consensusMechanismType", "S.4", ALL),
        recommended("EXS-OTHR-001", "Token standard should be specified", "partD.tokenStandard", "F.1", OTHR),
        recommended("EXS-OTHR-002", "Blockchain network should be specified", "partD.blockchainNetwork", null, OTHR),
        recommended("EXS-OTHR-003", "Consensus mechanism should be documented", "partD.consensusMechanism", "H.4", OTHR),
        required("EXS-ART-001", "Issuer information required for ART", "partB.legalName", "B.2", ART),
        required("EXS-ART-002", "Issuer LEI required for ART", "partB.lei", "B.7", ART),
        required("EXS-ART-003", "Reserve asset information required for ART", "partG.ownershipRights", "G.6", ART),
        required("EXS-EMT-001", "Issuer information required for EMT", "partB.legalName", "B.2", EMT),
        required("EXS-EMT-002", "Issuer LEI required for EMT", "partB.lei", "B.7", EMT)
    );

    /**
     * Returns the assertions applying to a token type, in execution order.
     *
     * @param tokenType token type
     * @return applicable assertions
     */
    public List<ExistenceAssertion> assertionsFor(TokenType tokenType) {
        Objects.requireNonNull(tokenType, "tokenType must not be null");
        return ASSERTIONS.stream().filter(assertion -> assertion.appliesTo(tokenType)).toList();
    }

    /**
     * Evaluates all applicable assertions.
     *
     * @param data record
     * @param tokenType token type selecting the rules
     * @return one finding per unmet assertion
     */
    public List<ValidationError> validate(WhitepaperData data, TokenType tokenType) {
        Objects.requireNonNull(data, "data must not be null");
        FieldPathResolver resolver = new FieldPathResolver(data);

        List<ValidationError> findings = new ArrayList<>();
        for (ExistenceAssertion assertion : assertionsFor(tokenType)) {
            if (!preconditionHolds(assertion, resolver)) {
                log.debug("Skipping {}: precondition on {} not met", assertion.id(), assertion.conditionPath());
                continue;
            }
            if (resolver.isPresent(assertion.fieldPath()) || resolver.hasRawField(assertion.fieldNumber())) {
                continue;
            }
            findings.add(new ValidationError(assertion.id(), assertion.severity(), assertion.message(),
                elementOf(assertion), assertion.fieldPath()));
        }
        return findings;
    }

    /**
     * Summarizes the assertions applying to a token type.
     *
     * @param tokenType token type
     * @return totals by severity and by record part
     */
    public ValidationRequirements.AssertionSummary summary(TokenType tokenType) {
        List<ExistenceAssertion> applicable = assertionsFor(tokenType);
        Map<String, Integer> byPart = new LinkedHashMap<>();
        for (ExistenceAssertion assertion : applicable) {
            byPart.merge(assertion.part(), 1, Integer::sum);
        }
        int required = (int) applicable.stream()
            .filter(assertion -> assertion.severity() == ValidationSeverity.ERROR)
            .count();
        return new ValidationRequirements.AssertionSummary(
            applicable.size(), required, applicable.size() - required, byPart);
    }

    private static boolean preconditionHolds(ExistenceAssertion assertion, FieldPathResolver resolver) {
        if (assertion.conditionPath() == null) {
            return true;
        }
        JsonNode condition = resolver.resolve(assertion.conditionPath());
        if (assertion.conditionValue() == null) {
            return FieldPathResolver.isPresent(condition);
        }
        return condition.isBoolean() && condition.booleanValue() == assertion.conditionValue();
    }

    private static String elementOf(ExistenceAssertion assertion) {
        if (assertion.fieldNumber() == null) {
            return null;
        }
        return FieldCatalog.byNumber(assertion.fieldNumber()).map(FieldDefinition::element).orElse(null);
    }

    private static ExistenceAssertion required(
            String id, String message, String fieldPath, String fieldNumber, Set<TokenType> tokenTypes) {
        return new ExistenceAssertion(id, message, fieldPath, fieldNumber, tokenTypes,
            ValidationSeverity.ERROR, null, null);
    }

    private static ExistenceAssertion recommended(
            String id, String message, String fieldPath, String fieldNumber, Set<TokenType> tokenTypes) {
        return new ExistenceAssertion(id, message, fieldPath, fieldNumber, tokenTypes,
            ValidationSeverity.WARNING, null, null);
    }
}
