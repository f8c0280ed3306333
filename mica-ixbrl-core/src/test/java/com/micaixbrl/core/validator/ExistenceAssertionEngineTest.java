package com.micaixbrl.core.validator;

import com.micaixbrl.core.WhitepaperFixtures;
import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.OfferingInfo;
import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.model.WhitepaperData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExistenceAssertionEngine}.
 */
class ExistenceAssertionEngineTest {

    private ExistenceAssertionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ExistenceAssertionEngine();
    }

    @Test
    void assertionsFor_countsPerTokenType() {
        assertThat(engine.assertionsFor(TokenType.OTHR)).hasSize(18);
        assertThat(engine.assertionsFor(TokenType.ART)).hasSize(18);
        assertThat(engine.assertionsFor(TokenType.EMT)).hasSize(17);
    }

    @Test
    void validate_completeRecord_noFindings() {
        assertThat(engine.validate(WhitepaperFixtures.complete(), TokenType.OTHR)).isEmpty();
    }

    @Test
    void validate_minimalRecord_reportsMissingRequiredAndRecommended() {
        List<ValidationError> findings = engine.validate(WhitepaperFixtures.minimal(), TokenType.OTHR);

        assertThat(findings).extracting(ValidationError::ruleId).containsExactly(
            "EXS-A-005", "EXS-A-006", "EXS-D-003", "EXS-D-004", "EXS-E-001", "EXS-H-001",
            "EXS-J-001", "EXS-J-002", "EXS-OTHR-001", "EXS-OTHR-002", "EXS-OTHR-003");
        assertThat(findings).filteredOn(ValidationError::isError).extracting(ValidationError::ruleId)
            .containsExactly("EXS-D-004", "EXS-E-001", "EXS-H-001");
    }

    @Test
    void validate_findingCarriesElementAndPath() {
        List<ValidationError> findings = engine.validate(WhitepaperFixtures.minimal(), TokenType.OTHR);

        ValidationError description = findings.stream()
            .filter(finding -> finding.ruleId().equals("EXS-D-004"))
            .findFirst()
            .orElseThrow();
        assertThat(description.fieldPath()).isEqualTo("partD.projectDescription");
        assertThat(description.element()).isEqualTo("mica:DescriptionOfOtherTokenProjectExplanatory");
        assertThat(description.message()).isEqualTo("Project description is required");
    }

    @Test
    void validate_rawFieldSatisfiesAssertion() {
        WhitepaperData base = WhitepaperFixtures.minimal();
        WhitepaperData data = new WhitepaperData(base.tokenType(), base.documentDate(), base.language(),
            base.partA(), null, null, base.partD(), null, null, null, null, null, null, null, null,
            Map.of("D.4", "A data marketplace token."));

        assertThat(engine.validate(data, TokenType.OTHR))
            .extracting(ValidationError::ruleId)
            .doesNotContain("EXS-D-004");
    }

    @Test
    void validate_blankStringCountsAsMissing() {
        WhitepaperData data = WhitepaperFixtures.withOfferorLei("   ");

        assertThat(engine.validate(data, TokenType.OTHR))
            .extracting(ValidationError::ruleId)
            .containsExactly("EXS-A-002");
    }

    @Test
    void validate_startDateRequiredOnlyForPublicOffering() {
        WhitepaperData base = WhitepaperFixtures.complete();
        OfferingInfo publicWithoutStart = new OfferingInfo(true, null, null, null, null, null, null, null, null);
        OfferingInfo admissionOnly = new OfferingInfo(false, null, null, null, null, null, null, null, null);

        assertThat(engine.validate(withOffering(base, publicWithoutStart), TokenType.OTHR))
            .extracting(ValidationError::ruleId).contains("EXS-E-002");
        assertThat(engine.validate(withOffering(base, admissionOnly), TokenType.OTHR))
            .extracting(ValidationError::ruleId).doesNotContain("EXS-E-002", "EXS-E-001");
    }

    @Test
    void validate_artWithoutIssuer_reportsIssuerAndReserveAssets() {
        WhitepaperData base = WhitepaperFixtures.complete();
        WhitepaperData data = new WhitepaperData(TokenType.ART, base.documentDate(), base.language(), base.partA(),
            null, null, base.partD(), base.partE(), base.partF(), null, base.partH(), base.partI(), base.partJ(),
            base.managementBodyMembers(), base.projectPersons(), Map.of());

        assertThat(engine.validate(data, TokenType.ART))
            .extracting(ValidationError::ruleId)
            .containsExactly("EXS-ART-001", "EXS-ART-002", "EXS-ART-003");
    }

    @Test
    void validate_emtWithIssuer_noTokenSpecificFindings() {
        WhitepaperData data = WhitepaperFixtures.withEntities(
            EntityInfo.of("E-Money Institution SA", WhitepaperFixtures.ISSUER_LEI, "Luxembourg", "LU"), null);

        assertThat(engine.validate(data, TokenType.EMT)).isEmpty();
    }

    @Test
    void summary_splitsRequiredAndRecommendedPerPart() {
        ValidationRequirements.AssertionSummary summary = engine.summary(TokenType.OTHR);

        assertThat(summary.total()).isEqualTo(18);
        assertThat(summary.required()).isEqualTo(10);
        assertThat(summary.recommended()).isEqualTo(8);
        assertThat(summary.byPart())
            .containsEntry("partA", 6)
            .containsEntry("partD", 7)
            .containsEntry("partE", 2)
            .containsEntry("partH", 1)
            .containsEntry("partJ", 2);
    }

    private static WhitepaperData withOffering(WhitepaperData base, OfferingInfo offering) {
        return new WhitepaperData(base.tokenType(), base.documentDate(), base.language(), base.partA(), base.partB(),
            base.partC(), base.partD(), offering, base.partF(), base.partG(), base.partH(), base.partI(),
            base.partJ(), base.managementBodyMembers(), base.projectPersons(), base.rawFields());
    }
}
