package com.micaixbrl.core.generator;

import com.micaixbrl.core.WhitepaperFixtures;
import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.EntityRole;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.MicaTaxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ContextBuilder}.
 */
class ContextBuilderTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 15);

    private ContextBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ContextBuilder();
    }

    @Test
    void build_completeRecord_createsPrimaryAndDimensionalContexts() {
        List<XbrlContext> contexts = builder.build(WhitepaperFixtures.complete(), DATE);

        assertThat(contexts).extracting(XbrlContext::id).containsExactly(
            "ctx_instant", "ctx_duration", "ctx_mgmt_offeror_0", "ctx_mgmt_offeror_1", "ctx_person_involved_0");
    }

    @Test
    void build_primaryContexts_useDocumentDateAndCalendarYear() {
        List<XbrlContext> contexts = builder.build(WhitepaperFixtures.minimal(), DATE);

        XbrlContext instant = contexts.get(0);
        assertThat(instant.period().isInstant()).isTrue();
        assertThat(instant.period().instant()).isEqualTo(DATE);
        assertThat(instant.identifier()).isEqualTo(WhitepaperFixtures.OFFEROR_LEI);
        assertThat(instant.scheme()).isEqualTo(MicaTaxonomy.LEI_SCHEME);
        assertThat(instant.typedMember()).isEmpty();

        XbrlContext duration = contexts.get(1);
        assertThat(duration.period().startDate()).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(duration.period().endDate()).isEqualTo(LocalDate.of(2025, 12, 31));
    }

    @Test
    void build_managementMember_carriesTypedDimension() {
        List<XbrlContext> contexts = builder.build(WhitepaperFixtures.complete(), DATE);

        XbrlContext second = contexts.stream()
            .filter(context -> context.id().equals("ctx_mgmt_offeror_1"))
            .findFirst()
            .orElseThrow();
        assertThat(second.typedMember()).hasValueSatisfying(member -> {
            assertThat(member.dimension()).isEqualTo("mica:OfferorManagementBodyMemberDimension");
            assertThat(member.value()).isEqualTo("member_1");
        });
        assertThat(second.period().isInstant()).isFalse();
    }

    @Test
    void build_personInvolved_carriesPersonDimension() {
        List<XbrlContext> contexts = builder.build(WhitepaperFixtures.complete(), DATE);

        assertThat(contexts.get(4).typedMember()).hasValueSatisfying(member -> {
            assertThat(member.dimension()).isEqualTo("mica:PersonInvolvedInImplementationDimension");
            assertThat(member.value()).isEqualTo("person_0");
        });
    }

    @Test
    void build_distinctIssuerAndOperator_addsEntityContexts() {
        WhitepaperData data = WhitepaperFixtures.withEntities(
            EntityInfo.of("Issuer SA", WhitepaperFixtures.ISSUER_LEI, "Paris, France", "FR"),
            EntityInfo.of("Exchange BV", WhitepaperFixtures.OPERATOR_LEI, "Amsterdam, Netherlands", "NL"));

        List<XbrlContext> contexts = builder.build(data, DATE);

        assertThat(contexts).extracting(XbrlContext::id).contains("ctx_issuer", "ctx_operator");
        XbrlContext issuer = contexts.stream().filter(context -> context.id().equals("ctx_issuer")).findFirst().orElseThrow();
        assertThat(issuer.identifier()).isEqualTo(WhitepaperFixtures.OFFEROR_LEI);
        assertThat(issuer.typedMember()).hasValueSatisfying(member -> {
            assertThat(member.dimension()).isEqualTo("mica:IssuerDimension");
            assertThat(member.value()).isEqualTo(WhitepaperFixtures.ISSUER_LEI);
        });
    }

    @Test
    void build_issuerSharingOfferorLei_noIssuerContext() {
        WhitepaperData data = WhitepaperFixtures.withEntities(
            EntityInfo.of("Example Labs Ltd", WhitepaperFixtures.OFFEROR_LEI.toLowerCase(), "Valletta", "MT"),
            null);

        assertThat(builder.build(data, DATE)).extracting(XbrlContext::id).doesNotContain("ctx_issuer");
    }

    @Test
    void build_operatorSharingIssuerLei_onlyIssuerContext() {
        WhitepaperData data = WhitepaperFixtures.withEntities(
            EntityInfo.of("Issuer SA", WhitepaperFixtures.ISSUER_LEI, "Paris", "FR"),
            EntityInfo.of("Exchange SA", WhitepaperFixtures.ISSUER_LEI, "Paris", "FR"));

        assertThat(builder.build(data, DATE)).extracting(XbrlContext::id)
            .contains("ctx_issuer")
            .doesNotContain("ctx_operator");
    }

    @Test
    void build_notApplicableOperatorLei_noOperatorContext() {
        WhitepaperData data = WhitepaperFixtures.withEntities(null,
            EntityInfo.of("Exchange BV", "Not applicable", "Amsterdam", "NL"));

        assertThat(builder.build(data, DATE)).extracting(XbrlContext::id).doesNotContain("ctx_operator");
    }

    @Test
    void build_missingLei_throws() {
        WhitepaperData data = WhitepaperFixtures.withOfferorLei(null);

        assertThatThrownBy(() -> builder.build(data, DATE))
            .isInstanceOf(MissingEntityIdentifierException.class)
            .hasMessageContaining("LEI is required");
    }

    @Test
    void build_malformedLei_throws() {
        WhitepaperData data = WhitepaperFixtures.withOfferorLei("NOT-AN-LEI");

        assertThatThrownBy(() -> builder.build(data, DATE))
            .isInstanceOf(MissingEntityIdentifierException.class)
            .hasMessageContaining("NOT-AN-LEI");
    }

    @Test
    void contextIds_followNamingScheme() {
        assertThat(ContextBuilder.managementContextId(EntityRole.ISSUER, 2))
            .isEqualTo("ctx_mgmt_issuer_2");
        assertThat(ContextBuilder.personContextId(0)).isEqualTo("ctx_person_involved_0");
        assertThat(ContextBuilder.entityContextId(EntityRole.OPERATOR))
            .isEqualTo("ctx_operator");
    }
}
