package com.micaixbrl.core.generator;

import com.micaixbrl.core.WhitepaperFixtures;
import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.ManagementBodies;
import com.micaixbrl.core.model.OfferingInfo;
import com.micaixbrl.core.model.ProjectInfo;
import com.micaixbrl.core.model.SustainabilityInfo;
import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.Section;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FactModelBuilder}.
 */
class FactModelBuilderTest {

    private FactModelBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new FactModelBuilder(WhitepaperFixtures.FIXED_CLOCK, GeneratorConfig.defaults());
    }

    @Test
    void build_totalSupply_isIntegerOnInstantContext() {
        FactModel model = builder.build(WhitepaperFixtures.complete());

        FactValue supply = model.fact("mica:TotalNumberOfOfferedOrTradedOtherTokens").orElseThrow();
        assertThat(supply.value()).isEqualTo("1000000");
        assertThat(supply.unitRef()).isEqualTo(Units.PURE);
        assertThat(supply.decimals()).isZero();
        assertThat(supply.contextRef()).isEqualTo(ContextBuilder.INSTANT);
    }

    @Test
    void build_issuePrice_usesCurrencyUnitAndEnumeration() {
        FactModel model = builder.build(WhitepaperFixtures.complete());

        FactValue price = model.fact("mica:IssuePrice").orElseThrow();
        assertThat(price.value()).isEqualTo("0.10");
        assertThat(price.unitRef()).isEqualTo("unit_EUR");
        assertThat(price.decimals()).isEqualTo(2);
        assertThat(price.contextRef()).isEqualTo(ContextBuilder.DURATION);

        FactValue currency = model.fact("mica:OfficialCurrencyDeterminingIssuePrice").orElseThrow();
        assertThat(currency.isEnumerationMember()).isTrue();
        assertThat(currency.taxonomyUri()).endsWith("#EUR");
    }

    @Test
    void build_subscriptionGoal_hasZeroDecimals() {
        FactValue goal = builder.build(WhitepaperFixtures.complete())
            .fact("mica:MaximumSubscriptionGoalsExpressedInCurrency").orElseThrow();

        assertThat(goal.value()).isEqualTo("5000000");
        assertThat(goal.decimals()).isZero();
    }

    @Test
    void build_subscriptionDates_useInstantContext() {
        FactModel model = builder.build(WhitepaperFixtures.complete());

        assertThat(model.fact("mica:SubscriptionPeriodBeginning"))
            .hasValueSatisfying(value -> assertThat(value.contextRef()).isEqualTo(ContextBuilder.INSTANT));
    }

    @Test
    void build_offerorCountryCode_becomesMemberStateEnumeration() {
        FactValue country = builder.build(WhitepaperFixtures.complete())
            .fact("mica:OfferorsRegisteredCountry").orElseThrow();

        assertThat(country.value()).isEqualTo("MT");
        assertThat(country.displayValue()).isEqualTo("Malta");
        assertThat(country.reportedValue()).endsWith("#MT");
    }

    @Test
    void build_unknownCountryWithAddress_fallsBackToAddress() {
        WhitepaperData data = WhitepaperFixtures.withEntities(
            EntityInfo.of("Issuer AG", WhitepaperFixtures.ISSUER_LEI, "Ringstrasse 5, Vienna, Austria", "Österreich"),
            null);

        FactValue country = builder.build(data).fact("mica:IssuersRegisteredCountry").orElseThrow();

        assertThat(country.value()).isEqualTo("AT");
    }

    @Test
    void build_unresolvableCountry_keptAsText() {
        WhitepaperData data = WhitepaperFixtures.withEntities(
            EntityInfo.of("Issuer Inc", WhitepaperFixtures.ISSUER_LEI, "1 Main Street, New York", "United States"),
            null);

        FactValue country = builder.build(data).fact("mica:IssuersRegisteredCountry").orElseThrow();

        assertThat(country.isEnumerationMember()).isFalse();
        assertThat(country.value()).isEqualTo("United States");
    }

    @Test
    void build_sustainabilityFigures_useDedicatedUnits() {
        FactModel model = builder.build(WhitepaperFixtures.complete());

        assertThat(model.fact("mica:EnergyConsumption")).hasValueSatisfying(value -> {
            assertThat(value.value()).isEqualTo("1200");
            assertThat(value.unitRef()).isEqualTo(Units.KWH);
            assertThat(value.decimals()).isZero();
        });
        assertThat(model.fact("mica:RenewableEnergyConsumptionPercentage")).hasValueSatisfying(value -> {
            assertThat(value.unitRef()).isEqualTo(Units.PURE);
            assertThat(value.decimals()).isEqualTo(2);
        });
        assertThat(model.fact("mica:ScopeOneAndTwoGhgEmissions")).hasValueSatisfying(value ->
            assertThat(value.unitRef()).isEqualTo(Units.TONNES_CO2E));
    }

    @Test
    void build_energyInMegawattHours_convertedToKilowattHours() {
        WhitepaperData base = WhitepaperFixtures.complete();
        WhitepaperData data = new WhitepaperData(base.tokenType(), base.documentDate(), base.language(),
            base.partA(), null, null, base.partD(), base.partE(), null, null, null, null,
            new SustainabilityInfo(new BigDecimal("1.5"), "MWh", null, null, null),
            null, null, null);

        assertThat(builder.build(data).fact("mica:EnergyConsumption"))
            .hasValueSatisfying(value -> assertThat(value.value()).isEqualTo("1500"));
    }

    @Test
    void build_referencedUnitsOnly() {
        FactModel model = builder.build(WhitepaperFixtures.complete());

        assertThat(model.units()).extracting(XbrlUnit::id)
            .containsExactlyInAnyOrder("unit_pure", "unit_EUR", "unit_kWh", "unit_tCO2e")
            .doesNotContain("unit_USD");
    }

    @Test
    void build_rawNumericWithoutNumber_keptAsNarrative() {
        FactValue fee = builder.build(WhitepaperFixtures.complete())
            .fact("mica:SubscriptionFeeExpressedInCurrency").orElseThrow();

        assertThat(fee.value()).isEqualTo("Not applicable");
        assertThat(fee.unitRef()).isNull();
        assertThat(fee.decimals()).isNull();
    }

    @Test
    void build_rawNumericWithNumber_extractsTokenAndCurrency() {
        WhitepaperData data = WhitepaperFixtures.withRawFields(Map.of("E.10", "A fee of $25 per subscription"));

        FactValue fee = builder.build(data).fact("mica:SubscriptionFeeExpressedInCurrency").orElseThrow();

        assertThat(fee.value()).isEqualTo("25");
        assertThat(fee.unitRef()).isEqualTo("unit_USD");
        assertThat(fee.decimals()).isEqualTo(2);
    }

    @Test
    void build_rawFieldNeverOverwritesTypedValue() {
        WhitepaperData data = WhitepaperFixtures.withRawFields(Map.of("D.2", "Some Other Name"));

        assertThat(builder.build(data).fact("mica:NameOfOtherToken"))
            .hasValueSatisfying(value -> assertThat(value.value()).isEqualTo("Example Token"));
    }

    @Test
    void build_rawBooleanAndEnumeration_normalized() {
        WhitepaperData data = WhitepaperFixtures.withRawFields(Map.of(
            "E.5", "Yes",
            "E.9", "Retail investors"));

        FactModel model = builder.build(data);

        assertThat(model.fact("mica:OversubscriptionAccepted"))
            .hasValueSatisfying(value -> assertThat(value.value()).isEqualTo("true"));
        assertThat(model.fact("mica:TargetedHoldersForOtherToken"))
            .hasValueSatisfying(value -> assertThat(value.taxonomyUri()).endsWith("#RetailInvestors"));
    }

    @Test
    void build_letteredFieldWithoutOwnedParent_fallsBackToParentNumber() {
        WhitepaperData data = WhitepaperFixtures.withRawFields(Map.of("E.31", "Example Exchange"));

        assertThat(builder.build(data).fact("mica:NameOfTradingPlatform"))
            .hasValueSatisfying(value -> assertThat(value.value()).isEqualTo("Example Exchange"));
    }

    @Test
    void build_invalidDocumentDate_usesClock() {
        WhitepaperData data = new WhitepaperData(TokenType.OTHR, "15/01/2025", null,
            EntityInfo.of("Example Labs Ltd", WhitepaperFixtures.OFFEROR_LEI, "Valletta, Malta", "MT"),
            null, null, new ProjectInfo("Example Token", "EXT", null, null, null, null, null),
            null, null, null, null, null, null, ManagementBodies.none(), List.of(), Map.of());

        FactModel model = builder.build(data);

        assertThat(model.documentDate()).isEqualTo(LocalDate.of(2024, 6, 30));
        assertThat(model.language()).isEqualTo("en");
    }

    @Test
    void build_dimensionalBlocks_placedInSections() {
        FactModel model = builder.build(WhitepaperFixtures.complete());

        assertThat(model.dimensionalBlocks()).extracting(DimensionalBlock::section)
            .containsExactly(Section.A, Section.C);
        DimensionalBlock persons = model.dimensionalBlocks().get(1);
        assertThat(persons.rows()).hasSize(1);
        assertThat(persons.rows().get(0).functionOrType().taxonomyUri()).endsWith("#Advisor");
    }

    @Test
    void allFacts_managementMembers_distinctContexts() {
        List<Fact> facts = builder.build(WhitepaperFixtures.complete()).allFacts();

        assertThat(facts)
            .filteredOn(fact -> fact.name().equals("mica:IdentityOfOfferorsManagementBodyMemberForOtherToken"))
            .extracting(Fact::contextRef)
            .containsExactly("ctx_mgmt_offeror_0", "ctx_mgmt_offeror_1");
    }

    @Test
    void referencedContexts_excludeUnusedContexts() {
        FactModel model = builder.build(WhitepaperFixtures.minimal());

        assertThat(model.referencedContexts()).extracting(XbrlContext::id)
            .containsExactlyInAnyOrder(ContextBuilder.DURATION);
    }

    @Test
    void build_issuePriceInOtherIsoCurrency_declaresThatCurrencyUnit() {
        FactModel model = builder.build(withPriceCurrency("jpy"));

        FactValue price = model.fact("mica:IssuePrice").orElseThrow();
        assertThat(price.unitRef()).isEqualTo("unit_JPY");
        assertThat(model.units()).contains(new XbrlUnit("unit_JPY", "iso4217:JPY"))
            .extracting(XbrlUnit::id).doesNotContain("unit_EUR");
    }

    @Test
    void build_issuePriceInNonIsoCurrency_keptAsText() {
        FactModel model = builder.build(withPriceCurrency("BTC"));

        FactValue price = model.fact("mica:IssuePrice").orElseThrow();
        assertThat(price.value()).isEqualTo("0.10 BTC");
        assertThat(price.unitRef()).isNull();
        assertThat(price.decimals()).isNull();
        assertThat(model.fact("mica:MaximumSubscriptionGoalsExpressedInCurrency"))
            .hasValueSatisfying(goal -> assertThat(goal.value()).isEqualTo("5000000 BTC"));
    }

    private static WhitepaperData withPriceCurrency(String currency) {
        WhitepaperData base = WhitepaperFixtures.complete();
        OfferingInfo offering = base.partE();
        OfferingInfo priced = new OfferingInfo(offering.isPublicOffering(), offering.publicOfferingStartDate(),
            offering.publicOfferingEndDate(), offering.tokenPrice(), currency, offering.maxSubscriptionGoal(),
            offering.distributionDate(), offering.withdrawalRights(), offering.paymentMethods());
        return new WhitepaperData(base.tokenType(), base.documentDate(), base.language(), base.partA(),
            base.partB(), base.partC(), base.partD(), priced, base.partF(), base.partG(), base.partH(),
            base.partI(), base.partJ(), base.managementBodyMembers(), base.projectPersons(), base.rawFields());
    }
}
