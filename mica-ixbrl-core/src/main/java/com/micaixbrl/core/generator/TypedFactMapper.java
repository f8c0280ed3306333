package com.micaixbrl.core.generator;

import com.micaixbrl.core.model.CharacteristicsInfo;
import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.OfferingInfo;
import com.micaixbrl.core.model.ProjectInfo;
import com.micaixbrl.core.model.RightsInfo;
import com.micaixbrl.core.model.RiskInfo;
import com.micaixbrl.core.model.SustainabilityInfo;
import com.micaixbrl.core.model.TechnologyInfo;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.EnumerationCatalog;
import com.micaixbrl.core.taxonomy.EnumerationMapping;
import com.micaixbrl.core.taxonomy.XbrlDataType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.micaixbrl.core.taxonomy.MicaTaxonomy.element;

/**
 * First build phase: maps the typed parts of the record onto taxonomy elements.
 */
final class TypedFactMapper {

    static final String WITHDRAWAL_GRANTED = "The purchaser has a right of withdrawal within 14 calendar days.";
    static final String WITHDRAWAL_NONE = "No right of withdrawal.";

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    private final String defaultCurrency;
    private final String defaultLanguage;

    TypedFactMapper(String defaultCurrency, String defaultLanguage) {
        this.defaultCurrency = defaultCurrency;
        this.defaultLanguage = defaultLanguage;
    }

    void map(WhitepaperData data, FactMapWriter writer) {
        mapOfferor(data.partA(), writer);
        mapIssuer(data.partB(), writer);
        mapOperator(data.partC(), writer);
        mapProject(data.partD(), writer);
        mapOffering(data.partE(), writer);
        mapCharacteristics(data.partF(), data.partG(), writer);
        writer.text(element("InformationAboutLanguagesUsedInOtherTokenWhitePaper"),
            isBlank(data.language()) ? defaultLanguage : data.language());
        mapRights(data.partG(), writer);
        mapTechnology(data.partH(), writer);
        mapRisks(data.partI(), writer);
        mapSustainability(data.partJ(), writer);
    }

    private void mapOfferor(EntityInfo offeror, FactMapWriter writer) {
        if (offeror == null) {
            return;
        }
        writer.text(element("NameOfOtherTokenOfferor"), offeror.legalName());
        writer.text(element("OfferorsLegalEntityIdentifier"), trimmed(offeror.lei()));
        writer.text(element("OfferorsRegisteredAddress"), offeror.registeredAddress());
        writer.text(element("OfferorsEmailAddress"), offeror.contactEmail());
        writer.text(element("OfferorsContactTelephoneNumber"), offeror.contactPhone());
        writer.text(element("OfferorsWebsite"), offeror.website());
        mapCountry(element("OfferorsRegisteredCountry"), offeror, writer);
    }

    private void mapIssuer(EntityInfo issuer, FactMapWriter writer) {
        if (issuer == null) {
            return;
        }
        writer.text(element("IssuerDifferentFromOfferrorOrPersonSeekingAdmissionToTrading"), "true");
        writer.text(element("NameOfOtherTokenIssuer"), issuer.legalName());
        writer.text(element("IssuersLegalEntityIdentifier"), trimmed(issuer.lei()));
        writer.text(element("IssuersRegisteredAddress"), issuer.registeredAddress());
        mapCountry(element("IssuersRegisteredCountry"), issuer, writer);
    }

    private void mapOperator(EntityInfo operator, FactMapWriter writer) {
        if (operator == null) {
            return;
        }
        writer.text(element("NameOfOtherTokenOperator"), operator.legalName());
        writer.text(element("OperatorsLegalEntityIdentifier"), trimmed(operator.lei()));
        writer.text(element("OperatorsRegisteredAddress"), operator.registeredAddress());
        mapCountry(element("OperatorsRegisteredCountry"), operator, writer);
    }

    /**
     * Country enumeration: table key or label, then a member state named in the country
     * value or the registered address, else the country as plain text.
     */
    private void mapCountry(String element, EntityInfo entity, FactMapWriter writer) {
        Optional<EnumerationMapping> resolved = EnumerationCatalog.resolve(element, entity.country())
            .or(() -> CountryCodeExtractor.extract(entity.country()))
            .or(() -> CountryCodeExtractor.extract(entity.registeredAddress()));
        if (resolved.isPresent()) {
            writer.enumeration(element, resolved.get());
        } else {
            writer.text(element, entity.country());
        }
    }

    private void mapProject(ProjectInfo project, FactMapWriter writer) {
        if (project == null) {
            return;
        }
        writer.text(element("NameOfOtherTokenProject"), project.cryptoAssetName());
        writer.text(element("NameOfOtherToken"), project.cryptoAssetName());
        writer.text(element("OtherTokenProjectAbbreviation"), project.cryptoAssetSymbol());
        writer.text(element("DescriptionOfOtherTokenProjectExplanatory"), project.projectDescription());
        writer.text(element("OtherTokenType"), project.tokenStandard());
        writer.text(element("ConsensusMechanismForOtherTokenExplanatory"), project.consensusMechanism());
        if (project.totalSupply() != null) {
            writer.numeric(element("TotalNumberOfOfferedOrTradedOtherTokens"),
                project.totalSupply().setScale(0, RoundingMode.HALF_UP).toPlainString(), Units.PURE, 0);
        }
    }

    private void mapOffering(OfferingInfo offering, FactMapWriter writer) {
        if (offering == null) {
            return;
        }
        if (offering.isPublicOffering() != null) {
            String key = offering.isPublicOffering() ? "publicOffering" : "admissionToTrading";
            EnumerationCatalog.lookup(element("PublicOfferingOrAdmissionToTrading"), key)
                .ifPresent(mapping -> writer.enumeration(element("PublicOfferingOrAdmissionToTrading"), mapping));
        }
        writer.text(element("SubscriptionPeriodBeginning"), offering.publicOfferingStartDate());
        writer.text(element("SubscriptionPeriodEnd"), offering.publicOfferingEndDate());

        String currency = isBlank(offering.tokenPriceCurrency())
            ? defaultCurrency
            : offering.tokenPriceCurrency().trim().toUpperCase(Locale.ROOT);
        if (offering.tokenPrice() != null) {
            monetary(writer, element("IssuePrice"), offering.tokenPrice(), currency, 2);
            String currencyElement = element("OfficialCurrencyDeterminingIssuePrice");
            EnumerationCatalog.resolve(currencyElement, currency)
                .ifPresent(mapping -> writer.enumeration(currencyElement, mapping));
        }
        if (offering.maxSubscriptionGoal() != null) {
            monetary(writer, element("MaximumSubscriptionGoalsExpressedInCurrency"),
                offering.maxSubscriptionGoal(), currency, 0);
        }
        if (offering.withdrawalRights() != null) {
            writer.text(element("RighOfWithdrawalExplanatory"),
                offering.withdrawalRights() ? WITHDRAWAL_GRANTED : WITHDRAWAL_NONE);
        }
        if (!offering.paymentMethods().isEmpty()) {
            writer.text(element("PaymentMethodsForOtherTokenPurchase"), String.join(", ", offering.paymentMethods()));
        }
        writer.text(element("PlannedDistributionDateOfOtherTokens"), offering.distributionDate());
    }

    private void mapCharacteristics(CharacteristicsInfo characteristics, RightsInfo rights, FactMapWriter writer) {
        if (characteristics == null) {
            return;
        }
        writer.text(element("DescriptionOfOtherTokenCharacteristicsExplanatory"), characteristics.classification());
        writer.text(element("TechnicalSpecificationsOfOtherTokenExplanatory"), characteristics.technicalSpecifications());
        if (rights == null || isBlank(rights.purchaseRights())) {
            writer.text(element("InformationAboutPurchaserRightsAndObligationsExplanatory"),
                characteristics.rightsDescription());
        }
    }

    private void mapRights(RightsInfo rights, FactMapWriter writer) {
        if (rights == null) {
            return;
        }
        writer.text(element("InformationAboutPurchaserRightsAndObligationsExplanatory"), rights.purchaseRights());
        writer.text(element("OwnershipRightsAttachedToOtherTokenExplanatory"), rights.ownershipRights());
        writer.text(element("OtherTokensTransferRestrictionsExplanatory"), rights.transferRestrictions());
        writer.text(element("LockUpArrangementsForOtherTokenExplanatory"), rights.lockUpPeriod());
        writer.text(element("SupplyAdjustmentMechanismsExplanatory"), rights.dynamicSupplyMechanism());
    }

    private void mapTechnology(TechnologyInfo technology, FactMapWriter writer) {
        writer.text(element("UseOfDistributedLedgerTechnologyIndicatorForOtherToken"), "true");
        if (technology == null) {
            return;
        }
        writer.text(element("DistributedLedgerTechnologyForOtherTokenExplanatory"), technology.blockchainDescription());
        writer.text(element("ProtocolsAndTechnicalStandardsForOtherTokenExplanatory"), technology.smartContractInfo());
        writer.text(element("TechnologyUsedForOtherTokenExplanatory"), technology.technicalCapacity());
        if (!technology.securityAudits().isEmpty()) {
            writer.text(element("AuditIndicatorForOtherToken"), "true");
            writer.text(element("AuditOutcomeForOtherTokenExplanatory"), String.join("; ", technology.securityAudits()));
        }
    }

    private void mapRisks(RiskInfo risks, FactMapWriter writer) {
        if (risks == null) {
            return;
        }
        writer.text(element("DescriptionOfOfferRelatedRisksForOtherTokenExplanatory"), paragraphs(risks.offerRisks()));
        writer.text(element("DescriptionOfIssuerRelatedRisksForOtherTokenExplanatory"), paragraphs(risks.issuerRisks()));
        writer.text(element("DescriptionOfOtherTokenRelatedRisksExplanatory"), paragraphs(risks.marketRisks()));
        writer.text(element("DescriptionOfTechnologyRelatedRisksForOtherTokenExplanatory"),
            paragraphs(risks.technologyRisks()));
        writer.text(element("DescriptionOfProjectImplementationRelatedRisksExplanatory"),
            paragraphs(risks.regulatoryRisks()));
    }

    private void mapSustainability(SustainabilityInfo sustainability, FactMapWriter writer) {
        if (sustainability == null) {
            return;
        }
        writer.text(element("InformationOnPrincipalAdverseImpactsOnClimateOfConsensusMechanismExplanatory"),
            sustainability.consensusMechanismType());
        writer.text(element("ConsensusMechanismSustainabilityIndicatorsExplanatory"),
            sustainability.consensusMechanismType());
        if (sustainability.energyConsumption() != null) {
            BigDecimal kwh = toKilowattHours(sustainability.energyConsumption(), sustainability.energyUnit());
            writer.numeric(element("EnergyConsumption"), kwh.setScale(0, RoundingMode.HALF_UP).toPlainString(),
                Units.KWH, 0);
        }
        if (sustainability.renewableEnergyPercentage() != null) {
            writer.numeric(element("RenewableEnergyConsumptionPercentage"),
                sustainability.renewableEnergyPercentage().toPlainString(), Units.PURE, 2);
        }
        if (sustainability.ghgEmissions() != null) {
            writer.numeric(element("ScopeOneAndTwoGhgEmissions"), sustainability.ghgEmissions().toPlainString(),
                Units.TONNES_CO2E, 2);
        }
    }

    private static BigDecimal toKilowattHours(BigDecimal value, String unit) {
        if (unit == null) {
            return value;
        }
        return switch (unit.trim().toLowerCase(Locale.ROOT)) {
            case "mwh" -> value.multiply(THOUSAND);
            case "gwh" -> value.multiply(MILLION);
            default -> value;
        };
    }

    private static void monetary(FactMapWriter writer, String element, BigDecimal amount, String currency, int decimals) {
        Optional<String> unit = Units.unitFor(XbrlDataType.MONETARY, element, currency);
        if (unit.isPresent()) {
            writer.numeric(element, amount.toPlainString(), unit.get(), decimals);
        } else {
            writer.text(element, amount.toPlainString() + " " + currency);
        }
    }

    private static String paragraphs(List<String> items) {
        return items.stream()
            .filter(item -> !isBlank(item))
            .collect(Collectors.joining("\n\n"));
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
