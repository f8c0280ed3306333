package com.micaixbrl.core.taxonomy;

import java.util.ArrayList;
import java.util.List;

import static com.micaixbrl.core.taxonomy.Section.*;

/**
 * Field definitions of the MiCA white paper template for other crypto-assets (Table 2).
 *
 * <p>Ordered by section, then by field number as printed in the template.</p>
 */
final class MicaFieldTable {

    private MicaFieldTable() {
        // Utility class
    }

    static final List<FieldDefinition> FIELDS = build();

    private static List<FieldDefinition> build() {
        List<FieldDefinition> fields = new ArrayList<>();

        // Summary
        fields.add(date(SUMMARY, "01", "Date of notification", "DateOfNotification"));
        fields.add(block(SUMMARY, "02", "Statement in accordance with Article 6(3) of Regulation (EU) 2023/1114",
            "StatementInAccordanceWithArticle63OfRegulationEU20231114"));
        fields.add(block(SUMMARY, "03", "Compliance statement in accordance with Article 6(6) of Regulation (EU) 2023/1114",
            "StatementInAccordanceWithArticle66OfRegulationEU20231114"));
        fields.add(block(SUMMARY, "04", "Statement in accordance with Article 6(5), points (a), (b), (c)",
            "StatementInAccordanceWithArticle65AToCOfRegulationEU20231114"));
        fields.add(block(SUMMARY, "05", "Statement in accordance with Article 6(5), point (d)",
            "StatementInAccordanceWithArticle65DOfRegulationEU20231114"));
        fields.add(block(SUMMARY, "06", "Warning in accordance with Article 6(7), second subparagraph",
            "WarningInAccordanceWithArticle67SecondSubparagraph"));
        fields.add(block(SUMMARY, "07", "Characteristics of the crypto-asset",
            "CharacteristicsOfTheCryptoAssetSummaryExplanatory"));
        fields.add(block(SUMMARY, "08", "Key information about the offer to the public or admission to trading",
            "KeyInformationAboutOfferToPublicOrAdmissionToTradingExplanatory"));

        // Part A: offeror
        fields.add(text(A, "A.1", "Name", "NameOfOtherTokenOfferor"));
        fields.add(text(A, "A.2", "Legal form", "OfferorsLegalForm"));
        fields.add(text(A, "A.3", "Registered address", "OfferorsRegisteredAddress"));
        fields.add(text(A, "A.4", "Head office", "OfferorsHeadOffice"));
        fields.add(date(A, "A.5", "Registration date", "OfferorsRegistrationDate"));
        fields.add(text(A, "A.6", "Legal entity identifier", "OfferorsLegalEntityIdentifier"));
        fields.add(text(A, "A.7", "Another identifier required pursuant to applicable national law",
            "OfferorsOtherIdentifier"));
        fields.add(text(A, "A.8", "Contact telephone number", "OfferorsContactTelephoneNumber"));
        fields.add(text(A, "A.9", "E-mail address", "OfferorsEmailAddress"));
        fields.add(integer(A, "A.10", "Response time (Days)", "OfferorsResponseTimeDays"));
        fields.add(text(A, "A.11", "Parent company", "NameOfOfferorsParentCompany"));
        fields.add(dimensional(A, "A.12a", "Members of the management body: identity",
            "IdentityOfOfferorsManagementBodyMemberForOtherToken"));
        fields.add(dimensional(A, "A.12b", "Members of the management body: business address",
            "BusinessAddressOfOfferorsManagementBodyMemberForOtherToken"));
        fields.add(dimensional(A, "A.12c", "Members of the management body: function",
            "FunctionOfOfferorsManagementBodyMemberForOtherToken"));
        fields.add(block(A, "A.13", "Business activity", "OfferorsBusinessActivityExplanatory"));
        fields.add(block(A, "A.14", "Parent company business activity",
            "OfferorsParentCompanyBusinessActivityExplanatory"));
        fields.add(bool(A, "A.15", "Newly established", "OfferorIsNewlyEstablished"));
        fields.add(block(A, "A.16", "Financial condition for the past three years",
            "OfferorsFinancialConditionForPastThreeYearsExplanatory"));
        fields.add(block(A, "A.17", "Financial condition since registration",
            "OfferorsFinancialConditionSinceRegistrationExplanatory"));
        fields.add(enumeration(A, "A.18", "Registered country", "OfferorsRegisteredCountry"));
        fields.add(enumeration(A, "A.19", "Head office country", "OfferorsHeadOfficeCountry"));
        fields.add(text(A, "A.20", "Website", "OfferorsWebsite"));

        // Part B: issuer
        fields.add(bool(B, "B.1", "Issuer different from offeror or person seeking admission to trading",
            "IssuerDifferentFromOfferrorOrPersonSeekingAdmissionToTrading"));
        fields.add(text(B, "B.2", "Name", "NameOfOtherTokenIssuer"));
        fields.add(text(B, "B.3", "Legal form", "IssuersLegalForm"));
        fields.add(text(B, "B.4", "Registered address", "IssuersRegisteredAddress"));
        fields.add(text(B, "B.5", "Head office", "IssuersHeadOffice"));
        fields.add(date(B, "B.6", "Registration date", "IssuersRegistrationDate"));
        fields.add(text(B, "B.7", "Legal entity identifier", "IssuersLegalEntityIdentifier"));
        fields.add(text(B, "B.8", "Another identifier required pursuant to applicable national law",
            "IssuersOtherIdentifier"));
        fields.add(text(B, "B.9", "Parent company", "NameOfIssuersParentCompany"));
        fields.add(dimensional(B, "B.10a", "Members of the management body: identity",
            "IdentityOfIssuersManagementBodyMemberForOtherToken"));
        fields.add(dimensional(B, "B.10b", "Members of the management body: business address",
            "BusinessAddressOfIssuersManagementBodyMemberForOtherToken"));
        fields.add(dimensional(B, "B.10c", "Members of the management body: function",
            "FunctionOfIssuersManagementBodyMemberForOtherToken"));
        fields.add(block(B, "B.11", "Business activity", "IssuersBusinessActivityExplanatory"));
        fields.add(block(B, "B.12", "Parent company business activity",
            "IssuersParentCompanyBusinessActivityExplanatory"));
        fields.add(enumeration(B, "B.13", "Registered country", "IssuersRegisteredCountry"));
        fields.add(enumeration(B, "B.14", "Head office country", "IssuersHeadOfficeCountry"));

        // Part C: trading platform operator
        fields.add(text(C, "C.1", "Name", "NameOfOtherTokenOperator"));
        fields.add(text(C, "C.2", "Legal form", "OperatorsLegalForm"));
        fields.add(text(C, "C.3", "Registered address", "OperatorsRegisteredAddress"));
        fields.add(text(C, "C.4", "Head office", "OperatorsHeadOffice"));
        fields.add(date(C, "C.5", "Registration date", "OperatorsRegistrationDate"));
        fields.add(text(C, "C.6", "Legal entity identifier", "OperatorsLegalEntityIdentifier"));
        fields.add(text(C, "C.7", "Another identifier required pursuant to applicable national law",
            "OperatorsOtherIdentifier"));
        fields.add(text(C, "C.8", "Parent company", "NameOfOperatorsParentCompany"));
        fields.add(block(C, "C.9", "Reason for crypto-asset white paper preparation",
            "ReasonForCryptoAssetWhitePaperPreparationExplanatory"));
        fields.add(integer(C, "C.10", "Number of units", "NumberOfUnits"));
        fields.add(dimensional(C, "C.11a", "Members of the management body: identity",
            "IdentityOfOperatorsManagementBodyMemberForOtherToken"));
        fields.add(dimensional(C, "C.11b", "Members of the management body: business address",
            "BusinessAddressOfOperatorsManagementBodyMemberForOtherToken"));
        fields.add(dimensional(C, "C.11c", "Members of the management body: function",
            "FunctionOfOperatorsManagementBodyMemberForOtherToken"));
        fields.add(block(C, "C.12", "Business activity", "OperatorsBusinessActivityExplanatory"));
        fields.add(block(C, "C.13", "Parent company business activity",
            "OperatorsParentCompanyBusinessActivityExplanatory"));
        fields.add(enumeration(C, "C.14", "Registered country", "OperatorsRegisteredCountry"));
        fields.add(enumeration(C, "C.15", "Head office country", "OperatorsHeadOfficeCountry"));
        fields.add(dimensional(C, "C.16a", "Persons involved in implementation: name",
            "NameOfPersonInvolvedInImplementationOfOtherToken"));
        fields.add(dimensional(C, "C.16b", "Persons involved in implementation: business address",
            "BusinessAddressOfPersonInvolvedInImplementationOfOtherToken"));
        fields.add(new FieldDefinition(C, "C.16c", "Persons involved in implementation: type",
            qualified("TypeOfPersonInvolvedInImplementationOfOtherToken"), XbrlDataType.ENUMERATION,
            PeriodType.DURATION, false, true, true));

        // Part D: project
        fields.add(text(D, "D.1", "Crypto-asset project name", "NameOfOtherTokenProject"));
        fields.add(text(D, "D.2", "Crypto-assets name", "NameOfOtherToken"));
        fields.add(text(D, "D.3", "Abbreviation", "OtherTokenProjectAbbreviation"));
        fields.add(block(D, "D.4", "Crypto-asset project description", "DescriptionOfOtherTokenProjectExplanatory"));
        fields.add(block(D, "D.5", "Details of all natural or legal persons involved in the implementation",
            "DetailsOfPersonsInvolvedInImplementationOfOtherTokenProjectExplanatory"));
        fields.add(bool(D, "D.6", "Utility token classification", "UtilityTokenClassification"));
        fields.add(block(D, "D.7", "Key features of goods or services for utility token projects",
            "KeyFeaturesOfGoodsOrServicesOfUtilityTokenProjectsExplanatory"));
        fields.add(block(D, "D.8", "Plans for the token", "PlansForTheOtherTokenExplanatory"));
        fields.add(block(D, "D.9", "Resource allocation", "ResourceAllocationForOtherTokenProjectExplanatory"));
        fields.add(block(D, "D.10", "Planned use of collected funds or crypto-assets",
            "PlannedUseOfCollectedFundsOrCryptoAssetsExplanatory"));

        // Part E: offer to the public or admission to trading
        fields.add(enumeration(E, "E.1", "Public offering or admission to trading",
            "PublicOfferingOrAdmissionToTrading"));
        fields.add(block(E, "E.2", "Reasons for public offer or admission to trading",
            "ReasonsForPublicOfferOrAdmissionToTradingExplanatory"));
        fields.add(money(E, "E.3", "Fundraising target", "MinimumSubscriptionGoalsExpressedInCurrency"));
        fields.add(money(E, "E.4", "Maximum subscription goal", "MaximumSubscriptionGoalsExpressedInCurrency"));
        fields.add(bool(E, "E.5", "Oversubscription acceptance", "OversubscriptionAccepted"));
        fields.add(block(E, "E.6", "Oversubscription allocation", "OversubscriptionAllocationExplanatory"));
        fields.add(money(E, "E.7", "Issue price", "IssuePrice"));
        fields.add(enumeration(E, "E.8", "Official currency or other crypto-assets determining the issue price",
            "OfficialCurrencyDeterminingIssuePrice"));
        fields.add(enumeration(E, "E.9", "Targeted holders", "TargetedHoldersForOtherToken"));
        fields.add(money(E, "E.10", "Subscription fee", "SubscriptionFeeExpressedInCurrency"));
        fields.add(block(E, "E.11", "Price determination method", "MethodOfDeterminingPriceExplanatory"));
        fields.add(new FieldDefinition(E, "E.12", "Total number of offered or traded crypto-assets",
            qualified("TotalNumberOfOfferedOrTradedOtherTokens"), XbrlDataType.INTEGER, PeriodType.INSTANT,
            false, false, false));
        fields.add(block(E, "E.13", "Holder restrictions", "DescriptionOfHolderRestrictionsExplanatory"));
        fields.add(block(E, "E.14", "Reimbursement notice", "ReimbursementNoticeExplanatory"));
        fields.add(block(E, "E.15", "Refund mechanism", "RefundMechanismExplanatory"));
        fields.add(block(E, "E.16", "Refund timeline", "RefundTimelineExplanatory"));
        fields.add(block(E, "E.17", "Offer phases", "OfferPhasesExplanatory"));
        fields.add(block(E, "E.18", "Early purchase discount", "EarlyPurchaseDiscountExplanatory"));
        fields.add(bool(E, "E.19", "Time-limited offer", "TimeLimitedOffer"));
        fields.add(date(E, "E.20", "Subscription period beginning", "SubscriptionPeriodBeginning"));
        fields.add(date(E, "E.21", "Subscription period end", "SubscriptionPeriodEnd"));
        fields.add(block(E, "E.22", "Safeguarding arrangements for offered funds or crypto-assets",
            "SafeguardingArrangementsForOfferedFundsExplanatory"));
        fields.add(text(E, "E.23", "Payment methods for crypto-asset purchase", "PaymentMethodsForOtherTokenPurchase"));
        fields.add(block(E, "E.24", "Value transfer methods for reimbursement",
            "ValueTransferMethodsForReimbursementExplanatory"));
        fields.add(block(E, "E.25", "Right of withdrawal", "RighOfWithdrawalExplanatory"));
        fields.add(block(E, "E.26", "Transfer of purchased crypto-assets", "TransferOfPurchasedOtherTokensExplanatory"));
        fields.add(text(E, "E.27", "Planned distribution date", "PlannedDistributionDateOfOtherTokens"));
        fields.add(block(E, "E.28", "Purchaser's technical requirements", "PurchasersTechnicalRequirementsExplanatory"));
        fields.add(text(E, "E.29", "Crypto-asset service provider name", "NameOfCryptoAssetServiceProvider"));
        fields.add(enumeration(E, "E.30", "Placement form", "PlacementFormForOtherToken"));
        fields.add(text(E, "E.31a", "Trading platforms name", "NameOfTradingPlatform"));
        fields.add(block(E, "E.32", "Applicable law", "ApplicableLawExplanatory"));
        fields.add(block(E, "E.33", "Competent court", "CompetentCourtExplanatory"));

        // Part F: crypto-asset
        fields.add(text(F, "F.1", "Crypto-asset type", "OtherTokenType"));
        fields.add(block(F, "F.2", "Crypto-asset functionality", "DescriptionOfOtherTokenCharacteristicsExplanatory"));
        fields.add(block(F, "F.3", "Planned application of functionalities",
            "PlannedApplicationOfFunctionalitiesExplanatory"));
        fields.add(enumeration(F, "F.4", "Type of crypto-asset white paper", "OtherTokenTypeOfWhitePaper"));
        fields.add(enumeration(F, "F.5", "Type of submission", "OtherTokenTypeOfSubmission"));
        fields.add(text(F, "F.6", "Language or languages of the crypto-asset white paper",
            "InformationAboutLanguagesUsedInOtherTokenWhitePaper"));
        fields.add(enumeration(F, "F.7", "Home member state", "OtherTokenHomeMemberState"));
        fields.add(enumeration(F, "F.8", "Host member states", "OtherTokenHostMemberStates"));
        fields.add(block(F, "F.9", "Technical specifications", "TechnicalSpecificationsOfOtherTokenExplanatory"));

        // Part G: rights and obligations
        fields.add(block(G, "G.1", "Purchaser rights and obligations",
            "InformationAboutPurchaserRightsAndObligationsExplanatory"));
        fields.add(block(G, "G.2", "Exercise of rights and obligations", "ExerciseOfRightsAndObligationsExplanatory"));
        fields.add(block(G, "G.3", "Conditions for modifications of rights and obligations",
            "ConditionsForModificationsOfRightsAndObligationsExplanatory"));
        fields.add(block(G, "G.4", "Future public offers", "FuturePublicOffersOfOtherTokenExplanatory"));
        fields.add(integer(G, "G.5", "Issuer retained crypto-assets", "NumberOfOtherTokensRetainedByIssuer"));
        fields.add(block(G, "G.6", "Ownership rights", "OwnershipRightsAttachedToOtherTokenExplanatory"));
        fields.add(block(G, "G.7", "Transfer restrictions", "OtherTokensTransferRestrictionsExplanatory"));
        fields.add(block(G, "G.8", "Lock-up arrangements", "LockUpArrangementsForOtherTokenExplanatory"));
        fields.add(block(G, "G.9", "Supply adjustment mechanisms", "SupplyAdjustmentMechanismsExplanatory"));
        fields.add(bool(G, "G.10", "Value protection schemes", "ProtectionSchemesProtectingValueOfOtherToken"));

        // Part H: underlying technology
        fields.add(block(H, "H.1", "Distributed ledger technology", "DistributedLedgerTechnologyForOtherTokenExplanatory"));
        fields.add(block(H, "H.2", "Protocols and technical standards",
            "ProtocolsAndTechnicalStandardsForOtherTokenExplanatory"));
        fields.add(block(H, "H.3", "Technology used", "TechnologyUsedForOtherTokenExplanatory"));
        fields.add(block(H, "H.4", "Consensus mechanism", "ConsensusMechanismForOtherTokenExplanatory"));
        fields.add(block(H, "H.5", "Incentive mechanisms and applicable fees",
            "IncentiveMechanismsAndApplicableFeesForOtherTokenExplanatory"));
        fields.add(bool(H, "H.6", "Use of distributed ledger technology",
            "UseOfDistributedLedgerTechnologyIndicatorForOtherToken"));
        fields.add(block(H, "H.7", "DLT functionality description",
            "DescriptionOfDistributedLedgerTechnologyFunctionalityExplanatory"));
        fields.add(bool(H, "H.8", "Audit", "AuditIndicatorForOtherToken"));
        fields.add(block(H, "H.9", "Audit outcome", "AuditOutcomeForOtherTokenExplanatory"));

        // Part I: risks
        fields.add(block(I, "I.1", "Offer-related risks", "DescriptionOfOfferRelatedRisksForOtherTokenExplanatory"));
        fields.add(block(I, "I.2", "Issuer-related risks", "DescriptionOfIssuerRelatedRisksForOtherTokenExplanatory"));
        fields.add(block(I, "I.3", "Crypto-assets-related risks", "DescriptionOfOtherTokenRelatedRisksExplanatory"));
        fields.add(block(I, "I.4", "Project implementation-related risks",
            "DescriptionOfProjectImplementationRelatedRisksExplanatory"));
        fields.add(block(I, "I.5", "Technology-related risks",
            "DescriptionOfTechnologyRelatedRisksForOtherTokenExplanatory"));
        fields.add(block(I, "I.6", "Mitigation measures", "DescriptionOfRiskMitigationMeasuresForOtherTokenExplanatory"));

        // Part J: sustainability
        fields.add(block(J, "J.1", "Adverse impacts on climate and other environment-related adverse impacts",
            "InformationOnPrincipalAdverseImpactsOnClimateOfConsensusMechanismExplanatory"));

        // Annex III: sustainability indicators
        fields.add(text(S, "S.1", "Name", "NameOfEntityDisclosingSustainabilityIndicators"));
        fields.add(text(S, "S.2", "Relevant legal entity identifier",
            "LegalEntityIdentifierOfEntityDisclosingSustainabilityIndicators"));
        fields.add(text(S, "S.3", "Name of the crypto-asset", "NameOfCryptoAssetForSustainabilityIndicators"));
        fields.add(block(S, "S.4", "Consensus mechanism", "ConsensusMechanismSustainabilityIndicatorsExplanatory"));
        fields.add(block(S, "S.5", "Incentive mechanisms and applicable fees",
            "IncentiveMechanismsAndFeesSustainabilityIndicatorsExplanatory"));
        fields.add(date(S, "S.6", "Beginning of the period to which the disclosure relates",
            "BeginningOfPeriodToWhichDisclosureRelates"));
        fields.add(date(S, "S.7", "End of the period to which the disclosure relates",
            "EndOfPeriodToWhichDisclosureRelates"));
        fields.add(decimal(S, "S.8", "Energy consumption (kWh per year)", "EnergyConsumption"));
        fields.add(block(S, "S.9", "Energy consumption sources and methodologies",
            "EnergyConsumptionSourcesAndMethodologiesExplanatory"));
        fields.add(percent(S, "S.10", "Renewable energy consumption", "RenewableEnergyConsumptionPercentage"));
        fields.add(decimal(S, "S.11", "Scope 1 and scope 2 GHG emissions (tCO2e per year)",
            "ScopeOneAndTwoGhgEmissions"));

        return List.copyOf(fields);
    }

    private static String qualified(String localName) {
        return MicaTaxonomy.PREFIX + ":" + localName;
    }

    private static FieldDefinition text(Section section, String number, String label, String localName) {
        return plain(section, number, label, localName, XbrlDataType.STRING);
    }

    private static FieldDefinition bool(Section section, String number, String label, String localName) {
        return plain(section, number, label, localName, XbrlDataType.BOOLEAN);
    }

    private static FieldDefinition money(Section section, String number, String label, String localName) {
        return plain(section, number, label, localName, XbrlDataType.MONETARY);
    }

    private static FieldDefinition integer(Section section, String number, String label, String localName) {
        return plain(section, number, label, localName, XbrlDataType.INTEGER);
    }

    private static FieldDefinition decimal(Section section, String number, String label, String localName) {
        return plain(section, number, label, localName, XbrlDataType.DECIMAL);
    }

    private static FieldDefinition percent(Section section, String number, String label, String localName) {
        return plain(section, number, label, localName, XbrlDataType.PERCENT);
    }

    private static FieldDefinition plain(Section section, String number, String label, String localName,
                                         XbrlDataType dataType) {
        return new FieldDefinition(section, number, label, qualified(localName), dataType,
            PeriodType.DURATION, false, false, false);
    }

    private static FieldDefinition date(Section section, String number, String label, String localName) {
        return new FieldDefinition(section, number, label, qualified(localName), XbrlDataType.DATE,
            PeriodType.INSTANT, false, false, false);
    }

    private static FieldDefinition block(Section section, String number, String label, String localName) {
        return new FieldDefinition(section, number, label, qualified(localName), XbrlDataType.TEXT_BLOCK,
            PeriodType.DURATION, true, false, false);
    }

    private static FieldDefinition enumeration(Section section, String number, String label, String localName) {
        return new FieldDefinition(section, number, label, qualified(localName), XbrlDataType.ENUMERATION,
            PeriodType.DURATION, false, true, false);
    }

    private static FieldDefinition dimensional(Section section, String number, String label, String localName) {
        return new FieldDefinition(section, number, label, qualified(localName), XbrlDataType.STRING,
            PeriodType.DURATION, false, false, true);
    }
}
