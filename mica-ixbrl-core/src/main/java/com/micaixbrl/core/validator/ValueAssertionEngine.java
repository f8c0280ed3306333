package com.micaixbrl.core.validator;

import com.micaixbrl.core.model.EntityInfo;
import com.micaixbrl.core.model.OfferingInfo;
import com.micaixbrl.core.model.ProjectInfo;
import com.micaixbrl.core.model.SustainabilityInfo;
import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.Languages;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Format and cross-field rules.
 *
 * <p>A rule only inspects values that are present; absence is the existence engine's job.</p>
 */
public class ValueAssertionEngine {

    private static final Set<TokenType> ALL = EnumSet.allOf(TokenType.class);

    private static final Pattern COUNTRY = Pattern.compile("^[A-Z]{2}$");
    private static final Pattern URL = Pattern.compile("^https?://.+", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern LANGUAGE = Pattern.compile("^[a-z]{2}$");

    private static final String SAME_ISSUER_MESSAGE =
        "If issuer is the same as offeror, issuer section may be omitted";

    private static final List<ValueAssertion> ASSERTIONS = List.of(
        error("VAL-001", "Offering end date after start date", "partE.publicOfferingEndDate",
            ValueAssertionEngine::checkOfferingPeriod),
        error("VAL-002", "Positive total supply", "partD.totalSupply",
            data -> positive(project(data).map(ProjectInfo::totalSupply),
                "Total supply must be a positive number")),
        error("VAL-003", "Positive token price", "partE.tokenPrice",
            data -> positive(offering(data).map(OfferingInfo::tokenPrice),
                "Token price must be a positive number")),
        error("VAL-004", "Positive subscription goal", "partE.maxSubscriptionGoal",
            data -> positive(offering(data).map(OfferingInfo::maxSubscriptionGoal),
                "Maximum subscription goal must be a positive number")),
        error("VAL-005", "Renewable energy percentage within 0..100", "partJ.renewableEnergyPercentage",
            ValueAssertionEngine::checkRenewableShare),
        error("VAL-006", "Country is an ISO 3166-1 alpha-2 code", "partA.country",
            data -> offeror(data).map(EntityInfo::country).filter(ValueAssertionEngine::hasText)
                .filter(country -> !COUNTRY.matcher(country).matches())
                .map(country -> "Country must be a 2-letter ISO 3166-1 alpha-2 code (e.g., MT, DE, FR)")),
        warning("VAL-007", "Website is an http(s) URL", "partA.website",
            data -> offeror(data).map(EntityInfo::website).filter(ValueAssertionEngine::hasText)
                .filter(website -> !URL.matcher(website).matches())
                .map(website -> "Website should be a valid URL starting with http:// or https://")),
        warning("VAL-008", "Contact email is an email address", "partA.contactEmail",
            data -> offeror(data).map(EntityInfo::contactEmail).filter(ValueAssertionEngine::hasText)
                .filter(email -> !EMAIL.matcher(email).matches())
                .map(email -> "Contact email should be a valid email address")),
        error("VAL-009", "Document date is an ISO date", "documentDate",
            data -> Optional.ofNullable(data.documentDate()).filter(ValueAssertionEngine::hasText)
                .filter(date -> !ISO_DATE.matcher(date).matches())
                .map(date -> "Document date must be in YYYY-MM-DD format")),
        error("VAL-010", "Language is an ISO 639-1 code", "language",
            data -> Optional.ofNullable(data.language()).filter(ValueAssertionEngine::hasText)
                .filter(language -> !LANGUAGE.matcher(language).matches())
                .map(language -> "Language must be a 2-letter ISO 639-1 code (e.g., en, de, fr)")),
        warning("VAL-014", "Language is an EU official language", "language",
            data -> Optional.ofNullable(data.language())
                .filter(language -> LANGUAGE.matcher(language).matches())
                .filter(language -> !Languages.isSupported(language))
                .map(language -> "Language '" + language + "' is not a supported EU official language. Supported: "
                    + String.join(", ", Languages.SUPPORTED))),
        warning("VAL-011", "Public offering states a price or goal", "partE",
            data -> offering(data)
                .filter(offering -> Boolean.TRUE.equals(offering.isPublicOffering()))
                .filter(offering -> isNullOrZero(offering.tokenPrice())
                    && isNullOrZero(offering.maxSubscriptionGoal()))
                .map(offering -> "Public offering should include token price or subscription goal")),
        warning("VAL-012", "Token symbol is uppercase", "partD.cryptoAssetSymbol",
            data -> project(data).map(ProjectInfo::cryptoAssetSymbol).filter(ValueAssertionEngine::hasText)
                .filter(symbol -> !symbol.equals(symbol.toUpperCase(Locale.ROOT)))
                .map(symbol -> "Token symbol should be uppercase (e.g., BTC, ETH)")),
        error("VAL-013", "Energy consumption is not negative", "partJ.energyConsumption",
            data -> sustainability(data).map(SustainabilityInfo::energyConsumption)
                .filter(energy -> energy.signum() < 0)
                .map(energy -> "Energy consumption cannot be negative")),
        new ValueAssertion("VAL-ART-001", "Issuer differs from offeror", "partB.lei",
            EnumSet.of(TokenType.ART), ValidationSeverity.WARNING, ValueAssertionEngine::checkSameIssuer),
        new ValueAssertion("VAL-EMT-001", "Issuer differs from offeror", "partB.lei",
            EnumSet.of(TokenType.EMT), ValidationSeverity.WARNING, ValueAssertionEngine::checkSameIssuer)
    );

    public List<ValueAssertion> assertionsFor(TokenType tokenType) {
        Objects.requireNonNull(tokenType, "tokenType must not be null");
        return ASSERTIONS.stream().filter(assertion -> assertion.appliesTo(tokenType)).toList();
    }

    /**
     * Evaluates all applicable rules.
     *
     * @param data record
     * @param tokenType token type selecting the rules
     * @return one finding per violated rule, in rule order
     */
    public List<ValidationError> validate(WhitepaperData data, TokenType tokenType) {
        Objects.requireNonNull(data, "data must not be null");
        return assertionsFor(tokenType).stream()
            .map(assertion -> assertion.evaluate(data))
            .flatMap(Optional::stream)
            .toList();
    }

    public ValidationRequirements.AssertionSummary summary(TokenType tokenType) {
        List<ValueAssertion> applicable = assertionsFor(tokenType);
        int required = (int) applicable.stream()
            .filter(assertion -> assertion.severity() == ValidationSeverity.ERROR)
            .count();
        return new ValidationRequirements.AssertionSummary(
            applicable.size(), required, applicable.size() - required, null);
    }

    private static Optional<String> checkOfferingPeriod(WhitepaperData data) {
        Optional<OfferingInfo> offering = offering(data);
        if (offering.isEmpty()) {
            return Optional.empty();
        }
        LocalDate start = parseDate(offering.get().publicOfferingStartDate());
        LocalDate end = parseDate(offering.get().publicOfferingEndDate());
        if (start == null || end == null || end.isAfter(start)) {
            return Optional.empty();
        }
        return Optional.of("Public offering end date must be after start date");
    }

    private static Optional<String> checkRenewableShare(WhitepaperData data) {
        return sustainability(data).map(SustainabilityInfo::renewableEnergyPercentage)
            .filter(share -> share.signum() < 0 || share.compareTo(BigDecimal.valueOf(100)) > 0)
            .map(share -> "Renewable energy percentage must be between 0 and 100");
    }

    private static Optional<String> checkSameIssuer(WhitepaperData data) {
        String issuerLei = data.partB() != null ? data.partB().lei() : null;
        String offerorLei = data.partA() != null ? data.partA().lei() : null;
        if (hasText(issuerLei) && issuerLei.equals(offerorLei)) {
            return Optional.of(SAME_ISSUER_MESSAGE);
        }
        return Optional.empty();
    }

    private static Optional<String> positive(Optional<BigDecimal> value, String message) {
        return value.filter(number -> number.signum() <= 0).map(number -> message);
    }

    private static boolean isNullOrZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    private static LocalDate parseDate(String value) {
        if (!hasText(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static Optional<EntityInfo> offeror(WhitepaperData data) {
        return Optional.ofNullable(data.partA());
    }

    private static Optional<ProjectInfo> project(WhitepaperData data) {
        return Optional.ofNullable(data.partD());
    }

    private static Optional<OfferingInfo> offering(WhitepaperData data) {
        return Optional.ofNullable(data.partE());
    }

    private static Optional<SustainabilityInfo> sustainability(WhitepaperData data) {
        return Optional.ofNullable(data.partJ());
    }

    private static ValueAssertion error(
            String id, String description, String fieldPath, Function<WhitepaperData, Optional<String>> check) {
        return new ValueAssertion(id, description, fieldPath, ALL, ValidationSeverity.ERROR, check);
    }

    private static ValueAssertion warning(
            String id, String description, String fieldPath, Function<WhitepaperData, Optional<String>> check) {
        return new ValueAssertion(id, description, fieldPath, ALL, ValidationSeverity.WARNING, check);
    }
}
