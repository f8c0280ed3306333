package com.micaixbrl.core.validator;

import com.micaixbrl.core.generator.FactModel;
import com.micaixbrl.core.generator.FactModelBuilder;
import com.micaixbrl.core.generator.MissingEntityIdentifierException;
import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.util.LeiCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs identifier, existence, value and duplicate validation over a record and merges
 * the findings into one {@link ValidationResult}.
 *
 * <p>Duplicate detection builds the same fact model the generators use. When the model
 * cannot be built because the offeror's identifier is unusable, that step is skipped;
 * the identifier findings already report the cause.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationOrchestrator orchestrator = new ValidationOrchestrator();
 * ValidationResult result = orchestrator.validate(data, ValidationOptions.defaults());
 * if (!result.valid()) {
 *     result.errors().forEach(error -> System.err.println(error.ruleId() + ": " + error.message()));
 * }
 * }</pre>
 */
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    private static final int DUPLICATE_ASSERTIONS = 1;

    private final LeiRegistry registry;
    private final FactModelBuilder factModelBuilder;
    private final LeiValidator leiValidator = new LeiValidator();
    private final ExistenceAssertionEngine existenceEngine = new ExistenceAssertionEngine();
    private final ValueAssertionEngine valueEngine = new ValueAssertionEngine();
    private final DuplicateFactDetector duplicateDetector = new DuplicateFactDetector();

    /**
     * Creates an orchestrator without a registry; registry checks are skipped.
     */
    public ValidationOrchestrator() {
        this(null, new FactModelBuilder());
    }

    /**
     * Creates an orchestrator.
     *
     * @param registry identifier registry, may be null
     * @param factModelBuilder builder used for duplicate detection
     */
    public ValidationOrchestrator(LeiRegistry registry, FactModelBuilder factModelBuilder) {
        this.registry = registry;
        this.factModelBuilder = Objects.requireNonNull(factModelBuilder, "factModelBuilder must not be null");
    }

    /**
     * Runs all validation categories.
     *
     * @param data record
     * @param options run options
     * @return merged result
     */
    public ValidationResult validate(WhitepaperData data, ValidationOptions options) {
        Objects.requireNonNull(data, "data must not be null");
        ValidationOptions effective = options != null ? options : ValidationOptions.defaults();
        TokenType tokenType = effective.tokenType() != null ? effective.tokenType() : data.effectiveTokenType();
        log.info("Validating {} white paper", tokenType);

        Map<ValidationCategory, List<ValidationError>> findings = new EnumMap<>(ValidationCategory.class);
        findings.put(ValidationCategory.LEI, filter(validateIdentifiers(data, effective), effective));
        findings.put(ValidationCategory.EXISTENCE, filter(existenceEngine.validate(data, tokenType), effective));
        findings.put(ValidationCategory.VALUE, filter(valueEngine.validate(data, tokenType), effective));
        findings.put(ValidationCategory.DUPLICATE, filter(detectDuplicates(data), effective));

        Map<ValidationCategory, CategoryFindings> byCategory = new EnumMap<>(ValidationCategory.class);
        findings.forEach((category, list) -> byCategory.put(category, CategoryFindings.of(list)));

        Map<ValidationCategory, AssertionCount> counts = new EnumMap<>(ValidationCategory.class);
        counts.put(ValidationCategory.LEI, AssertionCount.of(LeiValidator.ASSERTION_COUNT,
            byCategory.get(ValidationCategory.LEI).errors().size()));
        counts.put(ValidationCategory.EXISTENCE, AssertionCount.of(existenceEngine.assertionsFor(tokenType).size(),
            byCategory.get(ValidationCategory.EXISTENCE).errors().size()));
        counts.put(ValidationCategory.VALUE, AssertionCount.of(valueEngine.assertionsFor(tokenType).size(),
            byCategory.get(ValidationCategory.VALUE).errors().size()));
        counts.put(ValidationCategory.DUPLICATE, AssertionCount.of(DUPLICATE_ASSERTIONS,
            byCategory.get(ValidationCategory.DUPLICATE).errors().isEmpty() ? 0 : 1));

        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();
        for (CategoryFindings categoryFindings : byCategory.values()) {
            errors.addAll(categoryFindings.errors());
            warnings.addAll(categoryFindings.warnings());
        }

        int total = counts.values().stream().mapToInt(AssertionCount::total).sum();
        int passed = counts.values().stream().mapToInt(AssertionCount::passed).sum();
        ValidationSummary summary = new ValidationSummary(total, passed, errors.size(), warnings.size());

        log.info("Validation finished: {} errors, {} warnings", errors.size(), warnings.size());
        return new ValidationResult(errors.isEmpty(), errors, warnings, summary, byCategory, counts);
    }

    /**
     * Checks the offeror's identifier and the required fields only.
     *
     * @param data record
     * @param tokenType token type, or null for the record's own
     * @return ERROR findings of both checks
     */
    public QuickValidationResult quickValidate(WhitepaperData data, TokenType tokenType) {
        Objects.requireNonNull(data, "data must not be null");
        TokenType effective = tokenType != null ? tokenType : data.effectiveTokenType();

        List<ValidationError> errors = new ArrayList<>(
            leiValidator.validate(data.partA() != null ? data.partA().lei() : null));
        existenceEngine.validate(data, effective).stream()
            .filter(ValidationError::isError)
            .forEach(errors::add);
        return new QuickValidationResult(errors.isEmpty(), errors.size(), errors);
    }

    /**
     * Returns the existence and value findings reported against one field path.
     *
     * <p>For {@code partA.lei} the offeror's identifier findings are included.</p>
     *
     * @param data record
     * @param fieldPath dotted record path
     * @param tokenType token type, or null for the record's own
     * @return findings for the path
     */
    public List<ValidationError> validateField(WhitepaperData data, String fieldPath, TokenType tokenType) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        TokenType effective = tokenType != null ? tokenType : data.effectiveTokenType();

        List<ValidationError> findings = new ArrayList<>();
        if (LeiValidator.OFFEROR_PATH.equals(fieldPath)) {
            findings.addAll(leiValidator.validate(data.partA() != null ? data.partA().lei() : null));
        }
        existenceEngine.validate(data, effective).stream()
            .filter(finding -> fieldPath.equals(finding.fieldPath()))
            .forEach(findings::add);
        valueEngine.validate(data, effective).stream()
            .filter(finding -> fieldPath.equals(finding.fieldPath()))
            .forEach(findings::add);
        return findings;
    }

    /**
     * Returns the assertion totals applying to a token type.
     *
     * @param tokenType token type
     * @return requirements summary
     */
    public ValidationRequirements requirements(TokenType tokenType) {
        Objects.requireNonNull(tokenType, "tokenType must not be null");
        ValidationRequirements.AssertionSummary existence = existenceEngine.summary(tokenType);
        ValidationRequirements.AssertionSummary value = valueEngine.summary(tokenType);
        return new ValidationRequirements(existence, value,
            existence.total() + value.total() + LeiValidator.ASSERTION_COUNT + DUPLICATE_ASSERTIONS);
    }

    private List<ValidationError> validateIdentifiers(WhitepaperData data, ValidationOptions options) {
        List<ValidationError> findings = new ArrayList<>(leiValidator.validateAll(data));
        if (!options.checkRegistry()) {
            return findings;
        }
        if (registry == null) {
            log.debug("Registry check requested but no registry configured");
            return findings;
        }
        boolean hasErrors = findings.stream().anyMatch(ValidationError::isError);
        if (hasErrors || data.partA() == null) {
            return findings;
        }
        String lei = LeiCodes.normalize(data.partA().lei());
        RegistryLookupResult lookup = registry.lookup(lei);
        if (!lookup.lookupPerformed()) {
            log.warn("Registry lookup for {} not performed: {}", lei, lookup.error());
        }
        findings.addAll(leiValidator.registryFindings(lookup));
        return findings;
    }

    private List<ValidationError> detectDuplicates(WhitepaperData data) {
        FactModel model;
        try {
            model = factModelBuilder.build(data);
        } catch (MissingEntityIdentifierException e) {
            log.debug("Skipping duplicate detection: {}", e.getMessage());
            return List.of();
        }
        DuplicateDetectionResult result = duplicateDetector.detect(model.allFacts());
        log.debug("Scanned {} facts, {} duplicate groups", result.totalFacts(), result.duplicates().size());
        return duplicateDetector.toValidationErrors(result);
    }

    private static List<ValidationError> filter(List<ValidationError> findings, ValidationOptions options) {
        if (options.skipRules().isEmpty()) {
            return findings;
        }
        return findings.stream().filter(finding -> !options.isSkipped(finding)).toList();
    }
}
