package com.micaixbrl.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.micaixbrl.core.config.ConfigLoader;
import com.micaixbrl.core.config.ProjectConfig;
import com.micaixbrl.core.generator.FactModelBuilder;
import com.micaixbrl.core.io.WhitepaperReader;
import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.validator.GleifRegistryClient;
import com.micaixbrl.core.validator.LeiRegistry;
import com.micaixbrl.core.validator.ValidationError;
import com.micaixbrl.core.validator.ValidationOptions;
import com.micaixbrl.core.validator.ValidationOrchestrator;
import com.micaixbrl.core.validator.ValidationResult;
import com.micaixbrl.core.validator.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to validate a white paper record.
 *
 * <p>Exits with 1 when the record has errors, or warnings while {@code failOnWarnings}
 * is configured.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * mica-ixbrl validate whitepaper.json
 * mica-ixbrl validate whitepaper.json --check-registry --skip-rule EXS-OTHR-002
 * mica-ixbrl validate whitepaper.json --token-type ART --json
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate a white paper record",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "White paper record (JSON or YAML)")
    private Path input;

    @Option(names = "--check-registry", description = "Look the offeror's LEI up in the GLEIF registry")
    private boolean checkRegistry;

    @Option(names = "--token-type", description = "Token type overriding the record's: ${COMPLETION-CANDIDATES}")
    private TokenType tokenType;

    @Option(names = "--skip-rule", description = "Rule id to ignore, repeatable")
    private List<String> skipRules = new ArrayList<>();

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            ProjectConfig config = ConfigLoader.load(configFile);
            WhitepaperData data = WhitepaperReader.read(input);

            boolean registryEnabled = checkRegistry || config.registry().enabled();
            Set<String> skipped = new LinkedHashSet<>(config.validation().skipRules());
            skipped.addAll(skipRules);

            ValidationOrchestrator orchestrator = new ValidationOrchestrator(
                registryEnabled ? createRegistry(config.registry()) : null,
                new FactModelBuilder(Clock.systemDefaultZone(), config.toGeneratorConfig()));
            ValidationResult result = orchestrator.validate(
                data, new ValidationOptions(registryEnabled, skipped, tokenType));

            if (json) {
                printJson(result, out);
            } else {
                printReport(result, out);
            }

            boolean failed = !result.valid()
                || (config.validation().failOnWarnings() && !result.warnings().isEmpty());
            return failed ? 1 : 0;

        } catch (UncheckedIOException e) {
            log.error("Validation failed", e);
            err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private static LeiRegistry createRegistry(ProjectConfig.RegistrySettings settings) {
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(settings.timeout()).build();
        return new GleifRegistryClient(httpClient, settings.baseUrl(), settings.timeout(),
            System.getenv(settings.apiKeyEnv()));
    }

    private void printReport(ValidationResult result, PrintWriter out) {
        out.println("Validating: " + input);
        out.println();
        for (ValidationError error : result.errors()) {
            out.println("✗ " + describe(error));
        }
        for (ValidationError warning : result.warnings()) {
            out.println("⚠ " + describe(warning));
        }
        if (!result.errors().isEmpty() || !result.warnings().isEmpty()) {
            out.println();
        }

        ValidationSummary summary = result.summary();
        out.println("Validation Summary:");
        out.println("  Assertions:  " + summary.totalAssertions());
        out.println("  Passed:      " + summary.passed());
        out.println("  Errors:      " + summary.errors());
        out.println("  Warnings:    " + summary.warnings());
        out.println();
        out.println(result.valid() ? "✓ Record is valid" : "✗ Record is invalid");
    }

    private static String describe(ValidationError finding) {
        String location = finding.fieldPath() != null ? " [" + finding.fieldPath() + "]" : "";
        return finding.ruleId() + location + " " + finding.message();
    }

    private static void printJson(ValidationResult result, PrintWriter out) {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            out.println(mapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize validation result", e);
        }
    }
}
