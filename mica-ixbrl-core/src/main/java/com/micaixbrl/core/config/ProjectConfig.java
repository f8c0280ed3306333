package com.micaixbrl.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.micaixbrl.core.generator.GeneratorConfig;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration, loaded from {@code mica-ixbrl.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * generator:
 *   default: xhtml
 *   continuationThreshold: 5000
 *   defaultCurrency: EUR
 *   defaultLanguage: en
 *
 * registry:
 *   enabled: false
 *   baseUrl: "https://api.gleif.org/api/v1"
 *   timeoutSeconds: 5
 *   apiKeyEnv: LEI_API_KEY
 *
 * validation:
 *   skipRules:
 *     - EXS-OTHR-002
 *   failOnWarnings: false
 *
 * output:
 *   directory: "./output"
 * }</pre>
 *
 * <p>Missing sections fall back to their defaults.</p>
 *
 * @param generator generator settings
 * @param registry identifier registry settings
 * @param validation validation settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("registry") RegistrySettings registry,
    @JsonProperty("validation") ValidationSettings validation,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ProjectConfig {
        generator = generator != null ? generator : GeneratorSettings.defaults();
        registry = registry != null ? registry : RegistrySettings.defaults();
        validation = validation != null ? validation : ValidationSettings.defaults();
        output = output != null ? output : OutputSettings.defaults();
    }

    /**
     * Creates the default configuration: XHTML output, registry lookups off.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null);
    }

    /**
     * Converts the generator section into the settings passed to generators.
     *
     * @return generator configuration
     */
    public GeneratorConfig toGeneratorConfig() {
        return new GeneratorConfig(
            generator.continuationThreshold(),
            generator.defaultCurrency(),
            generator.defaultLanguage());
    }

    /**
     * Generator settings.
     *
     * @param defaultGenerator generator id used when none is requested
     * @param continuationThreshold maximum characters of a text-block fragment
     * @param defaultCurrency currency of monetary facts without one
     * @param defaultLanguage document language when the record has none
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("default") String defaultGenerator,
        @JsonProperty("continuationThreshold") Integer continuationThreshold,
        @JsonProperty("defaultCurrency") String defaultCurrency,
        @JsonProperty("defaultLanguage") String defaultLanguage
    ) {
        public GeneratorSettings {
            defaultGenerator = defaultGenerator != null ? defaultGenerator : "xhtml";
            continuationThreshold = continuationThreshold != null
                ? continuationThreshold
                : GeneratorConfig.DEFAULT_CONTINUATION_THRESHOLD;
            defaultCurrency = defaultCurrency != null ? defaultCurrency : "EUR";
            defaultLanguage = defaultLanguage != null ? defaultLanguage : "en";
        }

        public static GeneratorSettings defaults() {
            return new GeneratorSettings(null, null, null, null);
        }
    }

    /**
     * Identifier registry settings.
     *
     * @param enabled whether validation looks identifiers up by default
     * @param baseUrl registry API base URL
     * @param timeoutSeconds request timeout in seconds
     * @param apiKeyEnv environment variable holding the API key
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegistrySettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("apiKeyEnv") String apiKeyEnv
    ) {
        public RegistrySettings {
            enabled = enabled != null ? enabled : Boolean.FALSE;
            baseUrl = baseUrl != null ? baseUrl : "https://api.gleif.org/api/v1";
            timeoutSeconds = timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : 5;
            apiKeyEnv = apiKeyEnv != null ? apiKeyEnv : "LEI_API_KEY";
        }

        public static RegistrySettings defaults() {
            return new RegistrySettings(null, null, null, null);
        }

        @JsonIgnore
        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    /**
     * Validation settings.
     *
     * @param skipRules rule ids whose findings are dropped
     * @param failOnWarnings whether warnings make the CLI exit with failure
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("skipRules") List<String> skipRules,
        @JsonProperty("failOnWarnings") Boolean failOnWarnings
    ) {
        public ValidationSettings {
            skipRules = skipRules == null ? List.of() : List.copyOf(skipRules);
            failOnWarnings = failOnWarnings != null ? failOnWarnings : Boolean.FALSE;
        }

        public static ValidationSettings defaults() {
            return new ValidationSettings(null, null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory generated documents are written to
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory
    ) {
        public OutputSettings {
            directory = directory != null ? directory : "./output";
        }

        public static OutputSettings defaults() {
            return new OutputSettings(null);
        }
    }
}
