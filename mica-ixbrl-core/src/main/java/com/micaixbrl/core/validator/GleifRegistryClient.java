package com.micaixbrl.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link LeiRegistry} backed by the GLEIF public API.
 *
 * <p>Issues {@code GET {baseUrl}/lei-records/{lei}} with the JSON:API media type and an
 * optional bearer token. A 404 means the identifier is unknown. Any other non-200 status,
 * timeout, I/O failure or unusable base URL yields a "not performed" result and is logged at WARN.</p>
 */
public class GleifRegistryClient implements LeiRegistry {

    private static final Logger log = LoggerFactory.getLogger(GleifRegistryClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.gleif.org/api/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final String API_KEY_ENV = "LEI_API_KEY";

    private static final String MEDIA_TYPE = "application/vnd.api+json";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String baseUrl;
    private final Duration timeout;
    private final String apiKey;

    /**
     * Creates a client against the public endpoint, reading the API key from {@code LEI_API_KEY}.
     */
    public GleifRegistryClient() {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(),
            DEFAULT_BASE_URL, DEFAULT_TIMEOUT, System.getenv(API_KEY_ENV));
    }

    /**
     * Creates a client.
     *
     * @param httpClient HTTP client
     * @param baseUrl API base URL without trailing slash
     * @param timeout request timeout
     * @param apiKey bearer token, may be null
     */
    public GleifRegistryClient(HttpClient httpClient, String baseUrl, Duration timeout, String apiKey) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        this.apiKey = apiKey;
    }

    @Override
    public RegistryLookupResult lookup(String lei) {
        Objects.requireNonNull(lei, "lei must not be null");
        try {
            HttpResponse<String> response = httpClient.send(request(lei), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                log.debug("LEI {} not found in registry", lei);
                return RegistryLookupResult.notFound();
            }
            if (response.statusCode() != 200) {
                log.warn("Registry lookup for {} returned HTTP {}", lei, response.statusCode());
                return RegistryLookupResult.notPerformed("HTTP " + response.statusCode());
            }
            return parse(response.body());
        } catch (IllegalArgumentException e) {
            log.warn("Registry lookup for {} not attempted, invalid endpoint {}: {}", lei, baseUrl, e.getMessage());
            return RegistryLookupResult.notPerformed("invalid registry URL: " + e.getMessage());
        } catch (IOException e) {
            log.warn("Registry lookup for {} failed: {}", lei, e.getMessage());
            return RegistryLookupResult.notPerformed(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Registry lookup for {} interrupted", lei);
            return RegistryLookupResult.notPerformed("interrupted");
        }
    }

    private HttpRequest request(String lei) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/lei-records/" + lei))
            .header("Accept", MEDIA_TYPE)
            .timeout(timeout)
            .GET();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private RegistryLookupResult parse(String body) throws IOException {
        JsonNode attributes = objectMapper.readTree(body).path("data").path("attributes");
        JsonNode entity = attributes.path("entity");
        return RegistryLookupResult.found(
            textOrNull(entity.path("legalName").path("name")),
            textOrNull(entity.path("status")),
            textOrNull(attributes.path("registration").path("status")),
            textOrNull(entity.path("legalAddress").path("country")));
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
