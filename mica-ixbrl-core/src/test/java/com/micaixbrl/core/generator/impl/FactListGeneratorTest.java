package com.micaixbrl.core.generator.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micaixbrl.core.WhitepaperFixtures;
import com.micaixbrl.core.generator.GeneratedDocument;
import com.micaixbrl.core.taxonomy.MicaTaxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FactListGenerator}.
 */
class FactListGeneratorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private FactListGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new FactListGenerator(WhitepaperFixtures.FIXED_CLOCK);
    }

    @Test
    void generate_writesJsonNamedAfterSymbol() {
        GeneratedDocument document = generator.generate(WhitepaperFixtures.complete(), null);

        assertThat(generator.getId()).isEqualTo("facts-json");
        assertThat(document.fileName()).isEqualTo("ext-whitepaper-facts.json");
    }

    @Test
    void generate_headerFields() throws Exception {
        JsonNode root = mapper.readTree(generator.generate(WhitepaperFixtures.complete(), null).content());

        assertThat(root.path("taxonomy").asText()).isEqualTo(MicaTaxonomy.ENTRY_POINT);
        assertThat(root.path("documentDate").asText()).isEqualTo("2025-01-15");
        assertThat(root.path("language").asText()).isEqualTo("en");
    }

    @Test
    void generate_factCountMatchesFactArray() throws Exception {
        GeneratedDocument document = generator.generate(WhitepaperFixtures.complete(), null);
        JsonNode facts = mapper.readTree(document.content()).path("facts");

        assertThat(facts.isArray()).isTrue();
        assertThat(facts.size()).isEqualTo(document.factCount());
    }

    @Test
    void generate_numericFactCarriesUnitAndDecimals() throws Exception {
        JsonNode supply = factNamed("mica:TotalNumberOfOfferedOrTradedOtherTokens");

        assertThat(supply.path("contextRef").asText()).isEqualTo("ctx_instant");
        assertThat(supply.path("unitRef").asText()).isEqualTo("unit_pure");
        assertThat(supply.path("decimals").asInt()).isZero();
        assertThat(supply.path("value").asText()).isEqualTo("1000000");
    }

    @Test
    void generate_enumerationFactReportsUriAndLabel() throws Exception {
        JsonNode country = factNamed("mica:OfferorsRegisteredCountry");

        assertThat(country.path("value").asText()).isEqualTo(MicaTaxonomy.NAMESPACE + "#MT");
        assertThat(country.path("label").asText()).isEqualTo("Malta");
        assertThat(country.has("unitRef")).isFalse();
    }

    @Test
    void generate_contextsIncludeTypedDimension() throws Exception {
        JsonNode root = mapper.readTree(generator.generate(WhitepaperFixtures.complete(), null).content());

        List<String> ids = new ArrayList<>();
        JsonNode person = null;
        for (JsonNode context : root.path("contexts")) {
            ids.add(context.path("id").asText());
            if (context.path("id").asText().equals("ctx_person_involved_0")) {
                person = context;
            }
        }
        assertThat(ids).contains("ctx_instant", "ctx_duration", "ctx_mgmt_offeror_0");
        assertThat(person).isNotNull();
        assertThat(person.path("dimension").path("value").asText()).isEqualTo("person_0");
        assertThat(person.path("period").path("startDate").asText()).isEqualTo("2025-01-01");
    }

    private JsonNode factNamed(String name) throws Exception {
        JsonNode root = mapper.readTree(generator.generate(WhitepaperFixtures.complete(), null).content());
        for (JsonNode fact : root.path("facts")) {
            if (fact.path("name").asText().equals(name)) {
                return fact;
            }
        }
        throw new AssertionError("No fact named " + name);
    }
}
