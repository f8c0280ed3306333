package com.micaixbrl.core.generator.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.micaixbrl.core.generator.DimensionalBlock;
import com.micaixbrl.core.generator.DimensionalRow;
import com.micaixbrl.core.generator.DocumentGenerator;
import com.micaixbrl.core.generator.FactModel;
import com.micaixbrl.core.generator.FactModelBuilder;
import com.micaixbrl.core.generator.FactValue;
import com.micaixbrl.core.generator.GeneratedDocument;
import com.micaixbrl.core.generator.GeneratorConfig;
import com.micaixbrl.core.generator.XbrlContext;
import com.micaixbrl.core.generator.XbrlUnit;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.MicaTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Generates the fact model as JSON: the programmatic counterpart of the iXBRL document.
 *
 * <p>Lists the taxonomy entry point, the referenced contexts and units, and every reported
 * fact with its context, unit and precision. Enumeration facts carry their member URI as the
 * value and the label under {@code label}.</p>
 */
public class FactListGenerator implements DocumentGenerator {

    private static final Logger log = LoggerFactory.getLogger(FactListGenerator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Clock clock;

    public FactListGenerator() {
        this(Clock.systemDefaultZone());
    }

    public FactListGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String getId() {
        return "facts-json";
    }

    @Override
    public String getDisplayName() {
        return "Fact List JSON Generator";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public GeneratedDocument generate(WhitepaperData data, GeneratorConfig config) {
        Objects.requireNonNull(data, "data must not be null");
        FactModel model = new FactModelBuilder(clock, config).build(data);

        ObjectNode root = MAPPER.createObjectNode();
        root.put("taxonomy", MicaTaxonomy.ENTRY_POINT);
        root.put("documentDate", model.documentDate().toString());
        root.put("language", model.language());

        ArrayNode contexts = root.putArray("contexts");
        model.referencedContexts().forEach(context -> contexts.add(contextNode(context)));

        ArrayNode units = root.putArray("units");
        for (XbrlUnit unit : model.units()) {
            units.addObject().put("id", unit.id()).put("measure", unit.measure());
        }

        ArrayNode facts = root.putArray("facts");
        for (Map.Entry<String, FactValue> entry : model.facts().entrySet()) {
            addFact(facts, entry.getKey(), entry.getValue());
        }
        for (DimensionalBlock block : model.dimensionalBlocks()) {
            for (DimensionalRow row : block.rows()) {
                addFact(facts, block.identityElement(), row.identity());
                addFact(facts, block.addressElement(), row.businessAddress());
                addFact(facts, block.functionElement(), row.functionOrType());
            }
        }

        try {
            String content = MAPPER.writeValueAsString(root);
            log.info("Generated fact list with {} facts", facts.size());
            return new GeneratedDocument(IxbrlDocumentGenerator.baseName(data) + "-facts", content,
                getFileExtension(), facts.size());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize fact list", e);
        }
    }

    private static ObjectNode contextNode(XbrlContext context) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", context.id());
        node.put("identifier", context.identifier());
        node.put("scheme", context.scheme());
        ObjectNode period = node.putObject("period");
        if (context.period().isInstant()) {
            period.put("instant", context.period().instant().toString());
        } else {
            period.put("startDate", context.period().startDate().toString());
            period.put("endDate", context.period().endDate().toString());
        }
        context.typedMember().ifPresent(member -> node.putObject("dimension")
            .put("dimension", member.dimension())
            .put("value", member.value()));
        return node;
    }

    private static void addFact(ArrayNode facts, String element, FactValue value) {
        if (value.isEmpty()) {
            return;
        }
        ObjectNode fact = facts.addObject();
        fact.put("name", element);
        fact.put("contextRef", value.contextRef());
        if (value.unitRef() != null) {
            fact.put("unitRef", value.unitRef());
        }
        if (value.decimals() != null) {
            fact.put("decimals", value.decimals());
        }
        fact.put("value", value.reportedValue());
        if (value.isEnumerationMember()) {
            fact.put("label", value.displayValue());
        }
    }
}
