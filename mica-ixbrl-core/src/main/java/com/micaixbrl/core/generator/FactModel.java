package com.micaixbrl.core.generator;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a white paper instance reports: contexts, units and facts.
 *
 * <p>{@code facts} holds at most one value per element; repeated sub-records live in
 * {@code dimensionalBlocks} under their own contexts. {@link #allFacts()} flattens both into
 * the fact list a generated document contains.</p>
 *
 * @param documentDate resolved document date
 * @param language document language
 * @param contexts all contexts built for the record
 * @param units units referenced by at least one fact
 * @param facts fact values keyed by element name, in mapping order
 * @param dimensionalBlocks repeated sub-records per section
 */
public record FactModel(
    LocalDate documentDate,
    String language,
    List<XbrlContext> contexts,
    List<XbrlUnit> units,
    Map<String, FactValue> facts,
    List<DimensionalBlock> dimensionalBlocks
) {
    /**
     * Compact constructor with validation.
     */
    public FactModel {
        Objects.requireNonNull(documentDate, "documentDate must not be null");
        Objects.requireNonNull(language, "language must not be null");
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
        units = units == null ? List.of() : List.copyOf(units);
        facts = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        dimensionalBlocks = dimensionalBlocks == null ? List.of() : List.copyOf(dimensionalBlocks);
    }

    public Optional<FactValue> fact(String element) {
        return Optional.ofNullable(facts.get(element));
    }

    /**
     * Flattens the fact map and the dimensional rows into the facts a document reports.
     * Empty values are not reported and are left out.
     *
     * @return facts in rendering order
     */
    public List<Fact> allFacts() {
        List<Fact> all = new ArrayList<>();
        facts.forEach((element, value) -> addIfPresent(all, element, value));
        for (DimensionalBlock block : dimensionalBlocks) {
            for (DimensionalRow row : block.rows()) {
                addIfPresent(all, block.identityElement(), row.identity());
                addIfPresent(all, block.addressElement(), row.businessAddress());
                addIfPresent(all, block.functionElement(), row.functionOrType());
            }
        }
        return all;
    }

    /**
     * Returns the contexts referenced by at least one reported fact, in declaration order.
     *
     * @return referenced contexts
     */
    public List<XbrlContext> referencedContexts() {
        Set<String> referenced = new LinkedHashSet<>();
        for (Fact fact : allFacts()) {
            referenced.add(fact.contextRef());
        }
        return contexts.stream()
            .filter(context -> referenced.contains(context.id()))
            .toList();
    }

    private static void addIfPresent(List<Fact> all, String element, FactValue value) {
        if (!value.isEmpty()) {
            all.add(new Fact(element, value.contextRef(), value.unitRef(), value.reportedValue()));
        }
    }
}
