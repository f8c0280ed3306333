package com.micaixbrl.core.validator;

import com.micaixbrl.core.generator.Fact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reports facts that share element name, context and unit.
 *
 * <p>Pure scan: facts are never removed or merged.</p>
 */
public class DuplicateFactDetector {

    public static final String RULE_ID = "DUP-001";

    private static final int PREVIEW_VALUES = 3;
    private static final int PREVIEW_LENGTH = 50;

    /**
     * Groups facts by identity key.
     *
     * @param facts facts in emission order
     * @return groups with two or more members
     */
    public DuplicateDetectionResult detect(List<Fact> facts) {
        Objects.requireNonNull(facts, "facts must not be null");
        Map<Fact.Key, List<String>> groups = new LinkedHashMap<>();
        for (Fact fact : facts) {
            groups.computeIfAbsent(fact.key(), key -> new ArrayList<>()).add(fact.value());
        }

        List<DuplicateGroup> duplicates = new ArrayList<>();
        groups.forEach((key, values) -> {
            if (values.size() > 1) {
                duplicates.add(new DuplicateGroup(key.name(), key.contextRef(), key.unitRef(), values.size(), values));
            }
        });
        return new DuplicateDetectionResult(!duplicates.isEmpty(), duplicates, facts.size());
    }

    /**
     * Turns every duplicate group into one ERROR finding.
     *
     * @param result scan result
     * @return findings, one per group
     */
    public List<ValidationError> toValidationErrors(DuplicateDetectionResult result) {
        return result.duplicates().stream()
            .map(group -> ValidationError.error(RULE_ID, describe(group), group.name(), null))
            .toList();
    }

    static String describe(DuplicateGroup group) {
        StringBuilder message = new StringBuilder()
            .append("Duplicate fact: element \"").append(group.name())
            .append("\" with context \"").append(group.contextRef()).append('"');
        if (group.unitRef() != null) {
            message.append(" with unit \"").append(group.unitRef()).append('"');
        }
        message.append(" appears ").append(group.count()).append(" times. Values: ");

        List<String> preview = new ArrayList<>();
        for (String value : group.values().subList(0, Math.min(PREVIEW_VALUES, group.values().size()))) {
            String text = value == null ? "" : value;
            preview.add('"' + text.substring(0, Math.min(PREVIEW_LENGTH, text.length())) + '"');
        }
        message.append(String.join(", ", preview));
        if (group.values().size() > PREVIEW_VALUES) {
            message.append(" ... and ").append(group.values().size() - PREVIEW_VALUES).append(" more");
        }
        return message.toString();
    }
}
