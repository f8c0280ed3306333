package com.micaixbrl.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micaixbrl.core.model.WhitepaperData;

import java.util.Objects;

/**
 * Resolves dotted record paths such as {@code partA.legalName} or {@code rawFields.E.10}.
 *
 * <p>The record is converted to a Jackson tree once; paths then walk the tree. A value is
 * absent when missing, null, a blank string or an empty array.</p>
 */
final class FieldPathResolver {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String RAW_FIELDS = "rawFields.";

    private final WhitepaperData data;
    private final JsonNode tree;

    FieldPathResolver(WhitepaperData data) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        this.tree = MAPPER.valueToTree(data);
    }

    /**
     * Returns the node at a path, or a missing node.
     *
     * @param fieldPath dotted path
     * @return node, never null
     */
    JsonNode resolve(String fieldPath) {
        if (fieldPath.startsWith(RAW_FIELDS)) {
            // Raw field numbers contain dots themselves
            return tree.path("rawFields").path(fieldPath.substring(RAW_FIELDS.length()));
        }
        JsonNode node = tree;
        for (String segment : fieldPath.split("\\.")) {
            node = node.path(segment);
        }
        return node;
    }

    boolean isPresent(String fieldPath) {
        return isPresent(resolve(fieldPath));
    }

    /**
     * Whether the raw field with the given number carries content.
     *
     * @param fieldNumber taxonomy field number, may be null
     * @return true for non-blank content
     */
    boolean hasRawField(String fieldNumber) {
        if (fieldNumber == null) {
            return false;
        }
        String raw = data.rawField(fieldNumber);
        return raw != null && !raw.isBlank();
    }

    static boolean isPresent(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isBlank();
        }
        if (node.isArray()) {
            return !node.isEmpty();
        }
        return true;
    }
}
