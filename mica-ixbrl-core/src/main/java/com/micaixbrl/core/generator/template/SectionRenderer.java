package com.micaixbrl.core.generator.template;

import com.micaixbrl.core.generator.DimensionalBlock;
import com.micaixbrl.core.generator.DimensionalRow;
import com.micaixbrl.core.generator.FactModel;
import com.micaixbrl.core.generator.FactValue;
import com.micaixbrl.core.generator.GenerationContext;
import com.micaixbrl.core.generator.HiddenFact;
import com.micaixbrl.core.taxonomy.FieldCatalog;
import com.micaixbrl.core.taxonomy.FieldDefinition;
import com.micaixbrl.core.taxonomy.Section;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders one white paper section: a numbered {@code No | Field | Content} table followed by
 * the section's dimensional tables.
 */
public final class SectionRenderer {

    private SectionRenderer() {
        // Utility class
    }

    /**
     * Renders a section and its dimensional blocks.
     *
     * @param section section to render
     * @param model fact model
     * @param context generation context
     * @return section markup
     */
    public static String render(Section section, FactModel model, GenerationContext context) {
        String rows = FieldCatalog.fieldsForSection(section).stream()
            .filter(field -> !field.dimensional())
            .map(field -> renderFieldRow(field, model.facts().get(field.element()), context))
            .collect(Collectors.joining("\n"));

        StringBuilder html = new StringBuilder()
            .append("\n    <h2 class=\"section-heading\">").append(Markup.escape(section.title())).append("</h2>")
            .append("\n    <table class=\"").append(section.tableClass()).append("\">")
            .append("\n      <thead>\n        <tr>\n          <th>No</th>\n          <th>Field</th>")
            .append("\n          <th>Content</th>\n        </tr>\n      </thead>\n      <tbody>\n")
            .append(rows)
            .append("\n      </tbody>\n    </table>");

        for (DimensionalBlock block : model.dimensionalBlocks()) {
            if (block.section() == section) {
                html.append(renderDimensionalBlock(block, context));
            }
        }
        return html.toString();
    }

    /**
     * Renders one field row. Number and label are wrapped in {@code ix:exclude} when the
     * content cell holds a fact.
     *
     * @param field field definition
     * @param value fact value, null when the field has no content
     * @param context generation context
     * @return table row markup
     */
    static String renderFieldRow(FieldDefinition field, FactValue value, GenerationContext context) {
        TaggedFragment fragment = InlineTagger.tag(value, field, context);
        String contentCell = fragment.tagged()
            ? "<td>" + fragment.markup() + "</td>"
            : "<td class=\"empty-field\"></td>";
        String number = Markup.escape(field.number());
        String label = Markup.escape(field.label());
        if (fragment.tagged()) {
            number = InlineTagger.wrapExclude(number);
            label = InlineTagger.wrapExclude(label);
        }
        return "        <tr>\n"
            + "          <td>" + number + "</td>\n"
            + "          <td>" + label + "</td>\n"
            + "          " + contentCell + "\n"
            + "        </tr>";
    }

    /**
     * Renders a dimensional table; every cell is tagged against the row's own context.
     *
     * @param block dimensional block
     * @param context generation context
     * @return table markup, empty when the block has no rows
     */
    public static String renderDimensionalBlock(DimensionalBlock block, GenerationContext context) {
        List<DimensionalRow> rows = block.rows();
        if (rows.isEmpty()) {
            return "";
        }
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < rows.size(); i++) {
            DimensionalRow row = rows.get(i);
            if (i > 0) {
                body.append('\n');
            }
            body.append("        <tr>\n")
                .append("          <td>").append(i + 1).append("</td>\n")
                .append("          ").append(dimensionalCell(block.identityElement(), row.identity(), context)).append('\n')
                .append("          ").append(dimensionalCell(block.addressElement(), row.businessAddress(), context)).append('\n')
                .append("          ").append(dimensionalCell(block.functionElement(), row.functionOrType(), context)).append('\n')
                .append("        </tr>");
        }
        return "\n    <h3 class=\"section-subheading\">" + Markup.escape(block.title()) + "</h3>"
            + "\n    <table class=\"dimensional\">"
            + "\n      <thead>\n        <tr>\n          <th>#</th>\n          <th>Identity</th>"
            + "\n          <th>Business Address</th>\n          <th>Function / Type</th>\n        </tr>\n      </thead>"
            + "\n      <tbody>\n" + body + "\n      </tbody>\n    </table>";
    }

    private static String dimensionalCell(String element, FactValue value, GenerationContext context) {
        if (value.isEmpty()) {
            return "<td class=\"empty-field\"></td>";
        }
        if (value.isEnumerationMember()) {
            String hiddenId = context.nextId(InlineTagger.ENUMERATION_PREFIX);
            context.registerHiddenFact(new HiddenFact(hiddenId, element, value.contextRef(),
                value.taxonomyUri(), value.displayValue()));
            return "<td>" + InlineTagger.wrapHiddenLink(hiddenId, value.displayValue()) + "</td>";
        }
        String id = context.nextId(InlineTagger.DIMENSIONAL_PREFIX);
        return "<td><ix:nonNumeric id=\"" + id + "\" name=\"" + element + "\" contextRef=\"" + value.contextRef()
            + "\" escape=\"false\">" + Markup.escape(value.value()) + "</ix:nonNumeric></td>";
    }
}
