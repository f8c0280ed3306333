package com.micaixbrl.cli;

import com.micaixbrl.core.generator.DocumentGenerator;
import com.micaixbrl.core.generator.DocumentGenerators;
import com.micaixbrl.core.model.TokenType;
import com.micaixbrl.core.taxonomy.EnumerationCatalog;
import com.micaixbrl.core.taxonomy.EnumerationMapping;
import com.micaixbrl.core.taxonomy.FieldCatalog;
import com.micaixbrl.core.taxonomy.FieldDefinition;
import com.micaixbrl.core.taxonomy.Section;
import com.micaixbrl.core.validator.ExistenceAssertion;
import com.micaixbrl.core.validator.ExistenceAssertionEngine;
import com.micaixbrl.core.validator.ValueAssertion;
import com.micaixbrl.core.validator.ValueAssertionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to list taxonomy fields, sections, enumerations, generators or validation rules.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * mica-ixbrl list sections
 * mica-ixbrl list fields --section E
 * mica-ixbrl list enumerations
 * mica-ixbrl list generators
 * mica-ixbrl list rules --token-type ART
 * }</pre>
 */
@Command(
    name = "list",
    description = "List taxonomy fields, sections, enumerations, generators or validation rules",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: fields, sections, enumerations, generators or rules")
    private String type;

    @Option(names = {"-s", "--section"}, description = "Only fields of this section (summary, A ... J, S)")
    private String section;

    @Option(names = "--token-type", description = "Token type of the listed rules: ${COMPLETION-CANDIDATES}",
        defaultValue = "OTHR")
    private TokenType tokenType;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "fields", "field" -> listFields(out);
            case "sections", "section" -> listSections(out);
            case "enumerations", "enumeration" -> listEnumerations(out);
            case "generators", "generator" -> listGenerators(out);
            case "rules", "rule" -> listRules(out);
            default -> {
                log.debug("Unknown list type requested: {}", type);
                spec.commandLine().getErr().println(
                    "✗ Unknown type: " + type + ". Use: fields, sections, enumerations, generators or rules");
                yield 1;
            }
        };
    }

    private int listFields(PrintWriter out) {
        List<FieldDefinition> fields;
        if (section != null) {
            Optional<Section> selected = Section.fromKey(section);
            if (selected.isEmpty()) {
                spec.commandLine().getErr().println("✗ Unknown section: " + section);
                return 1;
            }
            fields = FieldCatalog.fieldsForSection(selected.get());
        } else {
            fields = FieldCatalog.all();
        }

        out.println("Taxonomy Fields (" + fields.size() + "):");
        out.println();
        for (FieldDefinition field : fields) {
            StringBuilder flags = new StringBuilder(field.dataType().name().toLowerCase(Locale.ROOT));
            if (field.textBlock()) {
                flags.append(", text block");
            }
            if (field.hidden()) {
                flags.append(", hidden");
            }
            if (field.dimensional()) {
                flags.append(", dimensional");
            }
            out.printf("  %-7s %s%n", field.number(), field.label());
            out.printf("          %s (%s)%n", field.element(), flags);
        }
        return 0;
    }

    private int listSections(PrintWriter out) {
        out.println("Sections:");
        out.println();
        for (Section value : Section.values()) {
            out.printf("  %-8s %s (%d fields)%n",
                value.key(), value.title(), FieldCatalog.fieldsForSection(value).size());
        }
        return 0;
    }

    private int listEnumerations(PrintWriter out) {
        out.println("Enumerated Elements:");
        out.println();
        EnumerationCatalog.elements().stream().sorted().forEach(element -> {
            out.println("  • " + element);
            EnumerationCatalog.tableFor(element).ifPresent(table -> {
                for (EnumerationMapping mapping : table.values()) {
                    out.printf("    %-12s %s%n", mapping.key(), mapping.label());
                }
            });
            out.println();
        });
        return 0;
    }

    private int listGenerators(PrintWriter out) {
        out.println("Available Generators:");
        out.println();

        List<DocumentGenerator> generators = DocumentGenerators.all();
        for (DocumentGenerator generator : generators) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.println();
        }

        if (generators.isEmpty()) {
            out.println("  No generators found.");
        }
        return 0;
    }

    private int listRules(PrintWriter out) {
        out.println("Validation Rules (" + tokenType + "):");
        out.println();
        out.println("  Existence:");
        for (ExistenceAssertion assertion : new ExistenceAssertionEngine().assertionsFor(tokenType)) {
            out.printf("    %-13s %-8s %s%n", assertion.id(), assertion.severity(), assertion.message());
        }
        out.println();
        out.println("  Value:");
        for (ValueAssertion assertion : new ValueAssertionEngine().assertionsFor(tokenType)) {
            out.printf("    %-13s %-8s %s%n", assertion.id(), assertion.severity(), assertion.description());
        }
        return 0;
    }
}
