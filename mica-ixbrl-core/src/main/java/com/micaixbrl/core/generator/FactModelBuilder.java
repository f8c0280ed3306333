package com.micaixbrl.core.generator;

import com.micaixbrl.core.model.EntityRole;
import com.micaixbrl.core.model.ManagementBodyMember;
import com.micaixbrl.core.model.ProjectPerson;
import com.micaixbrl.core.model.WhitepaperData;
import com.micaixbrl.core.taxonomy.EnumerationCatalog;
import com.micaixbrl.core.taxonomy.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.micaixbrl.core.taxonomy.MicaTaxonomy.element;

/**
 * Maps a white paper record to its fact model: contexts, units and fact values.
 *
 * <p>The fact map is built in two phases. Typed mappings from the record's parts run first;
 * the raw-field bag then fills only the elements still unset, so typed content always wins.
 * Management body members and project persons become dimensional blocks, one context per
 * sub-record.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * FactModel model = new FactModelBuilder().build(data);
 * model.fact("mica:IssuePrice").ifPresent(price -> ...);
 * }</pre>
 */
public class FactModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(FactModelBuilder.class);

    private final Clock clock;
    private final GeneratorConfig config;
    private final ContextBuilder contextBuilder = new ContextBuilder();

    public FactModelBuilder() {
        this(Clock.systemDefaultZone(), GeneratorConfig.defaults());
    }

    /**
     * Creates a builder.
     *
     * @param clock clock supplying the document date when the record has none
     * @param config generator configuration (default currency and language)
     */
    public FactModelBuilder(Clock clock, GeneratorConfig config) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.config = config != null ? config : GeneratorConfig.defaults();
    }

    /**
     * Builds the fact model of a record.
     *
     * @param data white paper record
     * @return fact model
     * @throws MissingEntityIdentifierException if the primary entity has no usable LEI
     */
    public FactModel build(WhitepaperData data) {
        Objects.requireNonNull(data, "data must not be null");
        LocalDate documentDate = resolveDocumentDate(data.documentDate());
        List<XbrlContext> contexts = contextBuilder.build(data, documentDate);

        FactMapWriter writer = new FactMapWriter();
        new TypedFactMapper(config.defaultCurrency(), config.defaultLanguage()).map(data, writer);
        int typedCount = writer.size();
        new RawFieldMapper(config.defaultCurrency()).map(data, writer);
        log.debug("Mapped {} typed facts and {} raw-field facts", typedCount, writer.size() - typedCount);

        List<DimensionalBlock> blocks = dimensionalBlocks(data);
        String language = data.language() == null || data.language().isBlank()
            ? config.defaultLanguage()
            : data.language();

        FactModel draft = new FactModel(documentDate, language, contexts, List.of(), writer.facts(), blocks);
        return new FactModel(documentDate, language, contexts, referencedUnits(draft), writer.facts(), blocks);
    }

    private LocalDate resolveDocumentDate(String documentDate) {
        if (documentDate != null && !documentDate.isBlank()) {
            try {
                return LocalDate.parse(documentDate.trim());
            } catch (DateTimeParseException e) {
                log.warn("Document date '{}' is not an ISO date, using today's date", documentDate);
            }
        }
        return LocalDate.now(clock);
    }

    private static List<XbrlUnit> referencedUnits(FactModel model) {
        Set<String> unitIds = new LinkedHashSet<>();
        for (Fact fact : model.allFacts()) {
            if (fact.unitRef() != null) {
                unitIds.add(fact.unitRef());
            }
        }
        List<XbrlUnit> units = new ArrayList<>();
        for (String unitId : unitIds) {
            units.add(Units.byId(unitId)
                .orElseThrow(() -> new IllegalStateException("No unit definition for " + unitId)));
        }
        return units;
    }

    private static List<DimensionalBlock> dimensionalBlocks(WhitepaperData data) {
        List<DimensionalBlock> blocks = new ArrayList<>();
        addManagementBlock(blocks, Section.A, EntityRole.OFFEROR, "Offerors",
            data.managementBodyMembers().offeror());
        addManagementBlock(blocks, Section.B, EntityRole.ISSUER, "Issuers",
            data.managementBodyMembers().issuer());
        addManagementBlock(blocks, Section.C, EntityRole.OPERATOR, "Operators",
            data.managementBodyMembers().operator());
        if (!data.projectPersons().isEmpty()) {
            blocks.add(personsBlock(data.projectPersons()));
        }
        return blocks;
    }

    private static void addManagementBlock(List<DimensionalBlock> blocks, Section section, EntityRole role,
                                           String elementInfix, List<ManagementBodyMember> members) {
        if (members.isEmpty()) {
            return;
        }
        List<DimensionalRow> rows = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            ManagementBodyMember member = members.get(i);
            String contextRef = ContextBuilder.managementContextId(role, i);
            rows.add(new DimensionalRow(contextRef,
                FactValue.text(nullToEmpty(member.identity()), contextRef),
                FactValue.text(nullToEmpty(member.businessAddress()), contextRef),
                FactValue.text(nullToEmpty(member.function()), contextRef)));
        }
        blocks.add(new DimensionalBlock(section, role.displayName() + " Management Body Members",
            element("IdentityOf" + elementInfix + "ManagementBodyMemberForOtherToken"),
            element("BusinessAddressOf" + elementInfix + "ManagementBodyMemberForOtherToken"),
            element("FunctionOf" + elementInfix + "ManagementBodyMemberForOtherToken"),
            rows));
    }

    private static DimensionalBlock personsBlock(List<ProjectPerson> persons) {
        String typeElement = element("TypeOfPersonInvolvedInImplementationOfOtherToken");
        List<DimensionalRow> rows = new ArrayList<>();
        for (int i = 0; i < persons.size(); i++) {
            ProjectPerson person = persons.get(i);
            String contextRef = ContextBuilder.personContextId(i);
            FactValue type = EnumerationCatalog.resolve(typeElement, person.role())
                .map(mapping -> FactValue.enumeration(mapping, contextRef))
                .orElseGet(() -> FactValue.text(nullToEmpty(person.role()), contextRef));
            rows.add(new DimensionalRow(contextRef,
                FactValue.text(nullToEmpty(person.identity()), contextRef),
                FactValue.text(nullToEmpty(person.businessAddress()), contextRef),
                type));
        }
        return new DimensionalBlock(Section.C, "Persons Involved in Implementation",
            element("NameOfPersonInvolvedInImplementationOfOtherToken"),
            element("BusinessAddressOfPersonInvolvedInImplementationOfOtherToken"),
            typeElement,
            rows);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
