package com.micaixbrl.core.taxonomy;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FieldCatalog} and {@link FieldDefinition}.
 */
class FieldCatalogTest {

    @Test
    void byNumber_knownField_returnsDefinition() {
        FieldDefinition field = FieldCatalog.byNumber("A.1").orElseThrow();

        assertThat(field.section()).isEqualTo(Section.A);
        assertThat(field.element()).isEqualTo("mica:NameOfOtherTokenOfferor");
        assertThat(field.localName()).isEqualTo("NameOfOtherTokenOfferor");
        assertThat(field.dataType()).isEqualTo(XbrlDataType.STRING);
        assertThat(field.periodType()).isEqualTo(PeriodType.DURATION);
    }

    @Test
    void byNumber_totalSupply_isInstantInteger() {
        FieldDefinition field = FieldCatalog.byNumber("E.12").orElseThrow();

        assertThat(field.dataType()).isEqualTo(XbrlDataType.INTEGER);
        assertThat(field.periodType()).isEqualTo(PeriodType.INSTANT);
    }

    @Test
    void byNumber_enumerationField_isHidden() {
        FieldDefinition field = FieldCatalog.byNumber("E.8").orElseThrow();

        assertThat(field.dataType()).isEqualTo(XbrlDataType.ENUMERATION);
        assertThat(field.hidden()).isTrue();
        assertThat(EnumerationCatalog.tableFor(field.element())).isPresent();
    }

    @Test
    void byNumber_unknownField_returnsEmpty() {
        assertThat(FieldCatalog.byNumber("Z.99")).isEmpty();
        assertThat(FieldCatalog.isDefined("Z.99")).isFalse();
    }

    @Test
    void byElement_returnsSameDefinitionAsByNumber() {
        assertThat(FieldCatalog.byElement("mica:IssuePrice")).isEqualTo(FieldCatalog.byNumber("E.7"));
    }

    @Test
    void fieldsForSection_returnsOnlyThatSectionInOrder() {
        List<FieldDefinition> partE = FieldCatalog.fieldsForSection(Section.E);

        assertThat(partE).isNotEmpty().allMatch(field -> field.section() == Section.E);
        assertThat(partE).extracting(FieldDefinition::number).containsSubsequence("E.5", "E.7", "E.12", "E.31a");
    }

    @Test
    void all_fieldNumbersAreUnique() {
        Set<String> numbers = new HashSet<>();

        assertThat(FieldCatalog.all()).allMatch(field -> numbers.add(field.number()));
    }

    @Test
    void parentNumber_letteredSubField_returnsParent() {
        FieldDefinition subField = FieldCatalog.byNumber("E.31a").orElseThrow();

        assertThat(subField.parentNumber()).contains("E.31");
        assertThat(FieldCatalog.isDefined("E.31")).isFalse();
        assertThat(FieldCatalog.byNumber("E.7").orElseThrow().parentNumber()).isEmpty();
    }
}
