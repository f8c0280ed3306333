package com.micaixbrl.core.generator.template;

import com.micaixbrl.core.generator.FactValue;
import com.micaixbrl.core.generator.GenerationContext;
import com.micaixbrl.core.generator.GeneratorConfig;
import com.micaixbrl.core.generator.HiddenFact;
import com.micaixbrl.core.taxonomy.EnumerationCatalog;
import com.micaixbrl.core.taxonomy.FieldCatalog;
import com.micaixbrl.core.taxonomy.FieldDefinition;
import com.micaixbrl.core.taxonomy.XbrlDataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InlineTagger}.
 */
class InlineTaggerTest {

    private GenerationContext context;

    @BeforeEach
    void setUp() {
        context = new GenerationContext(GeneratorConfig.defaults());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1,500.00", "14", "0.10", "5%", "€ 25", "42."})
    void isValueNumeric_numbers_returnsTrue(String value) {
        assertThat(InlineTagger.isValueNumeric(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Not applicable", "7 days.", "600,000 tokens", "", "N/A"})
    void isValueNumeric_narratives_returnsFalse(String value) {
        assertThat(InlineTagger.isValueNumeric(value)).isFalse();
    }

    @Test
    void wrapInlineTag_numericValue_emitsNonFractionWithUnitAndDecimals() {
        String tag = InlineTagger.wrapInlineTag("fact_1", "mica:TotalNumberOfOfferedOrTradedOtherTokens",
            "ctx_instant", "1000000", XbrlDataType.INTEGER, false, "unit_pure", 0);

        assertThat(tag).isEqualTo("<ix:nonFraction id=\"fact_1\" name=\"mica:TotalNumberOfOfferedOrTradedOtherTokens\""
            + " contextRef=\"ctx_instant\" unitRef=\"unit_pure\" decimals=\"0\" format=\"ixt:num-dot-decimal\">"
            + "1000000</ix:nonFraction>");
    }

    @Test
    void wrapInlineTag_narrativeInNumericField_fallsBackToNonNumeric() {
        String tag = InlineTagger.wrapInlineTag("fact_2", "mica:SubscriptionFeeExpressedInCurrency",
            "ctx_duration", "Not applicable", XbrlDataType.MONETARY, false, null, null);

        assertThat(tag).startsWith("<ix:nonNumeric id=\"fact_2\"")
            .contains("escape=\"false\"")
            .doesNotContain("unitRef")
            .endsWith(">Not applicable</ix:nonNumeric>");
    }

    @Test
    void wrapInlineTag_textBlock_usesEscapeAndFixedTrueFormat() {
        String tag = InlineTagger.wrapInlineTag("fact_3", "mica:DescriptionOfOtherTokenProjectExplanatory",
            "ctx_duration", "Tokens & <rights>", XbrlDataType.TEXT_BLOCK, true, null, null);

        assertThat(tag).contains("escape=\"true\" format=\"ixt4:fixed-true\"")
            .contains(">Tokens &amp; &lt;rights&gt;</ix:nonNumeric>");
    }

    @Test
    void tag_idsShareOneCounterAcrossPrefixes() {
        FieldDefinition name = FieldCatalog.byNumber("A.1").orElseThrow();
        FieldDefinition country = FieldCatalog.byNumber("A.18").orElseThrow();
        FactValue malta = FactValue.enumeration(EnumerationCatalog.MEMBER_STATE.get("MT"), "ctx_duration");

        String first = InlineTagger.tag(FactValue.text("Example Labs Ltd", "ctx_duration"), name, context).markup();
        String second = InlineTagger.tag(malta, country, context).markup();

        assertThat(first).contains("id=\"fact_1\"");
        assertThat(second).isEqualTo("<div style=\"-ix-hidden:mica_enum_2;\">Malta</div>");
        assertThat(context.issuedCount(InlineTagger.ENUMERATION_PREFIX)).isEqualTo(1);
    }

    @Test
    void tag_hiddenEnumeration_registersHiddenFact() {
        FieldDefinition country = FieldCatalog.byNumber("A.18").orElseThrow();
        FactValue malta = FactValue.enumeration(EnumerationCatalog.MEMBER_STATE.get("MT"), "ctx_duration");

        TaggedFragment fragment = InlineTagger.tag(malta, country, context);

        assertThat(fragment.tagged()).isTrue();
        List<HiddenFact> hidden = context.hiddenFacts();
        assertThat(hidden).hasSize(1);
        assertThat(hidden.get(0).name()).isEqualTo("mica:OfferorsRegisteredCountry");
        assertThat(hidden.get(0).taxonomyUri()).endsWith("#MT");
        assertThat(hidden.get(0).humanReadable()).isEqualTo("Malta");
    }

    @Test
    void tag_emptyValue_returnsUntaggedEmptyFragment() {
        FieldDefinition name = FieldCatalog.byNumber("A.1").orElseThrow();

        TaggedFragment fragment = InlineTagger.tag(FactValue.text("  ", "ctx_duration"), name, context);

        assertThat(fragment.tagged()).isFalse();
        assertThat(fragment.markup()).isEmpty();
        assertThat(context.issuedCount(InlineTagger.FACT_PREFIX)).isZero();
    }

    @Test
    void tag_longTextBlock_splitsIntoContinuationChain() {
        GenerationContext small = new GenerationContext(new GeneratorConfig(100, "EUR", "en"));
        FieldDefinition description = FieldCatalog.byNumber("D.4").orElseThrow();
        String text = "word ".repeat(60).trim();

        String markup = InlineTagger.tag(FactValue.text(text, "ctx_duration"), description, small).markup();

        assertThat(markup).contains("continuedAt=\"cont_fact_1_1\"")
            .contains("<ix:continuation id=\"cont_fact_1_1\" continuedAt=\"cont_fact_1_2\">")
            .contains("<ix:continuation id=\"cont_fact_1_2\">");
    }

    @Test
    void wrapContinuation_singleFragment_noChain() {
        ContinuationChain chain = InlineTagger.wrapContinuation("fact_9", "mica:X", "ctx_duration",
            List.of("short"), true);

        assertThat(chain.continuations()).isEmpty();
        assertThat(chain.primary()).doesNotContain("continuedAt");
    }

    @Test
    void wrapHiddenLink_escapesLabel() {
        assertThat(InlineTagger.wrapHiddenLink("mica_enum_1", "Both <a> & b"))
            .isEqualTo("<div style=\"-ix-hidden:mica_enum_1;\">Both &lt;a&gt; &amp; b</div>");
    }
}
