package com.micaixbrl.core.generator.template;

import com.micaixbrl.core.generator.FactValue;
import com.micaixbrl.core.generator.GenerationContext;
import com.micaixbrl.core.generator.HiddenFact;
import com.micaixbrl.core.taxonomy.FieldDefinition;
import com.micaixbrl.core.taxonomy.XbrlDataType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns fact values into Inline XBRL markup.
 *
 * <p>Numeric-typed fields become {@code ix:nonFraction} only when the value really is a
 * number; anything else, narrative overrides such as "Not applicable" included, is tagged
 * {@code ix:nonNumeric}. Resolved enumerations go to the hidden block and are shown through
 * an {@code -ix-hidden} link. Text blocks longer than the configured threshold are split
 * into a continuation chain.</p>
 */
public final class InlineTagger {

    private InlineTagger() {
        // Utility class
    }

    public static final String FACT_PREFIX = "fact";
    public static final String ENUMERATION_PREFIX = "mica_enum";
    public static final String DIMENSIONAL_PREFIX = "dim";

    private static final String TEXT_BLOCK_ATTRIBUTES = "escape=\"true\" format=\"ixt4:fixed-true\"";
    private static final String PLAIN_TEXT_ATTRIBUTES = "escape=\"false\"";

    private static final Pattern NUMERIC_NOISE = Pattern.compile("[,%$€£\\s]");
    private static final Pattern TRAILING_PERIOD = Pattern.compile("\\.$");
    private static final Pattern FINITE_NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Whether a value reads as a finite number once commas, currency symbols, percent signs,
     * whitespace and one trailing period are removed.
     *
     * @param value value text
     * @return true if the value can be tagged as a numeric fact
     */
    public static boolean isValueNumeric(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String cleaned = NUMERIC_NOISE.matcher(value).replaceAll("");
        cleaned = TRAILING_PERIOD.matcher(cleaned).replaceAll("");
        return !cleaned.isEmpty() && FINITE_NUMBER.matcher(cleaned).matches();
    }

    /**
     * Tags the value of one field for its content cell.
     *
     * @param value fact value, may be null when the field has no content
     * @param field field definition
     * @param context generation context issuing ids and collecting hidden facts
     * @return cell content and whether it holds a fact
     */
    public static TaggedFragment tag(FactValue value, FieldDefinition field, GenerationContext context) {
        if (value == null || value.isEmpty()) {
            return TaggedFragment.empty();
        }
        if (field.hidden() && value.isEnumerationMember()) {
            String hiddenId = context.nextId(ENUMERATION_PREFIX);
            context.registerHiddenFact(new HiddenFact(hiddenId, field.element(), value.contextRef(),
                value.taxonomyUri(), value.displayValue()));
            return new TaggedFragment(wrapHiddenLink(hiddenId, value.displayValue()), true);
        }

        String id = context.nextId(FACT_PREFIX);
        int threshold = context.config().continuationThreshold();
        if (field.textBlock() && value.value().length() > threshold) {
            ContinuationChain chain = wrapContinuation(id, field.element(), value.contextRef(),
                TextFragmentSplitter.split(value.value(), threshold), true);
            String markup = "<div class=\"text-block\">" + chain.primary() + "</div>"
                + String.join("\n", chain.continuations());
            return new TaggedFragment(markup, true);
        }

        String tag = wrapInlineTag(id, field.element(), value.contextRef(), value.value(), field.dataType(),
            field.textBlock(), value.unitRef(), value.decimals());
        return new TaggedFragment(field.textBlock() ? "<div class=\"text-block\">" + tag + "</div>" : tag, true);
    }

    /**
     * Wraps a value in a fact tag.
     *
     * @param id fact id
     * @param name qualified element name
     * @param contextRef context id
     * @param value value text
     * @param dataType data type of the element
     * @param textBlock whether the element is a text block
     * @param unitRef unit id for numeric facts, may be null
     * @param decimals decimal precision for numeric facts, may be null
     * @return {@code ix:nonFraction} or {@code ix:nonNumeric} element
     */
    public static String wrapInlineTag(String id, String name, String contextRef, String value,
                                       XbrlDataType dataType, boolean textBlock,
                                       String unitRef, Integer decimals) {
        if (dataType.isNumeric() && isValueNumeric(value)) {
            StringBuilder tag = new StringBuilder()
                .append("<ix:nonFraction id=\"").append(id)
                .append("\" name=\"").append(name)
                .append("\" contextRef=\"").append(contextRef).append('"');
            if (unitRef != null) {
                tag.append(" unitRef=\"").append(unitRef).append('"');
            }
            if (decimals != null) {
                tag.append(" decimals=\"").append(decimals).append('"');
            }
            return tag.append(" format=\"ixt:num-dot-decimal\">")
                .append(Markup.escape(value))
                .append("</ix:nonFraction>")
                .toString();
        }
        boolean block = !dataType.isNumeric() && (textBlock || dataType == XbrlDataType.TEXT_BLOCK);
        return nonNumeric(id, name, contextRef, block ? TEXT_BLOCK_ATTRIBUTES : PLAIN_TEXT_ATTRIBUTES, "", value);
    }

    /**
     * Hidden-block fact reporting an enumeration member URI.
     *
     * @param id fact id
     * @param name qualified element name
     * @param contextRef context id
     * @param taxonomyUri member URI
     * @return {@code ix:nonNumeric} element
     */
    public static String wrapHiddenFact(String id, String name, String contextRef, String taxonomyUri) {
        return nonNumeric(id, name, contextRef, PLAIN_TEXT_ATTRIBUTES, "", taxonomyUri);
    }

    public static String wrapHiddenLink(String hiddenFactId, String humanReadable) {
        return "<div style=\"-ix-hidden:" + hiddenFactId + ";\">" + Markup.escape(humanReadable) + "</div>";
    }

    /**
     * Builds a continuation chain: the primary tag links to {@code cont_{id}_1}, each
     * continuation links to the next and the last one has no forward link.
     *
     * @param id primary fact id
     * @param name qualified element name
     * @param contextRef context id
     * @param fragments text fragments in order
     * @param textBlock whether the element is a text block
     * @return primary tag and continuations
     */
    public static ContinuationChain wrapContinuation(String id, String name, String contextRef,
                                                     List<String> fragments, boolean textBlock) {
        String attributes = textBlock ? TEXT_BLOCK_ATTRIBUTES : PLAIN_TEXT_ATTRIBUTES;
        if (fragments.isEmpty()) {
            return new ContinuationChain(nonNumeric(id, name, contextRef, attributes, "", ""), List.of());
        }
        if (fragments.size() == 1) {
            return new ContinuationChain(nonNumeric(id, name, contextRef, attributes, "", fragments.get(0)), List.of());
        }

        String primary = nonNumeric(id, name, contextRef, attributes,
            " continuedAt=\"" + continuationId(id, 1) + "\"", fragments.get(0));
        List<String> continuations = new ArrayList<>();
        for (int i = 1; i < fragments.size(); i++) {
            boolean last = i == fragments.size() - 1;
            String forward = last ? "" : " continuedAt=\"" + continuationId(id, i + 1) + "\"";
            continuations.add("<ix:continuation id=\"" + continuationId(id, i) + "\"" + forward + ">"
                + Markup.escape(fragments.get(i)) + "</ix:continuation>");
        }
        return new ContinuationChain(primary, continuations);
    }

    public static String wrapExclude(String content) {
        return "<ix:exclude>" + content + "</ix:exclude>";
    }

    static String continuationId(String factId, int index) {
        return "cont_" + factId + "_" + index;
    }

    private static String nonNumeric(String id, String name, String contextRef, String attributes,
                                     String extraAttributes, String value) {
        return "<ix:nonNumeric id=\"" + id + "\" name=\"" + name + "\" contextRef=\"" + contextRef + "\" "
            + attributes + extraAttributes + ">" + Markup.escape(value) + "</ix:nonNumeric>";
    }
}
