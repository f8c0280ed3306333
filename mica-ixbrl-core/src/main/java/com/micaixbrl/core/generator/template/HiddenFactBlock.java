package com.micaixbrl.core.generator.template;

import com.micaixbrl.core.generator.HiddenFact;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the {@code ix:hidden} block of enumeration facts.
 */
public final class HiddenFactBlock {

    private HiddenFactBlock() {
        // Utility class
    }

    /**
     * Renders the hidden block.
     *
     * @param hiddenFacts facts registered during rendering
     * @return {@code ix:hidden} element, or empty string when there are none
     */
    public static String render(List<HiddenFact> hiddenFacts) {
        if (hiddenFacts.isEmpty()) {
            return "";
        }
        String facts = hiddenFacts.stream()
            .map(fact -> "        " + InlineTagger.wrapHiddenFact(
                fact.id(), fact.name(), fact.contextRef(), fact.taxonomyUri()))
            .collect(Collectors.joining("\n"));
        return "      <ix:hidden>\n" + facts + "\n      </ix:hidden>";
    }
}
