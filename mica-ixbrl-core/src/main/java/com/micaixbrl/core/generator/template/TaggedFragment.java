package com.micaixbrl.core.generator.template;

/**
 * Content cell markup for one field.
 *
 * @param markup cell content
 * @param tagged whether the content holds a fact, which makes the row's label cells excluded
 */
public record TaggedFragment(String markup, boolean tagged) {

    static TaggedFragment empty() {
        return new TaggedFragment("", false);
    }
}
