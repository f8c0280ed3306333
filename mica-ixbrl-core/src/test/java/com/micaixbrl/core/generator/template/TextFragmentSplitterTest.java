package com.micaixbrl.core.generator.template;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TextFragmentSplitter}.
 */
class TextFragmentSplitterTest {

    @Test
    void split_shortText_singleFragment() {
        assertThat(TextFragmentSplitter.split("short text", 100)).containsExactly("short text");
    }

    @Test
    void split_longText_fragmentsConcatenateToOriginal() {
        String text = "Lorem ipsum dolor sit amet, consectetur adipiscing elit. ".repeat(30);

        List<String> fragments = TextFragmentSplitter.split(text, 200);

        assertThat(fragments).hasSizeGreaterThan(1);
        assertThat(String.join("", fragments)).isEqualTo(text);
        assertThat(fragments).allSatisfy(fragment -> assertThat(fragment.length()).isLessThanOrEqualTo(200));
    }

    @Test
    void split_prefersParagraphBoundary() {
        String first = "a".repeat(60);
        String text = first + "\n\n" + "b ".repeat(50);

        List<String> fragments = TextFragmentSplitter.split(text, 100);

        assertThat(fragments.get(0)).isEqualTo(first + "\n\n");
    }

    @Test
    void split_boundaryTooEarly_cutsAtThreshold() {
        String text = "ab " + "x".repeat(200);

        List<String> fragments = TextFragmentSplitter.split(text, 100);

        assertThat(fragments.get(0)).hasSize(100);
        assertThat(String.join("", fragments)).isEqualTo(text);
    }

    @Test
    void split_null_singleEmptyFragment() {
        assertThat(TextFragmentSplitter.split(null, 10)).containsExactly("");
    }

    @Test
    void split_nonPositiveThreshold_throws() {
        assertThatThrownBy(() -> TextFragmentSplitter.split("text", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
